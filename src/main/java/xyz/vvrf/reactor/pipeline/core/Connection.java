package xyz.vvrf.reactor.pipeline.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 一条 Output -> Input 连接（不可变数据类）。
 * 只保存两端节点 ID 和端口键，既用于导出/比较，也是节点内部保存的形式。
 * 每次使用时通过管道的 ID 索引解析两端的实际端口，不缓存对象引用，
 * 因此已移除的节点不会留下悬挂引用。
 *
 * @author ruifeng.wen
 */
public final class Connection {

    private final long outputNodeId;
    private final PortKey outputKey;
    private final long inputNodeId;
    private final PortKey inputKey;

    public Connection(long outputNodeId, PortKey outputKey, long inputNodeId, PortKey inputKey) {
        this.outputNodeId = outputNodeId;
        this.outputKey = Objects.requireNonNull(outputKey, "输出端口键不能为空");
        this.inputNodeId = inputNodeId;
        this.inputKey = Objects.requireNonNull(inputKey, "输入端口键不能为空");
    }

    /**
     * 根据两个已放置节点上的端口创建连接描述。
     */
    public static Connection between(Output output, Input input) {
        Objects.requireNonNull(output, "输出端口不能为空");
        Objects.requireNonNull(input, "输入端口不能为空");
        return new Connection(output.getParent().getId(), output.getKey(),
                input.getParent().getId(), input.getKey());
    }

    public long getOutputNodeId() {
        return outputNodeId;
    }

    public PortKey getOutputKey() {
        return outputKey;
    }

    public long getInputNodeId() {
        return inputNodeId;
    }

    public PortKey getInputKey() {
        return inputKey;
    }

    /**
     * @return 连接任一端属于给定节点时为 true
     */
    public boolean touches(long nodeId) {
        return outputNodeId == nodeId || inputNodeId == nodeId;
    }

    /**
     * 通过管道的 ID 索引解析输出端口。
     */
    public Optional<Output> resolveOutput(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "管道不能为空");
        return pipeline.getNode(outputNodeId).flatMap(node -> node.getOutputRef(outputKey));
    }

    /**
     * 通过管道的 ID 索引解析输入端口。
     */
    public Optional<Input> resolveInput(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "管道不能为空");
        return pipeline.getNode(inputNodeId).flatMap(node -> node.getInputRef(inputKey));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return outputNodeId == that.outputNodeId
                && inputNodeId == that.inputNodeId
                && outputKey.equals(that.outputKey)
                && inputKey.equals(that.inputKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputNodeId, outputKey, inputNodeId, inputKey);
    }

    @Override
    public String toString() {
        return String.format("Connection[%d.%s -> %d.%s]", outputNodeId, outputKey, inputNodeId, inputKey);
    }
}
