package xyz.vvrf.reactor.pipeline.core;

import java.util.Objects;

/**
 * 管道描述中的一条连接（不可变数据类），按节点别名和端口键引用两端。
 *
 * @author ruifeng.wen
 */
public final class LinkDescriptor {
    private final String outputAlias;
    private final PortKey outputKey;
    private final String inputAlias;
    private final PortKey inputKey;

    public LinkDescriptor(String outputAlias, PortKey outputKey, String inputAlias, PortKey inputKey) {
        this.outputAlias = Objects.requireNonNull(outputAlias, "输出节点别名不能为空");
        this.outputKey = Objects.requireNonNull(outputKey, "输出端口键不能为空");
        this.inputAlias = Objects.requireNonNull(inputAlias, "输入节点别名不能为空");
        this.inputKey = Objects.requireNonNull(inputKey, "输入端口键不能为空");
    }

    public String getOutputAlias() {
        return outputAlias;
    }

    public PortKey getOutputKey() {
        return outputKey;
    }

    public String getInputAlias() {
        return inputAlias;
    }

    public PortKey getInputKey() {
        return inputKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LinkDescriptor that = (LinkDescriptor) o;
        return outputAlias.equals(that.outputAlias) &&
                outputKey.equals(that.outputKey) &&
                inputAlias.equals(that.inputAlias) &&
                inputKey.equals(that.inputKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputAlias, outputKey, inputAlias, inputKey);
    }

    @Override
    public String toString() {
        return String.format("Link[%s.%s -> %s.%s]", outputAlias, outputKey, inputAlias, inputKey);
    }
}
