package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.registry.NodeRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 管道的不可变描述：记录节点放置和连接，不持有任何运行时资源。
 * 通过 {@link #activate(NodeRegistry)} 转换为可运行的 {@link Pipeline}。
 * 描述和管道是两种不同的类型，描述上没有任何执行方法。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class PipelineDescriptor {

    private final String name;
    private final List<NodeDescriptor> nodes;
    private final List<LinkDescriptor> links;

    public PipelineDescriptor(String name, List<NodeDescriptor> nodes, List<LinkDescriptor> links) {
        this.name = Objects.requireNonNull(name, "管道名称不能为空");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(nodes, "节点列表不能为空")));
        this.links = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(links, "连接列表不能为空")));
    }

    public String getName() {
        return name;
    }

    public List<NodeDescriptor> getNodes() {
        return nodes;
    }

    public List<LinkDescriptor> getLinks() {
        return links;
    }

    public Optional<NodeDescriptor> getNode(String alias) {
        for (NodeDescriptor node : nodes) {
            if (node.getAlias().equals(alias)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public Pipeline activate(NodeRegistry registry) {
        return activate(registry, Collections.<PipelineMonitorListener>emptyList());
    }

    /**
     * 按描述创建节点（以别名作为子节点引用）并建立所有连接。
     *
     * @param registry  节点注册表
     * @param listeners 新管道的监听器
     * @return 已组装、尚未构建的管道
     * @throws PipelineException 节点类型未注册或端口无法解析时
     * @throws InvalidLinkException 连接校验失败时
     */
    public Pipeline activate(NodeRegistry registry, List<PipelineMonitorListener> listeners) {
        Objects.requireNonNull(registry, "NodeRegistry 不能为空");
        log.info("[Pipeline: {}] 开始激活，{} 个节点，{} 条连接", name, nodes.size(), links.size());
        Pipeline pipeline = new Pipeline(listeners);
        pipeline.setNodeRegistry(registry);

        for (NodeDescriptor descriptor : nodes) {
            pipeline.createSubnode(descriptor.getAlias(), () -> registry.createInstance(descriptor.getNodeTypeId())
                    .orElseThrow(() -> new PipelineException(String.format("管道 '%s': 节点 '%s' 的类型 '%s' 未注册",
                            name, descriptor.getAlias(), descriptor.getNodeTypeId()))));
        }
        for (LinkDescriptor link : links) {
            Node outputNode = requireNode(pipeline, link.getOutputAlias());
            Node inputNode = requireNode(pipeline, link.getInputAlias());
            Output output = resolveOutput(outputNode, link.getOutputKey())
                    .orElseThrow(() -> new PipelineException(String.format("管道 '%s': 节点 '%s' 上找不到输出端口 '%s'",
                            name, link.getOutputAlias(), link.getOutputKey())));
            Input input = resolveInput(inputNode, link.getInputKey())
                    .orElseThrow(() -> new PipelineException(String.format("管道 '%s': 节点 '%s' 上找不到输入端口 '%s'",
                            name, link.getInputAlias(), link.getInputKey())));
            output.link(input);
        }
        log.info("[Pipeline: {}] 激活完成", name);
        return pipeline;
    }

    private Node requireNode(Pipeline pipeline, String alias) {
        return pipeline.getNodeRef(alias)
                .orElseThrow(() -> new PipelineException(String.format("管道 '%s': 找不到别名为 '%s' 的节点", name, alias)));
    }

    /**
     * 先查直接声明的端口，再查分组对应的输出映射（按需创建）。
     */
    static Optional<Output> resolveOutput(Node node, PortKey key) {
        Optional<Output> direct = node.getOutputRef(key);
        if (direct.isPresent()) {
            return direct;
        }
        return node.getOutputMapRef(key.getGroup()).map(map -> map.get(key.getGroup(), key.getName()));
    }

    static Optional<Input> resolveInput(Node node, PortKey key) {
        Optional<Input> direct = node.getInputRef(key);
        if (direct.isPresent()) {
            return direct;
        }
        return node.getInputMapRef(key.getGroup()).map(map -> map.get(key.getGroup(), key.getName()));
    }

    @Override
    public String toString() {
        return String.format("PipelineDescriptor[name=%s, nodes=%d, links=%d]", name, nodes.size(), links.size());
    }
}
