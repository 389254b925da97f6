package xyz.vvrf.reactor.pipeline.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.InvalidLinkException;
import xyz.vvrf.reactor.pipeline.core.LinkDescriptor;
import xyz.vvrf.reactor.pipeline.core.NodeDescriptor;
import xyz.vvrf.reactor.pipeline.core.PipelineDescriptor;
import xyz.vvrf.reactor.pipeline.core.PortKey;
import xyz.vvrf.reactor.pipeline.registry.NodeRegistry;
import xyz.vvrf.reactor.pipeline.util.PipelineGraphUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建不可变的 {@link PipelineDescriptor}。
 * 需要一个 NodeRegistry 来验证节点类型、端口和数据类型兼容性，
 * 整个过程不创建任何真实节点或队列。
 * 构建成功后以文本表格和 DOT 图形描述的形式输出结构。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class PipelineDescriptorBuilder {

    private final NodeRegistry nodeRegistry;
    private String pipelineName;

    private final Map<String, NodeDescriptor> nodeDescriptors = new LinkedHashMap<>();
    private final List<LinkDescriptor> linkDescriptors = new ArrayList<>();

    public PipelineDescriptorBuilder(String pipelineName, NodeRegistry nodeRegistry) {
        this.pipelineName = Objects.requireNonNull(pipelineName, "管道名称不能为空");
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "NodeRegistry 不能为空");
        log.info("为管道 '{}' 创建 PipelineDescriptorBuilder", pipelineName);
    }

    public PipelineDescriptorBuilder name(String name) {
        this.pipelineName = Objects.requireNonNull(name, "管道名称不能为空");
        return this;
    }

    /**
     * 记录一个节点放置。
     *
     * @throws IllegalArgumentException 别名重复或类型 ID 未注册时
     */
    public PipelineDescriptorBuilder addNode(String alias, String nodeTypeId) {
        Objects.requireNonNull(alias, "节点别名不能为空");
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");

        if (nodeDescriptors.containsKey(alias)) {
            throw new IllegalArgumentException(String.format("节点别名 '%s' 在管道 '%s' 中已存在。", alias, pipelineName));
        }
        if (!nodeRegistry.getNodeMetadata(nodeTypeId).isPresent()) {
            throw new IllegalArgumentException(String.format("在 NodeRegistry 中找不到节点类型 ID '%s'。无法为管道 '%s' 添加节点 '%s'。",
                    nodeTypeId, pipelineName, alias));
        }
        nodeDescriptors.put(alias, new NodeDescriptor(alias, nodeTypeId));
        log.debug("管道 '{}': 添加了节点 '{}' (类型: {})", pipelineName, alias, nodeTypeId);
        return this;
    }

    public PipelineDescriptorBuilder addLink(String outputAlias, String outputName, String inputAlias, String inputName) {
        return addLink(outputAlias, PortKey.of(outputName), inputAlias, PortKey.of(inputName));
    }

    /**
     * 记录一条连接，并按注册表元数据校验。
     *
     * @throws IllegalArgumentException 节点别名或端口不存在时
     * @throws InvalidLinkException     数据类型不兼容或连接重复时
     */
    public PipelineDescriptorBuilder addLink(String outputAlias, PortKey outputKey, String inputAlias, PortKey inputKey) {
        Objects.requireNonNull(outputAlias, "输出节点别名不能为空");
        Objects.requireNonNull(outputKey, "输出端口键不能为空");
        Objects.requireNonNull(inputAlias, "输入节点别名不能为空");
        Objects.requireNonNull(inputKey, "输入端口键不能为空");

        NodeRegistry.NodeMetadata outputMeta = getMetadataOrThrow(outputAlias);
        NodeRegistry.NodeMetadata inputMeta = getMetadataOrThrow(inputAlias);
        List<DatatypeHierarchy> outputTypes = outputMeta.findOutputDatatypes(outputKey)
                .orElseThrow(() -> new IllegalArgumentException(String.format("在节点类型 '%s' (节点: '%s') 上找不到输出端口 '%s'。",
                        outputMeta.getTypeId(), outputAlias, outputKey)));
        List<DatatypeHierarchy> inputTypes = inputMeta.findInputDatatypes(inputKey)
                .orElseThrow(() -> new IllegalArgumentException(String.format("在节点类型 '%s' (节点: '%s') 上找不到输入端口 '%s'。",
                        inputMeta.getTypeId(), inputAlias, inputKey)));
        if (!DatatypeHierarchy.anyCompatible(outputTypes, inputTypes)) {
            throw new InvalidLinkException(String.format("连接 %s[%s] -> %s[%s] 数据类型不兼容。输出: %s, 输入: %s。",
                    outputAlias, outputKey, inputAlias, inputKey, outputTypes, inputTypes));
        }

        LinkDescriptor link = new LinkDescriptor(outputAlias, outputKey, inputAlias, inputKey);
        if (linkDescriptors.contains(link)) {
            throw new InvalidLinkException(String.format("管道 '%s': 连接 %s 已存在。", pipelineName, link));
        }
        linkDescriptors.add(link);
        log.debug("管道 '{}': 添加了连接 {}", pipelineName, link);
        return this;
    }

    public PipelineDescriptor build() {
        log.info("开始为 '{}' 构建 PipelineDescriptor...", pipelineName);
        PipelineDescriptor descriptor = new PipelineDescriptor(pipelineName,
                new ArrayList<>(nodeDescriptors.values()), linkDescriptors);

        log.info("管道 '{}' 描述构建成功。{} 个节点, {} 条连接。", pipelineName,
                descriptor.getNodes().size(), descriptor.getLinks().size());
        if (log.isInfoEnabled() && !descriptor.getNodes().isEmpty()) {
            log.info("管道 '{}' 最终结构 (文本):{}", pipelineName, PipelineGraphUtils.formatStructure(descriptor));
            log.info("管道 '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}\n--- DOT END ---",
                    pipelineName, PipelineGraphUtils.toDot(descriptor));
        }
        return descriptor;
    }

    private NodeRegistry.NodeMetadata getMetadataOrThrow(String alias) {
        NodeDescriptor node = nodeDescriptors.get(alias);
        if (node == null) {
            throw new IllegalArgumentException(String.format("节点 '%s' 尚未通过 addNode() 定义。", alias));
        }
        return nodeRegistry.getNodeMetadata(node.getNodeTypeId())
                .orElseThrow(() -> new IllegalStateException("节点类型 '" + node.getNodeTypeId() + "' 的元数据在注册表中未找到。"));
    }
}
