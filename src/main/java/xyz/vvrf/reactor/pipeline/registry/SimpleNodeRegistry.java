package xyz.vvrf.reactor.pipeline.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.Input;
import xyz.vvrf.reactor.pipeline.core.InputMap;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.Output;
import xyz.vvrf.reactor.pipeline.core.OutputMap;
import xyz.vvrf.reactor.pipeline.core.PortKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * NodeRegistry 的简单内存实现。
 * 注册时用工厂创建一个示例实例提取端口元数据，示例实例不会被放置到任何管道中。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleNodeRegistry implements NodeRegistry {

    private final Map<String, Supplier<? extends Node>> factoryMap = new ConcurrentHashMap<>();
    // 缓存节点元数据
    private final Map<String, NodeMetadata> metadataMap = new ConcurrentHashMap<>();

    @Override
    public void register(String nodeTypeId, Supplier<? extends Node> factory) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        Objects.requireNonNull(factory, "节点工厂不能为空");

        if (factoryMap.putIfAbsent(nodeTypeId, factory) != null) {
            throw new IllegalArgumentException(String.format("节点类型 ID '%s' 已注册。", nodeTypeId));
        }

        Node sampleInstance;
        try {
            sampleInstance = factory.get();
        } catch (Exception e) {
            factoryMap.remove(nodeTypeId);
            log.error("从工厂获取节点类型 '{}' 的示例实例失败。", nodeTypeId, e);
            throw new IllegalArgumentException("无法从工厂实例化节点以提取元数据: " + nodeTypeId, e);
        }
        if (sampleInstance == null) {
            factoryMap.remove(nodeTypeId);
            throw new IllegalArgumentException(String.format("节点类型 '%s' 的工厂返回了 null 实例。", nodeTypeId));
        }

        metadataMap.put(nodeTypeId, extractMetadata(nodeTypeId, sampleInstance));
        log.info("已注册节点类型 '{}' (实现: {})", nodeTypeId, sampleInstance.getClass().getName());
    }

    @Override
    public Optional<Node> createInstance(String nodeTypeId) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        Supplier<? extends Node> factory = factoryMap.get(nodeTypeId);
        if (factory == null) {
            return Optional.empty();
        }
        Node instance = factory.get();
        if (instance == null) {
            throw new IllegalStateException(String.format("节点类型 '%s' 的工厂返回了 null 实例。", nodeTypeId));
        }
        return Optional.of(instance);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String nodeTypeId) {
        Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
        return Optional.ofNullable(metadataMap.get(nodeTypeId));
    }

    @Override
    public Set<String> getRegisteredTypeIds() {
        return Collections.unmodifiableSet(new TreeSet<>(factoryMap.keySet()));
    }

    private static NodeMetadata extractMetadata(String nodeTypeId, Node node) {
        Map<PortKey, List<DatatypeHierarchy>> outputs = new LinkedHashMap<>();
        for (Output output : node.getOutputs()) {
            outputs.put(output.getKey(), output.getPossibleDatatypes());
        }
        Map<PortKey, List<DatatypeHierarchy>> inputs = new LinkedHashMap<>();
        for (Input input : node.getInputs()) {
            inputs.put(input.getKey(), input.getPossibleDatatypes());
        }
        Map<String, List<DatatypeHierarchy>> outputMaps = new LinkedHashMap<>();
        for (OutputMap map : node.getOutputMapRefs().values()) {
            outputMaps.put(map.getName(), map.getPossibleDatatypes());
        }
        Map<String, List<DatatypeHierarchy>> inputMaps = new LinkedHashMap<>();
        for (InputMap map : node.getInputMapRefs().values()) {
            inputMaps.put(map.getName(), map.getPossibleDatatypes());
        }
        return new DefaultNodeMetadata(nodeTypeId, node.getClass(), node.getName(),
                outputs, inputs, outputMaps, inputMaps);
    }

    /**
     * 不可变的元数据实现。
     */
    private static final class DefaultNodeMetadata implements NodeMetadata {
        private final String typeId;
        private final Class<? extends Node> nodeClass;
        private final String nodeName;
        private final Map<PortKey, List<DatatypeHierarchy>> outputs;
        private final Map<PortKey, List<DatatypeHierarchy>> inputs;
        private final Map<String, List<DatatypeHierarchy>> outputMaps;
        private final Map<String, List<DatatypeHierarchy>> inputMaps;

        private DefaultNodeMetadata(String typeId, Class<? extends Node> nodeClass, String nodeName,
                                    Map<PortKey, List<DatatypeHierarchy>> outputs,
                                    Map<PortKey, List<DatatypeHierarchy>> inputs,
                                    Map<String, List<DatatypeHierarchy>> outputMaps,
                                    Map<String, List<DatatypeHierarchy>> inputMaps) {
            this.typeId = typeId;
            this.nodeClass = nodeClass;
            this.nodeName = nodeName;
            this.outputs = Collections.unmodifiableMap(outputs);
            this.inputs = Collections.unmodifiableMap(inputs);
            this.outputMaps = Collections.unmodifiableMap(outputMaps);
            this.inputMaps = Collections.unmodifiableMap(inputMaps);
        }

        @Override public String getTypeId() { return typeId; }
        @Override public Class<? extends Node> getNodeClass() { return nodeClass; }
        @Override public String getNodeName() { return nodeName; }
        @Override public Map<PortKey, List<DatatypeHierarchy>> getOutputs() { return outputs; }
        @Override public Map<PortKey, List<DatatypeHierarchy>> getInputs() { return inputs; }
        @Override public Map<String, List<DatatypeHierarchy>> getOutputMaps() { return outputMaps; }
        @Override public Map<String, List<DatatypeHierarchy>> getInputMaps() { return inputMaps; }

        @Override
        public String toString() {
            return String.format("Metadata[type=%s, node=%s, inputs=%d, outputs=%d]",
                    typeId, nodeName, inputs.size() + inputMaps.size(), outputs.size() + outputMaps.size());
        }
    }
}
