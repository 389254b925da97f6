package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.registry.NodeRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 管道：节点图的根节点。
 * 负责分配节点 ID、维护 ID 索引、分发监听器事件，并提供管道级资源和节点注册表。
 * 管道自身的 ID 为 0，子节点从 1 开始编号。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class Pipeline extends Node {

    public static final String NAME = "Pipeline";

    private final AtomicLong idCounter = new AtomicLong(0);
    private final ConcurrentMap<Long, Node> nodeIndex = new ConcurrentHashMap<>();
    private final List<PipelineMonitorListener> listeners = new CopyOnWriteArrayList<>();
    private final AssetManager pipelineAssets = new AssetManager();

    private volatile ResourceLoader resourceLoader = new DefaultResourceLoader();
    private volatile NodeRegistry nodeRegistry;
    private volatile RuntimeVersion forcedRuntimeVersion;

    public Pipeline() {
        this(Collections.<PipelineMonitorListener>emptyList());
    }

    public Pipeline(List<PipelineMonitorListener> listeners) {
        Objects.requireNonNull(listeners, "监听器列表不能为空");
        this.listeners.addAll(listeners);
        markAttached();
        assignPlacement(this, idCounter::getAndIncrement);
        log.debug("[Pipeline] 新管道已创建，监听器数量: {}", this.listeners.size());
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * 管道级资源容器。节点级资源找不到时回退到这里。
     */
    @Override
    public AssetManager getAssetManager() {
        return pipelineAssets;
    }

    public ResourceLoader getResourceLoader() {
        return resourceLoader;
    }

    public void setResourceLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "ResourceLoader 不能为空");
    }

    public Optional<NodeRegistry> getNodeRegistry() {
        return Optional.ofNullable(nodeRegistry);
    }

    public void setNodeRegistry(NodeRegistry nodeRegistry) {
        this.nodeRegistry = nodeRegistry;
    }

    /**
     * 按注册表中的类型 ID 创建节点并加入管道。
     *
     * @throws IllegalStateException    未设置节点注册表时
     * @throws IllegalArgumentException 类型 ID 未注册时
     */
    public Node create(String nodeTypeId) {
        NodeRegistry registry = nodeRegistry;
        if (registry == null) {
            throw new IllegalStateException("管道未设置 NodeRegistry，无法按类型 ID 创建节点: " + nodeTypeId);
        }
        Node node = registry.createInstance(nodeTypeId)
                .orElseThrow(() -> new IllegalArgumentException("未注册的节点类型 ID: " + nodeTypeId));
        return add(node);
    }

    // --- 监听器 ---

    public void addListener(PipelineMonitorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "监听器不能为空"));
    }

    public boolean removeListener(PipelineMonitorListener listener) {
        return listeners.remove(listener);
    }

    public List<PipelineMonitorListener> getListeners() {
        return Collections.unmodifiableList(new ArrayList<>(listeners));
    }

    /**
     * 依次通知所有监听器，单个监听器的异常只记录日志。
     */
    void safeNotifyListeners(Consumer<PipelineMonitorListener> action) {
        if (listeners.isEmpty()) {
            return;
        }
        for (PipelineMonitorListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("[Pipeline] 监听器 {} 抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    // --- ID 索引 ---

    /**
     * 为子树中尚未放置的节点分配 ID 并加入索引。
     */
    void place(Node subtreeRoot) {
        List<Node> placed = new ArrayList<>();
        for (Node node : subtreeRoot.collectSubtree()) {
            if (node.assignPlacement(this, idCounter::getAndIncrement)) {
                nodeIndex.put(node.getId(), node);
                placed.add(node);
            }
        }
        for (Node node : placed) {
            log.debug("[Pipeline] 节点 {} 已放置到管道中", node);
            safeNotifyListeners(listener -> listener.onNodeAdded(this, node));
        }
    }

    void unindex(List<Node> nodes) {
        for (Node node : nodes) {
            nodeIndex.remove(node.getId(), node);
        }
    }

    /**
     * 通过 ID 索引查找节点。
     */
    @Override
    public Optional<Node> getNode(long nodeId) {
        if (nodeId == getId()) {
            return Optional.of(this);
        }
        return Optional.ofNullable(nodeIndex.get(nodeId));
    }

    public int getNodeCount() {
        return nodeIndex.size();
    }

    // --- 构建 ---

    /**
     * 依次对管道中所有节点执行构建阶段 1、2、3。
     * 每个阶段对全部节点执行完后才进入下一个阶段；已构建的节点会被跳过，
     * 因此构建后新加入的节点可以通过再次调用本方法完成构建。
     *
     * @throws PipelineException 节点要求的运行时版本冲突时
     */
    public void build() {
        getRequiredRuntimeVersion();
        List<Node> nodes = new ArrayList<>();
        nodes.add(this);
        nodes.addAll(getAllNodes());
        int built = 0;
        for (int stage = 1; stage <= 3; stage++) {
            NodeState expected = stage == 1 ? NodeState.PLACED : NodeState.buildStage(stage - 1);
            for (Node node : nodes) {
                if (node.getState() == expected) {
                    node.executeBuildStage(stage);
                    if (stage == 3) {
                        built++;
                    }
                }
            }
        }
        log.info("[Pipeline] 构建完成，本次构建 {} 个节点，管道共 {} 个节点", built, nodes.size());
    }

    // --- 运行时版本 ---

    /**
     * 强制指定管道使用的运行时版本。
     */
    public void setRuntimeVersion(RuntimeVersion version) {
        this.forcedRuntimeVersion = version;
    }

    /**
     * 汇总所有节点要求的运行时版本。
     *
     * @return 强制指定的版本，或节点共同要求的版本；都没有时为空
     * @throws PipelineException 节点之间、或节点与强制版本之间的要求冲突时
     */
    @Override
    public Optional<RuntimeVersion> getRequiredRuntimeVersion() {
        RuntimeVersion required = forcedRuntimeVersion;
        Node requiredBy = null;
        for (Node node : getAllNodes()) {
            Optional<RuntimeVersion> version = node.getRequiredRuntimeVersion();
            if (!version.isPresent()) {
                continue;
            }
            if (required == null) {
                required = version.get();
                requiredBy = node;
            } else if (!required.equals(version.get())) {
                String source = requiredBy == null ? "管道强制设置" : "节点 " + requiredBy;
                throw new PipelineException(String.format("运行时版本冲突: %s 要求 %s，节点 %s 要求 %s",
                        source, required, node, version.get()));
            }
        }
        return Optional.ofNullable(required);
    }
}
