package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;

import java.io.IOException;
import java.io.InputStream;
import java.lang.ref.WeakReference;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 管道图中的节点。
 * <p>
 * 节点拥有子节点列表（子管道组合）和子节点之间的连接集合，两者由节点自身的图锁保护；
 * 端口由具体子类作为成员字段持有，基类只维护按 (group, name) 索引的引用。
 * 对所属管道和父节点只保留弱引用，仅用于判断是否属于同一个图。
 * <p>
 * 生命周期由 {@link Pipeline} 或外部运行器驱动：
 * {@code DECLARED -> PLACED -> BUILD_STAGE_1..3 -> STARTED -> RUNNING -> STOPPED -> WAITED}，
 * 子类覆写 {@link #buildStage1()} 等受保护的钩子方法。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class Node {

    public static final long UNASSIGNED_ID = -1L;

    /**
     * 子节点列表和连接集合的锁。
     */
    protected final ReentrantLock graphLock = new ReentrantLock();

    private final List<Node> children = new ArrayList<>();
    private final Set<Connection> connections = new LinkedHashSet<>();
    private final Map<String, Node> subnodesByAlias = new LinkedHashMap<>();

    private final Object portIndexLock = new Object();
    private final Map<PortKey, Output> outputRefs = new LinkedHashMap<>();
    private final Map<PortKey, Input> inputRefs = new LinkedHashMap<>();
    private final Map<String, OutputMap> outputMapRefs = new LinkedHashMap<>();
    private final Map<String, InputMap> inputMapRefs = new LinkedHashMap<>();

    private final Object stateLock = new Object();
    private final AtomicBoolean attached = new AtomicBoolean(false);
    private final AssetManager assetManager = new AssetManager();

    private volatile long id = UNASSIGNED_ID;
    private volatile String alias = "";
    private volatile NodeState state = NodeState.DECLARED;
    private volatile WeakReference<Pipeline> pipelineRef = new WeakReference<>(null);
    private volatile WeakReference<Node> parentRef = new WeakReference<>(null);

    /**
     * @return 节点类型名称，如 "Replay"
     */
    public abstract String getName();

    // --- 标识 ---

    /**
     * @return 节点 ID；放置到管道之前为 {@link #UNASSIGNED_ID}
     */
    public long getId() {
        return id;
    }

    public String getAlias() {
        return alias;
    }

    public void setAlias(String alias) {
        this.alias = Objects.requireNonNull(alias, "别名不能为空");
    }

    public NodeState getState() {
        return state;
    }

    public Optional<Pipeline> getPipeline() {
        return Optional.ofNullable(pipelineRef.get());
    }

    public Optional<Node> getParentNode() {
        return Optional.ofNullable(parentRef.get());
    }

    /**
     * 节点自身的资源容器，优先于管道级资源。
     */
    public AssetManager getAssetManager() {
        return assetManager;
    }

    // --- 端口索引 ---

    void registerOutput(Output output) {
        synchronized (portIndexLock) {
            if (outputRefs.containsKey(output.getKey())) {
                throw new IllegalArgumentException(String.format("节点 '%s' 已存在输出端口 '%s'", getName(), output.getKey()));
            }
            outputRefs.put(output.getKey(), output);
        }
    }

    void registerInput(Input input) {
        synchronized (portIndexLock) {
            if (inputRefs.containsKey(input.getKey())) {
                throw new IllegalArgumentException(String.format("节点 '%s' 已存在输入端口 '%s'", getName(), input.getKey()));
            }
            inputRefs.put(input.getKey(), input);
        }
    }

    void registerOutputMap(OutputMap map) {
        synchronized (portIndexLock) {
            if (outputMapRefs.containsKey(map.getName())) {
                throw new IllegalArgumentException(String.format("节点 '%s' 已存在输出映射 '%s'", getName(), map.getName()));
            }
            outputMapRefs.put(map.getName(), map);
        }
    }

    void registerInputMap(InputMap map) {
        synchronized (portIndexLock) {
            if (inputMapRefs.containsKey(map.getName())) {
                throw new IllegalArgumentException(String.format("节点 '%s' 已存在输入映射 '%s'", getName(), map.getName()));
            }
            inputMapRefs.put(map.getName(), map);
        }
    }

    /**
     * @return 所有输出端口（包括映射中已创建的端口）的快照，按声明顺序
     */
    public List<Output> getOutputs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableList(new ArrayList<>(outputRefs.values()));
        }
    }

    public List<Input> getInputs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableList(new ArrayList<>(inputRefs.values()));
        }
    }

    public Map<PortKey, Output> getOutputRefs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(outputRefs));
        }
    }

    public Map<PortKey, Input> getInputRefs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(inputRefs));
        }
    }

    public Map<String, OutputMap> getOutputMapRefs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(outputMapRefs));
        }
    }

    public Map<String, InputMap> getInputMapRefs() {
        synchronized (portIndexLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(inputMapRefs));
        }
    }

    public Optional<Output> getOutputRef(String name) {
        return getOutputRef(PortKey.of(name));
    }

    public Optional<Output> getOutputRef(String group, String name) {
        return getOutputRef(PortKey.of(group, name));
    }

    public Optional<Output> getOutputRef(PortKey key) {
        synchronized (portIndexLock) {
            return Optional.ofNullable(outputRefs.get(key));
        }
    }

    public Optional<Input> getInputRef(String name) {
        return getInputRef(PortKey.of(name));
    }

    public Optional<Input> getInputRef(String group, String name) {
        return getInputRef(PortKey.of(group, name));
    }

    public Optional<Input> getInputRef(PortKey key) {
        synchronized (portIndexLock) {
            return Optional.ofNullable(inputRefs.get(key));
        }
    }

    public Optional<OutputMap> getOutputMapRef(String group) {
        synchronized (portIndexLock) {
            return Optional.ofNullable(outputMapRefs.get(group));
        }
    }

    public Optional<InputMap> getInputMapRef(String group) {
        synchronized (portIndexLock) {
            return Optional.ofNullable(inputMapRefs.get(group));
        }
    }

    // --- 图组装 ---

    /**
     * 将 node 作为子节点加入。如果本节点已在管道中，node 及其子树立即获得 ID。
     *
     * @param node 子节点
     * @return 传入的节点
     * @throws IllegalArgumentException 节点是管道、是本节点自身或祖先时
     * @throws IllegalStateException    节点已有父节点或已被放置过时
     */
    public <T extends Node> T add(T node) {
        Objects.requireNonNull(node, "节点不能为空");
        if (node instanceof Pipeline) {
            throw new IllegalArgumentException("管道不能作为子节点添加");
        }
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parentRef.get()) {
            if (ancestor == node) {
                throw new IllegalArgumentException(String.format("不能将 %s 添加到 %s: 会形成环", node.describe(), describe()));
            }
        }
        Node child = node;
        if (child.getId() != UNASSIGNED_ID || !child.attached.compareAndSet(false, true)) {
            throw new IllegalStateException(String.format("节点 %s 已被放置，不能重新指定父节点", child.describe()));
        }
        graphLock.lock();
        try {
            children.add(child);
            child.parentRef = new WeakReference<>(this);
        } finally {
            graphLock.unlock();
        }
        getPipeline().ifPresent(pipeline -> pipeline.place(child));
        return node;
    }

    /**
     * 用工厂创建节点并作为子节点加入。
     */
    public <T extends Node> T create(Supplier<T> factory) {
        Objects.requireNonNull(factory, "节点工厂不能为空");
        T node = Objects.requireNonNull(factory.get(), "节点工厂返回了 null");
        return add(node);
    }

    /**
     * 创建一个带别名的子节点，之后可以通过 {@link #getNodeRef(String)} 获取。
     *
     * @throws IllegalArgumentException 别名已被占用时
     */
    public <T extends Node> T createSubnode(String alias, Supplier<T> factory) {
        Objects.requireNonNull(alias, "别名不能为空");
        Objects.requireNonNull(factory, "节点工厂不能为空");
        graphLock.lock();
        try {
            if (subnodesByAlias.containsKey(alias)) {
                throw new IllegalArgumentException(String.format("节点 %s 中已存在别名为 '%s' 的子节点", describe(), alias));
            }
        } finally {
            graphLock.unlock();
        }
        T node = Objects.requireNonNull(factory.get(), "节点工厂返回了 null");
        node.setAlias(alias);
        add(node);
        graphLock.lock();
        try {
            subnodesByAlias.put(alias, node);
        } finally {
            graphLock.unlock();
        }
        return node;
    }

    public Optional<Node> getNodeRef(String alias) {
        graphLock.lock();
        try {
            return Optional.ofNullable(subnodesByAlias.get(alias));
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * 按别名获取指定类型的子节点。
     *
     * @throws IllegalArgumentException 子节点存在但类型不匹配时
     */
    public <T extends Node> Optional<T> getNodeRef(String alias, Class<T> type) {
        Objects.requireNonNull(type, "节点类型不能为空");
        Optional<Node> node = getNodeRef(alias);
        if (node.isPresent() && !type.isInstance(node.get())) {
            throw new IllegalArgumentException(String.format("子节点 '%s' 的类型为 %s，而不是 %s",
                    alias, node.get().getClass().getSimpleName(), type.getSimpleName()));
        }
        return node.map(type::cast);
    }

    /**
     * 移除子节点及其整个子树。
     * 在本节点及所有祖先的图锁下，删除所有涉及该子树的连接并断开对应的队列，
     * 清空子树中所有输出端口的扇出列表，释放其输入队列，并从管道 ID 索引中移除。
     *
     * @param node 要移除的直接子节点
     * @throws IllegalArgumentException node 不是本节点的直接子节点时
     */
    public void remove(Node node) {
        Objects.requireNonNull(node, "节点不能为空");
        List<Node> lockChain = ancestorsFromRoot();
        lockChain.add(this);
        Optional<Pipeline> pipeline = getPipeline();
        List<Connection> removedConnections = new ArrayList<>();
        List<Node> subtree;

        lockChain.forEach(n -> n.graphLock.lock());
        try {
            if (!containsChild(node)) {
                throw new IllegalArgumentException(String.format("%s 不是 %s 的子节点", node.describe(), describe()));
            }
            subtree = node.collectSubtree();
            Set<Long> removedIds = new HashSet<>();
            for (Node n : subtree) {
                removedIds.add(n.getId());
            }

            for (Node owner : lockChain) {
                Iterator<Connection> it = owner.connections.iterator();
                while (it.hasNext()) {
                    Connection connection = it.next();
                    if (removedIds.contains(connection.getOutputNodeId()) || removedIds.contains(connection.getInputNodeId())) {
                        pipeline.ifPresent(p -> detachResolved(p, connection));
                        it.remove();
                        removedConnections.add(connection);
                    }
                }
            }

            // 先脱离管道，之后在子树节点锁下进行的连接会在复查时失败
            children.remove(node);
            subnodesByAlias.values().removeIf(candidate -> candidate == node);
            node.parentRef = new WeakReference<>(null);
            pipeline.ifPresent(p -> p.unindex(subtree));
            for (Node n : subtree) {
                n.pipelineRef = new WeakReference<>(null);
            }

            for (Node n : subtree) {
                n.graphLock.lock();
                try {
                    removedConnections.addAll(n.connections);
                    n.connections.clear();
                } finally {
                    n.graphLock.unlock();
                }
                n.getOutputs().forEach(Output::detachAll);
                n.getInputs().forEach(Input::releaseQueue);
            }
        } finally {
            for (int i = lockChain.size() - 1; i >= 0; i--) {
                lockChain.get(i).graphLock.unlock();
            }
        }

        log.debug("[Pipeline] 已从 {} 移除节点 {} (子树 {} 个节点，断开 {} 条连接)",
                describe(), node.describe(), subtree.size(), removedConnections.size());
        if (pipeline.isPresent()) {
            Pipeline p = pipeline.get();
            for (Connection connection : removedConnections) {
                p.safeNotifyListeners(listener -> listener.onUnlink(p, connection));
            }
            p.safeNotifyListeners(listener -> listener.onNodeRemoved(p, node));
        }
    }

    /**
     * 等价于 {@code out.link(in)}。
     */
    public Connection link(Output out, Input in) {
        Objects.requireNonNull(out, "输出端口不能为空");
        return out.link(in);
    }

    /**
     * 等价于 {@code out.unlink(in)}。
     */
    public void unlink(Output out, Input in) {
        Objects.requireNonNull(out, "输出端口不能为空");
        out.unlink(in);
    }

    public boolean canConnect(Output out, Input in) {
        return out != null && out.canConnect(in);
    }

    /**
     * @return 本节点记录的连接快照
     */
    public List<Connection> getConnections() {
        graphLock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(connections));
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * @return 本节点及所有后代节点记录的连接
     */
    public List<Connection> getAllConnections() {
        List<Connection> result = new ArrayList<>(getConnections());
        for (Node node : getAllNodes()) {
            result.addAll(node.getConnections());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 返回以输入端节点为键、终止于该节点的连接集合为值的快照。
     * 结果与内部状态不共享。
     */
    public Map<Node, Set<Connection>> getConnectionMap() {
        List<Connection> snapshot = getConnections();
        Optional<Pipeline> pipeline = getPipeline();
        if (snapshot.isEmpty() || !pipeline.isPresent()) {
            return Collections.emptyMap();
        }
        Map<Node, Set<Connection>> result = new LinkedHashMap<>();
        for (Connection connection : snapshot) {
            Optional<Node> inputNode = pipeline.get().getNode(connection.getInputNodeId());
            if (!inputNode.isPresent()) {
                log.warn("[Pipeline] 连接 {} 的输入节点已不在管道中，忽略", connection);
                continue;
            }
            result.computeIfAbsent(inputNode.get(), k -> new LinkedHashSet<>()).add(connection);
        }
        Map<Node, Set<Connection>> readOnly = new LinkedHashMap<>();
        result.forEach((node, set) -> readOnly.put(node, Collections.unmodifiableSet(set)));
        return Collections.unmodifiableMap(readOnly);
    }

    /**
     * @return 直接子节点快照
     */
    public List<Node> getChildren() {
        graphLock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(children));
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * @return 所有后代节点（先序，不含自身）
     */
    public List<Node> getAllNodes() {
        List<Node> subtree = collectSubtree();
        return Collections.unmodifiableList(subtree.subList(1, subtree.size()));
    }

    /**
     * 在后代节点中按 ID 查找。
     */
    public Optional<Node> getNode(long nodeId) {
        for (Node node : getAllNodes()) {
            if (node.getId() == nodeId) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    // --- 资源 ---

    /**
     * 加载资源。"asset:" URI 先在本节点、再在管道的 {@link AssetManager} 中查找；
     * 其余 URI（classpath:、file:、URL）通过管道的 Spring {@link ResourceLoader} 加载。
     *
     * @param uri 资源 URI
     * @return 资源内容
     * @throws ResourceLoadException 资源不存在或无法读取时
     */
    public ByteBuffer loadResource(String uri) {
        Objects.requireNonNull(uri, "资源 URI 不能为空");
        if (uri.startsWith(AssetManager.ASSET_SCHEME)) {
            String key = uri.substring(AssetManager.ASSET_SCHEME.length());
            Optional<ByteBuffer> local = assetManager.get(key);
            if (local.isPresent()) {
                return local.get();
            }
            return getPipeline()
                    .flatMap(pipeline -> pipeline.getAssetManager().get(key))
                    .orElseThrow(() -> new ResourceLoadException(String.format("节点 %s 找不到资源 '%s'", describe(), uri)));
        }
        ResourceLoader loader = getPipeline().map(Pipeline::getResourceLoader).orElseGet(DefaultResourceLoader::new);
        Resource resource = loader.getResource(uri);
        if (!resource.exists()) {
            throw new ResourceLoadException(String.format("节点 %s 找不到资源 '%s'", describe(), uri));
        }
        try (InputStream in = resource.getInputStream()) {
            return ByteBuffer.wrap(StreamUtils.copyToByteArray(in)).asReadOnlyBuffer();
        } catch (IOException e) {
            throw new ResourceLoadException(String.format("节点 %s 读取资源 '%s' 失败: %s", describe(), uri, e.getMessage()), e);
        }
    }

    /**
     * 节点要求的运行时版本，默认没有要求。
     */
    public Optional<RuntimeVersion> getRequiredRuntimeVersion() {
        return Optional.empty();
    }

    // --- 生命周期钩子 (子类覆写) ---

    protected void buildStage1() {
    }

    protected void buildStage2() {
    }

    protected void buildStage3() {
    }

    /**
     * 打开外部资源。
     */
    protected void start() {
    }

    /**
     * 释放外部资源。
     */
    protected void stop() {
    }

    /**
     * 等待执行完全结束。
     *
     * @return 在超时前结束时为 true
     */
    protected boolean awaitTermination(Duration timeout) {
        return true;
    }

    // --- 生命周期驱动 ---

    /**
     * 执行第 stage 个构建阶段。阶段必须按 1、2、3 的顺序执行。
     *
     * @throws IllegalStateException 节点不处于上一个阶段时
     */
    public final void executeBuildStage(int stage) {
        NodeState target = NodeState.buildStage(stage);
        NodeState expected = stage == 1 ? NodeState.PLACED : NodeState.buildStage(stage - 1);
        if (state != expected) {
            throw new IllegalStateException(String.format("节点 %s 处于 %s，无法执行构建阶段 %d", describe(), state, stage));
        }
        transitionTo(target);
        switch (stage) {
            case 1:
                buildStage1();
                break;
            case 2:
                buildStage2();
                break;
            default:
                buildStage3();
                break;
        }
    }

    /**
     * @throws IllegalStateException 节点尚未完成构建阶段 3 时
     */
    public final void executeStart() {
        if (state != NodeState.BUILD_STAGE_3) {
            throw new IllegalStateException(String.format("节点 %s 处于 %s，必须先完成构建才能启动", describe(), state));
        }
        transitionTo(NodeState.STARTED);
        start();
    }

    /**
     * 请求停止。重复调用无效果。
     */
    public final void executeStop() {
        if (!tryTransitionTo(NodeState.STOPPED)) {
            return;
        }
        beforeStop();
        stop();
    }

    /**
     * 等待节点执行结束，成功后进入 {@link NodeState#WAITED}。
     *
     * @throws IllegalStateException 节点尚未停止时
     */
    public final boolean executeAwaitTermination(Duration timeout) {
        Objects.requireNonNull(timeout, "超时时间不能为空");
        NodeState current = state;
        if (current == NodeState.WAITED) {
            return true;
        }
        if (current != NodeState.STOPPED) {
            throw new IllegalStateException(String.format("节点 %s 处于 %s，必须先停止才能等待", describe(), current));
        }
        if (!awaitTermination(timeout)) {
            return false;
        }
        tryTransitionTo(NodeState.WAITED);
        return true;
    }

    /**
     * 停止钩子之前的框架内部处理。
     */
    void beforeStop() {
    }

    void transitionTo(NodeState target) {
        if (!tryTransitionTo(target)) {
            throw new IllegalStateException(String.format("节点 %s 无法从 %s 转换到 %s", describe(), state, target));
        }
    }

    boolean tryTransitionTo(NodeState target) {
        NodeState previous;
        synchronized (stateLock) {
            if (!state.canAdvanceTo(target)) {
                return false;
            }
            previous = state;
            state = target;
        }
        log.trace("[Pipeline] 节点 {} 状态: {} -> {}", describe(), previous, target);
        notifyListeners(listener -> listener.onNodeStateChange(this, previous, target));
        return true;
    }

    // --- 放置与内部辅助 ---

    /**
     * 分配 ID 并绑定到管道。已分配过的节点返回 false。
     */
    boolean assignPlacement(Pipeline pipeline, LongSupplier idSupplier) {
        synchronized (stateLock) {
            if (id != UNASSIGNED_ID) {
                return false;
            }
            id = idSupplier.getAsLong();
            pipelineRef = new WeakReference<>(pipeline);
        }
        transitionTo(NodeState.PLACED);
        return true;
    }

    void markAttached() {
        attached.set(true);
    }

    boolean containsConnection(Connection connection) {
        return connections.contains(connection);
    }

    void addConnection(Connection connection) {
        connections.add(connection);
    }

    void removeConnection(Connection connection) {
        connections.remove(connection);
    }

    void notifyListeners(Consumer<PipelineMonitorListener> action) {
        Pipeline pipeline = pipelineRef.get();
        if (pipeline != null) {
            pipeline.safeNotifyListeners(action);
        }
    }

    /**
     * @return 以本节点为根的子树（先序，含自身）
     */
    List<Node> collectSubtree() {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            result.add(current);
            List<Node> snapshot = current.getChildren();
            for (int i = snapshot.size() - 1; i >= 0; i--) {
                stack.push(snapshot.get(i));
            }
        }
        return result;
    }

    private boolean containsChild(Node node) {
        for (Node child : children) {
            if (child == node) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return 从根到父节点的祖先链（不含自身）
     */
    private List<Node> ancestorsFromRoot() {
        List<Node> chain = new ArrayList<>();
        for (Node ancestor = parentRef.get(); ancestor != null; ancestor = ancestor.parentRef.get()) {
            chain.add(ancestor);
        }
        Collections.reverse(chain);
        return chain;
    }

    private static void detachResolved(Pipeline pipeline, Connection connection) {
        Optional<Output> output = connection.resolveOutput(pipeline);
        Optional<Input> input = connection.resolveInput(pipeline);
        if (output.isPresent() && input.isPresent()) {
            output.get().detachQueue(input.get().getQueue());
        } else {
            log.warn("[Pipeline] 无法解析连接 {} 的端点，跳过队列断开", connection);
        }
    }

    /**
     * 两个节点的最近公共（严格）祖先，即同时包含两者的最深节点。
     */
    static Optional<Node> lowestCommonAncestor(Node a, Node b) {
        Set<Node> ancestorsOfA = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node n = a.parentRef.get(); n != null; n = n.parentRef.get()) {
            ancestorsOfA.add(n);
        }
        for (Node n = b.parentRef.get(); n != null; n = n.parentRef.get()) {
            if (ancestorsOfA.contains(n)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    /**
     * @return "NodeName[id]"
     */
    String describe() {
        return getName() + "[" + id + "]";
    }

    @Override
    public String toString() {
        return alias.isEmpty() ? describe() : describe() + "(" + alias + ")";
    }
}
