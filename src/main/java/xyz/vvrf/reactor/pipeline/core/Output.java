package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 节点的输出端口。
 * 一个 Output 向任意多个队列扇出消息；扇出列表由端口自身的锁保护，
 * 发送时先在锁内取快照，再在锁外按各队列自己的策略投递。
 * <p>
 * 通过 {@link #builder(Node, String)} 在节点构造期间声明，创建后自动登记到父节点的端口索引。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class Output {

    /**
     * 发送方角色。
     */
    public enum Type {
        /** 多消息/流式发送 */
        M_SENDER,
        /** 单消息发送 */
        S_SENDER
    }

    public static final List<DatatypeHierarchy> DEFAULT_DATATYPES =
            Collections.singletonList(DatatypeHierarchy.withDescendants(DatatypeEnum.BUFFER));

    private final Node parent;
    private final PortKey key;
    private final Type type;
    private final List<DatatypeHierarchy> possibleDatatypes;

    private final ReentrantLock fanOutLock = new ReentrantLock();
    private final List<MessageQueue> queues = new ArrayList<>();

    Output(Node parent, PortKey key, Type type, List<DatatypeHierarchy> possibleDatatypes) {
        this.parent = Objects.requireNonNull(parent, "父节点不能为空");
        this.key = Objects.requireNonNull(key, "端口键不能为空");
        this.type = Objects.requireNonNull(type, "端口类型不能为空");
        Objects.requireNonNull(possibleDatatypes, "数据类型列表不能为空");
        if (possibleDatatypes.isEmpty()) {
            throw new IllegalArgumentException("输出端口 '" + key + "' 至少需要声明一种数据类型");
        }
        this.possibleDatatypes = Collections.unmodifiableList(new ArrayList<>(possibleDatatypes));
    }

    /**
     * 开始声明一个属于 parent 的输出端口。
     */
    public static Builder builder(Node parent, String name) {
        return new Builder(parent, name);
    }

    // --- Getters ---

    public Node getParent() {
        return parent;
    }

    public PortKey getKey() {
        return key;
    }

    public String getName() {
        return key.getName();
    }

    public String getGroup() {
        return key.getGroup();
    }

    public Type getType() {
        return type;
    }

    public List<DatatypeHierarchy> getPossibleDatatypes() {
        return possibleDatatypes;
    }

    // --- 兼容性检查 ---

    /**
     * @return 两端口所属节点属于同一个管道实例时为 true
     */
    public boolean isSamePipeline(Input input) {
        if (input == null) {
            return false;
        }
        Optional<Pipeline> mine = parent.getPipeline();
        Optional<Pipeline> theirs = input.getParent().getPipeline();
        return mine.isPresent() && theirs.isPresent() && mine.get() == theirs.get();
    }

    /**
     * 判断能否连接到 input（无副作用）：同一管道，且至少有一对数据类型兼容。
     */
    public boolean canConnect(Input input) {
        return isSamePipeline(input)
                && DatatypeHierarchy.anyCompatible(possibleDatatypes, input.getPossibleDatatypes());
    }

    // --- 连接 ---

    /**
     * 连接到 input：将 input 的队列加入扇出列表，并在两端节点的最近公共祖先中记录连接。
     * 失败时图状态保持不变。
     *
     * @param input 目标输入端口
     * @return 新建立的连接
     * @throws InvalidLinkException 不同管道、无兼容数据类型或已连接时
     */
    public Connection link(Input input) {
        Objects.requireNonNull(input, "输入端口不能为空");
        if (!isSamePipeline(input)) {
            throw new InvalidLinkException(String.format("无法连接 %s -> %s: 两个端口不属于同一个管道", this, input));
        }
        if (!canConnect(input)) {
            throw new InvalidLinkException(String.format("无法连接 %s -> %s: 数据类型不兼容 (输出: %s, 输入: %s)",
                    this, input, possibleDatatypes, input.getPossibleDatatypes()));
        }
        Node owner = Node.lowestCommonAncestor(parent, input.getParent())
                .orElseThrow(() -> new InvalidLinkException(
                        String.format("无法连接 %s -> %s: 找不到公共祖先节点", this, input)));
        Connection connection = Connection.between(this, input);

        owner.graphLock.lock();
        try {
            // 加锁前的检查可能已被并发的 remove 作废
            if (!isSamePipeline(input) || !isPlaced(parent) || !isPlaced(input.getParent())) {
                throw new InvalidLinkException(String.format("无法连接 %s -> %s: 端口所属节点已从管道中移除", this, input));
            }
            if (owner.containsConnection(connection)) {
                throw new InvalidLinkException(String.format("无法连接 %s -> %s: 连接已存在", this, input));
            }
            attachQueue(input.getQueue());
            owner.addConnection(connection);
        } finally {
            owner.graphLock.unlock();
        }
        log.debug("[Pipeline] 已连接 {} -> {} (记录于 {})", this, input, owner.describe());
        owner.notifyListeners(listener -> listener.onLink(owner.getPipeline().orElse(null), connection));
        return connection;
    }

    /**
     * 断开与 input 的连接。
     *
     * @throws InvalidUnlinkException 两端口当前未连接时
     */
    public void unlink(Input input) {
        Objects.requireNonNull(input, "输入端口不能为空");
        Optional<Node> ownerOpt = isSamePipeline(input)
                ? Node.lowestCommonAncestor(parent, input.getParent())
                : Optional.empty();
        if (!ownerOpt.isPresent()) {
            throw new InvalidUnlinkException(String.format("无法断开 %s -> %s: 两个端口未连接", this, input));
        }
        Node owner = ownerOpt.get();
        Connection connection = Connection.between(this, input);

        owner.graphLock.lock();
        try {
            if (!owner.containsConnection(connection)) {
                throw new InvalidUnlinkException(String.format("无法断开 %s -> %s: 两个端口未连接", this, input));
            }
            detachQueue(input.getQueue());
            owner.removeConnection(connection);
        } finally {
            owner.graphLock.unlock();
        }
        log.debug("[Pipeline] 已断开 {} -> {}", this, input);
        owner.notifyListeners(listener -> listener.onUnlink(owner.getPipeline().orElse(null), connection));
    }

    /**
     * 直接连接到一个外部队列，不经过 Input，也不做管道和数据类型检查。
     *
     * @throws InvalidLinkException 队列已在扇出列表中或已关闭时
     */
    public void link(MessageQueue queue) {
        Objects.requireNonNull(queue, "队列不能为空");
        attachQueue(queue);
        log.debug("[Pipeline] {} 已直接连接到队列 '{}'", this, queue.getName());
    }

    /**
     * 断开与外部队列的直接连接。
     *
     * @throws InvalidUnlinkException 队列不在扇出列表中时
     */
    public void unlink(MessageQueue queue) {
        Objects.requireNonNull(queue, "队列不能为空");
        if (!detachQueue(queue)) {
            throw new InvalidUnlinkException(String.format("无法断开 %s 与队列 '%s': 未连接", this, queue.getName()));
        }
    }

    /**
     * 创建一个默认配置（容量 16，阻塞）的新队列并直接连接。
     * 返回的队列在调用方和本端口之间共享，端口断开后调用方仍可读取剩余消息。
     */
    public MessageQueue getQueue() {
        return getQueue(MessageQueue.DEFAULT_MAX_SIZE, MessageQueue.DEFAULT_BLOCKING);
    }

    public MessageQueue getQueue(int maxSize, boolean blocking) {
        MessageQueue queue = new MessageQueue(toString(), maxSize, blocking);
        link(queue);
        return queue;
    }

    /**
     * @return 当前扇出列表的快照
     */
    public List<MessageQueue> getQueueConnections() {
        fanOutLock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(queues));
        } finally {
            fanOutLock.unlock();
        }
    }

    /**
     * @return 以本端口为输出端的所有已记录连接
     */
    public List<Connection> getConnections() {
        List<Connection> result = new ArrayList<>();
        long nodeId = parent.getId();
        Optional<Node> current = parent.getParentNode();
        while (current.isPresent()) {
            for (Connection connection : current.get().getConnections()) {
                if (connection.getOutputNodeId() == nodeId && connection.getOutputKey().equals(key)) {
                    result.add(connection);
                }
            }
            current = current.get().getParentNode();
        }
        return result;
    }

    // --- 发送 ---

    /**
     * 向所有已连接的队列发送消息，各队列独立应用自己的阻塞/覆盖策略。
     * 没有连接时什么也不做；已关闭的队列会被跳过。
     */
    public void send(Message message) {
        Objects.requireNonNull(message, "消息不能为空");
        for (MessageQueue queue : snapshot()) {
            try {
                if (!queue.send(message)) {
                    log.debug("[Pipeline] {} 向队列 '{}' 发送被中断", this, queue.getName());
                }
            } catch (MessageQueueClosedException e) {
                log.debug("[Pipeline] {} 跳过已关闭的队列 '{}'", this, queue.getName());
            }
        }
    }

    /**
     * 不等待地向所有已连接的队列发送消息。
     * 只有全部队列都接收时才返回 true；返回 false 时消息可能已投递到部分队列，不做回滚。
     */
    public boolean trySend(Message message) {
        Objects.requireNonNull(message, "消息不能为空");
        boolean allAccepted = true;
        for (MessageQueue queue : snapshot()) {
            try {
                if (!queue.trySend(message)) {
                    allAccepted = false;
                }
            } catch (MessageQueueClosedException e) {
                log.debug("[Pipeline] {} 跳过已关闭的队列 '{}'", this, queue.getName());
                allAccepted = false;
            }
        }
        return allAccepted;
    }

    // --- 内部方法 ---

    private static boolean isPlaced(Node node) {
        Optional<Pipeline> pipeline = node.getPipeline();
        return pipeline.isPresent() && pipeline.get().getNode(node.getId()).orElse(null) == node;
    }

    void attachQueue(MessageQueue queue) {
        fanOutLock.lock();
        try {
            if (queues.contains(queue)) {
                throw new InvalidLinkException(String.format("%s 已连接到队列 '%s'", this, queue.getName()));
            }
            if (!queue.retain()) {
                throw new InvalidLinkException(String.format("%s 无法连接到已关闭的队列 '%s'", this, queue.getName()));
            }
            queues.add(queue);
        } finally {
            fanOutLock.unlock();
        }
    }

    boolean detachQueue(MessageQueue queue) {
        boolean removed;
        fanOutLock.lock();
        try {
            removed = queues.remove(queue);
        } finally {
            fanOutLock.unlock();
        }
        if (removed) {
            queue.release();
        }
        return removed;
    }

    /**
     * 清空扇出列表并释放所有队列引用。
     */
    void detachAll() {
        List<MessageQueue> detached;
        fanOutLock.lock();
        try {
            detached = new ArrayList<>(queues);
            queues.clear();
        } finally {
            fanOutLock.unlock();
        }
        detached.forEach(MessageQueue::release);
    }

    private List<MessageQueue> snapshot() {
        fanOutLock.lock();
        try {
            return queues.isEmpty() ? Collections.<MessageQueue>emptyList() : new ArrayList<>(queues);
        } finally {
            fanOutLock.unlock();
        }
    }

    /**
     * @return "NodeName[id].group:name"
     */
    @Override
    public String toString() {
        return parent.describe() + "." + key;
    }

    /**
     * Output 声明构建器。
     */
    public static final class Builder {
        private final Node parent;
        private final String name;
        private String group = PortKey.NO_GROUP;
        private Type type = Type.M_SENDER;
        private List<DatatypeHierarchy> possibleDatatypes = DEFAULT_DATATYPES;

        private Builder(Node parent, String name) {
            this.parent = Objects.requireNonNull(parent, "父节点不能为空");
            this.name = Objects.requireNonNull(name, "端口名称不能为空");
        }

        public Builder group(String group) {
            this.group = Objects.requireNonNull(group, "端口分组不能为空");
            return this;
        }

        public Builder type(Type type) {
            this.type = Objects.requireNonNull(type, "端口类型不能为空");
            return this;
        }

        public Builder possibleDatatypes(DatatypeHierarchy... datatypes) {
            return possibleDatatypes(Arrays.asList(datatypes));
        }

        public Builder possibleDatatypes(List<DatatypeHierarchy> datatypes) {
            this.possibleDatatypes = Objects.requireNonNull(datatypes, "数据类型列表不能为空");
            return this;
        }

        /**
         * 创建端口并登记到父节点。
         *
         * @throws IllegalArgumentException 父节点已有相同 (group, name) 的输出端口时
         */
        public Output build() {
            Output output = new Output(parent, PortKey.of(group, name), type, possibleDatatypes);
            parent.registerOutput(output);
            return output;
        }
    }
}
