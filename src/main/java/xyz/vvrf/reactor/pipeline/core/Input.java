package xyz.vvrf.reactor.pipeline.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 节点的输入端口。每个 Input 在构造时创建并持有唯一的一个 {@link MessageQueue}，
 * 所有连接到它的 Output 共享该队列。
 * <p>
 * 读取方法直接委托给队列。两个 Input 的相等性按结构判断：
 * 同一父节点、分组、名称、角色和队列配置。
 *
 * @author ruifeng.wen
 */
public class Input {

    /**
     * 期望的发送方角色。
     */
    public enum Type {
        /** 期望单消息发送方 */
        S_RECEIVER,
        /** 期望多消息/流式发送方 */
        M_RECEIVER
    }

    public static final boolean DEFAULT_BLOCKING = true;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 8;
    public static final boolean DEFAULT_WAIT_FOR_MESSAGE = false;

    private final Node parent;
    private final PortKey key;
    private final Type type;
    private final List<DatatypeHierarchy> possibleDatatypes;
    private final MessageQueue queue;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean waitForMessage;

    Input(Node parent, PortKey key, Type type, List<DatatypeHierarchy> possibleDatatypes,
          boolean blocking, int maxQueueSize, boolean waitForMessage) {
        this.parent = Objects.requireNonNull(parent, "父节点不能为空");
        this.key = Objects.requireNonNull(key, "端口键不能为空");
        this.type = Objects.requireNonNull(type, "端口类型不能为空");
        Objects.requireNonNull(possibleDatatypes, "数据类型列表不能为空");
        if (possibleDatatypes.isEmpty()) {
            throw new IllegalArgumentException("输入端口 '" + key + "' 至少需要声明一种数据类型");
        }
        this.possibleDatatypes = Collections.unmodifiableList(new ArrayList<>(possibleDatatypes));
        this.waitForMessage = waitForMessage;
        this.queue = new MessageQueue(parent.getName() + "." + key, maxQueueSize, blocking);
        this.queue.retain();
    }

    /**
     * 开始声明一个属于 parent 的输入端口。
     */
    public static Builder builder(Node parent, String name) {
        return new Builder(parent, name);
    }

    // --- Getters / Setters ---

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

    public MessageQueue getQueue() {
        return queue;
    }

    public boolean getBlocking() {
        return queue.isBlocking();
    }

    public void setBlocking(boolean blocking) {
        queue.setBlocking(blocking);
    }

    public int getMaxQueueSize() {
        return queue.getMaxSize();
    }

    public void setMaxQueueSize(int maxQueueSize) {
        queue.setMaxSize(maxQueueSize);
    }

    /**
     * 多输入节点是否必须等待此输入的消息后才继续。仅作为节点实现的调度提示。
     */
    public boolean getWaitForMessage() {
        return waitForMessage;
    }

    public void setWaitForMessage(boolean waitForMessage) {
        this.waitForMessage = waitForMessage;
    }

    /**
     * {@link #getWaitForMessage()} 的反义：没有新消息时是否复用上一条消息。
     */
    public boolean getReusePreviousMessage() {
        return !waitForMessage;
    }

    public void setReusePreviousMessage(boolean reusePreviousMessage) {
        this.waitForMessage = !reusePreviousMessage;
    }

    // --- 读取 (委托给队列) ---

    public boolean has() {
        return queue.has();
    }

    public <T extends Message> boolean has(Class<T> type) {
        return queue.has(type);
    }

    public Optional<Message> front() {
        return queue.front();
    }

    public <T extends Message> Optional<T> front(Class<T> type) {
        return queue.front(type);
    }

    public Optional<Message> tryGet() {
        return queue.tryGet();
    }

    public <T extends Message> Optional<T> tryGet(Class<T> type) {
        return queue.tryGet(type);
    }

    public Optional<Message> get() {
        return queue.get();
    }

    public <T extends Message> Optional<T> get(Class<T> type) {
        return queue.get(type);
    }

    public Optional<Message> get(Duration timeout) {
        return queue.get(timeout);
    }

    public <T extends Message> Optional<T> get(Class<T> type, Duration timeout) {
        return queue.get(type, timeout);
    }

    public List<Message> tryGetAll() {
        return queue.tryGetAll();
    }

    public <T extends Message> List<T> tryGetAll(Class<T> type) {
        return queue.tryGetAll(type);
    }

    public List<Message> getAll() {
        return queue.getAll();
    }

    public <T extends Message> List<T> getAll(Class<T> type) {
        return queue.getAll(type);
    }

    public List<Message> getAll(Duration timeout) {
        return queue.getAll(timeout);
    }

    // --- 内部方法 ---

    /**
     * 释放本端口对队列的引用（只生效一次）。
     */
    void releaseQueue() {
        if (released.compareAndSet(false, true)) {
            queue.release();
        }
    }

    /**
     * 关闭队列以唤醒阻塞在读取上的线程。
     */
    void closeQueue() {
        queue.close();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Input that = (Input) o;
        return parent == that.parent
                && key.equals(that.key)
                && type == that.type
                && getBlocking() == that.getBlocking()
                && getMaxQueueSize() == that.getMaxQueueSize()
                && waitForMessage == that.waitForMessage;
    }

    @Override
    public int hashCode() {
        // 队列配置可变，只使用不可变字段
        return Objects.hash(System.identityHashCode(parent), key, type);
    }

    /**
     * @return "NodeName[id].group:name"
     */
    @Override
    public String toString() {
        return parent.describe() + "." + key;
    }

    /**
     * Input 声明构建器。
     */
    public static final class Builder {
        private final Node parent;
        private final String name;
        private String group = PortKey.NO_GROUP;
        private Type type = Type.S_RECEIVER;
        private List<DatatypeHierarchy> possibleDatatypes = Output.DEFAULT_DATATYPES;
        private boolean blocking = DEFAULT_BLOCKING;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private boolean waitForMessage = DEFAULT_WAIT_FOR_MESSAGE;

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

        public Builder blocking(boolean blocking) {
            this.blocking = blocking;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder waitForMessage(boolean waitForMessage) {
            this.waitForMessage = waitForMessage;
            return this;
        }

        /**
         * 创建端口及其队列，并登记到父节点。
         *
         * @throws IllegalArgumentException 父节点已有相同 (group, name) 的输入端口，或队列容量小于 1 时
         */
        public Input build() {
            Input input = new Input(parent, PortKey.of(group, name), type, possibleDatatypes,
                    blocking, maxQueueSize, waitForMessage);
            parent.registerInput(input);
            return input;
        }
    }
}
