package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 承载一条（或多条汇聚的）连接数据的有界、线程安全 FIFO 队列。
 * <p>
 * 写满时的行为由 blocking 策略决定：
 * <ul>
 *     <li>blocking = true: 生产者等待，直到有空间（背压）。</li>
 *     <li>blocking = false: 丢弃最旧的一条消息腾出空间，生产者永不被慢消费者阻塞。</li>
 * </ul>
 * 所有取消息的方法都返回 {@link Optional} 或 {@link List}，空结果表示
 * “没有消息 / 超时 / 已取消”。{@link #close()} 会唤醒所有等待者。
 * <p>
 * 队列由创建它的 Input 和每个连接到它的 Output 共同持有，通过
 * {@link #retain()} / {@link #release()} 计数，最后一个持有者释放后自动关闭。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MessageQueue {

    public static final int DEFAULT_MAX_SIZE = 16;
    public static final boolean DEFAULT_BLOCKING = true;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<Message> messages = new ArrayDeque<>();
    private final AtomicInteger referenceCount = new AtomicInteger(0);
    private final List<Consumer<Message>> callbacks = new CopyOnWriteArrayList<>();

    private volatile String name;
    private int maxSize;
    private boolean blocking;
    private boolean closed;

    public MessageQueue() {
        this(DEFAULT_MAX_SIZE, DEFAULT_BLOCKING);
    }

    public MessageQueue(int maxSize, boolean blocking) {
        this("queue", maxSize, blocking);
    }

    public MessageQueue(String name, int maxSize, boolean blocking) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("队列容量必须至少为 1，实际为: " + maxSize);
        }
        this.name = Objects.requireNonNull(name, "队列名称不能为空");
        this.maxSize = maxSize;
        this.blocking = blocking;
    }

    // --- 配置 ---

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "队列名称不能为空");
    }

    public int getMaxSize() {
        lock.lock();
        try {
            return maxSize;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 修改队列容量。对覆盖型队列，超出新容量的最旧消息会被丢弃。
     *
     * @param maxSize 新容量 (至少为 1)
     */
    public void setMaxSize(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("队列容量必须至少为 1，实际为: " + maxSize);
        }
        lock.lock();
        try {
            this.maxSize = maxSize;
            if (!blocking) {
                while (messages.size() > maxSize) {
                    messages.pollFirst();
                }
            }
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isBlocking() {
        lock.lock();
        try {
            return blocking;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 修改写满时的策略。切换为覆盖模式会唤醒正在等待的生产者。
     */
    public void setBlocking(boolean blocking) {
        lock.lock();
        try {
            this.blocking = blocking;
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // --- 共享所有权 ---

    /**
     * 增加一个持有者。
     *
     * @return 队列仍处于打开状态时为 true；已关闭的队列不能再被持有
     */
    public boolean retain() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            referenceCount.incrementAndGet();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 释放一个持有者。最后一个持有者释放时关闭队列。
     */
    public void release() {
        int remaining;
        lock.lock();
        try {
            // 与 retain() 在同一把锁下判断，归零和关闭之间不会插入新的持有者
            remaining = referenceCount.updateAndGet(current -> current > 0 ? current - 1 : 0);
            if (remaining == 0) {
                close();
            }
        } finally {
            lock.unlock();
        }
        if (remaining == 0) {
            log.debug("队列 '{}' 已无持有者，关闭。", name);
        }
    }

    public int getReferenceCount() {
        return referenceCount.get();
    }

    /**
     * 关闭队列并唤醒所有等待的生产者和消费者。幂等。
     * 关闭后剩余消息仍可被取出，但不能再写入。
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // --- 回调 ---

    /**
     * 注册一个在每次成功写入后调用的回调。回调在生产者线程上执行，不持有队列锁。
     *
     * @param callback 回调 (不能为空)
     * @return 用于注销回调的 Disposable
     */
    public Disposable addCallback(Consumer<Message> callback) {
        Objects.requireNonNull(callback, "回调不能为空");
        callbacks.add(callback);
        return () -> callbacks.remove(callback);
    }

    // --- 写入 ---

    /**
     * 按队列策略写入消息。blocking 队列写满时等待空间。
     *
     * @param message 消息 (不能为空)
     * @return 写入成功为 true；等待期间线程被中断则为 false (中断标志会被恢复)
     * @throws MessageQueueClosedException 如果队列已关闭
     */
    public boolean send(Message message) {
        Objects.requireNonNull(message, "消息不能为空");
        lock.lock();
        try {
            ensureOpen();
            while (messages.size() >= maxSize) {
                if (!blocking) {
                    dropOldest();
                    continue;
                }
                try {
                    notFull.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("向队列 '{}' 写入时被中断。", name);
                    return false;
                }
                ensureOpen();
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
        fireCallbacks(message);
        return true;
    }

    /**
     * 最多等待 timeout 写入消息。覆盖型队列总是立即成功。
     *
     * @return 写入成功为 true；超时或被中断为 false
     * @throws MessageQueueClosedException 如果队列已关闭
     */
    public boolean send(Message message, Duration timeout) {
        Objects.requireNonNull(message, "消息不能为空");
        Objects.requireNonNull(timeout, "超时时间不能为空");
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            ensureOpen();
            while (messages.size() >= maxSize) {
                if (!blocking) {
                    dropOldest();
                    continue;
                }
                if (remainingNanos <= 0L) {
                    return false;
                }
                try {
                    remainingNanos = notFull.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                ensureOpen();
            }
            enqueue(message);
        } finally {
            lock.unlock();
        }
        fireCallbacks(message);
        return true;
    }

    /**
     * 不等待地尝试写入。
     *
     * @return blocking 队列已满时为 false，其余情况为 true
     * @throws MessageQueueClosedException 如果队列已关闭
     */
    public boolean trySend(Message message) {
        return send(message, Duration.ZERO);
    }

    // --- 读取 ---

    /**
     * @return 队列非空时为 true
     */
    public boolean has() {
        lock.lock();
        try {
            return !messages.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 队首消息是 type 类型时为 true
     */
    public <T extends Message> boolean has(Class<T> type) {
        return front(type).isPresent();
    }

    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * 查看但不取出队首消息。
     */
    public Optional<Message> front() {
        lock.lock();
        try {
            return Optional.ofNullable(messages.peekFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 查看队首消息，类型不匹配时返回空。
     */
    public <T extends Message> Optional<T> front(Class<T> type) {
        Objects.requireNonNull(type, "消息类型不能为空");
        return front().filter(type::isInstance).map(type::cast);
    }

    /**
     * 立即取出队首消息，没有消息时返回空。
     */
    public Optional<Message> tryGet() {
        lock.lock();
        try {
            return Optional.ofNullable(dequeue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 立即取出队首消息；消息会被消费，但类型不匹配时返回空。
     */
    public <T extends Message> Optional<T> tryGet(Class<T> type) {
        Objects.requireNonNull(type, "消息类型不能为空");
        return tryGet().filter(type::isInstance).map(type::cast);
    }

    /**
     * 阻塞直到有消息可取。
     *
     * @return 消息；队列关闭且已取空，或线程被中断时返回空
     */
    public Optional<Message> get() {
        lock.lock();
        try {
            while (messages.isEmpty()) {
                if (closed) {
                    return Optional.empty();
                }
                try {
                    notEmpty.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("从队列 '{}' 读取时被中断。", name);
                    return Optional.empty();
                }
            }
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    public <T extends Message> Optional<T> get(Class<T> type) {
        Objects.requireNonNull(type, "消息类型不能为空");
        return get().filter(type::isInstance).map(type::cast);
    }

    /**
     * 最多阻塞 timeout 等待消息。
     *
     * @return 消息；超时、队列关闭或被中断时返回空
     */
    public Optional<Message> get(Duration timeout) {
        Objects.requireNonNull(timeout, "超时时间不能为空");
        lock.lock();
        try {
            if (!awaitNotEmpty(timeout.toNanos())) {
                return Optional.empty();
            }
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    public <T extends Message> Optional<T> get(Class<T> type, Duration timeout) {
        Objects.requireNonNull(type, "消息类型不能为空");
        return get(timeout).filter(type::isInstance).map(type::cast);
    }

    /**
     * 立即取出当前所有消息。
     */
    public List<Message> tryGetAll() {
        lock.lock();
        try {
            return drain();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 立即取出当前所有消息，丢弃类型不匹配的消息。
     */
    public <T extends Message> List<T> tryGetAll(Class<T> type) {
        return filterByType(tryGetAll(), type);
    }

    /**
     * 阻塞直到至少有一条消息，然后取出全部消息。
     *
     * @return 消息列表；队列关闭或被中断时为空列表
     */
    public List<Message> getAll() {
        lock.lock();
        try {
            while (messages.isEmpty()) {
                if (closed) {
                    return Collections.emptyList();
                }
                try {
                    notEmpty.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Collections.emptyList();
                }
            }
            return drain();
        } finally {
            lock.unlock();
        }
    }

    public <T extends Message> List<T> getAll(Class<T> type) {
        return filterByType(getAll(), type);
    }

    /**
     * 最多阻塞 timeout 等待至少一条消息，然后取出全部消息。
     *
     * @return 消息列表；超时、关闭或被中断时为空列表
     */
    public List<Message> getAll(Duration timeout) {
        Objects.requireNonNull(timeout, "超时时间不能为空");
        lock.lock();
        try {
            if (!awaitNotEmpty(timeout.toNanos())) {
                return Collections.emptyList();
            }
            return drain();
        } finally {
            lock.unlock();
        }
    }

    public <T extends Message> List<T> getAll(Class<T> type, Duration timeout) {
        return filterByType(getAll(timeout), type);
    }

    // --- 内部方法 (调用方持有锁) ---

    private boolean awaitNotEmpty(long nanos) {
        long remaining = nanos;
        while (messages.isEmpty()) {
            if (closed || remaining <= 0L) {
                return false;
            }
            try {
                remaining = notEmpty.awaitNanos(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new MessageQueueClosedException("队列 '" + name + "' 已关闭");
        }
    }

    private void enqueue(Message message) {
        messages.addLast(message);
        notEmpty.signalAll();
    }

    private Message dequeue() {
        Message message = messages.pollFirst();
        if (message != null) {
            notFull.signalAll();
        }
        return message;
    }

    private void dropOldest() {
        Message dropped = messages.pollFirst();
        log.trace("队列 '{}' 已满 (容量 {})，丢弃最旧消息: {}", name, maxSize, dropped);
    }

    private List<Message> drain() {
        if (messages.isEmpty()) {
            return Collections.emptyList();
        }
        List<Message> drained = new ArrayList<>(messages);
        messages.clear();
        notFull.signalAll();
        return drained;
    }

    private static <T extends Message> List<T> filterByType(List<Message> source, Class<T> type) {
        Objects.requireNonNull(type, "消息类型不能为空");
        List<T> result = new ArrayList<>(source.size());
        for (Message message : source) {
            if (type.isInstance(message)) {
                result.add(type.cast(message));
            }
        }
        return result;
    }

    private void fireCallbacks(Message message) {
        if (callbacks.isEmpty()) {
            return;
        }
        for (Consumer<Message> callback : callbacks) {
            try {
                callback.accept(message);
            } catch (Exception e) {
                log.error("队列 '{}' 的回调 {} 抛出异常: {}", name, callback.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("MessageQueue[name=%s, size=%d/%d, blocking=%b, closed=%b]",
                name, size(), getMaxSize(), isBlocking(), isClosed());
    }
}
