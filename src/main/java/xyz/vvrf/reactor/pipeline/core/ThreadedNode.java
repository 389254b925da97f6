package xyz.vvrf.reactor.pipeline.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 拥有独立执行逻辑的节点。外部运行器在自己的线程上调用 {@link #executeRun()}，
 * 子类在 {@link #run()} 中通常以 {@code while (isRunning())} 循环收发消息。
 * <p>
 * 停止请求会把 {@link #isRunning()} 置为 false，并关闭本节点所有输入队列，
 * 使阻塞在读取上的 {@code get()} 立即返回空结果。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class ThreadedNode extends Node {

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean runClaimed = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    /**
     * 节点的执行逻辑。
     */
    protected abstract void run() throws Exception;

    /**
     * 在当前线程上执行 {@link #run()}。每个节点只执行一次；停止之后调用不会执行。
     *
     * @throws Exception run() 抛出的任何异常
     */
    public final void executeRun() throws Exception {
        if (!runClaimed.compareAndSet(false, true)) {
            log.debug("[Pipeline] 节点 {} 已运行或已停止，跳过执行", this);
            return;
        }
        try {
            // 先置位再转换状态，停止请求总能把它清除
            running.set(true);
            if (!tryTransitionTo(NodeState.RUNNING)) {
                log.debug("[Pipeline] 节点 {} 处于 {}，跳过执行", this, getState());
                return;
            }
            run();
        } finally {
            running.set(false);
            terminated.countDown();
        }
    }

    /**
     * @return 执行逻辑正在运行且尚未收到停止请求时为 true
     */
    public boolean isRunning() {
        return running.get();
    }

    @Override
    void beforeStop() {
        running.set(false);
        if (runClaimed.compareAndSet(false, true)) {
            terminated.countDown();
        }
        for (Input input : getInputs()) {
            input.closeQueue();
        }
    }

    /**
     * 等待 {@link #run()} 返回。
     */
    @Override
    protected boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Pipeline] 等待节点 {} 结束时被中断", this);
            return false;
        }
    }
}
