package xyz.vvrf.reactor.pipeline.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.Pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次管道运行的句柄。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class PipelineExecution {

    private final Pipeline pipeline;
    private final List<Node> nodes;
    private final Duration stopTimeout;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Sinks.Empty<Void> terminationSink = Sinks.empty();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Disposable subscription;

    PipelineExecution(Pipeline pipeline, List<Node> nodes, Duration stopTimeout) {
        this.pipeline = Objects.requireNonNull(pipeline, "管道不能为空");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "停止超时不能为空");
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
    }

    void markTerminated() {
        if (terminated.getCount() > 0) {
            terminated.countDown();
            terminationSink.tryEmitEmpty();
        }
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    /**
     * @return 尚未请求停止，且仍有节点在执行时为 true
     */
    public boolean isRunning() {
        return !stopRequested.get() && terminated.getCount() > 0;
    }

    /**
     * @return 所有执行节点结束时完成的 Mono
     */
    public Mono<Void> whenTerminated() {
        return terminationSink.asMono();
    }

    /**
     * 等待所有执行节点结束。
     *
     * @return 在超时前结束时为 true
     */
    public boolean awaitTermination(Duration timeout) {
        Objects.requireNonNull(timeout, "超时时间不能为空");
        try {
            return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Pipeline] 等待管道结束时被中断");
            return false;
        }
    }

    /**
     * 停止管道：向所有节点发出停止请求（关闭输入队列，唤醒阻塞的读取），
     * 等待执行节点在停止超时内结束，超时则取消执行线程，最后等待每个节点进入 WAITED 状态。
     * 重复调用无效果。
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("[Pipeline] 正在停止管道，{} 个节点", nodes.size());
        for (Node node : nodes) {
            try {
                node.executeStop();
            } catch (Exception e) {
                log.error("[Pipeline] 停止节点 {} 时发生错误: {}", node, e.getMessage(), e);
            }
        }
        if (!awaitTermination(stopTimeout)) {
            log.warn("[Pipeline] 节点未在 {}ms 内结束，取消执行线程", stopTimeout.toMillis());
            Disposable current = subscription;
            if (current != null) {
                current.dispose();
            }
            markTerminated();
        }
        for (Node node : nodes) {
            if (!node.executeAwaitTermination(stopTimeout)) {
                log.warn("[Pipeline] 节点 {} 未能在 {}ms 内结束", node, stopTimeout.toMillis());
            }
        }
        pipeline.executeStop();
        pipeline.executeAwaitTermination(stopTimeout);
        log.info("[Pipeline] 管道已停止");
    }
}
