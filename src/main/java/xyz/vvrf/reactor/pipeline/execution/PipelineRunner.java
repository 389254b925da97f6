package xyz.vvrf.reactor.pipeline.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.core.SourceExhaustedException;
import xyz.vvrf.reactor.pipeline.core.ThreadedNode;
import xyz.vvrf.reactor.pipeline.core.UnconfiguredNodeException;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 管道的外部运行器。
 * 构建管道、依次启动所有节点，然后在 Reactor {@link Scheduler} 上为每个
 * {@link ThreadedNode} 执行 {@link ThreadedNode#executeRun()}，每个节点占用一个工作线程。
 * <p>
 * 节点执行中的错误只影响该节点：记录日志、通知监听器，并停止该节点以关闭其输入队列，
 * 其他节点继续运行。{@link SourceExhaustedException} 视为正常结束。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class PipelineRunner {

    private final Scheduler nodeScheduler;
    private final Duration stopTimeout;

    /**
     * @param nodeScheduler 执行节点逻辑的调度器，需要能为每个节点提供独立线程 (如 boundedElastic)
     * @param stopTimeout   停止时等待节点结束的最长时间
     */
    public PipelineRunner(Scheduler nodeScheduler, Duration stopTimeout) {
        this.nodeScheduler = Objects.requireNonNull(nodeScheduler, "节点执行调度器不能为空");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "停止超时不能为空");
        if (stopTimeout.isNegative()) {
            throw new IllegalArgumentException("停止超时不能为负数: " + stopTimeout);
        }
        log.info("PipelineRunner 已创建: 调度器={}, 停止超时={}", nodeScheduler, stopTimeout);
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    /**
     * 构建并启动管道。
     *
     * @param pipeline 已组装的管道，每个管道只能运行一次
     * @return 运行句柄
     * @throws IllegalStateException 管道已经运行过时
     */
    public PipelineExecution run(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "管道不能为空");
        pipeline.build();
        pipeline.executeStart();
        List<PipelineMonitorListener> listeners = pipeline.getListeners();
        List<Node> nodes = pipeline.getAllNodes();

        List<Mono<Void>> runs = new ArrayList<>();
        for (Node node : nodes) {
            if (!startNode(node, listeners)) {
                continue;
            }
            if (node instanceof ThreadedNode) {
                runs.add(runNode((ThreadedNode) node, listeners));
            }
        }
        log.info("[Pipeline] 管道已启动: {} 个节点，其中 {} 个执行节点", nodes.size(), runs.size());

        PipelineExecution execution = new PipelineExecution(pipeline, nodes, stopTimeout);
        Disposable subscription = Mono.when(runs)
                .subscribe(null,
                        error -> {
                            log.error("[Pipeline] 管道执行意外终止: {}", error.getMessage(), error);
                            execution.markTerminated();
                        },
                        execution::markTerminated);
        execution.attach(subscription);
        return execution;
    }

    private boolean startNode(Node node, List<PipelineMonitorListener> listeners) {
        try {
            node.executeStart();
            return true;
        } catch (Exception e) {
            log.error("[Pipeline] 节点 {} 启动失败: {}", node, e.getMessage(), e);
            safeNotifyListeners(listeners, l -> l.onNodeFailure(node, Duration.ZERO, e));
            stopQuietly(node);
            return false;
        }
    }

    private Mono<Void> runNode(ThreadedNode node, List<PipelineMonitorListener> listeners) {
        return Mono.defer(() -> {
                    Instant startTime = Instant.now();
                    log.debug("[Pipeline] 节点 {} 开始执行，线程: {}", node, Thread.currentThread().getName());
                    return Mono.fromCallable(() -> {
                                node.executeRun();
                                return Boolean.FALSE;
                            })
                            .onErrorResume(SourceExhaustedException.class, e -> {
                                log.info("[Pipeline] 节点 {} 的数据源已耗尽: {}", node, e.getMessage());
                                return Mono.just(Boolean.TRUE);
                            })
                            .doOnNext(exhausted -> {
                                Duration duration = Duration.between(startTime, Instant.now());
                                log.info("[Pipeline] 节点 {} 执行结束，耗时 {}ms", node, duration.toMillis());
                                safeNotifyListeners(listeners, l -> l.onNodeComplete(node, duration, exhausted));
                            })
                            .onErrorResume(error -> {
                                Duration duration = Duration.between(startTime, Instant.now());
                                if (error instanceof UnconfiguredNodeException) {
                                    log.error("[Pipeline] 节点 {} 缺少必要配置，停止该节点: {}", node, error.getMessage());
                                } else {
                                    log.error("[Pipeline] 节点 {} 执行失败，停止该节点: {}", node, error.getMessage(), error);
                                }
                                safeNotifyListeners(listeners, l -> l.onNodeFailure(node, duration, error));
                                stopQuietly(node);
                                return Mono.empty();
                            })
                            .then();
                })
                .subscribeOn(nodeScheduler);
    }

    private void stopQuietly(Node node) {
        try {
            node.executeStop();
        } catch (Exception e) {
            log.error("[Pipeline] 停止节点 {} 时发生错误: {}", node, e.getMessage(), e);
        }
    }

    private void safeNotifyListeners(List<PipelineMonitorListener> listeners, Consumer<PipelineMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (PipelineMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("管道监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
