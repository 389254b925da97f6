package xyz.vvrf.reactor.pipeline.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.pipeline.core.Connection;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.NodeState;
import xyz.vvrf.reactor.pipeline.core.Pipeline;

import java.time.Duration;

/**
 * 将管道事件输出到日志。图变更使用 DEBUG 级别，生命周期和运行结果使用 INFO，失败使用 ERROR。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingPipelineMonitorListener implements PipelineMonitorListener {

    @Override
    public void onNodeAdded(Pipeline pipeline, Node node) {
        log.debug("[MONITOR] 管道:[{}] 节点:[{}] 已加入。 类:[{}]",
                pipeline.getId(), node, node.getClass().getSimpleName());
    }

    @Override
    public void onNodeRemoved(Pipeline pipeline, Node node) {
        log.debug("[MONITOR] 管道:[{}] 节点:[{}] 已移除。 类:[{}]",
                pipeline.getId(), node, node.getClass().getSimpleName());
    }

    @Override
    public void onLink(Pipeline pipeline, Connection connection) {
        log.debug("[MONITOR] 管道:[{}] 连接建立: {}", pipeline.getId(), connection);
    }

    @Override
    public void onUnlink(Pipeline pipeline, Connection connection) {
        log.debug("[MONITOR] 管道:[{}] 连接断开: {}", pipeline.getId(), connection);
    }

    @Override
    public void onNodeStateChange(Node node, NodeState from, NodeState to) {
        log.info("[MONITOR] 节点:[{}] 状态变更。 [{}] -> [{}]", node, from, to);
    }

    @Override
    public void onNodeFailure(Node node, Duration duration, Throwable error) {
        log.error("[MONITOR] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类:[{}]",
                node, duration.toMillis(), error.getMessage(), node.getClass().getSimpleName(), error);
    }

    @Override
    public void onNodeComplete(Node node, Duration duration, boolean exhausted) {
        log.info("[MONITOR] 节点:[{}] 结束。 耗时:[{}ms], 数据源耗尽:[{}]", node, duration.toMillis(), exhausted);
    }
}
