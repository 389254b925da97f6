package xyz.vvrf.reactor.pipeline.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.pipeline.core.Connection;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.NodeState;
import xyz.vvrf.reactor.pipeline.core.Pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 将管道事件记录为 Micrometer 指标。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerPipelineMonitorListener implements PipelineMonitorListener {

    // 指标名称
    public static final String METRIC_GRAPH_CHANGE_TOTAL = "pipeline.graph.change.total";
    public static final String METRIC_NODE_STATE_TOTAL = "pipeline.node.state.total";
    public static final String METRIC_NODE_RUN_TIME = "pipeline.node.run.time";
    public static final String METRIC_NODE_RUN_TOTAL = "pipeline.node.run.total";

    // 标签键
    private static final String TAG_NODE_NAME = "node.name";
    private static final String TAG_ACTION = "action";
    private static final String TAG_STATE = "state";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    private static final String ACTION_NODE_ADDED = "NODE_ADDED";
    private static final String ACTION_NODE_REMOVED = "NODE_REMOVED";
    private static final String ACTION_LINK = "LINK";
    private static final String ACTION_UNLINK = "UNLINK";

    private static final String STATUS_COMPLETED = "COMPLETED";
    private static final String STATUS_EXHAUSTED = "EXHAUSTED";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerPipelineMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onNodeAdded(Pipeline pipeline, Node node) {
        incrementCounter(METRIC_GRAPH_CHANGE_TOTAL, Tags.of(
                Tag.of(TAG_ACTION, ACTION_NODE_ADDED),
                Tag.of(TAG_NODE_NAME, node.getName())));
    }

    @Override
    public void onNodeRemoved(Pipeline pipeline, Node node) {
        incrementCounter(METRIC_GRAPH_CHANGE_TOTAL, Tags.of(
                Tag.of(TAG_ACTION, ACTION_NODE_REMOVED),
                Tag.of(TAG_NODE_NAME, node.getName())));
    }

    @Override
    public void onLink(Pipeline pipeline, Connection connection) {
        incrementCounter(METRIC_GRAPH_CHANGE_TOTAL, Tags.of(Tag.of(TAG_ACTION, ACTION_LINK)));
    }

    @Override
    public void onUnlink(Pipeline pipeline, Connection connection) {
        incrementCounter(METRIC_GRAPH_CHANGE_TOTAL, Tags.of(Tag.of(TAG_ACTION, ACTION_UNLINK)));
    }

    @Override
    public void onNodeStateChange(Node node, NodeState from, NodeState to) {
        incrementCounter(METRIC_NODE_STATE_TOTAL, Tags.of(
                Tag.of(TAG_NODE_NAME, node.getName()),
                Tag.of(TAG_STATE, to.name())));
    }

    @Override
    public void onNodeFailure(Node node, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = Tags.of(
                Tag.of(TAG_NODE_NAME, node.getName()),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue));
        recordTimer(tags, duration);
        incrementCounter(METRIC_NODE_RUN_TOTAL, tags);
    }

    @Override
    public void onNodeComplete(Node node, Duration duration, boolean exhausted) {
        Tags tags = Tags.of(
                Tag.of(TAG_NODE_NAME, node.getName()),
                Tag.of(TAG_STATUS, exhausted ? STATUS_EXHAUSTED : STATUS_COMPLETED));
        recordTimer(tags, duration);
        incrementCounter(METRIC_NODE_RUN_TOTAL, tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_NODE_RUN_TIME)
                    .tags(tags)
                    .description("管道节点运行时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, Tags tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
