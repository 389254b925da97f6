package xyz.vvrf.reactor.pipeline.monitor;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.test.util.TestSinkNode;
import xyz.vvrf.reactor.pipeline.test.util.TestSourceNode;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerPipelineMonitorListenerTest {

    private SimpleMeterRegistry meterRegistry;
    private MicrometerPipelineMonitorListener listener;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        listener = new MicrometerPipelineMonitorListener(meterRegistry);
    }

    @Test
    void graphChanges_shouldBeCountedByAction() {
        Pipeline pipeline = new Pipeline(Collections.<PipelineMonitorListener>singletonList(listener));
        TestSourceNode source = pipeline.add(new TestSourceNode());
        TestSinkNode sink = pipeline.add(new TestSinkNode());
        source.getOut().link(sink.getIn());
        source.getOut().unlink(sink.getIn());
        pipeline.remove(sink);

        assertThat(counter("action", "NODE_ADDED")).isEqualTo(2.0);
        assertThat(counter("action", "LINK")).isEqualTo(1.0);
        assertThat(counter("action", "UNLINK")).isEqualTo(1.0);
        assertThat(meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_GRAPH_CHANGE_TOTAL)
                .tags("action", "NODE_REMOVED", "node.name", "TestSink").counter().count()).isEqualTo(1.0);
    }

    @Test
    void stateChanges_shouldBeCountedPerState() {
        Pipeline pipeline = new Pipeline(Collections.<PipelineMonitorListener>singletonList(listener));
        pipeline.add(new TestSourceNode());
        pipeline.build();

        assertThat(meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_NODE_STATE_TOTAL)
                .tags("node.name", "TestSource", "state", "BUILD_STAGE_3").counter().count()).isEqualTo(1.0);
    }

    @Test
    void runResults_shouldRecordTimerAndStatus() {
        TestSourceNode node = new TestSourceNode();

        listener.onNodeComplete(node, Duration.ofMillis(20), false);
        listener.onNodeComplete(node, Duration.ofMillis(30), true);
        listener.onNodeFailure(node, Duration.ofMillis(5), new IllegalStateException("boom"));

        Timer completed = meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_NODE_RUN_TIME)
                .tags("node.name", "TestSource", "status", "COMPLETED").timer();
        assertThat(completed.count()).isEqualTo(1L);
        assertThat(meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_NODE_RUN_TOTAL)
                .tags("status", "EXHAUSTED").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_NODE_RUN_TOTAL)
                .tags("status", "FAILURE", "error", "IllegalStateException").counter().count()).isEqualTo(1.0);
    }

    private double counter(String tagKey, String tagValue) {
        return meterRegistry.get(MicrometerPipelineMonitorListener.METRIC_GRAPH_CHANGE_TOTAL)
                .tags(tagKey, tagValue).counters().stream()
                .mapToDouble(c -> c.count())
                .sum();
    }
}
