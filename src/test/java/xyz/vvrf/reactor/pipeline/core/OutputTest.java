package xyz.vvrf.reactor.pipeline.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.test.util.TestFrame;
import xyz.vvrf.reactor.pipeline.test.util.TestGroupNode;
import xyz.vvrf.reactor.pipeline.test.util.TestSinkNode;
import xyz.vvrf.reactor.pipeline.test.util.TestSourceNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class OutputTest {

    private Pipeline pipeline;
    private TestSourceNode source;
    private TestSinkNode sink;

    @BeforeEach
    void setUp() {
        pipeline = new Pipeline();
        source = pipeline.create(TestSourceNode::new);
        sink = pipeline.create(TestSinkNode::new);
    }

    @Test
    void canConnect_shouldBeFalseAcrossPipelines() {
        Pipeline other = new Pipeline();
        TestSinkNode foreignSink = other.create(TestSinkNode::new);

        assertThat(source.getOut().isSamePipeline(foreignSink.getIn())).isFalse();
        assertThat(source.getOut().canConnect(foreignSink.getIn())).isFalse();
        assertThatThrownBy(() -> source.getOut().link(foreignSink.getIn()))
                .isInstanceOf(InvalidLinkException.class);
        assertThat(source.getOut().getQueueConnections()).isEmpty();
    }

    @Test
    void canConnect_shouldBeFalseForUnplacedNode() {
        TestSinkNode loose = new TestSinkNode();

        assertThat(source.getOut().canConnect(loose.getIn())).isFalse();
    }

    @Test
    void canConnect_shouldBeFalseForDisjointDatatypes() {
        TestSourceNode frames = pipeline.create(() -> new TestSourceNode(DatatypeHierarchy.exact(DatatypeEnum.IMG_FRAME)));
        TestSinkNode tensors = pipeline.create(() -> new TestSinkNode(DatatypeHierarchy.exact(DatatypeEnum.NN_DATA)));

        assertThat(frames.getOut().canConnect(tensors.getIn())).isFalse();
        assertThatThrownBy(() -> frames.getOut().link(tensors.getIn()))
                .isInstanceOf(InvalidLinkException.class)
                .hasMessageContaining("数据类型不兼容");
        assertThat(pipeline.getConnections()).isEmpty();
    }

    @Test
    void canConnect_shouldAcceptDescendantDatatype() {
        TestSinkNode frames = pipeline.create(() -> new TestSinkNode(DatatypeHierarchy.exact(DatatypeEnum.IMG_FRAME)));

        assertThat(source.getOut().canConnect(frames.getIn())).isTrue();
    }

    @Test
    void link_shouldRecordConnectionAndAttachQueue() {
        Connection connection = source.getOut().link(sink.getIn());

        assertThat(connection).isEqualTo(Connection.between(source.getOut(), sink.getIn()));
        assertThat(pipeline.getConnections()).containsExactly(connection);
        assertThat(source.getOut().getQueueConnections()).containsExactly(sink.getIn().getQueue());
        assertThat(source.getOut().getConnections()).containsExactly(connection);
        assertThat(sink.getIn().getQueue().getReferenceCount()).isEqualTo(2);
        assertThat(connection.resolveOutput(pipeline)).contains(source.getOut());
        assertThat(connection.resolveInput(pipeline)).contains(sink.getIn());
    }

    @Test
    void link_twiceShouldFailAndLeaveStateUnchanged() {
        source.getOut().link(sink.getIn());

        assertThatThrownBy(() -> source.getOut().link(sink.getIn()))
                .isInstanceOf(InvalidLinkException.class)
                .hasMessageContaining("连接已存在");
        assertThat(pipeline.getConnections()).hasSize(1);
        assertThat(source.getOut().getQueueConnections()).hasSize(1);
    }

    @Test
    void unlink_twiceShouldFail() {
        source.getOut().link(sink.getIn());

        source.getOut().unlink(sink.getIn());

        assertThat(pipeline.getConnections()).isEmpty();
        assertThat(source.getOut().getQueueConnections()).isEmpty();
        assertThat(sink.getIn().getQueue().isClosed()).isFalse();
        assertThatThrownBy(() -> source.getOut().unlink(sink.getIn()))
                .isInstanceOf(InvalidUnlinkException.class);
    }

    @Test
    void send_withoutTargetsShouldBeNoOp() {
        source.getOut().send(new Buffer(new byte[]{1}));

        assertThat(source.getOut().trySend(new Buffer(new byte[]{2}))).isTrue();
        assertThat(sink.getIn().has()).isFalse();
    }

    @Test
    void send_shouldFanOutInOrderToEveryTarget() {
        TestSinkNode second = pipeline.create(TestSinkNode::new);
        source.getOut().link(sink.getIn());
        source.getOut().link(second.getIn());

        source.getOut().send(new TestFrame("a"));
        source.getOut().send(new TestFrame("b"));

        for (TestSinkNode target : new TestSinkNode[]{sink, second}) {
            List<TestFrame> received = target.getIn().tryGetAll(TestFrame.class);
            assertThat(received).extracting(TestFrame::getLabel).containsExactly("a", "b");
        }
    }

    @Test
    void trySend_shouldReportPartialDelivery() {
        TestSinkNode tiny = pipeline.create(() -> new TestSinkNode(1, true, Output.DEFAULT_DATATYPES.get(0)));
        source.getOut().link(tiny.getIn());
        source.getOut().link(sink.getIn());
        tiny.getIn().getQueue().send(new TestFrame("filler"));

        boolean allAccepted = source.getOut().trySend(new TestFrame("x"));

        assertThat(allAccepted).isFalse();
        assertThat(sink.getIn().tryGet(TestFrame.class)).map(TestFrame::getLabel).contains("x");
        assertThat(tiny.getIn().tryGetAll(TestFrame.class)).extracting(TestFrame::getLabel).containsExactly("filler");
    }

    @Test
    void send_shouldSkipClosedTargets() {
        TestSinkNode second = pipeline.create(TestSinkNode::new);
        source.getOut().link(sink.getIn());
        source.getOut().link(second.getIn());
        sink.getIn().getQueue().close();

        source.getOut().send(new TestFrame("a"));

        assertThat(second.getIn().has()).isTrue();
        assertThat(source.getOut().trySend(new TestFrame("b"))).isFalse();
    }

    @Test
    void getQueue_shouldReceiveAndCloseAfterUnlink() {
        MessageQueue queue = source.getOut().getQueue();
        source.getOut().send(new TestFrame("a"));

        source.getOut().unlink(queue);

        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.get(TestFrame.class)).map(TestFrame::getLabel).contains("a");
        assertThat(queue.get()).isEmpty();
        assertThatThrownBy(() -> source.getOut().unlink(queue)).isInstanceOf(InvalidUnlinkException.class);
    }

    @Test
    void linkQueue_shouldRejectDuplicate() {
        MessageQueue queue = new MessageQueue();
        source.getOut().link(queue);

        assertThatThrownBy(() -> source.getOut().link(queue)).isInstanceOf(InvalidLinkException.class);
        assertThat(source.getOut().getQueueConnections()).hasSize(1);
    }

    @Test
    void link_shouldRecordConnectionInLowestCommonAncestor() {
        TestGroupNode group = pipeline.create(TestGroupNode::new);
        TestSourceNode innerSource = group.create(TestSourceNode::new);
        TestSinkNode innerSink = group.create(TestSinkNode::new);

        Connection inner = innerSource.getOut().link(innerSink.getIn());
        Connection crossing = innerSource.getOut().link(sink.getIn());

        assertThat(group.getConnections()).containsExactly(inner);
        assertThat(pipeline.getConnections()).containsExactly(crossing);
        assertThat(pipeline.getAllConnections()).containsExactlyInAnyOrder(inner, crossing);
        assertThat(innerSource.getOut().getConnections()).containsExactlyInAnyOrder(inner, crossing);
        assertThat(Node.lowestCommonAncestor(innerSource, sink)).contains(pipeline);
        assertThat(Node.lowestCommonAncestor(innerSource, innerSink)).contains(group);
    }

    @Test
    void link_shouldNotifyListeners() {
        PipelineMonitorListener listener = mock(PipelineMonitorListener.class);
        pipeline.addListener(listener);

        Connection connection = source.getOut().link(sink.getIn());
        source.getOut().unlink(sink.getIn());

        verify(listener).onLink(pipeline, connection);
        verify(listener).onUnlink(pipeline, connection);
    }

    @Test
    void toString_shouldIncludeNodeAndKey() {
        assertThat(source.getOut().toString()).isEqualTo("TestSource[" + source.getId() + "].out");
        assertThat(sink.getIn().toString()).isEqualTo("TestSink[" + sink.getId() + "].in");
    }

    @Test
    void builder_shouldRejectDuplicatePort() {
        assertThatThrownBy(() -> Output.builder(source, "out").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(source.getOutputs()).hasSize(1);
        assertThat(source.getOutputRef("out")).contains(source.getOut());
    }
}
