package xyz.vvrf.reactor.pipeline.builder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.pipeline.core.DatatypeEnum;
import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.InvalidLinkException;
import xyz.vvrf.reactor.pipeline.core.LinkDescriptor;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.OutputMap;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.core.PipelineDescriptor;
import xyz.vvrf.reactor.pipeline.core.PortKey;
import xyz.vvrf.reactor.pipeline.registry.SimpleNodeRegistry;
import xyz.vvrf.reactor.pipeline.test.util.TestFrame;
import xyz.vvrf.reactor.pipeline.test.util.TestSinkNode;
import xyz.vvrf.reactor.pipeline.test.util.TestSourceNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineDescriptorBuilderTest {

    private SimpleNodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleNodeRegistry();
        registry.register("source", TestSourceNode::new);
        registry.register("sink", TestSinkNode::new);
        registry.register("tensorSink", () -> new TestSinkNode(DatatypeHierarchy.exact(DatatypeEnum.NN_DATA)));
        registry.register("frameSource", () -> new TestSourceNode(DatatypeHierarchy.exact(DatatypeEnum.IMG_FRAME)));
        registry.register("splitter", SplitterNode::new);
    }

    @Test
    void build_shouldProduceImmutableDescriptor() {
        PipelineDescriptor descriptor = new PipelineDescriptorBuilder("demo", registry)
                .addNode("camera", "source")
                .addNode("display", "sink")
                .addLink("camera", "out", "display", "in")
                .build();

        assertThat(descriptor.getName()).isEqualTo("demo");
        assertThat(descriptor.getNodes()).hasSize(2);
        assertThat(descriptor.getNode("camera")).hasValueSatisfying(n -> assertThat(n.getNodeTypeId()).isEqualTo("source"));
        assertThat(descriptor.getLinks()).containsExactly(
                new LinkDescriptor("camera", PortKey.of("out"), "display", PortKey.of("in")));
        assertThatThrownBy(() -> descriptor.getNodes().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void addNode_shouldRejectDuplicateAliasAndUnknownType() {
        PipelineDescriptorBuilder builder = new PipelineDescriptorBuilder("demo", registry).addNode("camera", "source");

        assertThatThrownBy(() -> builder.addNode("camera", "sink")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addNode("other", "unknown")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addLink_shouldValidateAgainstMetadata() {
        PipelineDescriptorBuilder builder = new PipelineDescriptorBuilder("demo", registry)
                .addNode("camera", "frameSource")
                .addNode("nn", "tensorSink")
                .addNode("display", "sink");

        assertThatThrownBy(() -> builder.addLink("camera", "out", "nn", "in"))
                .isInstanceOf(InvalidLinkException.class);
        assertThatThrownBy(() -> builder.addLink("camera", "missing", "display", "in"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addLink("ghost", "out", "display", "in"))
                .isInstanceOf(IllegalArgumentException.class);

        builder.addLink("camera", "out", "display", "in");
        assertThatThrownBy(() -> builder.addLink("camera", "out", "display", "in"))
                .isInstanceOf(InvalidLinkException.class);
        assertThat(builder.build().getLinks()).hasSize(1);
    }

    @Test
    void activate_shouldCreateLivePipeline() {
        PipelineDescriptor descriptor = new PipelineDescriptorBuilder("demo", registry)
                .addNode("camera", "source")
                .addNode("display", "sink")
                .addLink("camera", "out", "display", "in")
                .build();

        Pipeline pipeline = descriptor.activate(registry);
        TestSourceNode camera = pipeline.getNodeRef("camera", TestSourceNode.class).get();
        TestSinkNode display = pipeline.getNodeRef("display", TestSinkNode.class).get();
        camera.getOut().send(new TestFrame("live"));

        assertThat(pipeline.getNodeRegistry()).contains(registry);
        assertThat(pipeline.getConnections()).hasSize(1);
        assertThat(display.getIn().tryGet(TestFrame.class)).map(TestFrame::getLabel).contains("live");
        assertThat(descriptor.activate(registry)).isNotSameAs(pipeline);
    }

    @Test
    void activate_shouldMaterializeMapPorts() {
        PipelineDescriptor descriptor = new PipelineDescriptorBuilder("demo", registry)
                .addNode("split", "splitter")
                .addNode("display", "sink")
                .addLink("split", PortKey.of("streams", "left"), "display", PortKey.of("in"))
                .build();

        Pipeline pipeline = descriptor.activate(registry);
        Node split = pipeline.getNodeRef("split").get();

        assertThat(split.getOutputRef("streams", "left")).isPresent();
        assertThat(split.getOutputMapRef("streams").get().size()).isEqualTo(1);
        assertThat(pipeline.getConnections()).hasSize(1);
    }

    @Test
    void pipelineCreate_shouldUseRegistry() {
        Pipeline pipeline = new Pipeline();
        assertThatThrownBy(() -> pipeline.create("source")).isInstanceOf(IllegalStateException.class);

        pipeline.setNodeRegistry(registry);
        Node node = pipeline.create("source");

        assertThat(node).isInstanceOf(TestSourceNode.class);
        assertThat(node.getId()).isEqualTo(1L);
        assertThatThrownBy(() -> pipeline.create("unknown")).isInstanceOf(IllegalArgumentException.class);
    }

    static class SplitterNode extends Node {
        SplitterNode() {
            OutputMap.builder(this, "streams").build();
        }

        @Override
        public String getName() {
            return "Splitter";
        }
    }
}
