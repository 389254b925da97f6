package xyz.vvrf.reactor.pipeline.node;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.reactor.pipeline.core.Buffer;
import xyz.vvrf.reactor.pipeline.core.DatatypeEnum;
import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.NodeState;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.core.SourceExhaustedException;
import xyz.vvrf.reactor.pipeline.core.UnconfiguredNodeException;
import xyz.vvrf.reactor.pipeline.test.util.TestSinkNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplayNodeTest {

    @Test
    void run_shouldSendEveryFrameThenReportExhaustion(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("recording.bin");
        Files.write(file, new byte[]{1, 2, 3, 4, 5});
        Pipeline pipeline = new Pipeline();
        ReplayNode replay = pipeline.add(new ReplayNode()
                .setReplayFile(file.toUri().toString())
                .setFrameSourceFactory(resource -> new ChunkedFileFrameSource(resource, 2)));
        TestSinkNode sink = pipeline.add(new TestSinkNode());
        replay.getOut().link(sink.getIn());
        pipeline.build();
        pipeline.executeStart();
        replay.executeStart();
        sink.executeStart();

        assertThatThrownBy(replay::executeRun)
                .isInstanceOf(SourceExhaustedException.class)
                .hasMessageContaining("3");

        List<Buffer> frames = sink.getIn().tryGetAll(Buffer.class);
        assertThat(frames).extracting(Buffer::size).containsExactly(2, 2, 1);
        assertThat(frames.get(2).getData()).containsExactly(5);
        assertThat(replay.isRunning()).isFalse();
    }

    @Test
    void run_shouldRequireReplayFile() {
        Pipeline pipeline = new Pipeline();
        ReplayNode replay = pipeline.add(new ReplayNode());
        pipeline.build();
        replay.executeStart();

        assertThat(replay.getReplayFile()).isEmpty();
        assertThatThrownBy(replay::executeRun).isInstanceOf(UnconfiguredNodeException.class);
    }

    @Test
    void stop_shouldInterruptReplayAndCloseSource() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);
        AtomicReference<Boolean> closed = new AtomicReference<>(Boolean.FALSE);
        FrameSource endless = new FrameSource() {
            @Override
            public void open() {
                opened.countDown();
            }

            @Override
            public Optional<byte[]> next() throws IOException {
                if (closed.get()) {
                    throw new IOException("closed");
                }
                return Optional.of(new byte[]{0});
            }

            @Override
            public void close() {
                closed.set(Boolean.TRUE);
            }
        };
        Pipeline pipeline = new Pipeline();
        ReplayNode replay = pipeline.add(new ReplayNode()
                .setReplayFile("memory:endless")
                .setFrameSourceFactory(resource -> endless));
        TestSinkNode sink = pipeline.add(new TestSinkNode(1, false, DatatypeHierarchy.withDescendants(DatatypeEnum.BUFFER)));
        replay.getOut().link(sink.getIn());
        pipeline.build();
        replay.executeStart();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                replay.executeRun();
            } catch (Exception e) {
                failure.set(e);
            }
        }, "replay-test");
        runner.start();
        assertThat(opened.await(5, TimeUnit.SECONDS)).isTrue();

        replay.executeStop();

        assertThat(replay.executeAwaitTermination(Duration.ofSeconds(5))).isTrue();
        runner.join(5000);
        assertThat(failure.get()).isNull();
        assertThat(closed.get()).isTrue();
        assertThat(replay.getState()).isEqualTo(NodeState.WAITED);
    }
}
