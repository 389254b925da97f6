package xyz.vvrf.reactor.pipeline.node;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import xyz.vvrf.reactor.pipeline.annotation.PipelineNodeType;
import xyz.vvrf.reactor.pipeline.core.Buffer;
import xyz.vvrf.reactor.pipeline.core.DatatypeEnum;
import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.Output;
import xyz.vvrf.reactor.pipeline.core.Pipeline;
import xyz.vvrf.reactor.pipeline.core.SourceExhaustedException;
import xyz.vvrf.reactor.pipeline.core.ThreadedNode;
import xyz.vvrf.reactor.pipeline.core.UnconfiguredNodeException;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 回放节点：从录制文件中逐帧读取数据，每帧作为一个 {@link Buffer} 从 "out" 发送。
 * <p>
 * 必须在运行前通过 {@link #setReplayFile(String)} 设置回放文件，否则运行时抛出
 * {@link UnconfiguredNodeException}。数据源耗尽时以 {@link SourceExhaustedException} 结束运行。
 *
 * @author ruifeng.wen
 */
@Slf4j
@PipelineNodeType("replay")
public class ReplayNode extends ThreadedNode {

    public static final String NAME = "Replay";

    private final Output out = Output.builder(this, "out")
            .type(Output.Type.M_SENDER)
            .possibleDatatypes(DatatypeHierarchy.withDescendants(DatatypeEnum.BUFFER))
            .build();

    private volatile String replayFile;
    private volatile Function<Resource, FrameSource> frameSourceFactory = ChunkedFileFrameSource::new;
    private volatile FrameSource frameSource;

    @Override
    public String getName() {
        return NAME;
    }

    public Output getOut() {
        return out;
    }

    public Optional<String> getReplayFile() {
        return Optional.ofNullable(replayFile);
    }

    /**
     * @param replayFile 回放文件位置，按管道的 ResourceLoader 解析 (如 "file:/data/rec.bin")
     */
    public ReplayNode setReplayFile(String replayFile) {
        this.replayFile = replayFile;
        return this;
    }

    /**
     * 替换数据源的创建方式，默认按 {@link ChunkedFileFrameSource#DEFAULT_CHUNK_SIZE} 切分文件。
     */
    public ReplayNode setFrameSourceFactory(Function<Resource, FrameSource> frameSourceFactory) {
        this.frameSourceFactory = Objects.requireNonNull(frameSourceFactory, "数据源工厂不能为空");
        return this;
    }

    @Override
    protected void run() throws Exception {
        String file = replayFile;
        if (file == null || file.trim().isEmpty()) {
            throw new UnconfiguredNodeException("节点 " + this + " 未设置回放文件 (replayFile)");
        }
        ResourceLoader loader = getPipeline().map(Pipeline::getResourceLoader).orElseGet(DefaultResourceLoader::new);
        FrameSource source = frameSourceFactory.apply(loader.getResource(file));
        source.open();
        frameSource = source;
        log.info("[Pipeline] 回放节点 {} 开始回放: {}", this, file);

        long sequenceNum = 0;
        try {
            while (isRunning()) {
                Optional<byte[]> frame;
                try {
                    frame = source.next();
                } catch (IOException e) {
                    if (!isRunning()) {
                        log.debug("[Pipeline] 回放节点 {} 已停止，读取中断: {}", this, e.getMessage());
                        return;
                    }
                    throw e;
                }
                if (!frame.isPresent()) {
                    throw new SourceExhaustedException(String.format("回放文件 '%s' 已读完，共 %d 帧", file, sequenceNum));
                }
                out.send(new Buffer(frame.get(), sequenceNum++, Instant.now()));
            }
            log.info("[Pipeline] 回放节点 {} 收到停止请求，已发送 {} 帧", this, sequenceNum);
        } finally {
            source.close();
        }
    }

    @Override
    protected void stop() {
        FrameSource source = frameSource;
        if (source == null) {
            return;
        }
        try {
            source.close();
        } catch (IOException e) {
            log.warn("[Pipeline] 关闭回放节点 {} 的数据源失败: {}", this, e.getMessage(), e);
        }
    }
}
