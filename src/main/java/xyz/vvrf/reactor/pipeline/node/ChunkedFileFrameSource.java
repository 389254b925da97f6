package xyz.vvrf.reactor.pipeline.node;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 把资源内容按固定大小切分成帧的数据源，最后一帧可能小于块大小。
 * 资源通过 Spring {@link Resource} 访问，支持 classpath:、file: 和 URL。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ChunkedFileFrameSource implements FrameSource {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final Resource resource;
    private final int chunkSize;
    private volatile InputStream stream;
    private volatile boolean closed;
    private long framesRead;

    public ChunkedFileFrameSource(Resource resource) {
        this(resource, DEFAULT_CHUNK_SIZE);
    }

    public ChunkedFileFrameSource(Resource resource, int chunkSize) {
        this.resource = Objects.requireNonNull(resource, "回放资源不能为空");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("块大小必须大于 0: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    @Override
    public synchronized void open() throws IOException {
        if (stream != null) {
            throw new IllegalStateException("数据源已打开: " + resource.getDescription());
        }
        if (closed) {
            throw new IllegalStateException("数据源已关闭: " + resource.getDescription());
        }
        stream = resource.getInputStream();
        log.debug("回放数据源已打开: {}, 块大小: {}", resource.getDescription(), chunkSize);
    }

    @Override
    public Optional<byte[]> next() throws IOException {
        InputStream in = stream;
        if (in == null) {
            throw new IllegalStateException("数据源尚未打开: " + resource.getDescription());
        }
        if (closed) {
            return Optional.empty();
        }
        byte[] chunk = new byte[chunkSize];
        int filled = 0;
        while (filled < chunkSize) {
            int n = in.read(chunk, filled, chunkSize - filled);
            if (n < 0) {
                break;
            }
            filled += n;
        }
        if (filled == 0) {
            log.debug("回放数据源已耗尽: {}, 共读取 {} 帧", resource.getDescription(), framesRead);
            return Optional.empty();
        }
        framesRead++;
        return Optional.of(filled == chunkSize ? chunk : Arrays.copyOf(chunk, filled));
    }

    public long getFramesRead() {
        return framesRead;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (stream != null) {
            stream.close();
        }
    }
}
