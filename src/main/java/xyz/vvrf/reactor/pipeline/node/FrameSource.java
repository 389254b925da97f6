package xyz.vvrf.reactor.pipeline.node;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * 按顺序产生帧数据的回放数据源。
 *
 * @author ruifeng.wen
 */
public interface FrameSource extends Closeable {

    /**
     * 打开数据源。只调用一次。
     */
    void open() throws IOException;

    /**
     * 读取下一帧。
     *
     * @return 下一帧数据；数据源耗尽时为空
     */
    Optional<byte[]> next() throws IOException;

    /**
     * 关闭数据源。可以重复调用，也可以在另一个线程阻塞于 {@link #next()} 时调用。
     */
    @Override
    void close() throws IOException;
}
