package xyz.vvrf.reactor.pipeline.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * 通用字节负载消息，所有消息类型的根。
 *
 * @author ruifeng.wen
 */
public class Buffer extends Message {

    private final byte[] data;
    private final long sequenceNum;
    private final Instant timestamp;

    public Buffer(byte[] data) {
        this(data, 0L, Instant.now());
    }

    public Buffer(byte[] data, long sequenceNum, Instant timestamp) {
        Objects.requireNonNull(data, "消息数据不能为空");
        this.data = Arrays.copyOf(data, data.length);
        this.sequenceNum = sequenceNum;
        this.timestamp = Objects.requireNonNull(timestamp, "时间戳不能为空");
    }

    @Override
    public DatatypeEnum getDatatype() {
        return DatatypeEnum.BUFFER;
    }

    /**
     * @return 数据副本
     */
    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public int size() {
        return data.length;
    }

    public long getSequenceNum() {
        return sequenceNum;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return String.format("%s[seq=%d, size=%d, ts=%s]", getClass().getSimpleName(), sequenceNum, data.length, timestamp);
    }
}
