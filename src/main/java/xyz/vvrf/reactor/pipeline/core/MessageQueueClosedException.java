package xyz.vvrf.reactor.pipeline.core;

/**
 * 向已关闭的队列写入消息。
 *
 * @author ruifeng.wen
 */
public class MessageQueueClosedException extends PipelineException {

    public MessageQueueClosedException(String message) {
        super(message);
    }
}
