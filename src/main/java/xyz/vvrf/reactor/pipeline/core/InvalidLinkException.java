package xyz.vvrf.reactor.pipeline.core;

/**
 * 无法建立连接：端口不在同一个管道、没有兼容的消息类型，或连接已存在。
 * 抛出时图状态保持不变。
 *
 * @author ruifeng.wen
 */
public class InvalidLinkException extends PipelineException {

    public InvalidLinkException(String message) {
        super(message);
    }
}
