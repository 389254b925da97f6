package xyz.vvrf.reactor.pipeline.core;

/**
 * 试图断开一条不存在的连接。
 *
 * @author ruifeng.wen
 */
public class InvalidUnlinkException extends PipelineException {

    public InvalidUnlinkException(String message) {
        super(message);
    }
}
