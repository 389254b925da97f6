package xyz.vvrf.reactor.pipeline.core;

/**
 * 管道核心抛出的所有异常的基类。
 *
 * @author ruifeng.wen
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
