package xyz.vvrf.reactor.pipeline.core;

/**
 * 资源不存在或无法读取。
 *
 * @author ruifeng.wen
 */
public class ResourceLoadException extends PipelineException {

    public ResourceLoadException(String message) {
        super(message);
    }

    public ResourceLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
