package xyz.vvrf.reactor.pipeline.core;

/**
 * 数据源已耗尽。运行器把它视为节点正常完成，而不是错误。
 *
 * @author ruifeng.wen
 */
public class SourceExhaustedException extends PipelineException {

    public SourceExhaustedException(String message) {
        super(message);
    }
}
