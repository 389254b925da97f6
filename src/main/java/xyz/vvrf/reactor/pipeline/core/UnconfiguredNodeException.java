package xyz.vvrf.reactor.pipeline.core;

/**
 * 节点缺少必需配置（例如数据源路径）就开始执行。
 * 只终止该节点的运行，不影响图中的其他节点。
 *
 * @author ruifeng.wen
 */
public class UnconfiguredNodeException extends PipelineException {

    public UnconfiguredNodeException(String message) {
        super(message);
    }
}
