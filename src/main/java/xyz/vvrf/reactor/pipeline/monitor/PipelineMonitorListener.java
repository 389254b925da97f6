package xyz.vvrf.reactor.pipeline.monitor;

import xyz.vvrf.reactor.pipeline.core.Connection;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.NodeState;
import xyz.vvrf.reactor.pipeline.core.Pipeline;

import java.time.Duration;

/**
 * 用于监控管道图变更和节点运行事件的监听器接口。
 * 图变更事件在变更完成、锁释放后触发；运行事件在执行节点的线程上触发。
 * 实现抛出的异常会被记录并忽略，不会影响管道本身。
 *
 * @author ruifeng.wen
 */
public interface PipelineMonitorListener {

    /**
     * 节点被放置到管道中并获得 ID 时调用。
     *
     * @param pipeline 所属管道
     * @param node     新放置的节点
     */
    void onNodeAdded(Pipeline pipeline, Node node);

    /**
     * 节点（及其子树）从管道中移除后调用。
     *
     * @param pipeline 原所属管道
     * @param node     被移除的节点
     */
    void onNodeRemoved(Pipeline pipeline, Node node);

    /**
     * 一条连接建立后调用。
     */
    void onLink(Pipeline pipeline, Connection connection);

    /**
     * 一条连接被断开（显式 unlink 或级联删除）后调用。
     */
    void onUnlink(Pipeline pipeline, Connection connection);

    /**
     * 节点生命周期状态变化时调用。
     *
     * @param node 节点
     * @param from 原状态
     * @param to   新状态
     */
    void onNodeStateChange(Node node, NodeState from, NodeState to);

    /**
     * 节点执行逻辑抛出异常时调用。异常只影响该节点。
     *
     * @param node     节点
     * @param duration 从开始运行到失败的耗时
     * @param error    导致失败的错误
     */
    void onNodeFailure(Node node, Duration duration, Throwable error);

    /**
     * 节点执行逻辑正常结束时调用。
     *
     * @param node      节点
     * @param duration  运行耗时
     * @param exhausted 是否因数据源耗尽而结束
     */
    void onNodeComplete(Node node, Duration duration, boolean exhausted);
}
