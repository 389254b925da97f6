package xyz.vvrf.reactor.pipeline.core;

/**
 * 节点生命周期状态。状态只能向后推进，节点实例在一次运行中只使用一次。
 *
 * @author ruifeng.wen
 */
public enum NodeState {
    /** 已构造，端口已注册，尚未分配 ID */
    DECLARED,
    /** 已放置到管道中，ID 已分配 */
    PLACED,
    BUILD_STAGE_1,
    BUILD_STAGE_2,
    BUILD_STAGE_3,
    /** start() 已调用，外部资源已打开 */
    STARTED,
    /** 执行逻辑正在运行 */
    RUNNING,
    /** stop() 已调用，外部资源已释放 */
    STOPPED,
    /** 执行已完全结束 */
    WAITED;

    /**
     * @param target 目标状态
     * @return target 严格位于当前状态之后时为 true
     */
    public boolean canAdvanceTo(NodeState target) {
        return target != null && target.ordinal() > ordinal();
    }

    /**
     * @return 第 stage 个构建阶段对应的状态 (1..3)
     */
    public static NodeState buildStage(int stage) {
        switch (stage) {
            case 1:
                return BUILD_STAGE_1;
            case 2:
                return BUILD_STAGE_2;
            case 3:
                return BUILD_STAGE_3;
            default:
                throw new IllegalArgumentException("构建阶段必须为 1..3，实际为: " + stage);
        }
    }
}
