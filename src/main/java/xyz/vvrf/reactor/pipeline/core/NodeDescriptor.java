package xyz.vvrf.reactor.pipeline.core;

import java.util.Objects;

/**
 * 管道描述中的一个节点放置（不可变数据类）：别名 + 注册表中的类型 ID。
 *
 * @author ruifeng.wen
 */
public final class NodeDescriptor {
    private final String alias; // 在管道描述内唯一
    private final String nodeTypeId;

    public NodeDescriptor(String alias, String nodeTypeId) {
        this.alias = Objects.requireNonNull(alias, "节点别名不能为空");
        this.nodeTypeId = Objects.requireNonNull(nodeTypeId, "节点类型 ID 不能为空");
    }

    public String getAlias() {
        return alias;
    }

    public String getNodeTypeId() {
        return nodeTypeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDescriptor that = (NodeDescriptor) o;
        return alias.equals(that.alias) && nodeTypeId.equals(that.nodeTypeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, nodeTypeId);
    }

    @Override
    public String toString() {
        return String.format("NodeDescriptor[alias=%s, type=%s]", alias, nodeTypeId);
    }
}
