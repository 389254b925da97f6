package xyz.vvrf.reactor.pipeline.core;

import java.util.Objects;

/**
 * 端口在所属节点内的复合键（不可变数据类）：分组 + 名称。
 * 未分组的端口使用空字符串作为分组。
 *
 * @author ruifeng.wen
 */
public final class PortKey implements Comparable<PortKey> {

    public static final String NO_GROUP = "";

    private final String group;
    private final String name;

    private PortKey(String group, String name) {
        this.group = Objects.requireNonNull(group, "端口分组不能为空");
        this.name = Objects.requireNonNull(name, "端口名称不能为空");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("端口名称不能为空字符串");
        }
    }

    public static PortKey of(String name) {
        return new PortKey(NO_GROUP, name);
    }

    public static PortKey of(String group, String name) {
        return new PortKey(group == null ? NO_GROUP : group, name);
    }

    public String getGroup() {
        return group;
    }

    public String getName() {
        return name;
    }

    public boolean hasGroup() {
        return !group.isEmpty();
    }

    @Override
    public int compareTo(PortKey other) {
        int byGroup = group.compareTo(other.group);
        return byGroup != 0 ? byGroup : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortKey portKey = (PortKey) o;
        return group.equals(portKey.group) && name.equals(portKey.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, name);
    }

    /**
     * @return "group:name"，未分组时只有 "name"
     */
    @Override
    public String toString() {
        return hasGroup() ? group + ":" + name : name;
    }
}
