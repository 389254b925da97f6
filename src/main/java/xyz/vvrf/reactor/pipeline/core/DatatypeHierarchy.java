package xyz.vvrf.reactor.pipeline.core;

import java.util.List;
import java.util.Objects;

/**
 * 端口可收发的消息类型声明（不可变数据类）。
 * 由基础类型标签和是否匹配其后代类型组成。
 *
 * @author ruifeng.wen
 */
public final class DatatypeHierarchy {

    private final DatatypeEnum datatype;
    private final boolean descendants; // 是否同时匹配 datatype 的所有后代类型

    public DatatypeHierarchy(DatatypeEnum datatype, boolean descendants) {
        this.datatype = Objects.requireNonNull(datatype, "消息类型不能为空");
        this.descendants = descendants;
    }

    /**
     * 创建一个同时匹配后代类型的声明。
     */
    public static DatatypeHierarchy withDescendants(DatatypeEnum datatype) {
        return new DatatypeHierarchy(datatype, true);
    }

    /**
     * 创建一个只匹配精确类型的声明。
     */
    public static DatatypeHierarchy exact(DatatypeEnum datatype) {
        return new DatatypeHierarchy(datatype, false);
    }

    public DatatypeEnum getDatatype() {
        return datatype;
    }

    public boolean isDescendants() {
        return descendants;
    }

    /**
     * 判断两个声明是否兼容：标签相同，或一方声明匹配后代且另一方的标签是其后代。
     * 该判断是对称的，不区分输出方和输入方。
     *
     * @param other 另一端的类型声明
     * @return 兼容时为 true
     */
    public boolean isCompatibleWith(DatatypeHierarchy other) {
        if (other == null) {
            return false;
        }
        if (datatype == other.datatype) {
            return true;
        }
        if (descendants && other.datatype.isDescendantOf(datatype)) {
            return true;
        }
        return other.descendants && datatype.isDescendantOf(other.datatype);
    }

    /**
     * 判断两组声明中是否至少有一对兼容。
     *
     * @param outputs 输出端声明
     * @param inputs  输入端声明
     * @return 存在兼容的一对时为 true
     */
    public static boolean anyCompatible(List<DatatypeHierarchy> outputs, List<DatatypeHierarchy> inputs) {
        for (DatatypeHierarchy outType : outputs) {
            for (DatatypeHierarchy inType : inputs) {
                if (outType.isCompatibleWith(inType)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatatypeHierarchy that = (DatatypeHierarchy) o;
        return descendants == that.descendants && datatype == that.datatype;
    }

    @Override
    public int hashCode() {
        return Objects.hash(datatype, descendants);
    }

    @Override
    public String toString() {
        return String.format("%s%s", datatype, descendants ? "+" : "");
    }
}
