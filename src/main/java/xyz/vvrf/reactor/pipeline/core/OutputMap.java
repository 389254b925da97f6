package xyz.vvrf.reactor.pipeline.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 按需创建同构输出端口的映射。
 * 以新键访问时，按模板配置创建一个 Output 并登记到父节点的端口索引。
 *
 * @author ruifeng.wen
 */
public class OutputMap {

    private final Node parent;
    private final String name;
    private final Output.Type type;
    private final List<DatatypeHierarchy> possibleDatatypes;
    private final Map<PortKey, Output> outputs = new LinkedHashMap<>();

    private OutputMap(Node parent, String name, Output.Type type, List<DatatypeHierarchy> possibleDatatypes) {
        this.parent = Objects.requireNonNull(parent, "父节点不能为空");
        this.name = Objects.requireNonNull(name, "映射名称不能为空");
        this.type = Objects.requireNonNull(type, "端口类型不能为空");
        this.possibleDatatypes = Collections.unmodifiableList(new ArrayList<>(possibleDatatypes));
    }

    public static Builder builder(Node parent, String name) {
        return new Builder(parent, name);
    }

    public Node getParent() {
        return parent;
    }

    public String getName() {
        return name;
    }

    public Output.Type getType() {
        return type;
    }

    public List<DatatypeHierarchy> getPossibleDatatypes() {
        return possibleDatatypes;
    }

    /**
     * 获取（必要时创建）键为 (映射名, key) 的输出端口。
     */
    public Output get(String key) {
        return get(name, key);
    }

    /**
     * 获取（必要时创建）键为 (group, key) 的输出端口。
     *
     * @throws IllegalArgumentException 父节点已用同一键直接声明了输出端口时
     */
    public synchronized Output get(String group, String key) {
        PortKey portKey = PortKey.of(group, key);
        Output existing = outputs.get(portKey);
        if (existing != null) {
            return existing;
        }
        Output created = new Output(parent, portKey, type, possibleDatatypes);
        parent.registerOutput(created);
        outputs.put(portKey, created);
        return created;
    }

    public boolean has(String key) {
        return has(name, key);
    }

    public synchronized boolean has(String group, String key) {
        return outputs.containsKey(PortKey.of(group, key));
    }

    public synchronized Set<PortKey> keySet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(outputs.keySet()));
    }

    public synchronized List<Output> values() {
        return Collections.unmodifiableList(new ArrayList<>(outputs.values()));
    }

    public synchronized int size() {
        return outputs.size();
    }

    @Override
    public String toString() {
        return String.format("OutputMap[%s.%s, size=%d]", parent.describe(), name, size());
    }

    /**
     * OutputMap 声明构建器，设置的属性作为新端口的模板。
     */
    public static final class Builder {
        private final Node parent;
        private final String name;
        private Output.Type type = Output.Type.M_SENDER;
        private List<DatatypeHierarchy> possibleDatatypes = Output.DEFAULT_DATATYPES;

        private Builder(Node parent, String name) {
            this.parent = Objects.requireNonNull(parent, "父节点不能为空");
            this.name = Objects.requireNonNull(name, "映射名称不能为空");
        }

        public Builder type(Output.Type type) {
            this.type = Objects.requireNonNull(type, "端口类型不能为空");
            return this;
        }

        public Builder possibleDatatypes(DatatypeHierarchy... datatypes) {
            this.possibleDatatypes = Arrays.asList(datatypes);
            return this;
        }

        /**
         * @throws IllegalArgumentException 父节点已有同名输出映射时
         */
        public OutputMap build() {
            if (possibleDatatypes.isEmpty()) {
                throw new IllegalArgumentException("输出映射 '" + name + "' 至少需要声明一种数据类型");
            }
            OutputMap map = new OutputMap(parent, name, type, possibleDatatypes);
            parent.registerOutputMap(map);
            return map;
        }
    }
}
