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
 * 按需创建同构输入端口的映射。
 * 以新键访问时，按模板配置（类型、队列容量、阻塞策略等）创建一个 Input 并登记到父节点。
 *
 * @author ruifeng.wen
 */
public class InputMap {

    private final Node parent;
    private final String name;
    private final Input.Type type;
    private final List<DatatypeHierarchy> possibleDatatypes;
    private final boolean blocking;
    private final int maxQueueSize;
    private final boolean waitForMessage;
    private final Map<PortKey, Input> inputs = new LinkedHashMap<>();

    private InputMap(Builder builder) {
        this.parent = builder.parent;
        this.name = builder.name;
        this.type = builder.type;
        this.possibleDatatypes = Collections.unmodifiableList(new ArrayList<>(builder.possibleDatatypes));
        this.blocking = builder.blocking;
        this.maxQueueSize = builder.maxQueueSize;
        this.waitForMessage = builder.waitForMessage;
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

    public Input.Type getType() {
        return type;
    }

    public List<DatatypeHierarchy> getPossibleDatatypes() {
        return possibleDatatypes;
    }

    public boolean isBlocking() {
        return blocking;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public boolean isWaitForMessage() {
        return waitForMessage;
    }

    /**
     * 获取（必要时创建）键为 (映射名, key) 的输入端口。
     */
    public Input get(String key) {
        return get(name, key);
    }

    /**
     * 获取（必要时创建）键为 (group, key) 的输入端口。
     *
     * @throws IllegalArgumentException 父节点已用同一键直接声明了输入端口时
     */
    public synchronized Input get(String group, String key) {
        PortKey portKey = PortKey.of(group, key);
        Input existing = inputs.get(portKey);
        if (existing != null) {
            return existing;
        }
        Input created = new Input(parent, portKey, type, possibleDatatypes, blocking, maxQueueSize, waitForMessage);
        parent.registerInput(created);
        inputs.put(portKey, created);
        return created;
    }

    public boolean has(String key) {
        return has(name, key);
    }

    public synchronized boolean has(String group, String key) {
        return inputs.containsKey(PortKey.of(group, key));
    }

    public synchronized Set<PortKey> keySet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(inputs.keySet()));
    }

    public synchronized List<Input> values() {
        return Collections.unmodifiableList(new ArrayList<>(inputs.values()));
    }

    public synchronized int size() {
        return inputs.size();
    }

    @Override
    public String toString() {
        return String.format("InputMap[%s.%s, size=%d]", parent.describe(), name, size());
    }

    /**
     * InputMap 声明构建器，设置的属性作为新端口的模板。
     */
    public static final class Builder {
        private final Node parent;
        private final String name;
        private Input.Type type = Input.Type.S_RECEIVER;
        private List<DatatypeHierarchy> possibleDatatypes = Output.DEFAULT_DATATYPES;
        private boolean blocking = Input.DEFAULT_BLOCKING;
        private int maxQueueSize = Input.DEFAULT_MAX_QUEUE_SIZE;
        private boolean waitForMessage = Input.DEFAULT_WAIT_FOR_MESSAGE;

        private Builder(Node parent, String name) {
            this.parent = Objects.requireNonNull(parent, "父节点不能为空");
            this.name = Objects.requireNonNull(name, "映射名称不能为空");
        }

        public Builder type(Input.Type type) {
            this.type = Objects.requireNonNull(type, "端口类型不能为空");
            return this;
        }

        public Builder possibleDatatypes(DatatypeHierarchy... datatypes) {
            this.possibleDatatypes = Arrays.asList(datatypes);
            return this;
        }

        public Builder blocking(boolean blocking) {
            this.blocking = blocking;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            if (maxQueueSize < 1) {
                throw new IllegalArgumentException("队列容量必须至少为 1，实际为: " + maxQueueSize);
            }
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder waitForMessage(boolean waitForMessage) {
            this.waitForMessage = waitForMessage;
            return this;
        }

        /**
         * @throws IllegalArgumentException 父节点已有同名输入映射时
         */
        public InputMap build() {
            if (possibleDatatypes.isEmpty()) {
                throw new IllegalArgumentException("输入映射 '" + name + "' 至少需要声明一种数据类型");
            }
            InputMap map = new InputMap(this);
            parent.registerInputMap(map);
            return map;
        }
    }
}
