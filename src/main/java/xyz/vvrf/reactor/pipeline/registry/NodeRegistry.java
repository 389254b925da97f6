package xyz.vvrf.reactor.pipeline.registry;

import xyz.vvrf.reactor.pipeline.core.DatatypeHierarchy;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.core.PortKey;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 节点注册表接口。
 * 负责管理节点类型 ID 到节点工厂的映射，并提供节点的端口元数据，
 * 用于在不创建真实节点的情况下校验管道描述。
 *
 * @author ruifeng.wen
 */
public interface NodeRegistry {

    /**
     * 注册一个节点工厂。节点有状态且只能使用一次，因此每次创建都必须返回新实例。
     *
     * @param nodeTypeId 节点类型的唯一标识符 (不能为空)
     * @param factory    创建节点实例的 Supplier (不能为空, 不能返回 null)
     * @throws IllegalArgumentException 如果 nodeTypeId 已被注册，或 factory 无效。
     */
    void register(String nodeTypeId, Supplier<? extends Node> factory);

    /**
     * 根据节点类型 ID 创建一个新的节点实例。
     *
     * @param nodeTypeId 节点类型 ID (不能为空)
     * @return 新实例；未注册时为空
     */
    Optional<Node> createInstance(String nodeTypeId);

    /**
     * 获取指定节点类型的端口元数据。
     *
     * @param nodeTypeId 节点类型 ID (不能为空)
     * @return 元数据；未注册时为空
     */
    Optional<NodeMetadata> getNodeMetadata(String nodeTypeId);

    /**
     * @return 所有已注册的类型 ID
     */
    Set<String> getRegisteredTypeIds();

    /**
     * 节点元数据，包含节点声明的端口及其数据类型。
     */
    interface NodeMetadata {
        /** 获取节点类型 ID */
        String getTypeId();

        /** 获取节点实现类 */
        Class<? extends Node> getNodeClass();

        /** 获取节点名称 ({@link Node#getName()}) */
        String getNodeName();

        /** 直接声明的输出端口 */
        Map<PortKey, List<DatatypeHierarchy>> getOutputs();

        /** 直接声明的输入端口 */
        Map<PortKey, List<DatatypeHierarchy>> getInputs();

        /** 输出映射名 -> 模板数据类型 */
        Map<String, List<DatatypeHierarchy>> getOutputMaps();

        /** 输入映射名 -> 模板数据类型 */
        Map<String, List<DatatypeHierarchy>> getInputMaps();

        /**
         * 查找输出端口的数据类型。未直接声明时，如果分组对应一个输出映射，则使用映射的模板。
         */
        default Optional<List<DatatypeHierarchy>> findOutputDatatypes(PortKey key) {
            List<DatatypeHierarchy> direct = getOutputs().get(key);
            if (direct != null) {
                return Optional.of(direct);
            }
            return Optional.ofNullable(getOutputMaps().get(key.getGroup()));
        }

        /**
         * 查找输入端口的数据类型。未直接声明时，如果分组对应一个输入映射，则使用映射的模板。
         */
        default Optional<List<DatatypeHierarchy>> findInputDatatypes(PortKey key) {
            List<DatatypeHierarchy> direct = getInputs().get(key);
            if (direct != null) {
                return Optional.of(direct);
            }
            return Optional.ofNullable(getInputMaps().get(key.getGroup()));
        }
    }
}
