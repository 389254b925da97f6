package xyz.vvrf.reactor.pipeline.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.pipeline.annotation.PipelineNodeType;
import xyz.vvrf.reactor.pipeline.core.Node;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 一个 {@link NodeRegistry} 实现，它会自动发现并注册
 * 使用 {@link PipelineNodeType} 注解的 Spring Bean。
 * <p>
 * 只在初始化时按注解查找 Bean 名称；每次 {@link #createInstance(String)} 都从容器获取一个新的原型实例。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningNodeRegistry implements NodeRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleNodeRegistry 来存储注册信息和元数据
    private final SimpleNodeRegistry delegateRegistry = new SimpleNodeRegistry();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningNodeRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @PipelineNodeType Bean...");
        scanAndRegisterNodes();
    }

    private void scanAndRegisterNodes() {
        String[] beanNames = applicationContext.getBeanNamesForAnnotation(PipelineNodeType.class);
        int registeredCount = 0;

        for (String beanName : beanNames) {
            PipelineNodeType annotation = applicationContext.findAnnotationOnBean(beanName, PipelineNodeType.class);
            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @PipelineNodeType 注解，尽管按注解查找返回了它。", beanName);
                continue;
            }
            Class<?> beanType = applicationContext.getType(beanName);
            if (beanType == null || !Node.class.isAssignableFrom(beanType)) {
                log.error("Bean '{}' 使用了 @PipelineNodeType 注解，但不是 Node 的子类。跳过注册。", beanName);
                continue;
            }
            if (!applicationContext.isPrototype(beanName)) {
                log.error("Bean '{}' 是单例作用域，节点只能放置一次，必须使用原型作用域。跳过注册。", beanName);
                continue;
            }

            String nodeTypeId = determineNodeTypeId(annotation, beanName);
            Supplier<Node> factory = () -> applicationContext.getBean(beanName, Node.class);
            try {
                log.debug("注册节点: ID='{}', Bean名='{}'", nodeTypeId, beanName);
                delegateRegistry.register(nodeTypeId, factory);
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复ID），但继续扫描
                log.error("注册节点 Bean '{}' (ID: '{}') 失败: {}", beanName, nodeTypeId, e.getMessage());
            }
        }
        log.info("@PipelineNodeType 扫描完成。共注册了 {} 个节点。", registeredCount);
    }

    private String determineNodeTypeId(PipelineNodeType annotation, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (id.isEmpty()) {
            log.warn("在 Bean '{}' 的 @PipelineNodeType 注解中未提供 'id' 或 'value'。将使用 Bean 名称作为节点类型 ID。", beanName);
            return beanName;
        }
        return id;
    }

    @Override
    public void register(String nodeTypeId, Supplier<? extends Node> factory) {
        log.warn("尝试在 SpringScanningNodeRegistry 上手动注册 ID '{}'。推荐使用自动扫描。", nodeTypeId);
        delegateRegistry.register(nodeTypeId, factory);
    }

    @Override
    public Optional<Node> createInstance(String nodeTypeId) {
        return delegateRegistry.createInstance(nodeTypeId);
    }

    @Override
    public Optional<NodeMetadata> getNodeMetadata(String nodeTypeId) {
        return delegateRegistry.getNodeMetadata(nodeTypeId);
    }

    @Override
    public Set<String> getRegisteredTypeIds() {
        return delegateRegistry.getRegisteredTypeIds();
    }
}
