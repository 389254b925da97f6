package xyz.vvrf.reactor.pipeline.annotation;

import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个类为可被发现的管道节点实现。
 * 使用此注解的 Bean 会被 {@link xyz.vvrf.reactor.pipeline.registry.SpringScanningNodeRegistry} 自动注册。
 * <p>
 * 节点有状态且只能放置一次，因此注解自带原型作用域：每次从注册表创建都会得到新的 Bean 实例。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
@Scope(BeanDefinition.SCOPE_PROTOTYPE)
public @interface PipelineNodeType {

    /**
     * 节点类型 ID，{@link #id()} 的别名。
     *
     * @return 节点类型 ID。
     */
    @AliasFor("id")
    String value() default "";

    /**
     * 节点类型 ID，{@link #value()} 的别名。为空时使用 Bean 名称。
     *
     * @return 节点类型 ID。
     */
    @AliasFor("value")
    String id() default "";
}
