package xyz.vvrf.reactor.pipeline.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.pipeline.execution.PipelineRunner;
import xyz.vvrf.reactor.pipeline.monitor.LoggingPipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.monitor.MicrometerPipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.monitor.PipelineMonitorListener;
import xyz.vvrf.reactor.pipeline.registry.NodeRegistry;
import xyz.vvrf.reactor.pipeline.registry.SpringScanningNodeRegistry;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 管道框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link PipelineFrameworkProperties}。
 * 2. 提供节点执行调度器 ("pipelineNodeExecutionScheduler") 和 {@link PipelineRunner}。
 * 3. 提供扫描 {@link xyz.vvrf.reactor.pipeline.annotation.PipelineNodeType} Bean 的 {@link NodeRegistry}。
 * 4. 提供日志和 Micrometer 监听器，并把所有 {@link PipelineMonitorListener} 收集为 "pipelineMonitorListeners"。
 * <p>
 * 用户通过 {@code new Pipeline(pipelineMonitorListeners)} 或
 * {@code PipelineDescriptor.activate(registry, pipelineMonitorListeners)} 创建管道，再交给 PipelineRunner 运行。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(PipelineFrameworkProperties.class)
@Slf4j
public class PipelineFrameworkAutoConfiguration {

    private final ApplicationContext applicationContext;

    public PipelineFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("管道框架自动配置 (PipelineFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 节点执行调度器。每个执行节点在其上占用一个线程直到结束。
     */
    @Bean(name = "pipelineNodeExecutionScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "pipelineNodeExecutionScheduler")
    public Scheduler pipelineNodeExecutionScheduler(PipelineFrameworkProperties properties) {
        PipelineFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                PipelineFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 'pipelineNodeExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return newBoundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                PipelineFrameworkProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.warn("'pipelineNodeExecutionScheduler' 使用 Parallel 调度器，执行节点数超过 {} 时部分节点将无法运行", pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.warn("'pipelineNodeExecutionScheduler' 使用 Single 调度器，同一时刻只有一个执行节点能运行");
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'pipeline.scheduler.type=CUSTOM' 但 'pipeline.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义调度器 Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'pipeline.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return newBoundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private static Scheduler newBoundedElastic(PipelineFrameworkProperties.SchedulerProps schedulerProps, String name) {
        PipelineFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), name, beProps.getTtlSeconds(), true);
    }

    @Bean
    @ConditionalOnMissingBean(PipelineRunner.class)
    public PipelineRunner pipelineRunner(@Qualifier("pipelineNodeExecutionScheduler") Scheduler pipelineNodeExecutionScheduler, PipelineFrameworkProperties properties) {
        log.info("正在创建 PipelineRunner Bean，停止超时: {}", properties.getRunner().getStopTimeout());
        return new PipelineRunner(pipelineNodeExecutionScheduler, properties.getRunner().getStopTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(NodeRegistry.class)
    public SpringScanningNodeRegistry pipelineNodeRegistry() {
        return new SpringScanningNodeRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingPipelineMonitorListener.class)
    @ConditionalOnProperty(prefix = "pipeline.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingPipelineMonitorListener loggingPipelineMonitorListener() {
        return new LoggingPipelineMonitorListener();
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerPipelineMonitorListener.class)
        public MicrometerPipelineMonitorListener micrometerPipelineMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，正在创建 MicrometerPipelineMonitorListener。");
            return new MicrometerPipelineMonitorListener(meterRegistry);
        }
    }

    /**
     * 收集在应用上下文中定义的所有 PipelineMonitorListener Bean，作为不可变列表提供。
     */
    @Bean(name = "pipelineMonitorListeners")
    @ConditionalOnMissingBean(name = "pipelineMonitorListeners")
    public List<PipelineMonitorListener> pipelineMonitorListeners(ObjectProvider<PipelineMonitorListener> listenersProvider) {
        log.info("正在收集 PipelineMonitorListener Bean...");
        List<PipelineMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 PipelineMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 PipelineMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }
}
