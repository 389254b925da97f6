package xyz.vvrf.reactor.pipeline.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 管道框架的配置属性类，绑定 'pipeline' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineFrameworkProperties {

    @Valid
    private final Runner runner = new Runner();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Runner {
        /**
         * 停止管道时等待执行节点结束的最长时间。
         */
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。每个执行节点独占一个线程，推荐 BOUNDED_ELASTIC。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "pipeline-node";

        /**
         * BoundedElastic 调度器特定配置。
         */
        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        /**
         * Parallel 调度器特定配置。
         */
        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册 {@link xyz.vvrf.reactor.pipeline.monitor.LoggingPipelineMonitorListener}。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "PipelineFrameworkProperties{" +
                "runner={stopTimeout=" + runner.stopTimeout +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}, customBeanName='" + scheduler.customBeanName + '\'' +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
