package xyz.vvrf.reactor.pipeline.registry;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import xyz.vvrf.reactor.pipeline.core.Node;
import xyz.vvrf.reactor.pipeline.node.ReplayNode;

import static org.assertj.core.api.Assertions.assertThat;

class SpringScanningNodeRegistryTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ScanConfiguration.class);

    @Test
    void shouldRegisterAnnotatedPrototypeNodes() {
        contextRunner.run(context -> {
            SpringScanningNodeRegistry registry = context.getBean(SpringScanningNodeRegistry.class);

            assertThat(registry.getRegisteredTypeIds()).contains("replay");
            assertThat(registry.getNodeMetadata("replay")).hasValueSatisfying(metadata ->
                    assertThat(metadata.getNodeClass()).isEqualTo(ReplayNode.class));
            Node first = registry.createInstance("replay").get();
            Node second = registry.createInstance("replay").get();
            assertThat(first).isInstanceOf(ReplayNode.class).isNotSameAs(second);
        });
    }

    @Configuration
    @ComponentScan(basePackageClasses = ReplayNode.class)
    static class ScanConfiguration {

        @Bean
        SpringScanningNodeRegistry springScanningNodeRegistry() {
            return new SpringScanningNodeRegistry();
        }
    }
}
