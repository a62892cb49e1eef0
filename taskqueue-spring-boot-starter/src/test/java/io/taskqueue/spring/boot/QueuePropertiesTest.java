package io.taskqueue.spring.boot;

import io.taskqueue.QueueConfig;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueuePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(QueueProperties.class);
            assertEquals(Duration.ofSeconds(30), props.getVisibilityTimeout());
            assertEquals(3, props.getMaxRetries());
            assertEquals("unison", props.getNamePrefix());
            assertNull(props.getStore());
            assertEquals("task_queue", props.getTablePrefix());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("taskqueue", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "queue.visibility-timeout=2m",
                "queue.max-retries=0",
                "queue.name-prefix=",
                "queue.store=postgresql",
                "queue.table-prefix=jobs",
                "queue.metrics.enabled=false",
                "queue.metrics.name-prefix=jobs.queue"
        ).run(ctx -> {
            var props = ctx.getBean(QueueProperties.class);
            assertEquals(Duration.ofMinutes(2), props.getVisibilityTimeout());
            assertEquals(0, props.getMaxRetries());
            assertEquals("", props.getNamePrefix());
            assertEquals("postgresql", props.getStore());
            assertEquals("jobs", props.getTablePrefix());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("jobs.queue", props.getMetrics().getNamePrefix());

            QueueConfig config = props.toQueueConfig();
            assertEquals("orders", config.queueName("orders"));
        });
    }

    @Test
    void bindsQueueEnvironmentVariables() {
        MutablePropertySources sources = new MutablePropertySources();
        sources.addFirst(new SystemEnvironmentPropertySource("systemEnvironment", Map.<String, Object>of(
                "QUEUE_VISIBILITY_TIMEOUT", "45",
                "QUEUE_MAX_RETRIES", "5",
                "QUEUE_NAME_PREFIX", "billing")));

        QueueProperties props = new Binder(ConfigurationPropertySources.from(sources))
                .bind("queue", QueueProperties.class)
                .get();

        assertEquals(Duration.ofSeconds(45), props.getVisibilityTimeout());
        assertEquals(5, props.getMaxRetries());
        assertEquals("billing", props.getNamePrefix());
        assertEquals("billing_invoices", props.toQueueConfig().queueName("invoices"));
    }

    @Configuration
    @EnableConfigurationProperties(QueueProperties.class)
    static class PropsConfig {
    }
}
