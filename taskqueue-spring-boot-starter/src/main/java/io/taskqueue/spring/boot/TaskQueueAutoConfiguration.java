package io.taskqueue.spring.boot;

import io.taskqueue.QueueClient;
import io.taskqueue.QueueConfig;
import io.taskqueue.dead.DeadLetterManager;
import io.taskqueue.jdbc.DataSourceConnectionProvider;
import io.taskqueue.jdbc.store.AbstractJdbcMessageStore;
import io.taskqueue.jdbc.store.JdbcMessageStores;
import io.taskqueue.retry.RetryOrchestrator;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.MessageStore;
import io.taskqueue.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.logging.Logger;

/**
 * Auto-configuration for the task queue.
 *
 * <p>Wires a {@link QueueClient}, {@link RetryOrchestrator} and {@link DeadLetterManager}
 * from a {@link DataSource} and {@link QueueProperties}. The message store is chosen by
 * {@code queue.store} or detected from the DataSource.
 *
 * @see QueueProperties
 * @see TaskQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(QueueClient.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(QueueProperties.class)
public class TaskQueueAutoConfiguration {
    private static final Logger logger = Logger.getLogger(TaskQueueAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean(MessageStore.class)
    public AbstractJdbcMessageStore messageStore(DataSource dataSource, QueueProperties props) {
        String storeName = props.getStore();
        AbstractJdbcMessageStore selected = storeName == null || storeName.isBlank()
                ? JdbcMessageStores.detect(dataSource)
                : JdbcMessageStores.get(storeName.trim());
        logger.info("Using task queue message store: " + selected.name());
        return selected.withTables(props.getTablePrefix(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueConfig queueConfig(QueueProperties props) {
        return props.toQueueConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueClient queueClient(ConnectionProvider connectionProvider,
            MessageStore messageStore,
            QueueConfig queueConfig,
            ObjectProvider<MetricsExporter> metricsProvider) {
        QueueClient.Builder builder = QueueClient.builder()
                .connectionProvider(connectionProvider)
                .messageStore(messageStore)
                .config(queueConfig);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryOrchestrator retryOrchestrator(QueueClient queueClient) {
        return new RetryOrchestrator(queueClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(QueueClient queueClient) {
        return new DeadLetterManager(queueClient);
    }
}
