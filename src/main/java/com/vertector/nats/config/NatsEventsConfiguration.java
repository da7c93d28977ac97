package com.vertector.nats.config;

import com.vertector.nats.admin.NatsAdminController;
import com.vertector.nats.admin.NatsAdminExceptionHandler;
import com.vertector.nats.codec.EventCodec;
import com.vertector.nats.connection.NatsConnectionManager;
import com.vertector.nats.consumer.EventConsumerFactory;
import com.vertector.nats.jetstream.JetStreamCursorProvider;
import com.vertector.nats.jetstream.JetStreamStreamWriter;
import com.vertector.nats.metrics.EventMetrics;
import com.vertector.nats.publisher.EventPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the library.
 *
 * <h2>Beans</h2>
 * <ul>
 *   <li>{@link NatsConnectionManager}: one per context, closed on shutdown. Connects while
 *       the context starts unless {@code vertector.nats.auto-connect=false}.</li>
 *   <li>{@link EventCodec}, {@link EventMetrics} (on the context's {@link MeterRegistry}
 *       when there is one).</li>
 *   <li>{@link EventPublisher} and {@link EventConsumerFactory} bound to the manager's
 *       JetStream contexts.</li>
 *   <li>Admin endpoints when {@code vertector.nats.admin.enabled=true} in a reactive web
 *       application.</li>
 * </ul>
 *
 * <p>Every bean backs off when the application defines its own.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(NatsProperties.class)
public class NatsEventsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NatsEventsConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EventCodec eventCodec() {
        return new EventCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventMetrics eventMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("No MeterRegistry in the context; NATS metrics are not exported");
            return EventMetrics.noop();
        }
        return new EventMetrics(registry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public NatsConnectionManager natsConnectionManager(NatsProperties props, EventMetrics metrics) {
        NatsConnectionManager manager = new NatsConnectionManager(props.toConnectionSettings(), metrics);
        if (props.isAutoConnect()) {
            manager.connect();
        } else {
            log.info("vertector.nats.auto-connect=false; call NatsConnectionManager.connect() before publishing");
        }
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher(NatsConnectionManager manager,
                                         EventCodec codec,
                                         NatsProperties props,
                                         EventMetrics metrics) {
        return new EventPublisher(new JetStreamStreamWriter(manager::jetStream), codec, props.toPublisherSettings(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventConsumerFactory eventConsumerFactory(NatsConnectionManager manager,
                                                     EventCodec codec,
                                                     NatsProperties props,
                                                     EventMetrics metrics) {
        return new EventConsumerFactory(
                new JetStreamCursorProvider(manager::jetStream, manager::jetStreamManagement),
                codec,
                metrics,
                props::toConsumerDefinition);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(prefix = "vertector.nats.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
    static class AdminEndpoints {

        @Bean
        NatsAdminController natsAdminController(NatsConnectionManager manager) {
            return new NatsAdminController(manager);
        }

        @Bean
        NatsAdminExceptionHandler natsAdminExceptionHandler() {
            return new NatsAdminExceptionHandler();
        }
    }
}
