package io.eventbus.spring.boot;

import io.eventbus.EventBus;
import io.eventbus.dispatch.EventInterceptor;
import io.eventbus.spi.MetricsExporter;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the event bus.
 *
 * <p>Wires an {@link EventBus} from {@link EventBusProperties}, picking up an optional
 * {@link MetricsExporter} bean and any {@link EventInterceptor} beans in order, and
 * subscribes {@link EventBusListener @EventBusListener} beans once all singletons exist.
 *
 * @see EventBusProperties
 * @see EventBusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EventBus.class)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventBus eventBus(EventBusProperties props,
                             ObjectProvider<MetricsExporter> metricsProvider,
                             ObjectProvider<EventInterceptor> interceptorProvider) {
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        List<EventInterceptor> interceptors = interceptorProvider.orderedStream().toList();

        var builder = EventBus.builder()
                .workerCount(props.getDispatcher().getWorkerCount())
                .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
                .topics(props.getTopics().toArray(new String[0]));
        if (props.getSweeper().isEnabled()) {
            builder.sweepMaxAge(props.getSweeper().getMaxAge())
                    .sweepIntervalSeconds(props.getSweeper().getIntervalSeconds());
        }
        if (metrics != null) {
            builder.metrics(metrics);
        }
        interceptors.forEach(builder::interceptor);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBusListenerRegistrar eventBusListenerRegistrar(
            ListableBeanFactory beanFactory, EventBus eventBus) {
        return new EventBusListenerRegistrar(beanFactory, eventBus);
    }
}
