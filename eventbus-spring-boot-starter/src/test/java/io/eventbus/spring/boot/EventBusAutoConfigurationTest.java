package io.eventbus.spring.boot;

import io.eventbus.Event;
import io.eventbus.EventBus;
import io.eventbus.EventListener;
import io.eventbus.EventShadow;
import io.eventbus.ListenerKey;
import io.eventbus.dispatch.EventInterceptor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(EventBusAutoConfiguration.class))
      .withPropertyValues("eventbus.topics=orders,alerts");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("eventBus"));
      assertTrue(ctx.containsBean("eventBusListenerRegistrar"));
      assertInstanceOf(EventBus.class, ctx.getBean(EventBus.class));
    });
  }

  @Test
  void registersConfiguredTopics() {
    runner.run(ctx -> {
      assertEquals(Set.of("orders", "alerts"), ctx.getBean(EventBus.class).topics());
    });
  }

  @Test
  void subscribesAnnotatedListeners() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      EventBus bus = ctx.getBean(EventBus.class);
      OrdersListener listener = ctx.getBean(OrdersListener.class);

      assertEquals(List.of(ListenerKey.of(listener)), bus.subscribers("orders"));
      assertTrue(bus.subscribers("alerts").isEmpty());
    });
  }

  @Test
  void deliversToAnnotatedListener() {
    runner.withUserConfiguration(ListenerConfig.class).run(ctx -> {
      EventBus bus = ctx.getBean(EventBus.class);
      OrdersListener listener = ctx.getBean(OrdersListener.class);

      bus.notify(Event.of("orders", "1", "payload"));

      assertTrue(listener.received.await(3, TimeUnit.SECONDS));
      assertNotNull(bus.fetch("orders", "1"));
      assertTrue(bus.markAsCompleted(new EventShadow(ListenerKey.of(listener), "orders", "1")));
    });
  }

  @Test
  void appliesInterceptorBeans() {
    runner.withUserConfiguration(ListenerConfig.class, InterceptorConfig.class).run(ctx -> {
      EventBus bus = ctx.getBean(EventBus.class);
      InterceptorConfig config = ctx.getBean(InterceptorConfig.class);

      bus.notify(Event.of("orders", "1", "payload"));

      assertTrue(config.seen.await(3, TimeUnit.SECONDS));
    });
  }

  @Test
  void sweeperEnabledByProperty() {
    runner
        .withPropertyValues("eventbus.sweeper.enabled=true", "eventbus.sweeper.max-age=PT10M")
        .run(ctx -> assertInstanceOf(EventBus.class, ctx.getBean(EventBus.class)));
  }

  @Test
  void invalidDispatcherSettingFailsStartup() {
    runner
        .withPropertyValues("eventbus.dispatcher.worker-count=0")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class,
              findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomBusConfig.class).run(ctx -> {
      assertEquals("customBus", ctx.getBeanNamesForType(EventBus.class)[0]);
      assertFalse(ctx.getBean(EventBus.class).topicExists("orders"));
      assertTrue(ctx.getBean(EventBus.class).topicExists("custom"));
    });
  }

  // ── Test configurations ──────────────────────────────────────

  @EventBusListener(patterns = "^orders$")
  static class OrdersListener implements EventListener {
    final CountDownLatch received = new CountDownLatch(1);

    @Override
    public void process(EventShadow shadow) {
      received.countDown();
    }
  }

  @Configuration
  static class ListenerConfig {
    @Bean
    OrdersListener ordersListener() {
      return new OrdersListener();
    }
  }

  @Configuration
  static class InterceptorConfig {
    final CountDownLatch seen = new CountDownLatch(1);

    @Bean
    EventInterceptor countingInterceptor() {
      return EventInterceptor.before(shadow -> seen.countDown());
    }
  }

  @Configuration
  static class CustomBusConfig {
    @Bean(destroyMethod = "close")
    EventBus customBus() {
      return EventBus.builder().topics("custom").build();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
