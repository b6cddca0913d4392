/**
 * Spring Boot auto-configuration for the event bus.
 *
 * <p>{@link io.eventbus.spring.boot.EventBusAutoConfiguration} wires an
 * {@link io.eventbus.EventBus} from {@code eventbus.*} application properties.
 * Use {@link io.eventbus.spring.boot.EventBusListener @EventBusListener} on listener
 * beans to subscribe them declaratively.
 *
 * @see io.eventbus.spring.boot.EventBusProperties
 * @see io.eventbus.spring.boot.EventBusListenerRegistrar
 */
package io.eventbus.spring.boot;
