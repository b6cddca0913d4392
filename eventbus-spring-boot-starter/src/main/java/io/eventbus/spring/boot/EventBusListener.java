package io.eventbus.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as an event bus listener.
 *
 * <p>The annotated bean must implement {@link io.eventbus.EventListener}. It is
 * subscribed with the given topic patterns (regular expressions, matched anywhere
 * in the topic name) once all singletons are instantiated.
 *
 * <pre>{@code
 * @Component
 * @EventBusListener(patterns = "^orders$")
 * public class InventoryListener implements EventListener {
 *   public void process(EventShadow shadow) { ... }
 * }
 * }</pre>
 *
 * @see EventBusListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventBusListener {

    /**
     * Topic patterns; at least one is required.
     */
    String[] patterns() default {};
}
