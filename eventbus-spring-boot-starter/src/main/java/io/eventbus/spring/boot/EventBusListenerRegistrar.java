package io.eventbus.spring.boot;

import io.eventbus.EventBus;
import io.eventbus.EventListener;
import io.eventbus.InvalidPatternException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Arrays;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link EventBusListener} and subscribes them
 * to the {@link EventBus}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventBusListener
 */
public class EventBusListenerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventBusListenerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventBus eventBus;

    public EventBusListenerRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
        this.beanFactory = beanFactory;
        this.eventBus = eventBus;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventBusListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventBusListener must implement EventListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            EventBusListener annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), EventBusListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventBusListener annotation on " + bean.getClass().getName());
            }
            if (annotation.patterns().length == 0) {
                throw new BeanCreationException(beanName,
                        "@EventBusListener must specify at least one pattern");
            }

            try {
                eventBus.subscribe(listener, annotation.patterns());
            } catch (InvalidPatternException e) {
                throw new BeanCreationException(beanName,
                        "@EventBusListener pattern does not compile: " + e.pattern(), e);
            }
            logger.log(Level.FINE, "Subscribed bean {0} to {1}",
                    new Object[]{beanName, Arrays.toString(annotation.patterns())});
        }
    }
}
