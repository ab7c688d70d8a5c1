package io.eventlog.spring.boot;

import io.eventlog.projection.DefaultProjectionRegistry;
import io.eventlog.projection.Projection;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registers every {@link Projection} bean in the {@link DefaultProjectionRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so projections may themselves depend on the {@link io.eventlog.EventLog}. Beans are
 * registered in {@link org.springframework.core.Ordered} order.
 */
public class ProjectionBeanRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(ProjectionBeanRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final DefaultProjectionRegistry registry;

    public ProjectionBeanRegistrar(ListableBeanFactory beanFactory, DefaultProjectionRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Projection> beans = beanFactory.getBeansOfType(Projection.class);
        List<Map.Entry<String, Projection>> entries = new ArrayList<>(beans.entrySet());
        entries.sort((a, b) -> AnnotationAwareOrderComparator.INSTANCE.compare(a.getValue(), b.getValue()));
        for (Map.Entry<String, Projection> entry : entries) {
            String beanName = entry.getKey();
            Projection projection = entry.getValue();
            if (registry.find(projection.name()).filter(p -> p == projection).isPresent()) {
                continue;
            }
            try {
                registry.register(projection);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new BeanCreationException(beanName,
                        "Cannot register projection bean " + projection.getClass().getName(), e);
            }
            logger.fine("Registered projection '" + projection.name() + "' from bean " + beanName);
        }
    }
}
