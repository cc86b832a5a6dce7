package com.lingxiao.cachify.aop;

import com.lingxiao.cachify.Cached;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Registers every {@code @Cached} bean method at startup, so handles can be reset before the
 * method is first called.
 */
public class CachedMethodRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final CachedMethodRegistry registry;

    public CachedMethodRegistrar(ListableBeanFactory beanFactory, CachedMethodRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (String beanName : beanFactory.getBeanDefinitionNames()) {
            Class<?> type = beanFactory.getType(beanName, false);
            if (type == null) {
                continue;
            }
            Map<Method, Cached> annotated = MethodIntrospector.selectMethods(ClassUtils.getUserClass(type),
                    (MethodIntrospector.MetadataLookup<Cached>) method ->
                            AnnotatedElementUtils.findMergedAnnotation(method, Cached.class));
            annotated.keySet().forEach(registry::register);
        }
    }
}
