package com.neuron.infra.framework.core;

import com.neuron.infra.exception.NeuronException;
import com.neuron.infra.framework.annotation.PostConstruct;
import com.neuron.infra.framework.annotation.PreDestroy;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 生命周期回调工具
 * <p>
 * 负责执行 @PostConstruct，以及判断/执行实例的释放钩子
 * （{@link AutoCloseable#close()} 和 @PreDestroy 方法）。
 * 每个类的回调方法只反射扫描一次，结果缓存。
 *
 * @author qianye
 * @create 2026-10-12 16:30
 */
final class ServiceLifecycle {

    private static final Map<Class<?>, List<Method>> POST_CONSTRUCT_CACHE = new ConcurrentHashMap<>();
    private static final Map<Class<?>, List<Method>> PRE_DESTROY_CACHE = new ConcurrentHashMap<>();

    private ServiceLifecycle() {
    }

    /**
     * 执行 @PostConstruct 方法
     */
    static void postConstruct(Object instance) {
        for (Method method : POST_CONSTRUCT_CACHE.computeIfAbsent(instance.getClass(),
                c -> findAnnotated(c, PostConstruct.class))) {
            try {
                method.invoke(instance);
            } catch (InvocationTargetException e) {
                throw new NeuronException("初始化回调执行失败: " + describe(method), e.getTargetException());
            } catch (IllegalAccessException e) {
                throw new NeuronException("初始化回调无法访问: " + describe(method), e);
            }
        }
    }

    /**
     * 实例是否需要在作用域/容器释放时回收
     */
    static boolean isReleasable(Object instance) {
        return instance instanceof AutoCloseable || !preDestroyMethods(instance.getClass()).isEmpty();
    }

    /**
     * 执行释放钩子：先 close()，再 @PreDestroy
     */
    static void release(Object instance) throws Exception {
        if (instance instanceof AutoCloseable) {
            ((AutoCloseable) instance).close();
        }
        for (Method method : preDestroyMethods(instance.getClass())) {
            try {
                method.invoke(instance);
            } catch (InvocationTargetException e) {
                Throwable target = e.getTargetException();
                if (target instanceof Exception) {
                    throw (Exception) target;
                }
                throw new NeuronException("销毁回调执行失败: " + describe(method), target);
            }
        }
    }

    private static List<Method> preDestroyMethods(Class<?> type) {
        return PRE_DESTROY_CACHE.computeIfAbsent(type, c -> findAnnotated(c, PreDestroy.class));
    }

    private static List<Method> findAnnotated(Class<?> type, Class<? extends java.lang.annotation.Annotation> annotation) {
        List<Method> methods = new ArrayList<>();
        Class<?> clazz = type;
        // 循环向上遍历父类，直到 Object
        while (clazz != null && clazz != Object.class) {
            for (Method method : clazz.getDeclaredMethods()) {
                if (method.isAnnotationPresent(annotation) && method.getParameterCount() == 0) {
                    method.setAccessible(true);
                    methods.add(method);
                }
            }
            clazz = clazz.getSuperclass();
        }
        return List.copyOf(methods);
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
