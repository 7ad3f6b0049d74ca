package com.neuron.infra.framework.core;

import com.neuron.infra.exception.ScopeDisposalException;
import com.neuron.infra.exception.ScopeDisposedException;
import com.neuron.infra.exception.ServiceNotRegisteredException;
import com.neuron.infra.log.NeuronLog;

import java.util.*;

/**
 * 【核心实现】服务作用域 (一次工作单元)
 * <p>
 * 一个 HTTP 请求、一次异步事件处理各自对应一个作用域：
 * <ul>
 * <li>SCOPED 服务在作用域内只构造一次，整张对象图共享；</li>
 * <li>SINGLETON 服务委托给根容器；</li>
 * <li>TRANSIENT 服务每次构造，工厂拿到的解析器就是本作用域，所以它的 Scoped 依赖也来自本作用域。</li>
 * </ul>
 * 作用域不跨线程共享，内部缓存不加锁。
 * 释放 ({@link #dispose()}) 时按构造的逆序执行释放钩子，成功失败路径都必须调用，推荐 try-with-resources。
 * </p>
 *
 * @author qianye
 * @create 2026-10-12 16:40
 */
public class ServiceScope implements ServiceProvider, AutoCloseable {

    private final ServiceContainer container;
    private final String scopeId;

    /**
     * Scoped 实例缓存
     * Key: 描述符, Value: 实例
     */
    private final Map<ServiceDescriptor<?>, Object> scopedObjects = new HashMap<>();

    /**
     * 需要释放的实例，按构造顺序排列
     */
    private final List<Object> disposables = new ArrayList<>();

    private volatile boolean disposed = false;

    ServiceScope(ServiceContainer container, String scopeId) {
        this.container = container;
        this.scopeId = scopeId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public ServiceContainer getContainer() {
        return container;
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public <T> T getService(Class<T> serviceKey) {
        ensureNotDisposed(serviceKey);
        if (serviceKey == ServiceScope.class || serviceKey == ServiceProvider.class) {
            return serviceKey.cast(this);
        }
        ServiceDescriptor<T> descriptor = container.lastDescriptor(serviceKey);
        return descriptor == null ? null : container.resolve(descriptor, this);
    }

    @Override
    public <T> T getRequiredService(Class<T> serviceKey) {
        T service = getService(serviceKey);
        if (service == null) {
            throw new ServiceNotRegisteredException(serviceKey, ResolutionContext.snapshotWith(serviceKey));
        }
        return service;
    }

    @Override
    public <T> List<T> getServices(Class<T> serviceKey) {
        ensureNotDisposed(serviceKey);
        List<T> services = new ArrayList<>();
        for (ServiceDescriptor<T> descriptor : container.descriptors(serviceKey)) {
            services.add(container.resolve(descriptor, this));
        }
        return services;
    }

    /**
     * 获取或构造本作用域的 Scoped 实例
     * <p>
     * 不使用 computeIfAbsent：工厂可能递归解析其他 Scoped 服务，会在构造过程中修改同一个 Map。
     */
    <T> T getOrCreateScoped(ServiceDescriptor<T> descriptor) {
        Object existing = scopedObjects.get(descriptor);
        if (existing != null) {
            return descriptor.getServiceKey().cast(existing);
        }
        T instance = container.construct(descriptor, this);
        scopedObjects.put(descriptor, instance);
        track(instance);
        return instance;
    }

    void track(Object instance) {
        if (ServiceLifecycle.isReleasable(instance)) {
            disposables.add(instance);
        }
    }

    private void ensureNotDisposed(Class<?> serviceKey) {
        if (disposed) {
            throw new ScopeDisposedException(scopeId, serviceKey);
        }
    }

    /**
     * 释放作用域
     * <p>
     * 幂等；按构造的逆序执行释放钩子，某个钩子失败不影响其余实例，
     * 全部执行完后统一抛出 {@link ScopeDisposalException}。
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        List<Throwable> failures = new ArrayList<>();
        for (int i = disposables.size() - 1; i >= 0; i--) {
            Object instance = disposables.get(i);
            try {
                ServiceLifecycle.release(instance);
            } catch (Exception e) {
                NeuronLog.containerLog.error("作用域 {} 释放实例 [{}] 失败", scopeId, instance.getClass().getSimpleName(), e);
                failures.add(e);
            }
        }
        int released = disposables.size();
        disposables.clear();
        scopedObjects.clear();
        NeuronLog.containerLog.debug("作用域 {} 已释放，回收实例 {} 个", scopeId, released);
        if (!failures.isEmpty()) {
            throw new ScopeDisposalException(scopeId, failures);
        }
    }

    @Override
    public void close() {
        dispose();
    }
}
