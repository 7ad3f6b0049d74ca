package com.neuron.infra.framework.core;

import com.neuron.infra.exception.*;
import com.neuron.infra.lock.NeuronLock;
import com.neuron.infra.log.NeuronLog;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 【核心实现】服务容器 (根解析器)
 * <p>
 * 按声明的生命周期管理服务实例：
 * </p>
 * <ol>
 * <li><strong>SINGLETON:</strong> 首次解析时构造，之后所有作用域共享同一实例。并发首次访问时只构造一次。</li>
 * <li><strong>TRANSIENT:</strong> 每次解析都调用工厂构造新实例。从根容器解析出的实例归调用方所有，容器不负责释放；从作用域解析出的实例随作用域释放。</li>
 * <li><strong>SCOPED:</strong> 只能从 {@link ServiceScope} 解析，直接从根容器解析会抛出
 * {@link ScopedServiceResolutionException}。</li>
 * </ol>
 * <p>
 * 容器不是全局单例，由启动代码显式构造并向下传递，同一个 JVM 里可以同时存在多个互不相干的容器。
 * </p>
 *
 * @author qianye
 * @create 2026-10-12 16:00
 */
public class ServiceContainer implements ServiceProvider, AutoCloseable {

    private static final AtomicLong CONTAINER_COUNTER = new AtomicLong();

    /**
     * 服务注册表
     * Key: 服务类型, Value: 按注册顺序排列的描述符
     */
    private final Map<Class<?>, List<ServiceDescriptor<?>>> registrations = new ConcurrentHashMap<>();

    /**
     * 单例对象池
     * Key: 描述符 (同一类型的多个单例实现各自缓存), Value: 实例
     */
    private final Map<ServiceDescriptor<?>, Object> singletonObjects = new ConcurrentHashMap<>();

    /**
     * 需要在容器关闭时释放的实例，按构造顺序排列
     */
    private final List<Object> disposables = new CopyOnWriteArrayList<>();

    /**
     * 单例构造锁 (可重入，单例工厂可能递归解析其他单例)
     */
    private final NeuronLock singletonLock = NeuronLock.ofReentrant();

    private final AtomicLong registrationSequence = new AtomicLong();
    private final AtomicLong scopeSequence = new AtomicLong();
    private final RegistrationPolicy registrationPolicy;
    private final String containerId;
    private volatile boolean closed = false;

    public ServiceContainer() {
        this(RegistrationPolicy.REPLACE);
    }

    public ServiceContainer(RegistrationPolicy registrationPolicy) {
        this.registrationPolicy = Objects.requireNonNull(registrationPolicy, "registrationPolicy");
        this.containerId = "container-" + CONTAINER_COUNTER.incrementAndGet();
        // 将容器自身注册进去，方便单例工厂拿到根容器 (外部实例，不参与释放)
        registerInstance(ServiceContainer.class, this);
        NeuronLog.containerLog.debug("{} 已创建，注册策略: {}", containerId, registrationPolicy);
    }

    // ========================================================================
    //                              注册 API
    // ========================================================================

    /**
     * 注册服务
     *
     * @param serviceKey 服务类型
     * @param lifetime   生命周期
     * @param factory    工厂
     * @return 新建的描述符
     * @throws DuplicateRegistrationException 注册策略为 REJECT 且该类型已注册
     */
    public <T> ServiceDescriptor<T> register(Class<T> serviceKey, ServiceLifetime lifetime, ServiceFactory<? extends T> factory) {
        return doRegister(serviceKey, lifetime, factory, false);
    }

    /**
     * 追加一个实现（多实现服务，如管道行为）
     * <p>
     * 不受 REJECT 策略限制，通过 {@link #getServices} 按追加顺序取出全部实现。
     */
    public <T> ServiceDescriptor<T> addService(Class<T> serviceKey, ServiceLifetime lifetime, ServiceFactory<? extends T> factory) {
        return doRegister(serviceKey, lifetime, factory, true);
    }

    private <T> ServiceDescriptor<T> doRegister(Class<T> serviceKey, ServiceLifetime lifetime, ServiceFactory<? extends T> factory,
                                                boolean multiple) {
        Objects.requireNonNull(serviceKey, "serviceKey");
        Objects.requireNonNull(lifetime, "lifetime");
        Objects.requireNonNull(factory, "factory");
        ServiceDescriptor<T> descriptor = new ServiceDescriptor<>(serviceKey, lifetime, factory,
                registrationSequence.incrementAndGet());
        registrations.compute(serviceKey, (key, existing) -> {
            if (!multiple && existing != null && !existing.isEmpty() && registrationPolicy == RegistrationPolicy.REJECT) {
                throw new DuplicateRegistrationException(serviceKey);
            }
            List<ServiceDescriptor<?>> list = existing == null ? new CopyOnWriteArrayList<>() : existing;
            list.add(descriptor);
            return list;
        });
        NeuronLog.containerLog.debug("{} 注册服务 {}", containerId, descriptor);
        return descriptor;
    }

    public <T> ServiceDescriptor<T> registerSingleton(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return register(serviceKey, ServiceLifetime.SINGLETON, factory);
    }

    public <T> ServiceDescriptor<T> registerScoped(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return register(serviceKey, ServiceLifetime.SCOPED, factory);
    }

    public <T> ServiceDescriptor<T> registerTransient(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return register(serviceKey, ServiceLifetime.TRANSIENT, factory);
    }

    /**
     * 注册一个外部已构造好的单例
     * <p>
     * 实例的所有权仍在调用方，容器关闭时不会释放它。
     */
    public <T> ServiceDescriptor<T> registerInstance(Class<T> serviceKey, T instance) {
        Objects.requireNonNull(instance, "instance");
        ServiceDescriptor<T> descriptor = registerSingleton(serviceKey, provider -> instance);
        singletonObjects.put(descriptor, instance);
        return descriptor;
    }

    /**
     * 仅当该类型尚未注册时注册
     *
     * @return true=本次完成注册; false=已存在，忽略
     */
    public <T> boolean tryRegister(Class<T> serviceKey, ServiceLifetime lifetime, ServiceFactory<? extends T> factory) {
        boolean[] added = {false};
        registrations.compute(serviceKey, (key, existing) -> {
            if (existing != null && !existing.isEmpty()) {
                return existing;
            }
            List<ServiceDescriptor<?>> list = new CopyOnWriteArrayList<>();
            list.add(new ServiceDescriptor<>(serviceKey, lifetime, factory, registrationSequence.incrementAndGet()));
            added[0] = true;
            return list;
        });
        return added[0];
    }

    public <T> boolean tryRegisterSingleton(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return tryRegister(serviceKey, ServiceLifetime.SINGLETON, factory);
    }

    public <T> boolean tryRegisterScoped(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return tryRegister(serviceKey, ServiceLifetime.SCOPED, factory);
    }

    public <T> boolean tryRegisterTransient(Class<T> serviceKey, ServiceFactory<? extends T> factory) {
        return tryRegister(serviceKey, ServiceLifetime.TRANSIENT, factory);
    }

    public boolean isRegistered(Class<?> serviceKey) {
        List<ServiceDescriptor<?>> list = registrations.get(serviceKey);
        return list != null && !list.isEmpty();
    }

    public RegistrationPolicy getRegistrationPolicy() {
        return registrationPolicy;
    }

    public String getContainerId() {
        return containerId;
    }

    // ========================================================================
    //                              解析 API
    // ========================================================================

    /**
     * 创建一个新的作用域（一次请求 / 一次事件处理对应一个作用域）
     * <p>
     * 调用方必须保证作用域被释放，推荐 try-with-resources。
     */
    public ServiceScope createScope() {
        ensureOpen(ServiceScope.class);
        ServiceScope scope = new ServiceScope(this, containerId + "/scope-" + scopeSequence.incrementAndGet());
        NeuronLog.containerLog.debug("创建作用域 {}", scope.getScopeId());
        return scope;
    }

    @Override
    public <T> T getService(Class<T> serviceKey) {
        if (serviceKey == ServiceProvider.class) {
            return serviceKey.cast(this);
        }
        ServiceDescriptor<T> descriptor = lastDescriptor(serviceKey);
        return descriptor == null ? null : resolve(descriptor, null);
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
        List<T> services = new ArrayList<>();
        for (ServiceDescriptor<T> descriptor : descriptors(serviceKey)) {
            services.add(resolve(descriptor, null));
        }
        return services;
    }

    /**
     * 按生命周期解析一个描述符
     *
     * @param descriptor 描述符
     * @param scope      当前作用域，根容器解析时为 null
     */
    <T> T resolve(ServiceDescriptor<T> descriptor, ServiceScope scope) {
        ensureOpen(descriptor.getServiceKey());
        switch (descriptor.getLifetime()) {
            case SINGLETON:
                return getOrCreateSingleton(descriptor);
            case SCOPED:
                if (scope == null) {
                    throw new ScopedServiceResolutionException(descriptor.getServiceKey(),
                            ResolutionContext.snapshotWith(descriptor.getServiceKey()));
                }
                return scope.getOrCreateScoped(descriptor);
            case TRANSIENT:
                // 根容器上解析出的瞬时实例归调用方所有，容器不跟踪也不释放
                if (scope == null) {
                    return construct(descriptor, this);
                }
                T instance = construct(descriptor, scope);
                scope.track(instance);
                return instance;
            default:
                throw new IllegalStateException("未知的生命周期: " + descriptor.getLifetime());
        }
    }

    /**
     * 单例获取：双重检查锁定
     * 第一次检查走 ConcurrentHashMap 无锁读；未命中时加锁再检查一次，保证并发首次访问只构造一次。
     */
    private <T> T getOrCreateSingleton(ServiceDescriptor<T> descriptor) {
        Object existing = singletonObjects.get(descriptor);
        if (existing != null) {
            return descriptor.getServiceKey().cast(existing);
        }
        return singletonLock.supplyInWrite(() -> {
            Object cached = singletonObjects.get(descriptor);
            if (cached != null) {
                return descriptor.getServiceKey().cast(cached);
            }
            // 单例工厂永远拿根容器，杜绝单例捕获 Scoped 实例
            T instance = construct(descriptor, this);
            singletonObjects.put(descriptor, instance);
            track(instance);
            NeuronLog.containerLog.debug("{} 单例已构造 {}", containerId, descriptor);
            return instance;
        });
    }

    /**
     * 调用工厂构造实例，并执行 @PostConstruct
     * <p>
     * 工厂抛出的非解析类异常包装一次（带上解析链路），更深层已经包装过的解析异常原样抛出。
     */
    <T> T construct(ServiceDescriptor<T> descriptor, ServiceProvider provider) {
        Class<T> serviceKey = descriptor.getServiceKey();
        ResolutionContext.enter(serviceKey);
        try {
            T instance = descriptor.getFactory().create(provider);
            if (instance == null) {
                throw new ServiceResolutionException("服务工厂返回了 null: " + serviceKey.getName(),
                        ResolutionContext.snapshot());
            }
            ServiceLifecycle.postConstruct(instance);
            return instance;
        } catch (ServiceResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ServiceResolutionException.factoryFailed(serviceKey, ResolutionContext.snapshot(), e);
        } finally {
            ResolutionContext.exit();
        }
    }

    @SuppressWarnings("unchecked")
    <T> ServiceDescriptor<T> lastDescriptor(Class<T> serviceKey) {
        List<ServiceDescriptor<?>> list = registrations.get(serviceKey);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return (ServiceDescriptor<T>) list.get(list.size() - 1);
    }

    @SuppressWarnings("unchecked")
    <T> List<ServiceDescriptor<T>> descriptors(Class<T> serviceKey) {
        List<ServiceDescriptor<?>> list = registrations.get(serviceKey);
        if (list == null) {
            return Collections.emptyList();
        }
        List<ServiceDescriptor<T>> result = new ArrayList<>(list.size());
        for (ServiceDescriptor<?> descriptor : list) {
            result.add((ServiceDescriptor<T>) descriptor);
        }
        return result;
    }

    private void track(Object instance) {
        if (ServiceLifecycle.isReleasable(instance)) {
            disposables.add(instance);
        }
    }

    private void ensureOpen(Class<?> serviceKey) {
        if (closed) {
            throw new ScopeDisposedException(containerId, serviceKey);
        }
    }

    // ========================================================================
    //                              关闭
    // ========================================================================

    /**
     * 关闭容器：按构造的逆序释放单例
     * <p>
     * 幂等；某个释放钩子失败不影响其余实例的释放，全部执行完后统一抛出 {@link ScopeDisposalException}。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        NeuronLog.sysLog.info("{} 正在关闭，待释放实例 {} 个", containerId, disposables.size());
        List<Throwable> failures = new ArrayList<>();
        List<Object> reversed = new ArrayList<>(disposables);
        Collections.reverse(reversed);
        for (Object instance : reversed) {
            try {
                ServiceLifecycle.release(instance);
            } catch (Exception e) {
                NeuronLog.sysLog.error("{} 释放实例 [{}] 失败", containerId, instance.getClass().getSimpleName(), e);
                failures.add(e);
            }
        }
        disposables.clear();
        singletonObjects.clear();
        if (!failures.isEmpty()) {
            throw new ScopeDisposalException(containerId, failures);
        }
        NeuronLog.sysLog.info("{} 已安全关闭", containerId);
    }

    public boolean isClosed() {
        return closed;
    }
}
