package com.neuron.infra.framework.core;

import cn.hutool.core.util.StrUtil;

import java.util.Objects;

/**
 * 服务描述符：服务类型 + 生命周期 + 工厂
 * <p>
 * sequence 是注册序号，同一类型的多次注册按它排序；单例缓存也以描述符为粒度，
 * 这样 getServices 返回的多个单例实现互不干扰。
 *
 * @author qianye
 * @create 2026-10-12 16:08
 */
public final class ServiceDescriptor<T> {
    private final Class<T> serviceKey;
    private final ServiceLifetime lifetime;
    private final ServiceFactory<? extends T> factory;
    private final long sequence;

    ServiceDescriptor(Class<T> serviceKey, ServiceLifetime lifetime, ServiceFactory<? extends T> factory, long sequence) {
        this.serviceKey = Objects.requireNonNull(serviceKey, "serviceKey");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.sequence = sequence;
    }

    public Class<T> getServiceKey() {
        return serviceKey;
    }

    public ServiceLifetime getLifetime() {
        return lifetime;
    }

    public ServiceFactory<? extends T> getFactory() {
        return factory;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return StrUtil.format("{}[{}#{}]", serviceKey.getSimpleName(), lifetime, sequence);
    }
}
