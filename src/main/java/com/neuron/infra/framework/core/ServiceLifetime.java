package com.neuron.infra.framework.core;

/**
 * 服务生命周期
 *
 * @author qianye
 * @create 2026-10-12 16:00
 */
public enum ServiceLifetime {
    /**
     * 单例：整个容器生命周期内只构造一次，所有作用域共享
     */
    SINGLETON,
    /**
     * 作用域：每个 ServiceScope（一次请求 / 一次事件处理）构造一次
     */
    SCOPED,
    /**
     * 瞬时：每次解析都构造新实例
     */
    TRANSIENT
}
