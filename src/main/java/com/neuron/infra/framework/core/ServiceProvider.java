package com.neuron.infra.framework.core;

import java.util.List;

/**
 * 【核心接口】服务解析器
 * <p>
 * 根容器 (ServiceContainer) 和作用域 (ServiceScope) 都实现此接口。
 * 控制器、处理器通过它获取依赖。
 *
 * @author qianye
 * @create 2026-10-12 15:59
 */
public interface ServiceProvider {
    /**
     * 获取服务，未注册时返回 null
     *
     * @param serviceKey 服务类型
     * @return 服务实例或 null
     */
    <T> T getService(Class<T> serviceKey);

    /**
     * 获取服务，未注册时抛出 ServiceNotRegisteredException
     *
     * @param serviceKey 服务类型
     * @return 服务实例
     */
    <T> T getRequiredService(Class<T> serviceKey);

    /**
     * 获取同一服务类型的全部注册实现，按注册顺序排列
     *
     * @param serviceKey 服务类型
     * @return 实例列表，未注册时为空列表
     */
    <T> List<T> getServices(Class<T> serviceKey);
}
