package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.List;

/**
 * 在根容器（没有作用域）中解析了 Scoped 服务
 * <p>
 * Scoped 服务只能从 ServiceScope 中解析；单例工厂拿到的永远是根容器，
 * 所以单例依赖 Scoped 服务也会落到这里。
 *
 * @author qianye
 * @create 2026-10-12 14:38
 */
public class ScopedServiceResolutionException extends ServiceResolutionException {

    public ScopedServiceResolutionException(Class<?> serviceKey, List<Class<?>> chain) {
        super(StrUtil.format("Scoped 服务 [{}] 不能从根容器解析，请通过 ServiceScope 获取，解析链路: {}",
                serviceKey.getName(), describe(chain)), chain);
    }
}
