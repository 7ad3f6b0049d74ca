package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.List;

/**
 * 请求的服务类型未在容器中注册
 *
 * @author qianye
 * @create 2026-10-12 14:36
 */
public class ServiceNotRegisteredException extends ServiceResolutionException {

    private final Class<?> serviceKey;

    public ServiceNotRegisteredException(Class<?> serviceKey, List<Class<?>> chain) {
        super(StrUtil.format("服务 [{}] 未注册，解析链路: {}", serviceKey.getName(), describe(chain)), chain);
        this.serviceKey = serviceKey;
    }

    public Class<?> getServiceKey() {
        return serviceKey;
    }
}
