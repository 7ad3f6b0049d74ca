package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 从已经释放的作用域中解析服务
 *
 * @author qianye
 * @create 2026-10-12 14:42
 */
public class ScopeDisposedException extends NeuronException {

    public ScopeDisposedException(String scopeId, Class<?> serviceKey) {
        super(StrUtil.format("作用域 [{}] 已释放，无法解析服务 [{}]", scopeId, serviceKey.getName()));
    }
}
