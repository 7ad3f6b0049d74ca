package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 注册策略为 REJECT 时重复注册同一个服务类型
 *
 * @author qianye
 * @create 2026-10-12 14:41
 */
public class DuplicateRegistrationException extends NeuronException {

    public DuplicateRegistrationException(Class<?> serviceKey) {
        super(StrUtil.format("服务 [{}] 已注册，当前注册策略禁止覆盖", serviceKey.getName()));
    }
}
