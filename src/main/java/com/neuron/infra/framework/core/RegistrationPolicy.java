package com.neuron.infra.framework.core;

/**
 * 同一服务类型重复注册时的处理策略
 *
 * @author qianye
 * @create 2026-10-12 16:02
 */
public enum RegistrationPolicy {
    /**
     * 后注册的覆盖先注册的（单个解析取最后一次注册），getServices 仍能拿到全部注册
     */
    REPLACE,
    /**
     * 禁止重复注册，第二次注册直接抛出 DuplicateRegistrationException
     */
    REJECT
}
