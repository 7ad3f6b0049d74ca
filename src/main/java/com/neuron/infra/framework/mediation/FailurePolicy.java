package com.neuron.infra.framework.mediation;

/**
 * 通知处理器失败策略
 *
 * @author qianye
 * @create 2026-10-13 09:21
 */
public enum FailurePolicy {
    /**
     * 继续执行剩余处理器，全部结束后统一抛出 NotificationDispatchException（至少尝试一次投递）
     */
    CONTINUE,
    /**
     * 第一个失败立即抛出，剩余处理器不再执行（尽力投递）
     */
    FAIL_FAST
}
