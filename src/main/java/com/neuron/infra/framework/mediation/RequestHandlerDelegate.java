package com.neuron.infra.framework.mediation;

/**
 * 管道中的"下一步"（下一个行为，或最内层的处理器）
 *
 * @param <R> 结果类型
 * @author qianye
 * @create 2026-10-13 09:08
 */
@FunctionalInterface
public interface RequestHandlerDelegate<R> {

    R proceed();
}
