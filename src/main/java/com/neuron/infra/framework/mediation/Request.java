package com.neuron.infra.framework.mediation;

/**
 * 请求消息：有且只有一个处理器，产生一个结果
 *
 * @param <R> 结果类型
 * @author qianye
 * @create 2026-10-13 09:00
 */
public interface Request<R> {
}
