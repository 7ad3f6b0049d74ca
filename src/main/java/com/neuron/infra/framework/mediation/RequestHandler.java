package com.neuron.infra.framework.mediation;

/**
 * 请求处理器
 *
 * @param <Q> 请求类型
 * @param <R> 结果类型
 * @author qianye
 * @create 2026-10-13 09:05
 */
public interface RequestHandler<Q extends Request<R>, R> {

    R handle(Q request);
}
