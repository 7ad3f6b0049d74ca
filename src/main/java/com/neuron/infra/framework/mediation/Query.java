package com.neuron.infra.framework.mediation;

/**
 * 查询：只读请求
 *
 * @param <R> 结果类型
 * @author qianye
 * @create 2026-10-13 09:01
 */
public interface Query<R> extends Request<R> {
}
