package com.neuron.infra.framework.mediation;

/**
 * 命令：修改系统状态的请求
 *
 * @param <R> 结果类型
 * @author qianye
 * @create 2026-10-13 09:01
 */
public interface Command<R> extends Request<R> {
}
