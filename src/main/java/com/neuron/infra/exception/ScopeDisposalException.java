package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.List;

/**
 * 释放资源时有一个或多个释放钩子执行失败
 * <p>
 * 所有钩子都会执行完毕后才抛出，每个失败原因作为 suppressed 异常挂在本异常上。
 *
 * @author qianye
 * @create 2026-10-12 14:44
 */
public class ScopeDisposalException extends NeuronException {

    public ScopeDisposalException(String owner, List<Throwable> failures) {
        super(StrUtil.format("[{}] 释放资源时 {} 个释放钩子执行失败", owner, failures.size()));
        failures.forEach(this::addSuppressed);
    }
}
