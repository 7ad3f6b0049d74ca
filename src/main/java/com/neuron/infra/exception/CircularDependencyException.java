package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.List;

/**
 * 服务之间存在循环依赖
 *
 * @author qianye
 * @create 2026-10-12 14:40
 */
public class CircularDependencyException extends ServiceResolutionException {

    public CircularDependencyException(Class<?> serviceKey, List<Class<?>> chain) {
        super(StrUtil.format("检测到循环依赖: {} -> {}", describe(chain), serviceKey.getSimpleName()), chain);
    }
}
