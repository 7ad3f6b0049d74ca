package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 请求消息注册了多个处理器
 * <p>
 * 命令和查询必须有且只有一个处理器，框架绝不会从多个中随便挑一个。
 *
 * @author qianye
 * @create 2026-10-12 15:03
 */
public class AmbiguousHandlerException extends NeuronException {

    public AmbiguousHandlerException(Class<?> messageType, List<Class<?>> handlerTypes) {
        super(StrUtil.format("请求 [{}] 注册了 {} 个处理器: {}", messageType.getName(), handlerTypes.size(),
                handlerTypes.stream().map(Class::getSimpleName).collect(Collectors.joining(", "))));
    }
}
