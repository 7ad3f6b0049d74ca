package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 请求消息没有注册任何处理器
 *
 * @author qianye
 * @create 2026-10-12 15:02
 */
public class HandlerNotFoundException extends NeuronException {

    public HandlerNotFoundException(Class<?> messageType) {
        super(StrUtil.format("请求 [{}] 未注册处理器", messageType.getName()));
    }
}
