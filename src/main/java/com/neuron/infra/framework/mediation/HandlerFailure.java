package com.neuron.infra.framework.mediation;

import cn.hutool.core.util.StrUtil;

/**
 * 单个通知处理器的失败记录
 *
 * @author qianye
 * @create 2026-10-13 09:25
 */
public final class HandlerFailure {
    private final Class<?> handlerType;
    private final Class<?> notificationType;
    private final Throwable cause;

    public HandlerFailure(Class<?> handlerType, Class<?> notificationType, Throwable cause) {
        this.handlerType = handlerType;
        this.notificationType = notificationType;
        this.cause = cause;
    }

    public Class<?> getHandlerType() {
        return handlerType;
    }

    public Class<?> getNotificationType() {
        return notificationType;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return StrUtil.format("{}({}): {}", handlerType.getSimpleName(), notificationType.getSimpleName(),
                cause == null ? "" : cause.getMessage());
    }
}
