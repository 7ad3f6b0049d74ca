package com.neuron.infra.framework.mediation;

import cn.hutool.core.util.StrUtil;
import com.neuron.infra.exception.AmbiguousHandlerException;
import com.neuron.infra.log.NeuronLog;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 处理器注册表
 * <p>
 * 启动时显式登记 "消息类型 -> 处理器类型"，分发时只做一次 Map 查找，不做任何包扫描。
 * 通知处理器的执行顺序就是这里的登记顺序（稳定保证）。
 * </p>
 * 处理器类型本身还需要以自身 Class 为服务类型注册到容器中，分发时从作用域解析。
 *
 * @author qianye
 * @create 2026-10-13 10:00
 */
public class HandlerRegistry {

    private final Map<Class<?>, List<Class<?>>> requestHandlers = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<Class<?>>> notificationHandlers = new ConcurrentHashMap<>();

    /**
     * 登记处理器
     * <p>
     * 同一对 (消息类型, 处理器类型) 重复登记会被忽略。
     * 同一个请求类型登记多个不同处理器不会在这里报错，而是在 {@link #validate()} 或分发时报错。
     *
     * @param messageType 消息类型（Request 或 Notification 的实现类）
     * @param handlerType 处理器类型
     */
    public void registerHandler(Class<?> messageType, Class<?> handlerType) {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(handlerType, "handlerType");
        Map<Class<?>, List<Class<?>>> table;
        if (Request.class.isAssignableFrom(messageType)) {
            requireAssignable(RequestHandler.class, handlerType, messageType);
            table = requestHandlers;
        } else if (Notification.class.isAssignableFrom(messageType)) {
            requireAssignable(NotificationHandler.class, handlerType, messageType);
            table = notificationHandlers;
        } else {
            throw new IllegalArgumentException(StrUtil.format("[{}] 既不是 Request 也不是 Notification", messageType.getName()));
        }
        List<Class<?>> handlers = table.computeIfAbsent(messageType, k -> new CopyOnWriteArrayList<>());
        if (((CopyOnWriteArrayList<Class<?>>) handlers).addIfAbsent(handlerType)) {
            NeuronLog.mediatorLog.debug("登记处理器 {} -> {}", messageType.getSimpleName(), handlerType.getSimpleName());
        } else {
            NeuronLog.mediatorLog.debug("处理器 {} -> {} 已登记，忽略", messageType.getSimpleName(), handlerType.getSimpleName());
        }
    }

    /**
     * 获取请求类型登记的处理器（按登记顺序）
     */
    public List<Class<?>> getRequestHandlers(Class<?> requestType) {
        return snapshot(requestHandlers.get(requestType));
    }

    /**
     * 获取通知类型登记的处理器（按登记顺序）
     */
    public List<Class<?>> getNotificationHandlers(Class<?> notificationType) {
        return snapshot(notificationHandlers.get(notificationType));
    }

    /**
     * 启动期校验：每个请求类型最多只能有一个处理器
     *
     * @throws AmbiguousHandlerException 第一个违规的请求类型（全部违规项会先写入日志）
     */
    public void validate() {
        AmbiguousHandlerException first = null;
        for (Map.Entry<Class<?>, List<Class<?>>> entry : requestHandlers.entrySet()) {
            if (entry.getValue().size() > 1) {
                AmbiguousHandlerException e = new AmbiguousHandlerException(entry.getKey(), snapshot(entry.getValue()));
                NeuronLog.mediatorLog.error(e.getMessage());
                if (first == null) {
                    first = e;
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private static List<Class<?>> snapshot(List<Class<?>> handlers) {
        return handlers == null ? Collections.emptyList() : List.copyOf(handlers);
    }

    private static void requireAssignable(Class<?> expected, Class<?> handlerType, Class<?> messageType) {
        if (!expected.isAssignableFrom(handlerType)) {
            throw new IllegalArgumentException(StrUtil.format("[{}] 不是 {}，不能处理 [{}]",
                    handlerType.getName(), expected.getSimpleName(), messageType.getName()));
        }
    }
}
