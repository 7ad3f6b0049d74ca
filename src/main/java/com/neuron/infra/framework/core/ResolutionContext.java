package com.neuron.infra.framework.core;

import com.neuron.infra.exception.CircularDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 解析链路上下文（线程私有）
 * <p>
 * 记录当前线程正在构造的服务类型栈，用于：
 * 1. 工厂抛异常时拼出完整的解析链路；
 * 2. 同一条链路上再次出现同一类型时判定为循环依赖。
 *
 * @author qianye
 * @create 2026-10-12 16:20
 */
final class ResolutionContext {

    private static final ThreadLocal<Deque<Class<?>>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private ResolutionContext() {
    }

    /**
     * 进入一个服务的构造过程
     *
     * @throws CircularDependencyException 该类型已经在链路上
     */
    static void enter(Class<?> serviceKey) {
        Deque<Class<?>> stack = STACK.get();
        if (stack.contains(serviceKey)) {
            throw new CircularDependencyException(serviceKey, snapshot());
        }
        stack.addLast(serviceKey);
    }

    static void exit() {
        Deque<Class<?>> stack = STACK.get();
        stack.pollLast();
        if (stack.isEmpty()) {
            STACK.remove();
        }
    }

    /**
     * 当前链路快照（从最外层到最内层）
     */
    static List<Class<?>> snapshot() {
        return new ArrayList<>(STACK.get());
    }

    /**
     * 在当前链路末尾追加一个类型后的快照，用于描述"正要解析但失败"的那一环
     */
    static List<Class<?>> snapshotWith(Class<?> serviceKey) {
        List<Class<?>> chain = snapshot();
        if (chain.isEmpty() || chain.get(chain.size() - 1) != serviceKey) {
            chain.add(serviceKey);
        }
        return chain;
    }
}
