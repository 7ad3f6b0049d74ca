package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 服务解析失败
 * <p>
 * 携带完整的解析链路 (A -> B -> C)，深层依赖图中出错时可以直接定位是哪一环出了问题。
 *
 * @author qianye
 * @create 2026-10-12 14:35
 */
public class ServiceResolutionException extends NeuronException {

    private final transient List<Class<?>> resolutionChain;

    public ServiceResolutionException(String message, List<Class<?>> resolutionChain) {
        super(message);
        this.resolutionChain = List.copyOf(resolutionChain);
    }

    public ServiceResolutionException(String message, List<Class<?>> resolutionChain, Throwable cause) {
        super(message, cause);
        this.resolutionChain = List.copyOf(resolutionChain);
    }

    /**
     * 工厂执行失败时包装原始异常
     */
    public static ServiceResolutionException factoryFailed(Class<?> serviceKey, List<Class<?>> chain, Throwable cause) {
        String message = StrUtil.format("服务 [{}] 构造失败，解析链路: {}，原因: {}",
                serviceKey.getName(), describe(chain), cause.getMessage());
        return new ServiceResolutionException(message, chain, cause);
    }

    public List<Class<?>> getResolutionChain() {
        return Collections.unmodifiableList(resolutionChain);
    }

    /**
     * 把解析链路格式化为 "A -> B -> C"
     */
    public static String describe(List<Class<?>> chain) {
        if (chain == null || chain.isEmpty()) {
            return "<root>";
        }
        return chain.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
    }
}
