package com.neuron.infra.framework.core;

/**
 * 服务工厂
 * <p>
 * provider 是本次解析所在的解析器：作用域内解析时是 ServiceScope，
 * 单例构造时永远是根容器。工厂内部通过它递归解析自己的依赖。
 *
 * @author qianye
 * @create 2026-10-12 16:05
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(ServiceProvider provider);
}
