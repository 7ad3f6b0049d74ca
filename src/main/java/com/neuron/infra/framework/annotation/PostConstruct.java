package com.neuron.infra.framework.annotation;

import java.lang.annotation.*;

/**
 * 【生命周期】初始化回调
 * <p>
 * 作用：服务工厂返回实例后，容器立即执行此方法（每个实例只执行一次）。
 * 适合做依赖就绪后的初始化，例如建立连接、预热缓存。
 *
 * @author qianye
 * @create 2026-10-12 15:33
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
public @interface PostConstruct {
}
