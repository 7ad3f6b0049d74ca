package com.neuron.infra.framework.annotation;

import java.lang.annotation.*;

/**
 * 【生命周期】销毁回调
 * <p>
 * 作用：实例所属的作用域释放（或容器关闭）时，自动执行此方法。
 * 适合做资源释放（如：断开连接、停止线程池）。
 * 实现了 {@link AutoCloseable} 的实例会先执行 close()，再执行本注解标注的方法。
 *
 * @author qianye
 * @create 2026-10-12 15:33
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
public @interface PreDestroy {
}
