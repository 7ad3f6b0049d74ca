package com.neuron.infra.framework.mediation;

/**
 * 管道行为（中间件）
 * <p>
 * 包裹在请求处理器外层，可以在 next 前后执行逻辑、不调用 next 直接短路、或转换异常后重新抛出。
 * 按注册顺序进入，按相反顺序退出：先注册的在最外层。
 * 以 {@code PipelineBehavior.class} 为服务类型注册（通常为 SCOPED），执行时从当前作用域解析全部实现。
 *
 * @author qianye
 * @create 2026-10-13 09:10
 */
public interface PipelineBehavior {

    <R> R handle(Request<R> request, RequestHandlerDelegate<R> next);

    /**
     * 是否作用于该请求，默认作用于全部请求
     */
    default boolean supports(Request<?> request) {
        return true;
    }
}
