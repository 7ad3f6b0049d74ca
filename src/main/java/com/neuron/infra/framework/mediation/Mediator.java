package com.neuron.infra.framework.mediation;

/**
 * 【核心接口】中介者
 * <p>
 * 以 SCOPED 生命周期注册：从哪个作用域解析出来，请求处理器就从哪个作用域解析。
 *
 * @author qianye
 * @create 2026-10-13 10:10
 */
public interface Mediator {
    /**
     * 执行命令或查询
     *
     * @param request 请求
     * @param <R>     结果类型
     * @return 处理器结果
     * @throws com.neuron.infra.exception.HandlerNotFoundException  未登记处理器
     * @throws com.neuron.infra.exception.AmbiguousHandlerException 登记了多个处理器
     */
    <R> R execute(Request<R> request);

    /**
     * 广播通知，每个处理器在各自的新作用域中执行
     *
     * @param notification 通知
     * @throws NotificationDispatchException 有处理器执行失败（按失败策略汇总或快速失败）
     * @throws com.neuron.infra.exception.PublishCancelledException 广播过程中线程被中断
     */
    void publish(Notification notification);

    /**
     * 当前失败策略，工作单元提交时沿用
     */
    FailurePolicy getFailurePolicy();
}
