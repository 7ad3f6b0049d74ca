package com.neuron.infra.framework.mediation;

/**
 * 通知处理器
 * <p>
 * 每次调用都在一个独立的新作用域中解析并执行，执行完毕后该作用域立即释放。
 *
 * @param <N> 通知类型
 * @author qianye
 * @create 2026-10-13 09:06
 */
public interface NotificationHandler<N extends Notification> {

    void handle(N notification);
}
