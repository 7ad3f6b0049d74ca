package com.neuron.infra.framework.mediation;

/**
 * 通知消息：广播给 0..N 个处理器，发布方不期待返回值
 *
 * @author qianye
 * @create 2026-10-13 09:02
 */
public interface Notification {
}
