package com.neuron.infra.framework.mediation;

/**
 * 通知广播模式
 *
 * @author qianye
 * @create 2026-10-13 09:20
 */
public enum PublishMode {
    /**
     * 顺序：按注册顺序逐个执行，前一个处理器结束后才开始下一个
     */
    SEQUENTIAL,
    /**
     * 并行：全部处理器同时提交到 EventDispatchPool，不保证执行顺序，用顺序隔离换吞吐
     */
    PARALLEL
}
