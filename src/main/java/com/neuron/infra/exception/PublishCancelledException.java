package com.neuron.infra.exception;

/**
 * 事件广播过程中线程被中断
 * <p>
 * 抛出时线程的中断标记保持为 true，已经开始执行的处理器会执行完毕。
 *
 * @author qianye
 * @create 2026-10-13 10:20
 */
public class PublishCancelledException extends NeuronException {

    public PublishCancelledException(String message) {
        super(message);
    }

    public PublishCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
