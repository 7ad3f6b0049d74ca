package com.neuron.infra.exception;

/**
 * 框架异常基类
 * <p>
 * 容器、作用域、中介者抛出的异常都属于配置错误（程序员错误），统一为非受检异常，
 * 直接向调用方传播，不做任何吞没。
 * 唯一的例外是 {@link BusinessRuleException}，它表示可预期的业务失败。
 *
 * @author qianye
 * @create 2026-10-12 14:31
 */
public class NeuronException extends RuntimeException {

    public NeuronException(String message) {
        super(message);
    }

    public NeuronException(String message, Throwable cause) {
        super(message, cause);
    }
}
