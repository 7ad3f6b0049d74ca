package com.neuron.infra.exception;

/**
 * 违反业务规则
 * <p>
 * 由聚合在校验失败时抛出，属于可预期的业务失败，命令处理器将其转换为 400 结果。
 *
 * @author qianye
 * @create 2026-10-19 10:20
 */
public class BusinessRuleException extends NeuronException {

    public BusinessRuleException(String message) {
        super(message);
    }
}
