package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Command;

/**
 * 确认订单，成功返回订单新版本
 *
 * @author qianye
 * @create 2026-10-15 13:14
 */
public record ConfirmOrderCommand(String orderId) implements Command<OperationResult<Long>> {
}
