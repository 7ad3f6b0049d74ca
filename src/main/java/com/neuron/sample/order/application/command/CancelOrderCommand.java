package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Command;

/**
 * 取消订单，成功返回订单新版本
 *
 * @author qianye
 * @create 2026-10-15 13:16
 */
public record CancelOrderCommand(String orderId, String reason) implements Command<OperationResult<Long>> {
}
