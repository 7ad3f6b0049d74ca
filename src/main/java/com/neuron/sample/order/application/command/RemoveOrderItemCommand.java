package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Command;

/**
 * 从草稿订单移除商品，成功返回订单新版本
 *
 * @author qianye
 * @create 2026-10-15 13:12
 */
public record RemoveOrderItemCommand(String orderId, String productId) implements Command<OperationResult<Long>> {
}
