package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Command;

import java.math.BigDecimal;

/**
 * 向草稿订单添加商品，成功返回订单新版本
 *
 * @author qianye
 * @create 2026-10-15 13:10
 */
public record AddOrderItemCommand(String orderId, String productId, int quantity, BigDecimal unitPrice)
        implements Command<OperationResult<Long>> {
}
