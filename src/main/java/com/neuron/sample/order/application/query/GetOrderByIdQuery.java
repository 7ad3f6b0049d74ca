package com.neuron.sample.order.application.query;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Query;

/**
 * 按 ID 查询订单详情
 *
 * @author qianye
 * @create 2026-10-15 14:05
 */
public record GetOrderByIdQuery(String orderId) implements Query<OperationResult<OrderView>> {
}
