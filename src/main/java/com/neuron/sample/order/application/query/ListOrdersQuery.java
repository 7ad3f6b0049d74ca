package com.neuron.sample.order.application.query;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Query;
import com.neuron.sample.order.infra.OrderSummary;

import java.util.List;

/**
 * 查询全部订单摘要（读投影）
 *
 * @author qianye
 * @create 2026-10-15 14:15
 */
public record ListOrdersQuery() implements Query<OperationResult<List<OrderSummary>>> {
}
