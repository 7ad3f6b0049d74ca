package com.neuron.sample.order.application.query;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.infra.OrderSummary;
import com.neuron.sample.order.infra.OrderViewStore;

import java.util.List;
import java.util.Objects;

/**
 * 查询全部订单摘要
 *
 * @author qianye
 * @create 2026-10-15 14:20
 */
public class ListOrdersQueryHandler implements RequestHandler<ListOrdersQuery, OperationResult<List<OrderSummary>>> {

    private final OrderViewStore viewStore;

    public ListOrdersQueryHandler(OrderViewStore viewStore) {
        this.viewStore = Objects.requireNonNull(viewStore, "viewStore");
    }

    @Override
    public OperationResult<List<OrderSummary>> handle(ListOrdersQuery query) {
        return OperationResult.ok(viewStore.findAll());
    }
}
