package com.neuron.sample.order.application.query;

import cn.hutool.core.util.StrUtil;
import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.infra.OrderRepository;

import java.util.Objects;

/**
 * 按 ID 查询订单详情
 *
 * @author qianye
 * @create 2026-10-15 14:10
 */
public class GetOrderByIdQueryHandler implements RequestHandler<GetOrderByIdQuery, OperationResult<OrderView>> {

    private final OrderRepository repository;

    public GetOrderByIdQueryHandler(OrderRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    @Override
    public OperationResult<OrderView> handle(GetOrderByIdQuery query) {
        if (StrUtil.isBlank(query.orderId())) {
            return OperationResult.badRequest("订单 ID 不能为空");
        }
        return repository.findById(query.orderId())
                .map(order -> OperationResult.ok(OrderView.of(order)))
                .orElseGet(() -> OperationResult.notFound(StrUtil.format("订单 [{}] 不存在", query.orderId())));
    }
}
