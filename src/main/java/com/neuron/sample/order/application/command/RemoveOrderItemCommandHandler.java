package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.infra.OrderRepository;

/**
 * 移除商品
 *
 * @author qianye
 * @create 2026-10-15 13:37
 */
public class RemoveOrderItemCommandHandler extends OrderCommandHandlerBase
        implements RequestHandler<RemoveOrderItemCommand, OperationResult<Long>> {

    public RemoveOrderItemCommandHandler(OrderRepository repository) {
        super(repository);
    }

    @Override
    public OperationResult<Long> handle(RemoveOrderItemCommand command) {
        return modify(command.orderId(), order -> order.removeItem(command.productId()));
    }
}
