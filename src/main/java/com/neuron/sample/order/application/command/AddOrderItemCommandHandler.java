package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.infra.OrderRepository;

/**
 * 添加商品
 *
 * @author qianye
 * @create 2026-10-15 13:35
 */
public class AddOrderItemCommandHandler extends OrderCommandHandlerBase
        implements RequestHandler<AddOrderItemCommand, OperationResult<Long>> {

    public AddOrderItemCommandHandler(OrderRepository repository) {
        super(repository);
    }

    @Override
    public OperationResult<Long> handle(AddOrderItemCommand command) {
        return modify(command.orderId(), order -> order.addItem(command.productId(), command.quantity(), command.unitPrice()));
    }
}
