package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.domain.Order;
import com.neuron.sample.order.infra.OrderRepository;

/**
 * 确认订单
 *
 * @author qianye
 * @create 2026-10-15 13:40
 */
public class ConfirmOrderCommandHandler extends OrderCommandHandlerBase
        implements RequestHandler<ConfirmOrderCommand, OperationResult<Long>> {

    public ConfirmOrderCommandHandler(OrderRepository repository) {
        super(repository);
    }

    @Override
    public OperationResult<Long> handle(ConfirmOrderCommand command) {
        return modify(command.orderId(), Order::confirm);
    }
}
