package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.infra.OrderRepository;

/**
 * 取消订单
 *
 * @author qianye
 * @create 2026-10-15 13:42
 */
public class CancelOrderCommandHandler extends OrderCommandHandlerBase
        implements RequestHandler<CancelOrderCommand, OperationResult<Long>> {

    public CancelOrderCommandHandler(OrderRepository repository) {
        super(repository);
    }

    @Override
    public OperationResult<Long> handle(CancelOrderCommand command) {
        return modify(command.orderId(), order -> order.cancel(command.reason()));
    }
}
