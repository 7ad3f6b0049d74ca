package com.neuron.sample.order.application.command;

import cn.hutool.core.util.IdUtil;
import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.RequestHandler;
import com.neuron.sample.order.domain.Order;
import com.neuron.sample.order.infra.OrderRepository;

/**
 * 创建订单
 *
 * @author qianye
 * @create 2026-10-15 13:30
 */
public class CreateOrderCommandHandler extends OrderCommandHandlerBase
        implements RequestHandler<CreateOrderCommand, OperationResult<String>> {

    public CreateOrderCommandHandler(OrderRepository repository) {
        super(repository);
    }

    @Override
    public OperationResult<String> handle(CreateOrderCommand command) {
        return guard(() -> {
            Order order = Order.create(IdUtil.fastSimpleUUID(), command.customerId());
            for (OrderLine line : command.lines()) {
                order.addItem(line.productId(), line.quantity(), line.unitPrice());
            }
            repository.save(order);
            return OperationResult.created(order.getId());
        });
    }
}
