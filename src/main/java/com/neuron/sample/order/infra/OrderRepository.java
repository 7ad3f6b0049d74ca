package com.neuron.sample.order.infra;

import com.neuron.core.uow.UnitOfWork;
import com.neuron.persistence.repository.EventSourcedRepository;
import com.neuron.persistence.store.EventStore;
import com.neuron.sample.order.domain.Order;
import com.neuron.sample.order.domain.event.OrderEvent;

/**
 * 订单仓储 (SCOPED)，事件流前缀 {@code Order-}
 *
 * @author qianye
 * @create 2026-10-15 11:00
 */
public class OrderRepository extends EventSourcedRepository<Order, String, OrderEvent> {

    public OrderRepository(EventStore eventStore, UnitOfWork unitOfWork) {
        super(eventStore, unitOfWork, "Order", Order::new);
    }
}
