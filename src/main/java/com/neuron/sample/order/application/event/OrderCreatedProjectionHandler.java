package com.neuron.sample.order.application.event;

import com.neuron.infra.framework.mediation.NotificationHandler;
import com.neuron.sample.order.domain.OrderStatus;
import com.neuron.sample.order.domain.event.OrderCreatedEvent;
import com.neuron.sample.order.infra.OrderSummary;
import com.neuron.sample.order.infra.OrderViewStore;

import java.util.Objects;

/**
 * 订单创建后写入摘要投影
 *
 * @author qianye
 * @create 2026-10-15 14:35
 */
public class OrderCreatedProjectionHandler implements NotificationHandler<OrderCreatedEvent> {

    private final OrderViewStore viewStore;

    public OrderCreatedProjectionHandler(OrderViewStore viewStore) {
        this.viewStore = Objects.requireNonNull(viewStore, "viewStore");
    }

    @Override
    public void handle(OrderCreatedEvent event) {
        viewStore.insert(new OrderSummary(event.getAggregateId(), event.getCustomerId(), OrderStatus.DRAFT,
                event.getAggregateVersion()));
    }
}
