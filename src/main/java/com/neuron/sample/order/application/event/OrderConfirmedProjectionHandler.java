package com.neuron.sample.order.application.event;

import com.neuron.infra.framework.mediation.NotificationHandler;
import com.neuron.sample.order.domain.OrderStatus;
import com.neuron.sample.order.domain.event.OrderConfirmedEvent;
import com.neuron.sample.order.infra.OrderViewStore;

import java.util.Objects;

/**
 * 订单确认后更新摘要状态
 *
 * @author qianye
 * @create 2026-10-15 14:40
 */
public class OrderConfirmedProjectionHandler implements NotificationHandler<OrderConfirmedEvent> {

    private final OrderViewStore viewStore;

    public OrderConfirmedProjectionHandler(OrderViewStore viewStore) {
        this.viewStore = Objects.requireNonNull(viewStore, "viewStore");
    }

    @Override
    public void handle(OrderConfirmedEvent event) {
        viewStore.changeStatus(event.getAggregateId(), OrderStatus.CONFIRMED, event.getAggregateVersion());
    }
}
