package com.neuron.sample.order.application.event;

import com.neuron.infra.framework.mediation.NotificationHandler;
import com.neuron.sample.order.domain.OrderStatus;
import com.neuron.sample.order.domain.event.OrderCancelledEvent;
import com.neuron.sample.order.infra.OrderViewStore;

import java.util.Objects;

/**
 * 订单取消后更新摘要状态
 *
 * @author qianye
 * @create 2026-10-15 14:42
 */
public class OrderCancelledProjectionHandler implements NotificationHandler<OrderCancelledEvent> {

    private final OrderViewStore viewStore;

    public OrderCancelledProjectionHandler(OrderViewStore viewStore) {
        this.viewStore = Objects.requireNonNull(viewStore, "viewStore");
    }

    @Override
    public void handle(OrderCancelledEvent event) {
        viewStore.changeStatus(event.getAggregateId(), OrderStatus.CANCELLED, event.getAggregateVersion());
    }
}
