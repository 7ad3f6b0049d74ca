package com.neuron.sample.order.application.query;

import com.neuron.sample.order.domain.Order;
import com.neuron.sample.order.domain.OrderItem;
import com.neuron.sample.order.domain.OrderState;
import com.neuron.sample.order.domain.OrderStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * 订单详情（由事件流重建）
 *
 * @author qianye
 * @create 2026-10-15 14:00
 */
public record OrderView(String orderId, String customerId, OrderStatus status, List<OrderItem> items,
                        BigDecimal total, long version) {

    public static OrderView of(Order order) {
        OrderState state = order.getState();
        return new OrderView(order.getId(), state.getCustomerId(), state.getStatus(), state.getItems(),
                state.getTotal(), order.getVersion());
    }
}
