package com.neuron.sample.order.domain.event;

import lombok.Getter;

/**
 * 订单已取消
 *
 * @author qianye
 * @create 2026-10-15 09:18
 */
@Getter
public class OrderCancelledEvent extends OrderEvent {

    private final String reason;

    public OrderCancelledEvent(String orderId, String reason) {
        super(orderId);
        this.reason = reason;
    }

    @Override
    public void accept(OrderEventVisitor visitor) {
        visitor.visit(this);
    }
}
