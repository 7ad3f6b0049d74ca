package com.neuron.sample.order.domain.event;

import lombok.Getter;

import java.time.Instant;

/**
 * 订单已确认
 *
 * @author qianye
 * @create 2026-10-15 09:16
 */
@Getter
public class OrderConfirmedEvent extends OrderEvent {

    private final Instant confirmedAt;

    public OrderConfirmedEvent(String orderId, Instant confirmedAt) {
        super(orderId);
        this.confirmedAt = confirmedAt;
    }

    @Override
    public void accept(OrderEventVisitor visitor) {
        visitor.visit(this);
    }
}
