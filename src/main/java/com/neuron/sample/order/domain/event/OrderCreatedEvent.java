package com.neuron.sample.order.domain.event;

import lombok.Getter;

import java.time.Instant;

/**
 * 订单已创建
 *
 * @author qianye
 * @create 2026-10-15 09:10
 */
@Getter
public class OrderCreatedEvent extends OrderEvent {

    private final String customerId;
    /**
     * 业务创建时间（记录时取值，重放时只读取）
     */
    private final Instant placedAt;

    public OrderCreatedEvent(String orderId, String customerId, Instant placedAt) {
        super(orderId);
        this.customerId = customerId;
        this.placedAt = placedAt;
    }

    @Override
    public void accept(OrderEventVisitor visitor) {
        visitor.visit(this);
    }
}
