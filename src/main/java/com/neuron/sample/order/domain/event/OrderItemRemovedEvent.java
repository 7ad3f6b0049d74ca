package com.neuron.sample.order.domain.event;

import lombok.Getter;

/**
 * 订单已移除商品
 *
 * @author qianye
 * @create 2026-10-15 09:14
 */
@Getter
public class OrderItemRemovedEvent extends OrderEvent {

    private final String productId;

    public OrderItemRemovedEvent(String orderId, String productId) {
        super(orderId);
        this.productId = productId;
    }

    @Override
    public void accept(OrderEventVisitor visitor) {
        visitor.visit(this);
    }
}
