package com.neuron.sample.order.domain.event;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * 订单已添加商品
 *
 * @author qianye
 * @create 2026-10-15 09:12
 */
@Getter
public class OrderItemAddedEvent extends OrderEvent {

    private final String productId;
    private final int quantity;
    private final BigDecimal unitPrice;

    public OrderItemAddedEvent(String orderId, String productId, int quantity, BigDecimal unitPrice) {
        super(orderId);
        this.productId = productId;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    @Override
    public void accept(OrderEventVisitor visitor) {
        visitor.visit(this);
    }
}
