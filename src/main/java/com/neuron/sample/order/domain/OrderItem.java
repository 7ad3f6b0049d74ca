package com.neuron.sample.order.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 订单行（不可变）
 *
 * @author qianye
 * @create 2026-10-15 09:22
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OrderItem {

    private final String productId;
    private final int quantity;
    private final BigDecimal unitPrice;

    public OrderItem(String productId, int quantity, BigDecimal unitPrice) {
        this.productId = productId;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    public OrderItem withQuantity(int newQuantity) {
        return new OrderItem(productId, newQuantity, unitPrice);
    }

    public BigDecimal getSubtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
