package com.neuron.sample.order.infra;

import com.neuron.sample.order.domain.OrderStatus;
import lombok.Getter;
import lombok.ToString;

/**
 * 订单摘要（读模型）
 *
 * @author qianye
 * @create 2026-10-15 11:20
 */
@Getter
@ToString
public final class OrderSummary {

    private final String orderId;
    private final String customerId;
    private final OrderStatus status;
    private final long version;

    public OrderSummary(String orderId, String customerId, OrderStatus status, long version) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.status = status;
        this.version = version;
    }

    public OrderSummary withStatus(OrderStatus newStatus, long newVersion) {
        return new OrderSummary(orderId, customerId, newStatus, newVersion);
    }
}
