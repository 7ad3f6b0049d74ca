package com.neuron.sample.order.domain.event;

import com.neuron.core.domain.DomainEvent;

/**
 * 订单事件基类，事件种类固定，通过 {@link OrderEventVisitor} 分派
 *
 * @author qianye
 * @create 2026-10-15 09:00
 */
public abstract class OrderEvent extends DomainEvent<String> {

    protected OrderEvent(String orderId) {
        super(orderId);
    }

    public abstract void accept(OrderEventVisitor visitor);
}
