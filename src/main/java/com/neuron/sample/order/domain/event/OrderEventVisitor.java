package com.neuron.sample.order.domain.event;

/**
 * 订单事件访问者
 * <p>
 * 每种订单事件对应一个方法，新增事件类型时所有实现都必须补上对应的转换，编译器负责检查遗漏。
 *
 * @author qianye
 * @create 2026-10-15 09:05
 */
public interface OrderEventVisitor {

    void visit(OrderCreatedEvent event);

    void visit(OrderItemAddedEvent event);

    void visit(OrderItemRemovedEvent event);

    void visit(OrderConfirmedEvent event);

    void visit(OrderCancelledEvent event);
}
