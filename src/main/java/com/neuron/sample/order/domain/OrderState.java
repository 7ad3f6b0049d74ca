package com.neuron.sample.order.domain;

import com.neuron.core.domain.AggregateState;
import com.neuron.sample.order.domain.event.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 订单状态
 * <p>
 * 每个 visit 方法就是一种事件的状态转换函数，只读取事件数据，并且只调用一次 bumpVersion。
 *
 * @author qianye
 * @create 2026-10-15 09:30
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class OrderState extends AggregateState<String> implements OrderEventVisitor {

    private String customerId;
    private OrderStatus status;
    private Instant placedAt;
    private Instant confirmedAt;
    private String cancelReason;

    /**
     * Key: 商品 ID, Value: 订单行（保持添加顺序）
     */
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, OrderItem> items = new LinkedHashMap<>();

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    public boolean containsProduct(String productId) {
        return items.containsKey(productId);
    }

    public BigDecimal getTotal() {
        BigDecimal total = BigDecimal.ZERO;
        for (OrderItem item : items.values()) {
            total = total.add(item.getSubtotal());
        }
        return total;
    }

    @Override
    public void visit(OrderCreatedEvent event) {
        this.id = event.getAggregateId();
        this.customerId = event.getCustomerId();
        this.placedAt = event.getPlacedAt();
        this.status = OrderStatus.DRAFT;
        bumpVersion();
    }

    @Override
    public void visit(OrderItemAddedEvent event) {
        OrderItem existing = items.get(event.getProductId());
        if (existing == null) {
            items.put(event.getProductId(), new OrderItem(event.getProductId(), event.getQuantity(), event.getUnitPrice()));
        } else {
            items.put(event.getProductId(), existing.withQuantity(existing.getQuantity() + event.getQuantity()));
        }
        bumpVersion();
    }

    @Override
    public void visit(OrderItemRemovedEvent event) {
        items.remove(event.getProductId());
        bumpVersion();
    }

    @Override
    public void visit(OrderConfirmedEvent event) {
        this.status = OrderStatus.CONFIRMED;
        this.confirmedAt = event.getConfirmedAt();
        bumpVersion();
    }

    @Override
    public void visit(OrderCancelledEvent event) {
        this.status = OrderStatus.CANCELLED;
        this.cancelReason = event.getReason();
        bumpVersion();
    }
}
