package com.neuron.sample.order.domain;

import cn.hutool.core.util.StrUtil;
import com.neuron.core.domain.AggregateRoot;
import com.neuron.infra.exception.BusinessRuleException;
import com.neuron.sample.order.domain.event.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 订单聚合
 * <p>
 * 业务校验在这里完成，校验通过后记录事件；时间戳在记录时取值并写入事件。
 * 违反业务规则抛出 {@link BusinessRuleException}。
 *
 * @author qianye
 * @create 2026-10-15 10:00
 */
public class Order extends AggregateRoot<String, OrderState, OrderEvent> {

    /**
     * 构造空白订单（仓储重放使用）
     */
    public Order() {
        super(new OrderState());
    }

    public static Order create(String orderId, String customerId) {
        if (StrUtil.isBlank(orderId)) {
            throw new BusinessRuleException("订单 ID 不能为空");
        }
        if (StrUtil.isBlank(customerId)) {
            throw new BusinessRuleException("客户 ID 不能为空");
        }
        Order order = new Order();
        order.recordEvent(new OrderCreatedEvent(orderId, customerId, Instant.now()));
        return order;
    }

    public void addItem(String productId, int quantity, BigDecimal unitPrice) {
        requireStatus(OrderStatus.DRAFT, "添加商品");
        if (StrUtil.isBlank(productId)) {
            throw new BusinessRuleException("商品 ID 不能为空");
        }
        if (quantity <= 0) {
            throw new BusinessRuleException("商品数量必须大于 0: " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new BusinessRuleException("商品单价不能为负: " + unitPrice);
        }
        recordEvent(new OrderItemAddedEvent(getId(), productId, quantity, unitPrice));
    }

    public void removeItem(String productId) {
        requireStatus(OrderStatus.DRAFT, "移除商品");
        if (!getState().containsProduct(productId)) {
            throw new BusinessRuleException(StrUtil.format("订单 [{}] 不包含商品 {}", getId(), productId));
        }
        recordEvent(new OrderItemRemovedEvent(getId(), productId));
    }

    public void confirm() {
        requireStatus(OrderStatus.DRAFT, "确认");
        if (getState().getItems().isEmpty()) {
            throw new BusinessRuleException(StrUtil.format("订单 [{}] 没有任何商品，不能确认", getId()));
        }
        recordEvent(new OrderConfirmedEvent(getId(), Instant.now()));
    }

    public void cancel(String reason) {
        if (getState().getStatus() == OrderStatus.CANCELLED) {
            throw new BusinessRuleException(StrUtil.format("订单 [{}] 已取消", getId()));
        }
        recordEvent(new OrderCancelledEvent(getId(), StrUtil.blankToDefault(reason, "未说明")));
    }

    @Override
    protected void apply(OrderEvent event) {
        event.accept(getState());
    }

    private void requireStatus(OrderStatus expected, String action) {
        if (getState().getStatus() != expected) {
            throw new BusinessRuleException(StrUtil.format("订单 [{}] 当前状态 {}，不能{}", getId(), getState().getStatus(), action));
        }
    }
}
