package com.neuron.sample.order.application.event;

import com.neuron.infra.framework.mediation.NotificationHandler;
import com.neuron.sample.order.domain.event.OrderCreatedEvent;
import com.neuron.sample.order.infra.AuditTrail;

import java.util.Objects;

/**
 * 订单创建审计
 * <p>
 * 依赖 SCOPED 的 {@link AuditTrail}，每次广播拿到自己子作用域里的实例，子作用域释放时刷入审计日志。
 *
 * @author qianye
 * @create 2026-10-15 14:30
 */
public class OrderCreatedAuditHandler implements NotificationHandler<OrderCreatedEvent> {

    private final AuditTrail auditTrail;

    public OrderCreatedAuditHandler(AuditTrail auditTrail) {
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
    }

    @Override
    public void handle(OrderCreatedEvent event) {
        auditTrail.record("order-created", event.getAggregateId());
    }
}
