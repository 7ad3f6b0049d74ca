package com.neuron.sample.order;

import com.neuron.NeuronApplication;
import com.neuron.core.result.OperationResult;
import com.neuron.infra.config.Environment;
import com.neuron.infra.config.NeuronYaml;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.core.ServiceScope;
import com.neuron.infra.framework.mediation.Mediator;
import com.neuron.persistence.store.EventStore;
import com.neuron.persistence.store.InMemoryEventStore;
import com.neuron.sample.order.application.command.AddOrderItemCommand;
import com.neuron.sample.order.application.command.CancelOrderCommand;
import com.neuron.sample.order.application.command.ConfirmOrderCommand;
import com.neuron.sample.order.application.command.CreateOrderCommand;
import com.neuron.sample.order.application.command.OrderLine;
import com.neuron.sample.order.application.command.RemoveOrderItemCommand;
import com.neuron.sample.order.application.query.GetOrderByIdQuery;
import com.neuron.sample.order.application.query.ListOrdersQuery;
import com.neuron.sample.order.application.query.OrderView;
import com.neuron.sample.order.domain.OrderStatus;
import com.neuron.sample.order.domain.event.OrderCreatedEvent;
import com.neuron.sample.order.infra.AuditJournal;
import com.neuron.sample.order.infra.AuditTrail;
import com.neuron.sample.order.infra.OrderSummary;
import com.neuron.sample.order.infra.OrderViewStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 订单模块端到端测试：真实容器 + 中介者 + 工作单元 + 内存事件存储
 *
 * @author qianye
 * @create 2026-10-16 17:00
 */
@DisplayName("订单模块端到端测试")
class OrderingEndToEndTest {

    private ServiceContainer container;

    @BeforeEach
    void setUp() {
        container = NeuronApplication.bootstrap(new NeuronYaml(new Environment()));
    }

    @AfterEach
    void tearDown() {
        container.close();
    }

    /**
     * 模拟一次请求：开作用域 → 执行 → 释放
     */
    private <T> T inRequest(Function<Mediator, T> action) {
        try (ServiceScope scope = container.createScope()) {
            return action.apply(scope.getRequiredService(Mediator.class));
        }
    }

    private String createOrder(OrderLine... lines) {
        OperationResult<String> created = inRequest(m -> m.execute(new CreateOrderCommand("c-1", List.of(lines))));
        assertEquals(201, created.getStatus(), created::toString);
        return created.getData();
    }

    // ========================================================================
    //                        1. 创建订单
    // ========================================================================

    @Test
    @DisplayName("创建订单：事件只写入一次，审计与投影各执行一次")
    void createOrderPersistsAndPublishesOnce() {
        String orderId = createOrder();

        InMemoryEventStore store = (InMemoryEventStore) container.getRequiredService(EventStore.class);
        assertEquals(1, store.getStreamVersion("Order-" + orderId));
        assertEquals(1, store.getGlobalOffset());

        assertEquals(List.of("order-created:" + orderId), container.getRequiredService(AuditJournal.class).getEntries());
        OrderViewStore viewStore = container.getRequiredService(OrderViewStore.class);
        assertEquals(1, viewStore.getUpdateCount());
        assertEquals(OrderStatus.DRAFT, viewStore.find(orderId).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("创建时带订单行：多个事件在同一次提交中写入")
    void createOrderWithLines() {
        String orderId = createOrder(new OrderLine("sku-1", 2, new BigDecimal("19.90")), new OrderLine("sku-2", 1, BigDecimal.ONE));

        OperationResult<OrderView> view = inRequest(m -> m.execute(new GetOrderByIdQuery(orderId)));
        assertEquals(200, view.getStatus());
        assertEquals(3, view.getData().version());
        assertEquals(2, view.getData().items().size());
        assertEquals(0, new BigDecimal("40.80").compareTo(view.getData().total()));
    }

    @Test
    @DisplayName("请求作用域释放后，用它的中介者广播：处理器拿到全新的审计缓冲")
    void publishAfterRequestScopeDisposed() {
        Mediator captured;
        AuditTrail requestTrail;
        try (ServiceScope scope = container.createScope()) {
            captured = scope.getRequiredService(Mediator.class);
            requestTrail = scope.getRequiredService(AuditTrail.class);
        }
        assertTrue(requestTrail.isClosed());

        captured.publish(new OrderCreatedEvent("late-1", "c-9", Instant.now()));

        assertEquals(List.of("order-created:late-1"), container.getRequiredService(AuditJournal.class).getEntries());
        assertTrue(container.getRequiredService(OrderViewStore.class).find("late-1").isPresent());
    }

    // ========================================================================
    //                        2. 完整流程
    // ========================================================================

    @Test
    @DisplayName("添加 → 移除 → 确认，查询详情与摘要列表")
    void fullFlow() {
        String orderId = createOrder(new OrderLine("sku-1", 1, BigDecimal.TEN));

        assertEquals(3L, inRequest(m -> m.execute(new AddOrderItemCommand(orderId, "sku-2", 2, new BigDecimal("2.50")))).getData());
        assertEquals(4L, inRequest(m -> m.execute(new RemoveOrderItemCommand(orderId, "sku-1"))).getData());
        assertEquals(5L, inRequest(m -> m.execute(new ConfirmOrderCommand(orderId))).getData());

        OrderView view = inRequest(m -> m.execute(new GetOrderByIdQuery(orderId))).getData();
        assertEquals(OrderStatus.CONFIRMED, view.status());
        assertEquals(0, new BigDecimal("5.00").compareTo(view.total()));
        assertEquals("c-1", view.customerId());

        List<OrderSummary> summaries = inRequest(m -> m.execute(new ListOrdersQuery())).getData();
        assertEquals(1, summaries.size());
        assertEquals(OrderStatus.CONFIRMED, summaries.get(0).getStatus());
        assertEquals(5, summaries.get(0).getVersion());
    }

    @Test
    @DisplayName("取消订单后摘要同步为已取消")
    void cancelFlow() {
        String orderId = createOrder();
        OperationResult<Long> cancelled = inRequest(m -> m.execute(new CancelOrderCommand(orderId, "重复下单")));

        assertEquals(200, cancelled.getStatus());
        assertEquals(OrderStatus.CANCELLED, container.getRequiredService(OrderViewStore.class).find(orderId).orElseThrow().getStatus());
    }

    // ========================================================================
    //                        3. 失败结果
    // ========================================================================

    @Test
    @DisplayName("业务规则失败返回 400，且不写入任何事件")
    void businessRuleViolationIsBadRequest() {
        OperationResult<String> blankCustomer = inRequest(m -> m.execute(new CreateOrderCommand(" ")));
        assertEquals(400, blankCustomer.getStatus());

        String orderId = createOrder();
        OperationResult<Long> emptyConfirm = inRequest(m -> m.execute(new ConfirmOrderCommand(orderId)));
        assertEquals(400, emptyConfirm.getStatus());
        assertNotNull(emptyConfirm.getDetail());

        InMemoryEventStore store = (InMemoryEventStore) container.getRequiredService(EventStore.class);
        assertEquals(1, store.getGlobalOffset());
    }

    @Test
    @DisplayName("订单不存在返回 404，空 ID 查询返回 400")
    void notFoundAndBlankId() {
        assertEquals(404, inRequest(m -> m.execute(new ConfirmOrderCommand("missing"))).getStatus());
        assertEquals(404, inRequest(m -> m.execute(new GetOrderByIdQuery("missing"))).getStatus());
        assertEquals(400, inRequest(m -> m.execute(new GetOrderByIdQuery(""))).getStatus());
        assertTrue(container.getRequiredService(AuditJournal.class).getEntries().isEmpty());
    }
}
