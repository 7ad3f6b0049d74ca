package com.neuron.sample.order;

import com.neuron.core.uow.UnitOfWork;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.mediation.MediationConfigurer;
import com.neuron.persistence.store.EventStore;
import com.neuron.persistence.store.InMemoryEventStore;
import com.neuron.sample.order.application.command.*;
import com.neuron.sample.order.application.event.OrderCancelledProjectionHandler;
import com.neuron.sample.order.application.event.OrderConfirmedProjectionHandler;
import com.neuron.sample.order.application.event.OrderCreatedAuditHandler;
import com.neuron.sample.order.application.event.OrderCreatedProjectionHandler;
import com.neuron.sample.order.application.query.GetOrderByIdQuery;
import com.neuron.sample.order.application.query.GetOrderByIdQueryHandler;
import com.neuron.sample.order.application.query.ListOrdersQuery;
import com.neuron.sample.order.application.query.ListOrdersQueryHandler;
import com.neuron.sample.order.domain.event.OrderCancelledEvent;
import com.neuron.sample.order.domain.event.OrderConfirmedEvent;
import com.neuron.sample.order.domain.event.OrderCreatedEvent;
import com.neuron.sample.order.infra.AuditJournal;
import com.neuron.sample.order.infra.AuditTrail;
import com.neuron.sample.order.infra.OrderRepository;
import com.neuron.sample.order.infra.OrderViewStore;

/**
 * 订单模块装配表
 * <p>
 * 所有服务与处理器都在这里显式登记，需先完成中介者与工作单元的装配。
 * <pre>
 * SINGLETON  EventStore, AuditJournal, OrderViewStore
 * SCOPED     OrderRepository, AuditTrail
 * TRANSIENT  全部处理器
 * </pre>
 *
 * @author qianye
 * @create 2026-10-15 15:00
 */
public final class OrderingModule {

    private OrderingModule() {
    }

    public static void configure(MediationConfigurer mediation) {
        ServiceContainer container = mediation.container();
        container.tryRegisterSingleton(EventStore.class, provider -> new InMemoryEventStore());
        container.registerSingleton(AuditJournal.class, provider -> new AuditJournal());
        container.registerSingleton(OrderViewStore.class, provider -> new OrderViewStore());
        container.registerScoped(AuditTrail.class, provider -> new AuditTrail(provider.getRequiredService(AuditJournal.class)));
        container.registerScoped(OrderRepository.class, provider -> new OrderRepository(
                provider.getRequiredService(EventStore.class),
                provider.getRequiredService(UnitOfWork.class)));

        mediation
                .addRequestHandler(CreateOrderCommand.class, CreateOrderCommandHandler.class,
                        provider -> new CreateOrderCommandHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(AddOrderItemCommand.class, AddOrderItemCommandHandler.class,
                        provider -> new AddOrderItemCommandHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(RemoveOrderItemCommand.class, RemoveOrderItemCommandHandler.class,
                        provider -> new RemoveOrderItemCommandHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(ConfirmOrderCommand.class, ConfirmOrderCommandHandler.class,
                        provider -> new ConfirmOrderCommandHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(CancelOrderCommand.class, CancelOrderCommandHandler.class,
                        provider -> new CancelOrderCommandHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(GetOrderByIdQuery.class, GetOrderByIdQueryHandler.class,
                        provider -> new GetOrderByIdQueryHandler(provider.getRequiredService(OrderRepository.class)))
                .addRequestHandler(ListOrdersQuery.class, ListOrdersQueryHandler.class,
                        provider -> new ListOrdersQueryHandler(provider.getRequiredService(OrderViewStore.class)))
                .addNotificationHandler(OrderCreatedEvent.class, OrderCreatedAuditHandler.class,
                        provider -> new OrderCreatedAuditHandler(provider.getRequiredService(AuditTrail.class)))
                .addNotificationHandler(OrderCreatedEvent.class, OrderCreatedProjectionHandler.class,
                        provider -> new OrderCreatedProjectionHandler(provider.getRequiredService(OrderViewStore.class)))
                .addNotificationHandler(OrderConfirmedEvent.class, OrderConfirmedProjectionHandler.class,
                        provider -> new OrderConfirmedProjectionHandler(provider.getRequiredService(OrderViewStore.class)))
                .addNotificationHandler(OrderCancelledEvent.class, OrderCancelledProjectionHandler.class,
                        provider -> new OrderCancelledProjectionHandler(provider.getRequiredService(OrderViewStore.class)));
    }
}
