package com.neuron.core.uow;

import com.neuron.core.domain.AggregateRoot;
import com.neuron.core.domain.DomainEvent;

import java.util.List;

/**
 * 工作单元
 * <p>
 * 跟踪本作用域内被修改并已持久化的聚合，在持久化成功后统一广播它们的领域事件。
 * 只属于一个作用域，不跨线程共享。
 * </p>
 *
 * @author qianye
 * @create 2026-10-14 13:00
 */
public interface UnitOfWork {

    /**
     * 跟踪聚合。同一实例重复登记被忽略，null 被忽略，保持登记顺序
     */
    void register(AggregateRoot<?, ?, ?> aggregate);

    boolean hasChanges();

    /**
     * 全部已跟踪聚合的未提交事件（按聚合登记顺序，再按事件记录顺序）
     */
    List<DomainEvent<?>> getDomainEvents();

    /**
     * 放弃跟踪，不广播任何事件，也不清除聚合上的事件
     */
    void clear();

    /**
     * 广播已跟踪聚合的领域事件
     * <p>
     * 调用方义务：只能在所有聚合都已成功持久化之后调用。持久化失败时不得调用，
     * 聚合上的未提交事件保持不变，供重试使用。
     *
     * @throws com.neuron.infra.framework.mediation.NotificationDispatchException 通知处理器失败
     * @throws com.neuron.infra.exception.PublishCancelledException              当前线程已被中断
     */
    void commit();
}
