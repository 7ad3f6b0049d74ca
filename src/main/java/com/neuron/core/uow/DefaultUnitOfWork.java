package com.neuron.core.uow;

import com.neuron.core.domain.AggregateRoot;
import com.neuron.core.domain.DomainEvent;
import com.neuron.infra.exception.PublishCancelledException;
import com.neuron.infra.framework.mediation.FailurePolicy;
import com.neuron.infra.framework.mediation.HandlerFailure;
import com.neuron.infra.framework.mediation.Mediator;
import com.neuron.infra.framework.mediation.NotificationDispatchException;
import com.neuron.infra.log.NeuronLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 默认工作单元 (SCOPED)
 * <p>
 * 提交流程：按登记顺序遍历聚合 → 取出未提交事件并清空聚合上的列表 → 逐个交给中介者广播。
 * </p>
 * <h3>失败策略（跟随中介者配置）：</h3>
 * <ul>
 * <li><b>CONTINUE</b>：剩余事件照常广播，全部尝试后汇总抛出一个 {@link NotificationDispatchException}（至少尝试一次）。</li>
 * <li><b>FAIL_FAST</b>：第一个失败立即抛出，之后的事件不再广播（尽力而为）。</li>
 * </ul>
 * 无论成功失败，提交结束后都不再跟踪任何聚合。
 *
 * @author qianye
 * @create 2026-10-14 13:20
 */
public class DefaultUnitOfWork implements UnitOfWork {

    private final Mediator mediator;
    private final List<AggregateRoot<?, ?, ?>> aggregates = new ArrayList<>();

    public DefaultUnitOfWork(Mediator mediator) {
        this.mediator = Objects.requireNonNull(mediator, "mediator");
    }

    @Override
    public void register(AggregateRoot<?, ?, ?> aggregate) {
        if (aggregate == null) {
            return;
        }
        for (AggregateRoot<?, ?, ?> tracked : aggregates) {
            if (tracked == aggregate) {
                return;
            }
        }
        aggregates.add(aggregate);
    }

    @Override
    public boolean hasChanges() {
        for (AggregateRoot<?, ?, ?> aggregate : aggregates) {
            if (!aggregate.getUncommittedEvents().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<DomainEvent<?>> getDomainEvents() {
        List<DomainEvent<?>> events = new ArrayList<>();
        for (AggregateRoot<?, ?, ?> aggregate : aggregates) {
            events.addAll(aggregate.getUncommittedEvents());
        }
        return events;
    }

    @Override
    public void clear() {
        aggregates.clear();
    }

    @Override
    public void commit() {
        if (Thread.currentThread().isInterrupted()) {
            throw new PublishCancelledException("工作单元提交前线程已被中断，未广播任何事件");
        }
        List<HandlerFailure> failures = new ArrayList<>();
        int published = 0;
        try {
            for (AggregateRoot<?, ?, ?> aggregate : new ArrayList<>(aggregates)) {
                List<? extends DomainEvent<?>> events = aggregate.getUncommittedEvents();
                aggregate.clearUncommittedEvents();
                for (DomainEvent<?> event : events) {
                    try {
                        mediator.publish(event);
                        published++;
                    } catch (NotificationDispatchException e) {
                        if (mediator.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                            throw e;
                        }
                        failures.addAll(e.getFailures());
                    }
                }
            }
        } finally {
            aggregates.clear();
        }
        NeuronLog.eventLog.debug("工作单元提交完成 | 成功广播:{} | 失败处理器:{}", published, failures.size());
        if (!failures.isEmpty()) {
            throw new NotificationDispatchException("UnitOfWork", failures);
        }
    }
}
