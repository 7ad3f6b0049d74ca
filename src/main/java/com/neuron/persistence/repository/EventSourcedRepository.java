package com.neuron.persistence.repository;

import com.neuron.core.domain.AggregateRoot;
import com.neuron.core.domain.DomainEvent;
import com.neuron.core.uow.UnitOfWork;
import com.neuron.infra.exception.AggregateNotFoundException;
import com.neuron.infra.log.NeuronLog;
import com.neuron.persistence.store.EventRecord;
import com.neuron.persistence.store.EventStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 事件溯源仓储 (SCOPED)
 * <p>
 * 每个聚合对应一个事件流 {@code <聚合类型>-<id>}。
 * </p>
 * <ul>
 * <li><b>save</b>：以聚合的已持久化版本作为期望版本，追加比它新的事件；成功后标记已持久化并登记到本作用域的工作单元。
 * 未提交事件保留在聚合上，由工作单元提交时广播并清空。</li>
 * <li><b>getById</b>：用工厂构造全新聚合，按存储顺序重放整个事件流。</li>
 * </ul>
 *
 * @param <A> 聚合类型
 * @param <K> 聚合 ID 类型
 * @param <E> 聚合事件基类型
 * @author qianye
 * @create 2026-10-14 16:00
 */
public class EventSourcedRepository<A extends AggregateRoot<K, ?, E>, K, E extends DomainEvent<K>> implements Repository<A, K> {

    private final EventStore eventStore;
    private final UnitOfWork unitOfWork;
    private final String aggregateType;
    private final Supplier<A> aggregateFactory;

    /**
     * @param eventStore       事件存储
     * @param unitOfWork       当前作用域的工作单元
     * @param aggregateType    聚合类型名，作为事件流前缀
     * @param aggregateFactory 构造全新聚合（内部持有全新的状态对象）
     */
    public EventSourcedRepository(EventStore eventStore, UnitOfWork unitOfWork, String aggregateType, Supplier<A> aggregateFactory) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.aggregateFactory = Objects.requireNonNull(aggregateFactory, "aggregateFactory");
    }

    @Override
    public void save(A aggregate) {
        Objects.requireNonNull(aggregate, "aggregate");
        List<E> pending = aggregate.getPendingEvents();
        if (pending.isEmpty()) {
            return;
        }
        String streamId = streamId(aggregate.getId());
        long version = eventStore.appendToStream(streamId, aggregate.getPersistedVersion(), pending);
        aggregate.markPersisted();
        unitOfWork.register(aggregate);
        NeuronLog.storeLog.debug("聚合 [{}] 已保存，当前版本 {}", streamId, version);
    }

    @Override
    public A getById(K id) {
        return findById(id).orElseThrow(() -> new AggregateNotFoundException(aggregateType, id));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<A> findById(K id) {
        Objects.requireNonNull(id, "id");
        List<EventRecord> records = eventStore.readStream(streamId(id));
        if (records.isEmpty()) {
            return Optional.empty();
        }
        List<E> history = new ArrayList<>(records.size());
        for (EventRecord record : records) {
            history.add((E) record.getEvent());
        }
        A aggregate = aggregateFactory.get();
        aggregate.loadFromHistory(history);
        return Optional.of(aggregate);
    }

    @Override
    public boolean contains(K id) {
        return eventStore.containsStream(streamId(id));
    }

    public String streamId(K id) {
        return aggregateType + "-" + id;
    }
}
