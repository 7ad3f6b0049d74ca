package com.neuron.core.domain;

import com.neuron.infra.framework.mediation.Notification;

import java.time.Instant;
import java.util.Objects;

/**
 * 领域事件基类
 * <p>
 * 事件本身就是通知，工作单元提交时原样交给中介者广播。
 * 事件数据在构造后不再变化；聚合版本号由 {@link AggregateRoot#recordEvent} 在记录时写入一次。
 * </p>
 *
 * @param <K> 聚合 ID 类型
 * @author qianye
 * @create 2026-10-14 09:00
 */
public abstract class DomainEvent<K> implements Notification {

    private final K aggregateId;
    private final Instant createdAt;
    private long aggregateVersion;

    protected DomainEvent(K aggregateId) {
        this(aggregateId, Instant.now());
    }

    protected DomainEvent(K aggregateId, Instant createdAt) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public K getAggregateId() {
        return aggregateId;
    }

    /**
     * 事件记录后聚合的版本号，从 1 开始；尚未记录时为 0
     */
    public long getAggregateVersion() {
        return aggregateVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    void assignAggregateVersion(long version) {
        if (aggregateVersion != 0 && aggregateVersion != version) {
            throw new IllegalStateException("事件 " + getClass().getSimpleName() + " 已记录在版本 " + aggregateVersion);
        }
        this.aggregateVersion = version;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{aggregateId=" + aggregateId + ", version=" + aggregateVersion + "}";
    }
}
