package com.neuron.persistence.store;

import com.neuron.core.domain.DomainEvent;

import java.time.Instant;

/**
 * 事件存储中的一条记录
 *
 * @author qianye
 * @create 2026-10-14 15:00
 */
public final class EventRecord {

    private final String streamId;
    private final long streamVersion;
    private final long globalOffset;
    private final String eventType;
    private final DomainEvent<?> event;
    private final Instant storedAt;

    public EventRecord(String streamId, long streamVersion, long globalOffset, DomainEvent<?> event, Instant storedAt) {
        this.streamId = streamId;
        this.streamVersion = streamVersion;
        this.globalOffset = globalOffset;
        this.eventType = event.getClass().getSimpleName();
        this.event = event;
        this.storedAt = storedAt;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * 事件在流内的版本，从 1 开始
     */
    public long getStreamVersion() {
        return streamVersion;
    }

    /**
     * 全局追加序号，从 1 开始
     */
    public long getGlobalOffset() {
        return globalOffset;
    }

    public String getEventType() {
        return eventType;
    }

    public DomainEvent<?> getEvent() {
        return event;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    @Override
    public String toString() {
        return streamId + "@" + streamVersion + "#" + globalOffset + " " + eventType;
    }
}
