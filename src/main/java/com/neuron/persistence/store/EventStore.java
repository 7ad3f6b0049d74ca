package com.neuron.persistence.store;

import com.neuron.core.domain.DomainEvent;

import java.util.List;

/**
 * 事件存储
 *
 * @author qianye
 * @create 2026-10-14 15:10
 */
public interface EventStore {

    /**
     * 追加事件
     *
     * @param streamId        事件流 ID
     * @param expectedVersion 写入方读取时的流版本（新流为 0）
     * @param events          按顺序追加的事件
     * @return 追加后的流版本
     * @throws com.neuron.infra.exception.ConcurrencyConflictException 流的当前版本不等于 expectedVersion
     */
    long appendToStream(String streamId, long expectedVersion, List<? extends DomainEvent<?>> events);

    /**
     * 读取流版本大于等于 fromVersion 的事件（按版本升序）；流不存在返回空列表
     */
    List<EventRecord> readStream(String streamId, long fromVersion);

    /**
     * 读取整个事件流
     */
    default List<EventRecord> readStream(String streamId) {
        return readStream(streamId, 1);
    }

    /**
     * 当前流版本，流不存在返回 0
     */
    long getStreamVersion(String streamId);

    boolean containsStream(String streamId);
}
