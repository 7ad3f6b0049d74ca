package com.neuron.persistence.repository;

import java.util.Optional;

/**
 * 聚合仓储
 *
 * @param <A> 聚合类型
 * @param <K> 聚合 ID 类型
 * @author qianye
 * @create 2026-10-14 15:40
 */
public interface Repository<A, K> {

    /**
     * 持久化聚合的新事件
     *
     * @throws com.neuron.infra.exception.ConcurrencyConflictException 其他写入方已修改该聚合，需重新加载后重试
     */
    void save(A aggregate);

    /**
     * @throws com.neuron.infra.exception.AggregateNotFoundException 聚合不存在
     */
    A getById(K id);

    Optional<A> findById(K id);

    boolean contains(K id);
}
