package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 聚合不存在
 *
 * @author qianye
 * @create 2026-10-14 10:05
 */
public class AggregateNotFoundException extends NeuronException {

    private final Object aggregateId;

    public AggregateNotFoundException(String aggregateType, Object aggregateId) {
        super(StrUtil.format("聚合 [{}] 不存在: {}", aggregateType, aggregateId));
        this.aggregateId = aggregateId;
    }

    public Object getAggregateId() {
        return aggregateId;
    }
}
