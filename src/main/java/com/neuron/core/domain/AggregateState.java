package com.neuron.core.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 聚合状态基类
 * <p>
 * 状态只能由事件的状态转换函数修改。每个转换函数必须且只能调用一次 {@link #bumpVersion()}，
 * 版本号不允许在转换函数之外变化；转换函数只能使用事件里的数据，不得读取时钟或随机数，
 * 保证同一事件序列重放得到完全相同的状态。
 * </p>
 *
 * @param <K> 聚合 ID 类型
 * @author qianye
 * @create 2026-10-14 09:10
 */
@Getter
@EqualsAndHashCode
public abstract class AggregateState<K> {

    protected K id;

    private long version;

    /**
     * 版本号加 1，只能在状态转换函数内部调用
     */
    protected final void bumpVersion() {
        version++;
    }
}
