package com.neuron.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 事件溯源聚合根
 * <p>
 * 生命周期：未保存 → 经过 N 个事件到达版本 N → 只在内存中被丢弃。
 * </p>
 * <ul>
 * <li>{@link #recordEvent}：写入版本号 → 调用 {@link #apply} 修改状态 → 追加到未提交列表。</li>
 * <li>{@link #loadFromHistory}：仓储重放已存储的事件，不产生未提交事件。</li>
 * <li>{@code persistedVersion}：已经写入事件存储的版本。仓储只追加比它新的事件，
 * 而未提交事件一直保留到工作单元提交时才清空。</li>
 * <li>状态转换抛出异常或没有推进版本号时，聚合被标记为损坏：状态可能已被部分修改，
 * 之后记录事件、重放、取待写事件都会被拒绝，只能丢弃后重新加载。</li>
 * </ul>
 *
 * @param <K> 聚合 ID 类型
 * @param <S> 状态类型
 * @param <E> 本聚合的事件基类型
 * @author qianye
 * @create 2026-10-14 09:20
 */
public abstract class AggregateRoot<K, S extends AggregateState<K>, E extends DomainEvent<K>> {

    private final S state;
    private final List<E> uncommittedEvents = new ArrayList<>();
    private long persistedVersion;
    private boolean corrupted;

    protected AggregateRoot(S state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public K getId() {
        return state.getId();
    }

    public long getVersion() {
        return state.getVersion();
    }

    public S getState() {
        return state;
    }

    /**
     * 已写入事件存储的版本
     */
    public long getPersistedVersion() {
        return persistedVersion;
    }

    /**
     * 状态转换失败后为 true，此时内存状态与事件不再一致
     */
    public boolean isCorrupted() {
        return corrupted;
    }

    /**
     * 未提交事件的只读快照（按记录顺序）
     */
    public List<E> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    /**
     * 尚未写入事件存储的事件
     */
    public List<E> getPendingEvents() {
        ensureUsable();
        List<E> pending = new ArrayList<>();
        for (E event : uncommittedEvents) {
            if (event.getAggregateVersion() > persistedVersion) {
                pending.add(event);
            }
        }
        return pending;
    }

    public void clearUncommittedEvents() {
        uncommittedEvents.clear();
    }

    /**
     * 仓储写入成功后调用
     */
    public void markPersisted() {
        ensureUsable();
        this.persistedVersion = state.getVersion();
    }

    /**
     * 重放历史事件，重建后未提交列表为空，版本号等于事件数量
     */
    public void loadFromHistory(List<? extends E> history) {
        ensureUsable();
        if (!uncommittedEvents.isEmpty() || state.getVersion() != 0) {
            throw new IllegalStateException("只能在全新的聚合上重放历史事件");
        }
        for (E event : history) {
            transition(event);
        }
        this.persistedVersion = state.getVersion();
    }

    /**
     * 记录一个新事件并立即应用到状态上
     */
    protected E recordEvent(E event) {
        Objects.requireNonNull(event, "event");
        ensureUsable();
        event.assignAggregateVersion(state.getVersion() + 1);
        transition(event);
        uncommittedEvents.add(event);
        return event;
    }

    private void transition(E event) {
        long expected = state.getVersion() + 1;
        try {
            apply(event);
        } catch (RuntimeException e) {
            corrupted = true;
            throw e;
        }
        if (state.getVersion() != expected) {
            corrupted = true;
            throw new IllegalStateException(getClass().getSimpleName() + " 应用 " + event.getClass().getSimpleName()
                    + " 后版本号应为 " + expected + "，实际为 " + state.getVersion());
        }
    }

    private void ensureUsable() {
        if (corrupted) {
            throw new IllegalStateException(getClass().getSimpleName() + " [" + getId() + "] 状态转换曾经失败，聚合已不可用，请重新加载");
        }
    }

    /**
     * 按事件类型分派到唯一的状态转换函数，转换函数内部负责 {@link AggregateState#bumpVersion()}
     */
    protected abstract void apply(E event);
}
