package com.neuron.persistence.store;

import com.neuron.core.domain.DomainEvent;
import com.neuron.infra.exception.ConcurrencyConflictException;
import com.neuron.infra.lock.NeuronLock;
import com.neuron.infra.log.NeuronLog;

import java.time.Instant;
import java.util.*;

/**
 * 内存事件存储 (SINGLETON)
 * <p>
 * 每个事件流一个有序列表，另有全局追加序号。
 * 版本校验与追加在同一把写锁内完成，读操作共享读锁。
 * </p>
 *
 * @author qianye
 * @create 2026-10-14 15:20
 */
public class InMemoryEventStore implements EventStore {

    private final Map<String, List<EventRecord>> streams = new HashMap<>();
    private final NeuronLock lock = NeuronLock.ofReadWrite();
    private long globalOffset = 0;

    @Override
    public long appendToStream(String streamId, long expectedVersion, List<? extends DomainEvent<?>> events) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        return lock.supplyInWrite(() -> {
            List<EventRecord> stream = streams.getOrDefault(streamId, Collections.emptyList());
            long actual = stream.size();
            if (actual != expectedVersion) {
                NeuronLog.storeLog.warn("事件流 [{}] 并发冲突 | 期望版本:{} | 实际版本:{}", streamId, expectedVersion, actual);
                throw new ConcurrencyConflictException(streamId, expectedVersion, actual);
            }
            if (events.isEmpty()) {
                return actual;
            }
            List<EventRecord> target = streams.computeIfAbsent(streamId, k -> new ArrayList<>());
            Instant now = Instant.now();
            long version = actual;
            for (DomainEvent<?> event : events) {
                target.add(new EventRecord(streamId, ++version, ++globalOffset, event, now));
            }
            NeuronLog.storeLog.debug("事件流 [{}] 追加 {} 个事件 | 版本 {} -> {}", streamId, events.size(), actual, version);
            return version;
        });
    }

    @Override
    public List<EventRecord> readStream(String streamId, long fromVersion) {
        return lock.supplyInRead(() -> {
            List<EventRecord> stream = streams.get(streamId);
            if (stream == null) {
                return Collections.emptyList();
            }
            int from = (int) Math.min(stream.size(), Math.max(1, fromVersion) - 1);
            return List.copyOf(stream.subList(from, stream.size()));
        });
    }

    @Override
    public long getStreamVersion(String streamId) {
        return lock.supplyInRead(() -> {
            List<EventRecord> stream = streams.get(streamId);
            return stream == null ? 0L : (long) stream.size();
        });
    }

    @Override
    public boolean containsStream(String streamId) {
        return lock.supplyInRead(() -> streams.containsKey(streamId));
    }

    /**
     * 全局已追加事件数
     */
    public long getGlobalOffset() {
        return lock.supplyInRead(() -> globalOffset);
    }
}
