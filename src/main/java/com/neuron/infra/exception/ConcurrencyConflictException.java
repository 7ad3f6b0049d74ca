package com.neuron.infra.exception;

import cn.hutool.core.util.StrUtil;

/**
 * 乐观并发冲突
 * <p>
 * 事件流的当前版本已经超过写入方读取时的版本，说明有其他写入方插入。
 * 调用方应重新加载聚合后重试，不能直接覆盖。
 *
 * @author qianye
 * @create 2026-10-14 10:00
 */
public class ConcurrencyConflictException extends NeuronException {

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
        super(StrUtil.format("事件流 [{}] 并发冲突：期望版本 {}，实际版本 {}", streamId, expectedVersion, actualVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
