package com.neuron.sample.order.infra;

import cn.hutool.core.util.StrUtil;
import com.neuron.infra.log.NeuronLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 审计缓冲 (SCOPED)
 * <p>
 * 在一个作用域内累积审计记录，作用域释放时一次性刷入 {@link AuditJournal}。
 * 释放之后再写入会抛出 {@link IllegalStateException}，依赖它的处理器必须拿到属于自己作用域的实例。
 *
 * @author qianye
 * @create 2026-10-15 11:15
 */
public class AuditTrail implements AutoCloseable {

    private final AuditJournal journal;
    private final List<String> pending = new ArrayList<>();
    private boolean closed = false;

    public AuditTrail(AuditJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    public void record(String action, String subject) {
        if (closed) {
            throw new IllegalStateException(StrUtil.format("审计缓冲已释放，无法记录 {} {}", action, subject));
        }
        pending.add(action + ":" + subject);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!pending.isEmpty()) {
            journal.append(pending);
            NeuronLog.eventLog.debug("审计缓冲刷入 {} 条记录", pending.size());
            pending.clear();
        }
    }
}
