package com.neuron.sample.order.infra;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 审计日志 (SINGLETON)
 * <p>
 * 只接收 {@link AuditTrail} 在作用域释放时刷入的记录。
 *
 * @author qianye
 * @create 2026-10-15 11:10
 */
public class AuditJournal {

    private final List<String> entries = new CopyOnWriteArrayList<>();

    void append(List<String> batch) {
        entries.addAll(batch);
    }

    public List<String> getEntries() {
        return new ArrayList<>(entries);
    }
}
