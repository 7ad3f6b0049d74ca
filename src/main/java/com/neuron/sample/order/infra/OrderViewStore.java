package com.neuron.sample.order.infra;

import com.neuron.sample.order.domain.OrderStatus;
import com.neuron.infra.log.NeuronLog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 订单摘要投影存储 (SINGLETON)
 * <p>
 * 由通知处理器维护，查询端直接读取，不重放事件。
 * 版本号不大于已有版本的更新被忽略。
 *
 * @author qianye
 * @create 2026-10-15 11:25
 */
public class OrderViewStore {

    private final Map<String, OrderSummary> summaries = new ConcurrentHashMap<>();
    private final AtomicInteger updateCount = new AtomicInteger();

    public void insert(OrderSummary summary) {
        OrderSummary previous = summaries.putIfAbsent(summary.getOrderId(), summary);
        if (previous == null) {
            updateCount.incrementAndGet();
        } else {
            NeuronLog.eventLog.warn("订单摘要 [{}] 已存在，忽略重复创建", summary.getOrderId());
        }
    }

    public void changeStatus(String orderId, OrderStatus status, long version) {
        summaries.computeIfPresent(orderId, (id, current) -> {
            if (version <= current.getVersion()) {
                return current;
            }
            updateCount.incrementAndGet();
            return current.withStatus(status, version);
        });
    }

    public Optional<OrderSummary> find(String orderId) {
        return Optional.ofNullable(summaries.get(orderId));
    }

    public List<OrderSummary> findAll() {
        List<OrderSummary> all = new ArrayList<>(summaries.values());
        all.sort(Comparator.comparing(OrderSummary::getOrderId));
        return all;
    }

    /**
     * 投影被实际修改的次数
     */
    public int getUpdateCount() {
        return updateCount.get();
    }
}
