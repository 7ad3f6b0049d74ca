package com.neuron.infra.thread;

import cn.hutool.core.thread.ExecutorBuilder;
import cn.hutool.core.thread.ThreadFactoryBuilder;
import com.neuron.infra.framework.annotation.PreDestroy;
import com.neuron.infra.log.NeuronLog;

import java.util.concurrent.*;

/**
 * 事件广播线程池【并行广播专用】
 * <p>
 * 只有 mediator.publish_mode=PARALLEL 时才会被真正使用：每个通知处理器在各自的作用域里、
 * 各自的线程上执行。顺序广播模式下本线程池保持空闲（线程按需创建，不会预启动）。
 * </p>
 *
 * <h3>参数说明：</h3>
 * <ul>
 * <li><b>有界队列</b>：防止事件风暴时任务无限堆积耗尽内存。</li>
 * <li><b>拒绝策略 CallerRuns</b>：队列满时由发布线程自己执行处理器，变相减慢发布速度（反压）。</li>
 * <li><b>守护线程</b>：JVM 退出时不会被广播任务卡住。</li>
 * </ul>
 *
 * @author qianye
 * @create 2026-10-13 14:30
 */
public class EventDispatchPool {

    private final ExecutorService executor;
    private final int poolSize;
    /** 标记当前线程是否正在执行本池提交的任务 */
    private final ThreadLocal<Boolean> dispatching = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public EventDispatchPool(int poolSize, int queueCapacity) {
        this.poolSize = Math.max(1, poolSize);
        this.executor = ExecutorBuilder.create()
                .setCorePoolSize(this.poolSize)
                .setMaxPoolSize(this.poolSize)
                .setKeepAliveTime(60, TimeUnit.SECONDS)
                .setWorkQueue(new LinkedBlockingQueue<>(Math.max(1, queueCapacity)))
                .setHandler((r, pool) -> {
                    NeuronLog.eventLog.warn(NeuronLog.getTemplate(2), "EventDispatchPool",
                            "线程池已满，降级为由发布线程直接执行处理器");
                    if (!pool.isShutdown()) {
                        r.run();
                    }
                })
                .setThreadFactory(new ThreadFactoryBuilder().setNamePrefix("evt-").setDaemon(true).build())
                .build();
        NeuronLog.eventLog.info("EventDispatchPool 初始化完成 | 线程数:{} | 队列:{}", this.poolSize, queueCapacity);
    }

    /**
     * 提交有返回值的任务
     */
    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(() -> {
            Boolean previous = dispatching.get();
            dispatching.set(Boolean.TRUE);
            try {
                return task.call();
            } finally {
                if (previous) {
                    dispatching.set(previous);
                } else {
                    dispatching.remove();
                }
            }
        });
    }

    /**
     * 当前线程是否正在执行本池的任务（含队列满时由发布线程代为执行的任务）
     */
    public boolean isDispatchThread() {
        return dispatching.get();
    }

    public int getPoolSize() {
        return poolSize;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * 优雅停机
     * <p>
     * 1. shutdown(): 停止接收新任务，等待已提交的处理器执行完毕。
     * 2. awaitTermination(): 给 5 秒缓冲时间。
     * 3. shutdownNow(): 超时则中断仍在执行的处理器。
     */
    @PreDestroy
    public void shutdown() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    NeuronLog.sysLog.error("EventDispatchPool 线程池未能彻底关闭");
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        NeuronLog.eventLog.info("EventDispatchPool 资源释放完毕");
    }
}
