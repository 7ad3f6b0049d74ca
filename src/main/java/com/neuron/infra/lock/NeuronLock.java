package com.neuron.infra.lock;

import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 【核心并发组件】通用锁 (NeuronLock)
 * <p>
 * 统一框架内部的锁使用方式，屏蔽 ReentrantLock / ReentrantReadWriteLock 的 API 差异，
 * 所有加解锁动作都封装在 try-finally 中，调用方只需提供业务逻辑。
 * </p>
 *
 * <h3>锁类型与适用场景</h3>
 * <ul>
 * <li><b>REENTRANT</b> (互斥)：单例缓存的首次构造。必须可重入，因为单例工厂可能递归解析其他单例。</li>
 * <li><b>READ_WRITE</b> (读写)：事件存储这类读多写少的共享结构。</li>
 * </ul>
 *
 * @author qianye
 * @create 2026-10-12 10:43
 */
public abstract class NeuronLock {

    /**
     * 创建【互斥锁】(非公平)
     */
    public static NeuronLock ofReentrant() {
        return new ReentrantImpl();
    }

    /**
     * 创建【读写锁】(非公平)
     */
    public static NeuronLock ofReadWrite() {
        return new ReadWriteImpl();
    }

    /**
     * 执行写操作（独占/互斥）- 无返回值
     *
     * @param runnable 业务逻辑
     */
    public void runInWrite(Runnable runnable) {
        supplyInWrite(() -> {
            runnable.run();
            return null;
        });
    }

    /**
     * 执行写操作（独占/互斥）- 带返回值
     *
     * @param supplier 业务逻辑
     * @param <T>      返回值类型
     * @return 业务结果
     */
    public abstract <T> T supplyInWrite(Supplier<T> supplier);

    /**
     * 执行读操作 - 带返回值
     * <ul>
     * <li>对于互斥锁：自动降级为互斥执行（串行）。</li>
     * <li>对于读写锁：并行执行（共享）。</li>
     * </ul>
     */
    public abstract <T> T supplyInRead(Supplier<T> supplier);

    /**
     * 当前线程是否持有写锁（用于诊断与断言）
     */
    public abstract boolean isHeldByCurrentThread();

    private static class ReentrantImpl extends NeuronLock {
        private final ReentrantLock lock = new ReentrantLock();

        @Override
        public <T> T supplyInWrite(Supplier<T> supplier) {
            lock.lock();
            try {
                return supplier.get();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public <T> T supplyInRead(Supplier<T> supplier) {
            // ReentrantLock 不区分读写，读操作也必须互斥
            return supplyInWrite(supplier);
        }

        @Override
        public boolean isHeldByCurrentThread() {
            return lock.isHeldByCurrentThread();
        }
    }

    private static class ReadWriteImpl extends NeuronLock {
        private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

        @Override
        public <T> T supplyInWrite(Supplier<T> supplier) {
            rwLock.writeLock().lock();
            try {
                return supplier.get();
            } finally {
                rwLock.writeLock().unlock();
            }
        }

        @Override
        public <T> T supplyInRead(Supplier<T> supplier) {
            rwLock.readLock().lock();
            try {
                return supplier.get();
            } finally {
                rwLock.readLock().unlock();
            }
        }

        @Override
        public boolean isHeldByCurrentThread() {
            return rwLock.isWriteLockedByCurrentThread();
        }
    }
}
