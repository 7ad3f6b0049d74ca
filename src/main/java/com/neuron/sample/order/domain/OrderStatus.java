package com.neuron.sample.order.domain;

/**
 * 订单状态
 *
 * @author qianye
 * @create 2026-10-15 09:20
 */
public enum OrderStatus {
    /**
     * 草稿，可以增删商品
     */
    DRAFT,
    /**
     * 已确认
     */
    CONFIRMED,
    /**
     * 已取消
     */
    CANCELLED
}
