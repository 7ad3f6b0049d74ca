package com.neuron.sample.order.application.command;

import java.math.BigDecimal;

/**
 * 下单时携带的订单行
 *
 * @author qianye
 * @create 2026-10-15 13:00
 */
public record OrderLine(String productId, int quantity, BigDecimal unitPrice) {
}
