package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.framework.mediation.Command;

import java.util.List;

/**
 * 创建订单，成功返回新订单 ID
 *
 * @author qianye
 * @create 2026-10-15 13:05
 */
public record CreateOrderCommand(String customerId, List<OrderLine> lines) implements Command<OperationResult<String>> {

    public CreateOrderCommand {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public CreateOrderCommand(String customerId) {
        this(customerId, List.of());
    }
}
