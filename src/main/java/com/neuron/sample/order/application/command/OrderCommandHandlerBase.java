package com.neuron.sample.order.application.command;

import com.neuron.core.result.OperationResult;
import com.neuron.infra.exception.AggregateNotFoundException;
import com.neuron.infra.exception.BusinessRuleException;
import com.neuron.infra.exception.ConcurrencyConflictException;
import com.neuron.infra.log.NeuronLog;
import com.neuron.sample.order.domain.Order;
import com.neuron.sample.order.infra.OrderRepository;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 订单命令处理器基类
 * <p>
 * 把可预期的业务失败转换为 {@link OperationResult}：
 * 业务规则 → 400，聚合不存在 → 404，并发冲突 → 409。其他异常（包括框架的不变量校验失败）原样抛出。
 *
 * @author qianye
 * @create 2026-10-15 13:20
 */
public abstract class OrderCommandHandlerBase {

    protected final OrderRepository repository;

    protected OrderCommandHandlerBase(OrderRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /**
     * 加载订单 → 执行变更 → 保存，返回新版本
     */
    protected OperationResult<Long> modify(String orderId, Consumer<Order> change) {
        return guard(() -> {
            Order order = repository.getById(orderId);
            change.accept(order);
            repository.save(order);
            return OperationResult.ok(order.getVersion());
        });
    }

    protected <T> OperationResult<T> guard(Supplier<OperationResult<T>> action) {
        try {
            return action.get();
        } catch (AggregateNotFoundException e) {
            return OperationResult.notFound(e.getMessage());
        } catch (ConcurrencyConflictException e) {
            NeuronLog.mediatorLog.warn(NeuronLog.getTemplate(2), getClass().getSimpleName(), e.getMessage());
            return OperationResult.conflict(e.getMessage());
        } catch (BusinessRuleException e) {
            return OperationResult.badRequest(e.getMessage());
        }
    }
}
