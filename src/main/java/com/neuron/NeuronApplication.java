package com.neuron;

import cn.hutool.core.util.StrUtil;
import com.neuron.core.result.OperationResult;
import com.neuron.core.uow.UnitOfWorkConfigurer;
import com.neuron.infra.config.NeuronYaml;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.core.ServiceScope;
import com.neuron.infra.framework.mediation.MediationConfigurer;
import com.neuron.infra.framework.mediation.Mediator;
import com.neuron.infra.framework.mediation.behavior.LoggingBehavior;
import com.neuron.infra.log.NeuronLog;
import com.neuron.sample.order.OrderingModule;
import com.neuron.sample.order.application.command.AddOrderItemCommand;
import com.neuron.sample.order.application.command.ConfirmOrderCommand;
import com.neuron.sample.order.application.command.CreateOrderCommand;
import com.neuron.sample.order.application.command.OrderLine;
import com.neuron.sample.order.application.query.GetOrderByIdQuery;
import com.neuron.sample.order.application.query.ListOrdersQuery;
import com.neuron.sample.order.application.query.OrderView;

import java.math.BigDecimal;
import java.util.List;

/**
 * 启动类
 * <p>
 * 启动代码只做三件事：读取 neuron.yaml → 显式构造并装配容器 → 每个工作单元开一个作用域。
 * 容器不是全局单例，由这里构造并向下传递。
 *
 * @author qianye
 * @create 2026-10-16 09:00
 */
public class NeuronApplication {

    /**
     * 版本号
     */
    private static final String VERSION = "v1.0.0";

    /**
     * 按配置构造并装配容器
     *
     * @param yaml 框架配置
     * @return 装配完成的根容器
     */
    public static ServiceContainer bootstrap(NeuronYaml yaml) {
        ServiceContainer container = new ServiceContainer(yaml.getRegistrationPolicy());
        container.registerInstance(NeuronYaml.class, yaml);
        MediationConfigurer mediation = MediationConfigurer.install(container, yaml);
        mediation.addPipelineBehavior(provider -> new LoggingBehavior());
        UnitOfWorkConfigurer.install(mediation);
        OrderingModule.configure(mediation);
        mediation.validate();
        return container;
    }

    /**
     * 程序启动入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        NeuronLog.sysLog.info("neuron {} 启动", VERSION);
        try (ServiceContainer container = bootstrap(NeuronYaml.fromClasspath())) {
            String orderId;
            // 一次请求一个作用域
            try (ServiceScope scope = container.createScope()) {
                Mediator mediator = scope.getRequiredService(Mediator.class);
                OperationResult<String> created = mediator.execute(new CreateOrderCommand("customer-001",
                        List.of(new OrderLine("sku-001", 2, new BigDecimal("19.90")))));
                orderId = created.getData();
                NeuronLog.sysLog.info("创建订单: {}", created);
            }
            try (ServiceScope scope = container.createScope()) {
                Mediator mediator = scope.getRequiredService(Mediator.class);
                NeuronLog.sysLog.info("添加商品: {}", mediator.execute(new AddOrderItemCommand(orderId, "sku-002", 1, new BigDecimal("5.00"))));
                NeuronLog.sysLog.info("确认订单: {}", mediator.execute(new ConfirmOrderCommand(orderId)));
            }
            try (ServiceScope scope = container.createScope()) {
                Mediator mediator = scope.getRequiredService(Mediator.class);
                OperationResult<OrderView> view = mediator.execute(new GetOrderByIdQuery(orderId));
                NeuronLog.sysLog.info(StrUtil.format("订单详情: {}", view.getData()));
                NeuronLog.sysLog.info("订单摘要: {}", mediator.execute(new ListOrdersQuery()).getData());
            }
        }
        NeuronLog.sysLog.info("neuron {} 已停止", VERSION);
    }
}
