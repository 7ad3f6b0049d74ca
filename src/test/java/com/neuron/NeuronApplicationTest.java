package com.neuron;

import cn.hutool.core.io.FileUtil;
import com.neuron.core.result.OperationResult;
import com.neuron.core.uow.UnitOfWork;
import com.neuron.infra.config.Environment;
import com.neuron.infra.config.NeuronYaml;
import com.neuron.infra.framework.core.RegistrationPolicy;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.core.ServiceScope;
import com.neuron.infra.framework.mediation.Mediator;
import com.neuron.infra.framework.mediation.PipelineBehavior;
import com.neuron.infra.thread.EventDispatchPool;
import com.neuron.sample.order.application.command.CreateOrderCommand;
import com.neuron.sample.order.infra.AuditJournal;
import com.neuron.sample.order.infra.OrderViewStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 启动装配测试
 *
 * @author qianye
 * @create 2026-10-17 11:00
 */
@DisplayName("启动装配(NeuronApplication)测试")
class NeuronApplicationTest {

    @Test
    @DisplayName("默认配置装配：每个作用域一个中介者和工作单元，两个管道行为")
    void bootstrapDefaults() {
        try (ServiceContainer container = NeuronApplication.bootstrap(new NeuronYaml(new Environment()))) {
            assertEquals(RegistrationPolicy.REPLACE, container.getRegistrationPolicy());
            try (ServiceScope first = container.createScope(); ServiceScope second = container.createScope()) {
                assertSame(first.getRequiredService(Mediator.class), first.getRequiredService(Mediator.class));
                assertNotSame(first.getRequiredService(Mediator.class), second.getRequiredService(Mediator.class));
                assertNotSame(first.getRequiredService(UnitOfWork.class), second.getRequiredService(UnitOfWork.class));
                assertEquals(2, first.getServices(PipelineBehavior.class).size());
            }
        }
    }

    @Test
    @DisplayName("REJECT + PARALLEL 配置下同样可以装配并处理命令")
    void bootstrapRejectParallel(@TempDir Path dir) {
        FileUtil.writeUtf8String("""
                container:
                  registration_policy: REJECT
                mediator:
                  publish_mode: PARALLEL
                  pool_size: 2
                """, dir.resolve("neuron.yaml").toFile());
        Environment environment = new Environment();
        environment.scanAndLoad(dir.toString());

        EventDispatchPool pool;
        try (ServiceContainer container = NeuronApplication.bootstrap(new NeuronYaml(environment))) {
            assertEquals(RegistrationPolicy.REJECT, container.getRegistrationPolicy());
            pool = container.getRequiredService(EventDispatchPool.class);
            assertEquals(2, pool.getPoolSize());

            OperationResult<String> created;
            try (ServiceScope scope = container.createScope()) {
                created = scope.getRequiredService(Mediator.class).execute(new CreateOrderCommand("c-1"));
            }
            assertEquals(201, created.getStatus());
            assertEquals(List.of("order-created:" + created.getData()),
                    container.getRequiredService(AuditJournal.class).getEntries());
            assertTrue(container.getRequiredService(OrderViewStore.class).find(created.getData()).isPresent());
        }
        assertTrue(pool.isShutdown());
    }

    @Test
    @DisplayName("演示入口完整运行")
    void mainRuns() {
        assertDoesNotThrow(() -> NeuronApplication.main(new String[0]));
    }
}
