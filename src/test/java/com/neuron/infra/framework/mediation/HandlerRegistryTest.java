package com.neuron.infra.framework.mediation;

import com.neuron.infra.exception.AmbiguousHandlerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandlerRegistry 测试
 *
 * @author qianye
 * @create 2026-10-16 11:00
 */
@DisplayName("处理器注册表(HandlerRegistry)测试")
class HandlerRegistryTest {

    private final HandlerRegistry registry = new HandlerRegistry();

    @Test
    @DisplayName("请求与通知分表登记，通知处理器保持登记顺序")
    void registersByMessageKind() {
        registry.registerHandler(Echo.class, EchoHandler.class);
        registry.registerHandler(Tick.class, SecondTickHandler.class);
        registry.registerHandler(Tick.class, FirstTickHandler.class);

        assertEquals(List.of(EchoHandler.class), registry.getRequestHandlers(Echo.class));
        assertEquals(List.of(SecondTickHandler.class, FirstTickHandler.class), registry.getNotificationHandlers(Tick.class));
        assertTrue(registry.getRequestHandlers(Tick.class).isEmpty());
        assertTrue(registry.getNotificationHandlers(Echo.class).isEmpty());
    }

    @Test
    @DisplayName("同一对 (消息, 处理器) 重复登记被忽略")
    void duplicatePairIgnored() {
        registry.registerHandler(Tick.class, FirstTickHandler.class);
        registry.registerHandler(Tick.class, FirstTickHandler.class);

        assertEquals(1, registry.getNotificationHandlers(Tick.class).size());
    }

    @Test
    @DisplayName("处理器与消息种类不匹配时拒绝登记")
    void mismatchedHandlerRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.registerHandler(Echo.class, FirstTickHandler.class));
        assertThrows(IllegalArgumentException.class, () -> registry.registerHandler(Tick.class, EchoHandler.class));
        assertThrows(IllegalArgumentException.class, () -> registry.registerHandler(String.class, EchoHandler.class));
    }

    @Test
    @DisplayName("validate：请求类型存在多个处理器时报错")
    void validateDetectsAmbiguity() {
        registry.registerHandler(Echo.class, EchoHandler.class);
        registry.validate();

        registry.registerHandler(Echo.class, LoudEchoHandler.class);
        AmbiguousHandlerException e = assertThrows(AmbiguousHandlerException.class, registry::validate);
        assertTrue(e.getMessage().contains(Echo.class.getName()) || e.getMessage().contains(Echo.class.getSimpleName()));
    }

    @Test
    @DisplayName("返回的列表是快照，修改注册表不影响已取出的列表")
    void lookupsAreSnapshots() {
        registry.registerHandler(Tick.class, FirstTickHandler.class);
        List<Class<?>> before = registry.getNotificationHandlers(Tick.class);
        registry.registerHandler(Tick.class, SecondTickHandler.class);

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(EchoHandler.class));
    }

    record Echo(String text) implements Query<String> {
    }

    record Tick(int sequence) implements Notification {
    }

    static class EchoHandler implements RequestHandler<Echo, String> {
        @Override
        public String handle(Echo request) {
            return request.text();
        }
    }

    static class LoudEchoHandler implements RequestHandler<Echo, String> {
        @Override
        public String handle(Echo request) {
            return request.text().toUpperCase();
        }
    }

    static class FirstTickHandler implements NotificationHandler<Tick> {
        @Override
        public void handle(Tick notification) {
        }
    }

    static class SecondTickHandler implements NotificationHandler<Tick> {
        @Override
        public void handle(Tick notification) {
        }
    }
}
