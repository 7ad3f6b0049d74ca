package com.neuron.infra.framework.core;

import com.neuron.infra.exception.*;
import com.neuron.infra.framework.annotation.PostConstruct;
import com.neuron.infra.framework.annotation.PreDestroy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServiceContainer 单元测试
 * <p>
 * 不依赖任何配置文件，每个用例自己构造容器，互不影响。
 *
 * @author qianye
 * @create 2026-10-16 10:00
 */
@DisplayName("服务容器(ServiceContainer)测试")
class ServiceContainerTest {

    private ServiceContainer container;

    @BeforeEach
    void setUp() {
        container = new ServiceContainer();
    }

    @AfterEach
    void tearDown() {
        container.close();
    }

    // ========================================================================
    //                        1. 生命周期
    // ========================================================================

    @Test
    @DisplayName("单例：不同作用域解析得到同一个实例")
    void singletonIsSharedAcrossScopes() {
        container.registerSingleton(Clock.class, provider -> new Clock());

        Clock fromRoot = container.getRequiredService(Clock.class);
        try (ServiceScope first = container.createScope(); ServiceScope second = container.createScope()) {
            assertSame(fromRoot, first.getRequiredService(Clock.class));
            assertSame(fromRoot, second.getRequiredService(Clock.class));
        }
    }

    @Test
    @DisplayName("Scoped：同一作用域同一实例，不同作用域不同实例")
    void scopedIsCachedPerScope() {
        container.registerScoped(Session.class, provider -> new Session());

        try (ServiceScope first = container.createScope(); ServiceScope second = container.createScope()) {
            Session a = first.getRequiredService(Session.class);
            assertSame(a, first.getRequiredService(Session.class));
            assertNotSame(a, second.getRequiredService(Session.class));
        }
    }

    @Test
    @DisplayName("Transient：每次解析都是新实例，同一作用域内也一样")
    void transientIsAlwaysNew() {
        container.registerTransient(Session.class, provider -> new Session());

        try (ServiceScope scope = container.createScope()) {
            assertNotSame(scope.getRequiredService(Session.class), scope.getRequiredService(Session.class));
        }
        assertNotSame(container.getRequiredService(Session.class), container.getRequiredService(Session.class));
    }

    @Test
    @DisplayName("Scoped 服务直接从根容器解析必须失败")
    void scopedFromRootFails() {
        container.registerScoped(Session.class, provider -> new Session());

        ScopedServiceResolutionException e = assertThrows(ScopedServiceResolutionException.class,
                () -> container.getService(Session.class));
        assertTrue(e.getMessage().contains(Session.class.getName()));
    }

    @Test
    @DisplayName("单例工厂拿到的是根容器，无法捕获 Scoped 依赖")
    void singletonCannotCaptureScopedDependency() {
        container.registerScoped(Session.class, provider -> new Session());
        container.registerSingleton(Repository.class, provider -> new Repository(provider.getRequiredService(Session.class)));

        try (ServiceScope scope = container.createScope()) {
            ServiceResolutionException e = assertThrows(ServiceResolutionException.class,
                    () -> scope.getRequiredService(Repository.class));
            assertEquals(List.of(Repository.class, Session.class), e.getResolutionChain());
        }
    }

    @Test
    @DisplayName("Scoped 依赖在同一作用域的整张对象图中共享")
    void scopedDependencySharedAcrossGraph() {
        container.registerScoped(Session.class, provider -> new Session());
        container.registerTransient(Repository.class, provider -> new Repository(provider.getRequiredService(Session.class)));

        try (ServiceScope scope = container.createScope()) {
            Repository a = scope.getRequiredService(Repository.class);
            Repository b = scope.getRequiredService(Repository.class);
            assertNotSame(a, b);
            assertSame(a.session, b.session);
            assertSame(scope.getRequiredService(Session.class), a.session);
        }
    }

    @Test
    @DisplayName("并发首次访问单例只构造一次")
    void singletonConstructedOnceUnderContention() throws Exception {
        AtomicInteger constructions = new AtomicInteger();
        container.registerSingleton(Clock.class, provider -> {
            constructions.incrementAndGet();
            sleepQuietly(20);
            return new Clock();
        });

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Clock>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try (ServiceScope scope = container.createScope()) {
                    return scope.getRequiredService(Clock.class);
                }
            }));
        }
        start.countDown();
        Clock first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (Future<Clock> future : futures) {
            assertSame(first, future.get(5, TimeUnit.SECONDS));
        }
        executor.shutdownNow();
        assertEquals(1, constructions.get());
    }

    // ========================================================================
    //                        2. 注册
    // ========================================================================

    @Test
    @DisplayName("REPLACE 策略：最后注册的生效，getServices 按注册顺序返回全部")
    void replacePolicyLastWins() {
        container.registerTransient(Greeter.class, provider -> () -> "first");
        container.registerTransient(Greeter.class, provider -> () -> "second");

        assertEquals("second", container.getRequiredService(Greeter.class).greet());
        List<String> all = new ArrayList<>();
        container.getServices(Greeter.class).forEach(g -> all.add(g.greet()));
        assertEquals(List.of("first", "second"), all);
    }

    @Test
    @DisplayName("REJECT 策略：重复注册抛出 DuplicateRegistrationException，addService 不受限制")
    void rejectPolicyThrowsOnDuplicate() {
        try (ServiceContainer strict = new ServiceContainer(RegistrationPolicy.REJECT)) {
            strict.registerTransient(Greeter.class, provider -> () -> "first");
            assertThrows(DuplicateRegistrationException.class,
                    () -> strict.registerTransient(Greeter.class, provider -> () -> "second"));
            assertEquals("first", strict.getRequiredService(Greeter.class).greet());

            strict.addService(Greeter.class, ServiceLifetime.TRANSIENT, provider -> () -> "extra");
            assertEquals(2, strict.getServices(Greeter.class).size());
        }
    }

    @Test
    @DisplayName("tryRegister：已注册时忽略")
    void tryRegisterKeepsExisting() {
        assertTrue(container.tryRegisterSingleton(Greeter.class, provider -> () -> "first"));
        assertFalse(container.tryRegisterSingleton(Greeter.class, provider -> () -> "second"));
        assertEquals("first", container.getRequiredService(Greeter.class).greet());
        assertTrue(container.isRegistered(Greeter.class));
    }

    @Test
    @DisplayName("未注册：getService 返回 null，getRequiredService 抛出并带类型名")
    void unregisteredService() {
        assertNull(container.getService(Clock.class));
        assertTrue(container.getServices(Clock.class).isEmpty());
        ServiceNotRegisteredException e = assertThrows(ServiceNotRegisteredException.class,
                () -> container.getRequiredService(Clock.class));
        assertEquals(Clock.class, e.getServiceKey());
        assertTrue(e.getMessage().contains(Clock.class.getName()));
    }

    @Test
    @DisplayName("容器自身与 ServiceProvider 可以被解析")
    void containerResolvesItself() {
        assertSame(container, container.getRequiredService(ServiceContainer.class));
        assertSame(container, container.getRequiredService(ServiceProvider.class));
    }

    // ========================================================================
    //                        3. 失败诊断
    // ========================================================================

    @Test
    @DisplayName("工厂异常被包装一次，保留原始异常与完整解析链路")
    void factoryFailureWrappedWithChain() {
        IllegalStateException boom = new IllegalStateException("connection refused");
        container.registerScoped(Session.class, provider -> {
            throw boom;
        });
        container.registerTransient(Repository.class, provider -> new Repository(provider.getRequiredService(Session.class)));

        try (ServiceScope scope = container.createScope()) {
            ServiceResolutionException e = assertThrows(ServiceResolutionException.class,
                    () -> scope.getRequiredService(Repository.class));
            assertSame(boom, e.getCause());
            assertEquals(List.of(Repository.class, Session.class), e.getResolutionChain());
            assertTrue(e.getMessage().contains("Repository -> Session"));
        }
    }

    @Test
    @DisplayName("深层依赖未注册：异常携带从外到内的链路")
    void missingNestedDependencyReportsChain() {
        container.registerTransient(Repository.class, provider -> new Repository(provider.getRequiredService(Session.class)));

        try (ServiceScope scope = container.createScope()) {
            ServiceNotRegisteredException e = assertThrows(ServiceNotRegisteredException.class,
                    () -> scope.getRequiredService(Repository.class));
            assertEquals(List.of(Repository.class, Session.class), e.getResolutionChain());
        }
    }

    @Test
    @DisplayName("循环依赖被识别")
    void circularDependencyDetected() {
        container.registerSingleton(Ping.class, provider -> new Ping(provider.getRequiredService(Pong.class)));
        container.registerSingleton(Pong.class, provider -> new Pong(provider.getRequiredService(Ping.class)));

        CircularDependencyException e = assertThrows(CircularDependencyException.class,
                () -> container.getRequiredService(Ping.class));
        assertEquals(List.of(Ping.class, Pong.class), e.getResolutionChain());
        // 失败后链路被清理，后续解析不受影响
        container.registerSingleton(Clock.class, provider -> new Clock());
        assertNotNull(container.getRequiredService(Clock.class));
    }

    @Test
    @DisplayName("工厂返回 null 视为解析失败")
    void nullFactoryResultFails() {
        container.registerTransient(Clock.class, provider -> null);
        assertThrows(ServiceResolutionException.class, () -> container.getRequiredService(Clock.class));
    }

    // ========================================================================
    //                        4. 初始化与释放
    // ========================================================================

    @Test
    @DisplayName("@PostConstruct 在构造后执行一次")
    void postConstructInvoked() {
        container.registerSingleton(Clock.class, provider -> new Clock());
        Clock clock = container.getRequiredService(Clock.class);
        container.getRequiredService(Clock.class);
        assertEquals(1, clock.started);
    }

    @Test
    @DisplayName("关闭容器：单例按构造逆序释放，幂等，关闭后无法解析")
    void closeReleasesSingletonsInReverseOrder() {
        List<String> released = new ArrayList<>();
        container.registerSingleton(FirstResource.class, provider -> new FirstResource(released));
        container.registerSingleton(SecondResource.class, provider -> new SecondResource(released));
        container.getRequiredService(FirstResource.class);
        container.getRequiredService(SecondResource.class);

        container.close();
        container.close();

        assertEquals(List.of("second", "first"), released);
        assertTrue(container.isClosed());
        assertThrows(ScopeDisposedException.class, () -> container.getRequiredService(FirstResource.class));
        assertThrows(ScopeDisposedException.class, () -> container.createScope());
    }

    @Test
    @DisplayName("registerInstance 注册的外部实例不会被容器释放")
    void registeredInstanceNotReleased() {
        List<String> released = new ArrayList<>();
        FirstResource external = new FirstResource(released);
        container.registerInstance(FirstResource.class, external);

        assertSame(external, container.getRequiredService(FirstResource.class));
        container.close();
        assertTrue(released.isEmpty());
    }

    @Test
    @DisplayName("根容器解析的 Transient 实例归调用方所有，容器关闭时不释放；作用域内的随作用域释放")
    void rootTransientsAreNotTracked() {
        List<String> released = new ArrayList<>();
        container.registerTransient(FirstResource.class, provider -> new FirstResource(released));
        for (int i = 0; i < 3; i++) {
            container.getRequiredService(FirstResource.class);
        }
        try (ServiceScope scope = container.createScope()) {
            scope.getRequiredService(FirstResource.class);
        }
        assertEquals(List.of("first"), released);

        container.close();
        assertEquals(List.of("first"), released);
    }

    // ========================================================================
    //                        测试夹具
    // ========================================================================

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    interface Greeter {
        String greet();
    }

    static class Clock {
        int started;

        @PostConstruct
        void start() {
            started++;
        }
    }

    static class Session {
    }

    static class Repository {
        final Session session;

        Repository(Session session) {
            this.session = session;
        }
    }

    static class Ping {
        Ping(Pong pong) {
        }
    }

    static class Pong {
        Pong(Ping ping) {
        }
    }

    static class FirstResource implements AutoCloseable {
        private final List<String> released;

        FirstResource(List<String> released) {
            this.released = released;
        }

        @Override
        public void close() {
            released.add("first");
        }
    }

    static class SecondResource {
        private final List<String> released;

        SecondResource(List<String> released) {
            this.released = released;
        }

        @PreDestroy
        void shutdown() {
            released.add("second");
        }
    }
}
