package com.neuron.infra.framework.mediation;

import com.neuron.infra.exception.AmbiguousHandlerException;
import com.neuron.infra.exception.HandlerNotFoundException;
import com.neuron.infra.exception.PublishCancelledException;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.core.ServiceProvider;
import com.neuron.infra.framework.core.ServiceScope;
import com.neuron.infra.log.NeuronLog;
import com.neuron.infra.thread.EventDispatchPool;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 【核心实现】中介者
 * <p>
 * <h3>execute：</h3>
 * 查出唯一的请求处理器 → 从当前作用域解析 → 由管道行为链包裹后调用。
 * <h3>publish：</h3>
 * 查出全部通知处理器 → 每个处理器新建一个子作用域 → 在子作用域里解析并执行 → 立即释放子作用域。
 * 子作用域来自根容器而不是当前作用域，所以通知处理器依赖的 Scoped 服务（仓储、工作单元）
 * 都是全新的实例，不会解析到已经释放的请求作用域上，处理器之间的副作用也互不泄漏。
 * </p>
 *
 * <h3>取消语义（协作式）：</h3>
 * 顺序广播在每个处理器开始前检查中断标记，已经开始的处理器会执行完毕；
 * 并行广播在等待期间被中断时，尚未开始的处理器被取消。两种情况都保留中断标记并抛出
 * {@link PublishCancelledException}。
 *
 * @author qianye
 * @create 2026-10-13 10:30
 */
public class DefaultMediator implements Mediator {

    private final ServiceProvider provider;
    private final ServiceContainer container;
    private final HandlerRegistry registry;
    private final MediatorOptions options;

    /**
     * @param provider  当前作用域（请求处理器与管道行为从这里解析）
     * @param container 根容器（通知处理器的子作用域从这里创建）
     * @param registry  处理器注册表
     * @param options   运行参数
     */
    public DefaultMediator(ServiceProvider provider, ServiceContainer container, HandlerRegistry registry, MediatorOptions options) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.container = Objects.requireNonNull(container, "container");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R execute(Request<R> request) {
        Objects.requireNonNull(request, "request");
        Class<?> requestType = request.getClass();
        List<Class<?>> handlerTypes = registry.getRequestHandlers(requestType);
        if (handlerTypes.isEmpty()) {
            throw new HandlerNotFoundException(requestType);
        }
        if (handlerTypes.size() > 1) {
            throw new AmbiguousHandlerException(requestType, handlerTypes);
        }

        RequestHandler<Request<R>, R> handler = (RequestHandler<Request<R>, R>) provider.getRequiredService(handlerTypes.get(0));

        // 从内向外组装管道：最后注册的行为紧贴处理器，最先注册的行为在最外层
        RequestHandlerDelegate<R> next = () -> handler.handle(request);
        List<PipelineBehavior> behaviors = provider.getServices(PipelineBehavior.class);
        for (int i = behaviors.size() - 1; i >= 0; i--) {
            PipelineBehavior behavior = behaviors.get(i);
            if (!behavior.supports(request)) {
                continue;
            }
            RequestHandlerDelegate<R> inner = next;
            next = () -> behavior.handle(request, inner);
        }
        NeuronLog.mediatorLog.debug("分发请求 {} -> {}", requestType.getSimpleName(), handlerTypes.get(0).getSimpleName());
        return next.proceed();
    }

    @Override
    public void publish(Notification notification) {
        Objects.requireNonNull(notification, "notification");
        Class<?> notificationType = notification.getClass();
        List<Class<?>> handlerTypes = registry.getNotificationHandlers(notificationType);
        if (handlerTypes.isEmpty()) {
            NeuronLog.eventLog.debug("通知 {} 没有处理器，跳过", notificationType.getSimpleName());
            return;
        }
        if (options.getPublishMode() == PublishMode.PARALLEL) {
            publishParallel(notification, handlerTypes);
        } else {
            publishSequential(notification, handlerTypes);
        }
    }

    @Override
    public FailurePolicy getFailurePolicy() {
        return options.getFailurePolicy();
    }

    private void publishSequential(Notification notification, List<Class<?>> handlerTypes) {
        Class<?> notificationType = notification.getClass();
        List<HandlerFailure> failures = new ArrayList<>();
        for (Class<?> handlerType : handlerTypes) {
            if (Thread.currentThread().isInterrupted()) {
                PublishCancelledException cancelled = new PublishCancelledException(
                        "通知 " + notificationType.getSimpleName() + " 广播被中断，剩余处理器未执行");
                failures.forEach(f -> cancelled.addSuppressed(f.getCause()));
                throw cancelled;
            }
            try {
                invokeIsolated(handlerType, notification);
            } catch (RuntimeException e) {
                HandlerFailure failure = new HandlerFailure(handlerType, notificationType, e);
                NeuronLog.eventLog.error("通知处理器 {} 处理 {} 失败", handlerType.getSimpleName(), notificationType.getSimpleName(), e);
                if (options.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                    throw new NotificationDispatchException(notificationType.getSimpleName(), List.of(failure));
                }
                failures.add(failure);
            }
        }
        if (!failures.isEmpty()) {
            throw new NotificationDispatchException(notificationType.getSimpleName(), failures);
        }
    }

    private void publishParallel(Notification notification, List<Class<?>> handlerTypes) {
        Class<?> notificationType = notification.getClass();
        EventDispatchPool pool = container.getRequiredService(EventDispatchPool.class);
        if (pool.isDispatchThread()) {
            // 处理器内部再次广播：在池线程上等待池内任务可能把池占满，改为当前线程顺序执行
            NeuronLog.eventLog.debug("通知 {} 在广播线程内发布，改为顺序执行", notificationType.getSimpleName());
            publishSequential(notification, handlerTypes);
            return;
        }
        List<Future<Void>> futures = new ArrayList<>(handlerTypes.size());
        for (Class<?> handlerType : handlerTypes) {
            futures.add(pool.submit(() -> {
                invokeIsolated(handlerType, notification);
                return null;
            }));
        }

        List<HandlerFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Class<?> handlerType = handlerTypes.get(i);
            try {
                futures.get(i).get(options.getAwaitTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                NeuronLog.eventLog.error("通知处理器 {} 处理 {} 失败", handlerType.getSimpleName(), notificationType.getSimpleName(), e.getCause());
                failures.add(new HandlerFailure(handlerType, notificationType, e.getCause()));
            } catch (TimeoutException e) {
                NeuronLog.eventLog.error("通知处理器 {} 处理 {} 超时", handlerType.getSimpleName(), notificationType.getSimpleName());
                futures.get(i).cancel(true);
                failures.add(new HandlerFailure(handlerType, notificationType, e));
            } catch (InterruptedException e) {
                // 未开始的处理器取消，已开始的让其执行完毕
                futures.forEach(f -> f.cancel(false));
                Thread.currentThread().interrupt();
                PublishCancelledException cancelled = new PublishCancelledException(
                        "通知 " + notificationType.getSimpleName() + " 并行广播等待被中断", e);
                failures.forEach(f -> cancelled.addSuppressed(f.getCause()));
                throw cancelled;
            }
        }
        if (failures.isEmpty()) {
            return;
        }
        if (options.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
            throw new NotificationDispatchException(notificationType.getSimpleName(), List.of(failures.get(0)));
        }
        throw new NotificationDispatchException(notificationType.getSimpleName(), failures);
    }

    /**
     * 在独立的子作用域中执行一个通知处理器，执行完毕（无论成功失败）立即释放子作用域
     */
    @SuppressWarnings("unchecked")
    private void invokeIsolated(Class<?> handlerType, Notification notification) {
        try (ServiceScope scope = container.createScope()) {
            NotificationHandler<Notification> handler = (NotificationHandler<Notification>) scope.getRequiredService(handlerType);
            handler.handle(notification);
        }
    }
}
