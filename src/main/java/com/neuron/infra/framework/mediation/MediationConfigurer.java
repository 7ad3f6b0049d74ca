package com.neuron.infra.framework.mediation;

import com.neuron.infra.config.NeuronYaml;
import com.neuron.infra.framework.core.ServiceContainer;
import com.neuron.infra.framework.core.ServiceFactory;
import com.neuron.infra.framework.core.ServiceLifetime;
import com.neuron.infra.log.NeuronLog;
import com.neuron.infra.thread.EventDispatchPool;

import java.util.Objects;

/**
 * 中介者装配器
 * <p>
 * 启动代码通过它一次性完成：
 * <ol>
 * <li>把 {@link HandlerRegistry}、{@link MediatorOptions} 作为外部实例注册进容器；</li>
 * <li>注册 {@link EventDispatchPool} 单例（并行广播时才会被构造）；</li>
 * <li>把 {@link Mediator} 注册为 SCOPED，每个作用域拿到绑定自己的中介者；</li>
 * <li>登记处理器：同时写入注册表和容器（处理器以自身 Class 注册为 TRANSIENT）。</li>
 * </ol>
 *
 * @author qianye
 * @create 2026-10-13 11:00
 */
public class MediationConfigurer {

    private final ServiceContainer container;
    private final HandlerRegistry registry;

    private MediationConfigurer(ServiceContainer container, HandlerRegistry registry) {
        this.container = container;
        this.registry = registry;
    }

    /**
     * 使用 neuron.yaml 中的中介者参数装配
     */
    public static MediationConfigurer install(ServiceContainer container, NeuronYaml yaml) {
        return install(container, MediatorOptions.fromYaml(yaml), yaml.getPoolSize(), yaml.getQueueCapacity());
    }

    /**
     * 使用默认线程池参数装配
     */
    public static MediationConfigurer install(ServiceContainer container, MediatorOptions options) {
        return install(container, options, 4, 256);
    }

    public static MediationConfigurer install(ServiceContainer container, MediatorOptions options, int poolSize, int queueCapacity) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(options, "options");
        HandlerRegistry registry = new HandlerRegistry();
        container.registerInstance(HandlerRegistry.class, registry);
        container.registerInstance(MediatorOptions.class, options);
        container.registerSingleton(EventDispatchPool.class, provider -> new EventDispatchPool(poolSize, queueCapacity));
        container.registerScoped(Mediator.class, provider -> new DefaultMediator(
                provider,
                provider.getRequiredService(ServiceContainer.class),
                provider.getRequiredService(HandlerRegistry.class),
                provider.getRequiredService(MediatorOptions.class)));
        NeuronLog.mediatorLog.info("中介者装配完成 | 广播模式:{} | 失败策略:{}", options.getPublishMode(), options.getFailurePolicy());
        return new MediationConfigurer(container, registry);
    }

    /**
     * 登记请求处理器
     *
     * @param requestType 请求类型
     * @param handlerType 处理器类型（同时作为服务类型）
     * @param factory     处理器工厂，拿到的解析器是当前作用域
     */
    public <Q extends Request<R>, R, H extends RequestHandler<Q, R>> MediationConfigurer addRequestHandler(
            Class<Q> requestType, Class<H> handlerType, ServiceFactory<? extends H> factory) {
        container.registerTransient(handlerType, factory);
        registry.registerHandler(requestType, handlerType);
        return this;
    }

    /**
     * 登记通知处理器，执行顺序即登记顺序
     */
    public <N extends Notification, H extends NotificationHandler<N>> MediationConfigurer addNotificationHandler(
            Class<N> notificationType, Class<H> handlerType, ServiceFactory<? extends H> factory) {
        if (!container.isRegistered(handlerType)) {
            container.registerTransient(handlerType, factory);
        }
        registry.registerHandler(notificationType, handlerType);
        return this;
    }

    /**
     * 追加管道行为，先追加的在外层
     */
    public MediationConfigurer addPipelineBehavior(ServiceFactory<? extends PipelineBehavior> factory) {
        container.addService(PipelineBehavior.class, ServiceLifetime.SCOPED, factory);
        return this;
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public ServiceContainer container() {
        return container;
    }

    /**
     * 启动期校验处理器注册表
     */
    public void validate() {
        registry.validate();
    }
}
