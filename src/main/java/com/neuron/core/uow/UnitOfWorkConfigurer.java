package com.neuron.core.uow;

import com.neuron.infra.framework.mediation.MediationConfigurer;
import com.neuron.infra.framework.mediation.Mediator;

/**
 * 工作单元装配
 *
 * @author qianye
 * @create 2026-10-14 14:00
 */
public final class UnitOfWorkConfigurer {

    private UnitOfWorkConfigurer() {
    }

    /**
     * 注册 SCOPED 的 {@link UnitOfWork}，并追加 {@link DomainEventDispatchingBehavior}
     */
    public static void install(MediationConfigurer mediation) {
        mediation.container().registerScoped(UnitOfWork.class,
                provider -> new DefaultUnitOfWork(provider.getRequiredService(Mediator.class)));
        mediation.addPipelineBehavior(provider -> new DomainEventDispatchingBehavior(provider.getRequiredService(UnitOfWork.class)));
    }
}
