package com.neuron.core.uow;

import com.neuron.infra.framework.mediation.Command;
import com.neuron.infra.framework.mediation.PipelineBehavior;
import com.neuron.infra.framework.mediation.Request;
import com.neuron.infra.framework.mediation.RequestHandlerDelegate;
import com.neuron.infra.log.NeuronLog;

import java.util.Objects;

/**
 * 领域事件分发管道行为
 * <p>
 * 只作用于命令：处理器正常返回后提交工作单元；处理器抛出异常时不提交，
 * 聚合上的未提交事件保持原样，异常原样抛给调用方。
 * </p>
 *
 * @author qianye
 * @create 2026-10-14 13:40
 */
public class DomainEventDispatchingBehavior implements PipelineBehavior {

    private final UnitOfWork unitOfWork;

    public DomainEventDispatchingBehavior(UnitOfWork unitOfWork) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
    }

    @Override
    public boolean supports(Request<?> request) {
        return request instanceof Command;
    }

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        R result = next.proceed();
        if (unitOfWork.hasChanges()) {
            NeuronLog.eventLog.debug(NeuronLog.getTemplate(2), request.getClass().getSimpleName(), "处理成功，提交工作单元");
            unitOfWork.commit();
        } else {
            unitOfWork.clear();
        }
        return result;
    }
}
