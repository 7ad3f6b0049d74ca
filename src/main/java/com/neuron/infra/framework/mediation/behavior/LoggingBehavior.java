package com.neuron.infra.framework.mediation.behavior;

import cn.hutool.core.date.TimeInterval;
import com.neuron.infra.framework.mediation.PipelineBehavior;
import com.neuron.infra.framework.mediation.Request;
import com.neuron.infra.framework.mediation.RequestHandlerDelegate;
import com.neuron.infra.log.NeuronLog;

/**
 * 请求日志管道行为
 * <p>
 * 记录每个请求的类型与耗时；处理失败时记录异常后原样抛出，不做转换。
 * 一般注册为第一个行为，位于管道最外层，耗时包含内层全部行为。
 * </p>
 *
 * @author qianye
 * @create 2026-10-13 11:20
 */
public class LoggingBehavior implements PipelineBehavior {

    @Override
    public <R> R handle(Request<R> request, RequestHandlerDelegate<R> next) {
        String requestName = request.getClass().getSimpleName();
        TimeInterval timer = new TimeInterval();
        NeuronLog.mediatorLog.debug(NeuronLog.getTemplate(2), requestName, "开始处理");
        try {
            R result = next.proceed();
            NeuronLog.mediatorLog.info(NeuronLog.getTemplate(3), requestName, "处理完成，耗时(ms):", timer.intervalMs());
            return result;
        } catch (RuntimeException e) {
            NeuronLog.mediatorLog.error("[{}] 处理失败，耗时(ms): {} | {}", requestName, timer.intervalMs(), e.getMessage(), e);
            throw e;
        }
    }
}
