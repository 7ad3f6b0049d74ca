package com.neuron.infra.framework.mediation;

import cn.hutool.core.util.StrUtil;
import com.neuron.infra.exception.NeuronException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 通知处理器执行失败（汇总）
 * <p>
 * 第一个失败原因作为 cause，其余作为 suppressed，完整列表通过 {@link #getFailures()} 获取。
 *
 * @author qianye
 * @create 2026-10-13 09:30
 */
public class NotificationDispatchException extends NeuronException {

    private final transient List<HandlerFailure> failures;

    public NotificationDispatchException(String subject, List<HandlerFailure> failures) {
        super(StrUtil.format("[{}] {} 个通知处理器执行失败: {}", subject, failures.size(),
                failures.stream().map(HandlerFailure::toString).collect(Collectors.joining("; "))),
                failures.isEmpty() ? null : failures.get(0).getCause());
        this.failures = List.copyOf(failures);
        for (int i = 1; i < failures.size(); i++) {
            Throwable cause = failures.get(i).getCause();
            if (cause != null) {
                addSuppressed(cause);
            }
        }
    }

    public List<HandlerFailure> getFailures() {
        return failures;
    }
}
