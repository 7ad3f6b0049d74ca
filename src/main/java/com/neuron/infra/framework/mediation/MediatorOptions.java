package com.neuron.infra.framework.mediation;

import com.neuron.infra.config.NeuronYaml;
import com.neuron.infra.exception.NeuronException;

import java.util.Locale;
import java.util.Objects;

/**
 * 中介者运行参数
 *
 * @author qianye
 * @create 2026-10-13 09:40
 */
public final class MediatorOptions {
    private final PublishMode publishMode;
    private final FailurePolicy failurePolicy;
    private final int awaitTimeoutSeconds;

    public MediatorOptions(PublishMode publishMode, FailurePolicy failurePolicy, int awaitTimeoutSeconds) {
        this.publishMode = Objects.requireNonNull(publishMode, "publishMode");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.awaitTimeoutSeconds = awaitTimeoutSeconds <= 0 ? 30 : awaitTimeoutSeconds;
    }

    /**
     * 默认参数：顺序广播 + 继续执行后汇总报告
     */
    public static MediatorOptions defaults() {
        return new MediatorOptions(PublishMode.SEQUENTIAL, FailurePolicy.CONTINUE, 30);
    }

    public static MediatorOptions fromYaml(NeuronYaml yaml) {
        return new MediatorOptions(
                parse(PublishMode.class, yaml.getPublishMode(), "mediator.publish_mode"),
                parse(FailurePolicy.class, yaml.getFailurePolicy(), "mediator.failure_policy"),
                yaml.getAwaitTimeoutSeconds());
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new NeuronException("非法的配置 " + key + ": " + value, e);
        }
    }

    public PublishMode getPublishMode() {
        return publishMode;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public int getAwaitTimeoutSeconds() {
        return awaitTimeoutSeconds;
    }

    public MediatorOptions withPublishMode(PublishMode mode) {
        return new MediatorOptions(mode, failurePolicy, awaitTimeoutSeconds);
    }

    public MediatorOptions withFailurePolicy(FailurePolicy policy) {
        return new MediatorOptions(publishMode, policy, awaitTimeoutSeconds);
    }
}
