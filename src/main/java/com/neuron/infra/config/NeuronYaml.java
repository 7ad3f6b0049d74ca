package com.neuron.infra.config;

import cn.hutool.core.convert.Convert;
import com.neuron.infra.config.pojo.NeuronConfig;
import com.neuron.infra.exception.NeuronException;
import com.neuron.infra.framework.core.RegistrationPolicy;

import java.util.Locale;

/**
 * 框架核心 Yaml 配置
 * <p>
 * 所有配置项都有默认值，neuron.yaml 不存在时框架照常运行。
 *
 * @author qianye
 * @create 2026-10-13 16:19
 */
public class NeuronYaml {

    public static final String SOURCE_NAME = "neuron";

    private volatile NeuronConfig config;
    private final Environment environment;

    public NeuronYaml(Environment environment) {
        this.environment = environment;
        rebind();
    }

    /**
     * 从 classpath 的 neuron.yaml 构建
     */
    public static NeuronYaml fromClasspath() {
        Environment environment = new Environment();
        environment.loadClasspath(SOURCE_NAME + ".yaml");
        return new NeuronYaml(environment);
    }

    /**
     * 重新从 Environment 绑定
     */
    public void rebind() {
        NeuronConfig bound = environment.bind(SOURCE_NAME, NeuronConfig.class);
        this.config = bound == null ? new NeuronConfig() : bound;
    }

    public Environment getEnvironment() {
        return environment;
    }

    /**
     * 获取 重复注册策略，默认 REPLACE
     */
    public RegistrationPolicy getRegistrationPolicy() {
        String value = config.getContainer().getOrDefault("registration_policy", RegistrationPolicy.REPLACE.name());
        try {
            return RegistrationPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new NeuronException("非法的 container.registration_policy: " + value, e);
        }
    }

    /**
     * 获取 事件广播模式 (SEQUENTIAL / PARALLEL)，默认 SEQUENTIAL
     */
    public String getPublishMode() {
        return config.getMediator().getOrDefault("publish_mode", "SEQUENTIAL");
    }

    /**
     * 获取 通知处理器失败策略 (CONTINUE / FAIL_FAST)，默认 CONTINUE
     */
    public String getFailurePolicy() {
        return config.getMediator().getOrDefault("failure_policy", "CONTINUE");
    }

    /**
     * 获取 并行广播线程池大小，默认 4
     */
    public int getPoolSize() {
        return Convert.toInt(config.getMediator().get("pool_size"), 4);
    }

    /**
     * 获取 并行广播线程池队列容量，默认 256
     */
    public int getQueueCapacity() {
        return Convert.toInt(config.getMediator().get("queue_capacity"), 256);
    }

    /**
     * 获取 并行广播等待处理器完成的超时秒数，默认 30
     */
    public int getAwaitTimeoutSeconds() {
        return Convert.toInt(config.getMediator().get("await_timeout_seconds"), 30);
    }
}
