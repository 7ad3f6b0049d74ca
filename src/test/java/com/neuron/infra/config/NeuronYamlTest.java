package com.neuron.infra.config;

import cn.hutool.core.io.FileUtil;
import com.neuron.infra.exception.NeuronException;
import com.neuron.infra.framework.core.RegistrationPolicy;
import com.neuron.infra.framework.mediation.FailurePolicy;
import com.neuron.infra.framework.mediation.MediatorOptions;
import com.neuron.infra.framework.mediation.PublishMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NeuronYaml 测试
 *
 * @author qianye
 * @create 2026-10-17 09:40
 */
@DisplayName("框架配置(NeuronYaml)测试")
class NeuronYamlTest {

    private static NeuronYaml load(Path dir, String content) {
        FileUtil.writeUtf8String(content, dir.resolve("neuron.yaml").toFile());
        Environment environment = new Environment();
        environment.scanAndLoad(dir.toString());
        return new NeuronYaml(environment);
    }

    @Test
    @DisplayName("没有配置文件时使用默认值")
    void defaults() {
        NeuronYaml yaml = new NeuronYaml(new Environment());

        assertEquals(RegistrationPolicy.REPLACE, yaml.getRegistrationPolicy());
        assertEquals("SEQUENTIAL", yaml.getPublishMode());
        assertEquals("CONTINUE", yaml.getFailurePolicy());
        assertEquals(4, yaml.getPoolSize());
        assertEquals(256, yaml.getQueueCapacity());
        assertEquals(30, yaml.getAwaitTimeoutSeconds());

        MediatorOptions options = MediatorOptions.fromYaml(yaml);
        assertEquals(PublishMode.SEQUENTIAL, options.getPublishMode());
        assertEquals(FailurePolicy.CONTINUE, options.getFailurePolicy());
    }

    @Test
    @DisplayName("classpath 上的 neuron.yaml 与默认值一致")
    void fromClasspath() {
        NeuronYaml yaml = NeuronYaml.fromClasspath();
        assertTrue(yaml.getEnvironment().containsSource(NeuronYaml.SOURCE_NAME));
        assertEquals(RegistrationPolicy.REPLACE, yaml.getRegistrationPolicy());
        assertEquals(4, yaml.getPoolSize());
    }

    @Test
    @DisplayName("配置值大小写不敏感")
    void overrides(@TempDir Path dir) {
        NeuronYaml yaml = load(dir, """
                container:
                  registration_policy: reject
                mediator:
                  publish_mode: parallel
                  failure_policy: fail_fast
                  pool_size: 2
                  await_timeout_seconds: 5
                """);

        assertEquals(RegistrationPolicy.REJECT, yaml.getRegistrationPolicy());
        assertEquals(2, yaml.getPoolSize());

        MediatorOptions options = MediatorOptions.fromYaml(yaml);
        assertEquals(PublishMode.PARALLEL, options.getPublishMode());
        assertEquals(FailurePolicy.FAIL_FAST, options.getFailurePolicy());
        assertEquals(5, options.getAwaitTimeoutSeconds());
    }

    @Test
    @DisplayName("非法枚举值抛出 NeuronException")
    void invalidValues(@TempDir Path dir) {
        NeuronYaml yaml = load(dir, """
                container:
                  registration_policy: merge
                mediator:
                  publish_mode: broadcast
                """);

        assertThrows(NeuronException.class, yaml::getRegistrationPolicy);
        assertThrows(NeuronException.class, () -> MediatorOptions.fromYaml(yaml));
    }

    @Test
    @DisplayName("非数字的线程池参数回退到默认值")
    void nonNumericFallsBack(@TempDir Path dir) {
        NeuronYaml yaml = load(dir, """
                mediator:
                  pool_size: many
                """);
        assertEquals(4, yaml.getPoolSize());
    }
}
