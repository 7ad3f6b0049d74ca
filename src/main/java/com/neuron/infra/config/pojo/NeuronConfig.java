package com.neuron.infra.config.pojo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;

/**
 * 框架核心配置类 (对应 neuron.yaml)
 *
 * @author qianye
 * @create 2026-10-13 16:22
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class NeuronConfig {
    /**
     * 容器配置
     */
    @JsonProperty("container")
    private LinkedHashMap<String, String> container = new LinkedHashMap<>();
    /**
     * 中介者配置
     */
    @JsonProperty("mediator")
    private LinkedHashMap<String, String> mediator = new LinkedHashMap<>();
}
