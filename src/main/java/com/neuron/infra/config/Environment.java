package com.neuron.infra.config;

import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.SecureUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.neuron.infra.exception.NeuronException;
import com.neuron.infra.lock.NeuronLock;
import com.neuron.infra.log.NeuronLog;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 【核心组件】环境配置管理器
 * <p>
 * 职责：
 * 1. 从 classpath 或配置目录加载 .yaml / .yml 文件。
 * 2. 建立 "扁平化视图" (Properties)：key.subkey[0]=value，供按键读取单个配置项。
 * 3. 建立 "结构化视图" (SourceMap)：供 bind 方法将配置绑定为 Java 对象。
 *
 * @author qianye
 * @create 2026-10-13 15:08
 */
public class Environment {
    /**
     * 扁平化属性池
     * 示例：mediator.publish_mode=SEQUENTIAL, container.registration_policy=REPLACE
     */
    private final Properties properties = new Properties();

    /**
     * 结构化数据池
     * Key: 数据源名称 (文件名不含后缀，如 "neuron")
     * Value: 解析后的 Map 数据
     */
    private final Map<String, Map<String, Object>> sourceMap = new ConcurrentHashMap<>();

    /**
     * 文件指纹缓存: FileName -> MD5
     */
    private final Map<String, String> fileFingerprints = new ConcurrentHashMap<>();

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private final NeuronLock lock = NeuronLock.ofReentrant();

    /**
     * 从 classpath 加载一个 YAML 资源
     *
     * @param resource 资源路径，如 "neuron.yaml"
     * @return true=找到并加载; false=资源不存在
     */
    public boolean loadClasspath(String resource) {
        return lock.supplyInWrite(() -> {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null) {
                loader = Environment.class.getClassLoader();
            }
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    NeuronLog.sysLog.debug("classpath 中未找到配置 [{}]，使用默认值", resource);
                    return false;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> map = mapper.readValue(in, Map.class);
                register(sourceNameOf(resource), map);
                NeuronLog.sysLog.info("已加载 classpath 配置: {}", resource);
                return true;
            } catch (IOException e) {
                throw new NeuronException("配置解析失败: " + resource, e);
            }
        });
    }

    /**
     * 扫描并加载指定目录 (增量)
     *
     * @param configDir 配置文件目录
     * @return 本次扫描中【发生变更】的数据源名称集合
     */
    public Set<String> scanAndLoad(String configDir) {
        return lock.supplyInWrite(() -> {
            Set<String> changedSources = new HashSet<>();
            File dir = new File(configDir);
            if (!dir.exists() || !dir.isDirectory()) {
                return changedSources;
            }
            File[] files = dir.listFiles((d, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
            if (files == null) {
                return changedSources;
            }
            Arrays.sort(files, Comparator.comparing(File::getName));
            for (File file : files) {
                String fileName = file.getName();
                String currentMd5 = SecureUtil.md5(file);
                // 指纹一致，跳过解析
                if (currentMd5.equals(fileFingerprints.get(fileName))) {
                    continue;
                }
                try {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> map = mapper.readValue(file, Map.class);
                    register(sourceNameOf(fileName), map);
                } catch (IOException e) {
                    throw new NeuronException("配置解析失败: " + file.getAbsolutePath(), e);
                }
                fileFingerprints.put(fileName, currentMd5);
                changedSources.add(sourceNameOf(fileName));
                NeuronLog.sysLog.info("已加载配置文件: {}", file.getName());
            }
            return changedSources;
        });
    }

    /**
     * 【数据绑定】将指定源的配置转换为 Java Bean
     *
     * @param sourceName 数据源名称 (如 "neuron")
     * @param targetType 目标类型
     * @return 绑定结果，数据源不存在时返回 null
     */
    public <T> T bind(String sourceName, Class<T> targetType) {
        Map<String, Object> rawData = sourceMap.get(sourceName);
        if (rawData == null) {
            return null;
        }
        return mapper.convertValue(rawData, targetType);
    }

    public boolean containsSource(String sourceName) {
        return sourceMap.containsKey(sourceName);
    }

    public boolean containsProperty(String key) {
        return properties.containsKey(key);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private void register(String sourceName, Map<String, Object> map) {
        Map<String, Object> data = map == null ? new LinkedHashMap<>() : map;
        sourceMap.put(sourceName, data);
        buildFlattenedMap("", data);
    }

    private static String sourceNameOf(String fileName) {
        String name = fileName.contains("/") ? fileName.substring(fileName.lastIndexOf('/') + 1) : fileName;
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    // ================== 私有递归逻辑 (用于扁平化 YAML) ==================

    private void buildFlattenedMap(String prefix, Map<String, Object> map) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = entry.getKey();
            String fullKey = prefix.isEmpty() ? key : StrUtil.format("{}.{}", prefix, key);
            processValue(fullKey, entry.getValue());
        }
    }

    @SuppressWarnings("unchecked")
    private void processValue(String currentKey, Object value) {
        if (value instanceof Map) {
            buildFlattenedMap(currentKey, (Map<String, Object>) value);
        } else if (value instanceof Collection) {
            int index = 0;
            for (Object item : (Collection<Object>) value) {
                processValue(StrUtil.format("{}[{}]", currentKey, index), item);
                index++;
            }
        } else if (value != null) {
            properties.put(currentKey, value.toString());
        }
    }
}
