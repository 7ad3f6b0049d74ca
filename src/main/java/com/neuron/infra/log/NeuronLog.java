package com.neuron.infra.log;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 框架日志类
 * debug  指出细粒度信息事件对调试应用程序是非常有帮助的 主要用于开发过程中打印一些运行信息
 * info   消息在粗粒度级别上突出强调应用程序的运行过程
 * warn   表明会出现潜在错误的情形 有些信息不是错误信息 但是也要给程序员的一些提示
 * error  指出虽然发生错误事件 但仍然不影响系统的继续运行
 *
 * @author qianye
 * @create 2026-10-12 9:13
 */
public class NeuronLog {

    /**
     * 系统日志
     * 一般用于记录框架运行过程中产生的系统错误、启动关闭等生命周期信息
     */
    public static final Logger sysLog = LogManager.getLogger("SysLog");
    /**
     * 容器日志
     * 一般用于记录服务注册、解析、作用域创建与释放相关的日志信息
     */
    public static final Logger containerLog = LogManager.getLogger("ContainerLog");
    /**
     * 中介者日志
     * 一般用于记录命令/查询的分发、管道行为的执行耗时与异常
     */
    public static final Logger mediatorLog = LogManager.getLogger("MediatorLog");
    /**
     * 事件日志
     * 一般用于记录工作单元提交、领域事件广播、通知处理器执行结果
     */
    public static final Logger eventLog = LogManager.getLogger("EventLog");
    /**
     * 事件存储日志
     * 一般用于记录事件流的追加、读取以及并发冲突
     */
    public static final Logger storeLog = LogManager.getLogger("StoreLog");

    /**
     * 获取日志格式模板
     * <p>
     * 格式示例：
     * 1参: "[{}]"
     * 2参: "[{}] {}"
     * 3参: "[{}] {} {}"
     * </p>
     *
     * @param count 总参数数量
     * @return 模板字符串
     */
    public static String getTemplate(int count) {
        if (count < 0) {
            return "{}";
        }
        if (count < CACHE_SIZE) {
            return TEMPLATES[count];
        }
        return generateTemplate(count);
    }

    private static final int CACHE_SIZE = 8;
    private static final String[] TEMPLATES = new String[CACHE_SIZE];

    static {
        for (int i = 0; i < CACHE_SIZE; i++) {
            TEMPLATES[i] = generateTemplate(i);
        }
    }

    /**
     * 生成通用模板
     * 注意：传入0 时返回 {}
     * 逻辑：第一个参数用 [] 包裹，后面的用空格分隔
     */
    private static String generateTemplate(int count) {
        if (count <= 0) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i == 0) {
                sb.append("[{}]");
            } else {
                sb.append(" {}");
            }
        }
        return sb.toString();
    }
}
