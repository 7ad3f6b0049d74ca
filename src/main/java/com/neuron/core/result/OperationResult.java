package com.neuron.core.result;

import lombok.Getter;

/**
 * 命令/查询的统一返回结果
 * <p>
 * 状态码沿用 HTTP 语义，方便上层接口直接转换成响应。
 *
 * @param <T> 数据类型
 * @author qianye
 * @create 2026-10-14 11:00
 */
@Getter
public final class OperationResult<T> {

    private final int status;
    private final String title;
    private final String detail;
    private final T data;

    private OperationResult(int status, String title, String detail, T data) {
        this.status = status;
        this.title = title;
        this.detail = detail;
        this.data = data;
    }

    public static <T> OperationResult<T> ok(T data) {
        return new OperationResult<>(200, "OK", null, data);
    }

    public static <T> OperationResult<T> created(T data) {
        return new OperationResult<>(201, "Created", null, data);
    }

    public static <T> OperationResult<T> badRequest(String detail) {
        return new OperationResult<>(400, "Bad Request", detail, null);
    }

    public static <T> OperationResult<T> notFound(String detail) {
        return new OperationResult<>(404, "Not Found", detail, null);
    }

    public static <T> OperationResult<T> conflict(String detail) {
        return new OperationResult<>(409, "Conflict", detail, null);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    @Override
    public String toString() {
        return "OperationResult{" + status + " " + title + (detail == null ? "" : ", detail=" + detail)
                + (data == null ? "" : ", data=" + data) + "}";
    }
}
