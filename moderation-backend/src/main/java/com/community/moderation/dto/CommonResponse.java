package com.community.moderation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 统一 API 响应信封：{success, data?, error?, message?, degraded}
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommonResponse<T> implements Serializable {

    private boolean success;

    // 业务数据 (可以是任何DTO, List, 或 null)
    private T data;

    // 错误码，如 VALIDATION_ERROR、DUPLICATE_ACTIVE
    private String error;

    private String message;

    // true 表示降级结果（打分服务不可用、存储不可用），调用方据此区分真实数据和兜底数据
    private boolean degraded;

    // 响应时间戳 (ms)
    private Long timestamp;

    // --- 静态构造方法 ---

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(true, data, null, null, false, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(true, data, null, message, false, Instant.now().toEpochMilli());
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    /**
     * 降级但仍可用的成功响应（例如打分失败后回退为 review）
     */
    public static <T> CommonResponse<T> degraded(T data, String message) {
        return new CommonResponse<>(true, data, null, message, true, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> error(String error, String message) {
        return new CommonResponse<>(false, null, error, message, false, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> unavailable(String error, String message) {
        return new CommonResponse<>(false, null, error, message, true, Instant.now().toEpochMilli());
    }
}
