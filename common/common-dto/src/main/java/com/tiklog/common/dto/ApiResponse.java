package com.tiklog.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>배차 API가 동일한 응답 형식을 사용하도록 강제하는 공통 DTO.
 * success/data/message 3개 필드로 고객 앱과 라이더 앱이 일관되게 파싱한다.</p>
 *
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(result);
 *
 *   // 성공 + 안내 메시지: {"success": true, "data": {...}, "message": "Rider will arrive in 5min"}
 *   return ApiResponse.ok(result, "Rider will arrive in 5min");
 * </pre>
 *
 * @param <T> 응답 데이터의 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
