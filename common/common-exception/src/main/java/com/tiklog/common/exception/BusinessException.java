package com.tiklog.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>도메인 규칙 위반 시 발생하는 unchecked 예외.
 * ErrorCode와 결합하여 HTTP 상태 코드와 에러 메시지를 함께 전달한다.</p>
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.NO_ONLINE_RIDER);
 *   throw new BusinessException(ErrorCode.INVALID_DELIVERY_STATUS, "PENDING -> DELIVERED");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    /**
     * ErrorCode의 기본 메시지 대신 상세 메시지를 전달할 때 사용.
     */
    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** 404 계열(미발견) 에러인지 여부 - 비동기 경로에서 로그 레벨 결정에 사용 */
    public boolean isNotFound() {
        return errorCode.getStatus().value() == 404;
    }
}
