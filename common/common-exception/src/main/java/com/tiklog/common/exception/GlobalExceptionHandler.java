package com.tiklog.common.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>HTTP로 들어온 동기 호출의 예외를 RFC 7807 ProblemDetail 형식으로 통일한다.
 * 라이더 탐색 실패(NotFound)는 여기서 404로 변환된다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 도메인 규칙 위반 (라이더 없음, 잘못된 상태 전이 등)</li>
 *   <li><b>MethodArgumentNotValidException</b>: 요청 본문 검증 실패 (400)</li>
 *   <li><b>BulkheadFullException</b>: 라이더 매칭 동시 실행 한도 초과</li>
 *   <li><b>RequestNotPermitted</b>: API Rate Limiter 초과 (429)</li>
 * </ol>
 *
 * <pre>
 *   {
 *     "type": "https://tiklog.com/errors/no_online_rider",
 *     "status": 404,
 *     "detail": "No rider is currently online"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://tiklog.com/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (e.isNotFound()) {
            log.info("Not found: code={}, detail={}", errorCode, e.getMessage());
        } else {
            log.warn("Business rule violated: code={}, detail={}", errorCode, e.getMessage());
        }
        return problem(errorCode.getStatus(), e.getMessage(), errorCode);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse(ErrorCode.INVALID_INPUT.getMessage());
        return problem(HttpStatus.BAD_REQUEST, detail, ErrorCode.INVALID_INPUT);
    }

    // 라이더 매칭 @Bulkhead 슬롯이 모두 사용 중
    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ProblemDetail> handleBulkheadFull(BulkheadFullException e) {
        log.warn("Bulkhead full: {}", e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorCode.BULKHEAD_FULL.getMessage(), ErrorCode.BULKHEAD_FULL);
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS,
                ErrorCode.RATE_LIMIT_EXCEEDED.getMessage(), ErrorCode.RATE_LIMIT_EXCEEDED);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String detail, ErrorCode errorCode) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        // type URI: 에러 코드명을 소문자로 변환하여 에러 문서 URI 생성
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(status).body(problem);
    }
}
