package com.tiklog.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>배차(dispatch) 엔진과 배달 생명주기에서 공유하는 에러 코드 정의.
 * 각 에러 코드는 HTTP 상태 코드와 기본 에러 메시지를 포함.</p>
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류</li>
 *   <li><b>Infrastructure</b>: 브로커/저장소 장애, Resilience4j 트래픽 제어</li>
 *   <li><b>Delivery</b>: 배송 생성/수정, 고객 지갑 잔액</li>
 *   <li><b>Dispatch</b>: 라이더 탐색, 매칭 레코드, 배달 상태 전이</li>
 * </ul>
 *
 * <h3>NotFound 전달 방식</h3>
 * <p>동기 호출(라이더 탐색 API)에서는 GlobalExceptionHandler가 404 ProblemDetail로 변환한다.
 * 버스 consumer나 WebSocket 이벤트처럼 비동기 경로에서는 예외를 던지지 않고
 * 로그 + 실패 카운터로만 남긴다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),

    // ── Infrastructure ──
    // 메시지 브로커(Redis) 연결 불가 - 재시도 없이 기동 실패로 처리
    BROKER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Message broker is unreachable"),
    BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent requests. Please try again later"),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),

    // ── Delivery (배송 생성 / 수정) ──
    DELIVERY_NOT_FOUND(HttpStatus.NOT_FOUND, "Delivery does not exist"),
    DELIVERY_NOT_EDITABLE(HttpStatus.BAD_REQUEST, "Delivery can not be edited"),
    WALLET_NOT_FOUND(HttpStatus.NOT_FOUND, "Add funds to wallet before initiating a delivery"),
    INSUFFICIENT_BALANCE(HttpStatus.BAD_REQUEST, "Wallet is low on cash, please fund wallet."),

    // ── Dispatch (라이더 탐색 / 매칭) ──
    NO_AVAILABLE_RIDER(HttpStatus.NOT_FOUND, "No riders available at the moment"),
    NO_ONLINE_RIDER(HttpStatus.NOT_FOUND, "No rider is currently online"),
    // 매칭 레코드가 TTL 만료 또는 거절로 이미 삭제된 경우
    MATCH_NOT_FOUND(HttpStatus.NOT_FOUND, "No pending match for this delivery"),
    INVALID_DELIVERY_STATUS(HttpStatus.CONFLICT, "Invalid delivery status transition"),
    SETTLEMENT_IN_PROGRESS(HttpStatus.CONFLICT, "Settlement already in progress for this delivery");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 기본 에러 메시지
}
