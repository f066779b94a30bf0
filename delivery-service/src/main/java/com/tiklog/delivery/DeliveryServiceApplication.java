package com.tiklog.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 배달 서비스(Delivery Service) - 실시간 배차 + 배달 생명주기 엔진.
 *
 * <p>고객의 배송 요청을 주변 라이더에게 실시간으로 매칭하고, 배달 완료 시 정산까지 수행한다.</p>
 *
 * <h3>구성 요소</h3>
 * <ul>
 *   <li>Connection Registry - 참여자 ID ↔ WebSocket 연결</li>
 *   <li>Match Cache - 배달별 매칭 레코드 (Redis, TTL)</li>
 *   <li>Message Bus - Redis Pub/Sub fanout exchange</li>
 *   <li>Rider Discovery - Redis GEO 반경 검색</li>
 *   <li>Dispatch / Response Relay / Lifecycle - 배차, 응답 중계, 시작/종료 + 정산</li>
 * </ul>
 *
 * <h3>scanBasePackages 구성</h3>
 * <ul>
 *   <li>{@code com.tiklog.delivery} - 배달 서비스 자체 패키지</li>
 *   <li>{@code com.tiklog.common.exception} - 공통 예외 처리 (GlobalExceptionHandler)</li>
 * </ul>
 */
@SpringBootApplication(scanBasePackages = {
        "com.tiklog.delivery",
        "com.tiklog.common.exception"
})
@ConfigurationPropertiesScan
public class DeliveryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliveryServiceApplication.class, args);
    }
}
