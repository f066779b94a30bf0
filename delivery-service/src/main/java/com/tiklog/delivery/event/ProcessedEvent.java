package com.tiklog.delivery.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 처리 완료 이벤트(ProcessedEvent) 엔티티 - 라이더 응답 중복 처리 방지 테이블.
 *
 * <p>driver_responses exchange는 모든 인스턴스에 fanout 되므로 같은 응답이 여러 번 도착한다.
 * 응답의 eventId를 기록해 두고, 알림 기록 저장과 배달 상태 변경은 최초 1회만 수행한다.</p>
 *
 * <pre>
 * 1. 응답 수신 → processedEventRepository.existsById(eventId) 확인
 * 2-A. 이미 존재 → 고객 알림만 전달, 영속화 스킵
 * 2-B. 존재하지 않음 → 알림 기록 저장 + 상태 변경 → save(new ProcessedEvent(eventId))
 * </pre>
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEvent {

    @Id
    @Column(nullable = false)
    private String eventId;

    @Column(nullable = false)
    private LocalDateTime processedAt;

    public ProcessedEvent(String eventId) {
        this.eventId = eventId;
        this.processedAt = LocalDateTime.now();
    }
}
