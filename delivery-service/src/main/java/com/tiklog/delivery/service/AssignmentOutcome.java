package com.tiklog.delivery.service;

/**
 * 배차 시도 결과.
 */
public enum AssignmentOutcome {
    /** 매칭된 라이더에게 알림 + assigned_package_requests 발행 (같은 제출의 재수신 포함) */
    ASSIGNED("assigned"),
    /** 라이더 소켓이 이 인스턴스에 없음 - 소켓을 가진 인스턴스의 구독자가 배정한다 */
    FORWARDED("forwarded"),
    /** 매칭 레코드 없음 (탐색 전이거나 만료/거절로 제거됨) */
    NO_CANDIDATE("no_candidate"),
    /** 이전의 다른 제출이 이미 배차함 */
    ALREADY_CLAIMED("duplicate");

    private final String metricTag;

    AssignmentOutcome(String metricTag) {
        this.metricTag = metricTag;
    }

    public String metricTag() {
        return metricTag;
    }
}
