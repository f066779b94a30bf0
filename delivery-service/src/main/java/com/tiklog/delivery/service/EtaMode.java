package com.tiklog.delivery.service;

/**
 * 도착 예정 시간 계산 방식.
 */
public enum EtaMode {
    /** 반경 내 모든 후보의 이동 시간을 합산 (기존 동작 유지) */
    ALL_CANDIDATES,
    /** 선택된 라이더의 이동 시간만 사용 */
    SELECTED_RIDER
}
