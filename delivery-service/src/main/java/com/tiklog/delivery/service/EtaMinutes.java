package com.tiklog.delivery.service;

/**
 * 이동 시간(h)을 분으로 바꾸는 방식.
 *
 * <pre>
 * HOUR_REMAINDER : round((h - floor(h)) × 60)   1.5h → 30분 (시간 단위는 버림, 기존 동작)
 * TOTAL          : round(h × 60)                1.5h → 90분
 * </pre>
 */
public enum EtaMinutes {
    HOUR_REMAINDER {
        @Override
        public int toMinutes(double hours) {
            return (int) Math.round((hours - Math.floor(hours)) * 60);
        }
    },
    TOTAL {
        @Override
        public int toMinutes(double hours) {
            return (int) Math.round(hours * 60);
        }
    };

    public abstract int toMinutes(double hours);
}
