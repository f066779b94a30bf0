package com.tiklog.delivery.entity;

/** 라이더 접속 상태 */
public enum RiderStatus {
    ONLINE,
    OFFLINE
}
