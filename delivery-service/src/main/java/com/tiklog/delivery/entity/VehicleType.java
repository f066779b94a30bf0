package com.tiklog.delivery.entity;

/** 차량 종류 - 도착 예정 시간 계산의 주행 속도를 결정한다 */
public enum VehicleType {
    BIKE,
    CAR,
    BUS,
    OTHER
}
