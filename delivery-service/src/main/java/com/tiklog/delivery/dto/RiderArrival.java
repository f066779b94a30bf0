package com.tiklog.delivery.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** 라이더 도착 이벤트. {@code riderArrived}는 그대로 고객에게 전달된다. */
public record RiderArrival(String customerId, String riderId, JsonNode riderArrived) {
}
