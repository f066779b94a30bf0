package com.tiklog.delivery.bus;

/** fanout exchange 이름 (Redis Pub/Sub 채널명과 동일) */
public final class Exchanges {

    /** 고객의 배송 요청. 만료 TTL이 붙는다. */
    public static final String PACKAGE_REQUEST = "package_request";

    /** 라이더의 수락/거절 응답 */
    public static final String DRIVER_RESPONSES = "driver_responses";

    /** 라이더에게 배정된 배송 요청 (관찰용) */
    public static final String ASSIGNED_PACKAGE_REQUESTS = "assigned_package_requests";

    private Exchanges() {
    }
}
