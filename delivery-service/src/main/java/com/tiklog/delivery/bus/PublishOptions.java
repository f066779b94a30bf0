package com.tiklog.delivery.bus;

import java.time.Duration;

/**
 * 발행 옵션.
 *
 * @param expiration 메시지 만료 시간. null이면 만료 없음.
 */
public record PublishOptions(Duration expiration) {

    public static PublishOptions none() {
        return new PublishOptions(null);
    }

    public static PublishOptions expiringIn(Duration expiration) {
        return new PublishOptions(expiration);
    }
}
