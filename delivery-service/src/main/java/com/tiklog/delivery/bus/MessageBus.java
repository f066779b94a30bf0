package com.tiklog.delivery.bus;

import java.util.function.Consumer;

/**
 * 발행/구독 메시지 버스 - 일시적인 fanout 알림 수단이며, 재생 가능한 이벤트 로그가 아니다.
 *
 * <p>구독은 인스턴스마다 독립적이므로 한 exchange에 발행된 메시지는 모든 구독 인스턴스에 전달된다.
 * 구독자가 없을 때 발행된 메시지는 사라진다.</p>
 */
public interface MessageBus {

    /**
     * 브로커 연결 확인. 실패하면 {@code BROKER_UNAVAILABLE}로 즉시 실패한다.
     */
    void connect();

    void disconnect();

    void publish(String exchange, Object payload, PublishOptions options);

    default void publish(String exchange, Object payload) {
        publish(exchange, payload, PublishOptions.none());
    }

    /**
     * exchange 구독. 핸들러가 던지는 예외는 버스가 잡아서 기록하며 구독은 유지된다.
     */
    <T> void subscribe(String exchange, Class<T> payloadType, Consumer<T> handler);
}
