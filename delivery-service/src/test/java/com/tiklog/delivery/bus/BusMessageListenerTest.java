package com.tiklog.delivery.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.common.event.PackageRequest;
import com.tiklog.delivery.metrics.DispatchMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class BusMessageListenerTest {

    private static final long NOW = 1_700_000_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final DispatchMetrics metrics = new DispatchMetrics(meterRegistry);
    private final List<PackageRequest> received = new ArrayList<>();

    private final PackageRequest request = new PackageRequest("req-1", 1L, "cust-1", "REF-1",
            "Ada", "12 Marina Rd", "4 Allen Ave");

    @Test
    @DisplayName("만료된 메시지는 늦게 도착한 소비자에게 전달되지 않는다")
    void expiredMessage_IsDropped() throws Exception {
        BusMessageListener<PackageRequest> listener = listener(received::add);

        listener.onMessage(message(NOW - 31_000, NOW - 1_000), null);

        assertThat(received).isEmpty();
        assertThat(meterRegistry.get("dispatch.bus.expired").tag("exchange", Exchanges.PACKAGE_REQUEST)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("만료 전 메시지는 타입 변환되어 전달된다")
    void liveMessage_IsDelivered() throws Exception {
        BusMessageListener<PackageRequest> listener = listener(received::add);

        listener.onMessage(message(NOW - 1_000, NOW + 29_000), null);

        assertThat(received).containsExactly(request);
    }

    @Test
    @DisplayName("만료 시각이 없는 메시지는 항상 전달된다")
    void messageWithoutExpiration_IsDelivered() throws Exception {
        BusMessageListener<PackageRequest> listener = listener(received::add);

        listener.onMessage(message(NOW - 3_600_000, null), null);

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("핸들러 예외는 리스너 밖으로 전파되지 않고 실패 카운터에 기록된다")
    void failingHandler_IsContained() throws Exception {
        BusMessageListener<PackageRequest> listener = listener(payload -> {
            throw new IllegalStateException("boom");
        });

        assertThatCode(() -> listener.onMessage(message(NOW, NOW + 30_000), null))
                .doesNotThrowAnyException();
        assertThat(meterRegistry.get("dispatch.async.failures").tag("source", "bus:" + Exchanges.PACKAGE_REQUEST)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("깨진 메시지도 리스너를 멈추지 않는다")
    void malformedMessage_IsContained() {
        BusMessageListener<PackageRequest> listener = listener(received::add);

        assertThatCode(() -> listener.onMessage(new DefaultMessage(
                Exchanges.PACKAGE_REQUEST.getBytes(StandardCharsets.UTF_8),
                "not-json".getBytes(StandardCharsets.UTF_8)), null))
                .doesNotThrowAnyException();
        assertThat(received).isEmpty();
    }

    private BusMessageListener<PackageRequest> listener(java.util.function.Consumer<PackageRequest> handler) {
        return new BusMessageListener<>(Exchanges.PACKAGE_REQUEST, PackageRequest.class, handler,
                objectMapper, clock, metrics);
    }

    private DefaultMessage message(long publishedAt, Long expiresAt) throws Exception {
        BusMessage envelope = new BusMessage("m-1", Exchanges.PACKAGE_REQUEST, publishedAt, expiresAt,
                objectMapper.valueToTree(request));
        return new DefaultMessage(Exchanges.PACKAGE_REQUEST.getBytes(StandardCharsets.UTF_8),
                objectMapper.writeValueAsBytes(envelope));
    }
}
