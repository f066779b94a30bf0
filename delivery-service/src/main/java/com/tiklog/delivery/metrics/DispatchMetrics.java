package com.tiklog.delivery.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 배차 엔진 Micrometer 카운터 모음.
 *
 * <ul>
 *   <li>{@code dispatch.package.requests{outcome}} - assigned / no_candidate / duplicate</li>
 *   <li>{@code dispatch.rider.responses{outcome}} - accepted / declined</li>
 *   <li>{@code dispatch.settlements{outcome}} - settled / duplicate</li>
 *   <li>{@code dispatch.async.failures{source}} - 비동기 경로(버스 소비자, 소켓 이벤트)의 실패</li>
 *   <li>{@code dispatch.bus.expired{exchange}} - 만료되어 버려진 버스 메시지</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class DispatchMetrics {

    private final MeterRegistry meterRegistry;

    public void recordPackageRequest(String outcome) {
        counter("dispatch.package.requests", "outcome", outcome).increment();
    }

    public void recordRiderResponse(boolean accepted) {
        counter("dispatch.rider.responses", "outcome", accepted ? "accepted" : "declined").increment();
    }

    public void recordSettlement(String outcome) {
        counter("dispatch.settlements", "outcome", outcome).increment();
    }

    public void recordAsyncFailure(String source) {
        counter("dispatch.async.failures", "source", source).increment();
    }

    public void recordExpiredMessage(String exchange) {
        counter("dispatch.bus.expired", "exchange", exchange).increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name)
                .tag(tagKey, tagValue)
                .register(meterRegistry);
    }
}
