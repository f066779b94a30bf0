package com.tiklog.delivery.event;

import com.tiklog.common.event.DriverResponse;
import com.tiklog.common.event.PackageRequest;
import com.tiklog.delivery.bus.Exchanges;
import com.tiklog.delivery.bus.MessageBus;
import com.tiklog.delivery.service.DispatchService;
import com.tiklog.delivery.service.DriverResponseRelay;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 기동 시 버스 연결 + exchange 구독.
 *
 * <pre>
 * package_request  → DispatchService.assignPackageToDriver
 * driver_responses → DriverResponseRelay.relay
 * </pre>
 *
 * <p>브로커에 연결할 수 없으면 BROKER_UNAVAILABLE로 기동이 실패한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BusSubscriptionRegistrar implements ApplicationRunner {

    private final MessageBus messageBus;
    private final DispatchService dispatchService;
    private final DriverResponseRelay driverResponseRelay;

    @Override
    public void run(ApplicationArguments args) {
        messageBus.connect();
        messageBus.subscribe(Exchanges.PACKAGE_REQUEST, PackageRequest.class,
                dispatchService::assignPackageToDriver);
        messageBus.subscribe(Exchanges.DRIVER_RESPONSES, DriverResponse.class,
                driverResponseRelay::relay);
        log.info("Bus subscriptions registered");
    }

    @PreDestroy
    public void shutdown() {
        messageBus.disconnect();
    }
}
