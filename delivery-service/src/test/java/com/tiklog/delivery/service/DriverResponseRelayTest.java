package com.tiklog.delivery.service;

import com.tiklog.common.event.DriverResponse;
import com.tiklog.delivery.bus.Exchanges;
import com.tiklog.delivery.bus.MessageBus;
import com.tiklog.delivery.connection.ConnectionRegistry;
import com.tiklog.delivery.connection.SocketEvents;
import com.tiklog.delivery.dto.RiderResponseNotification;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.entity.DeliveryStatus;
import com.tiklog.delivery.entity.Notification;
import com.tiklog.delivery.event.ProcessedEvent;
import com.tiklog.delivery.event.ProcessedEventRepository;
import com.tiklog.delivery.metrics.DispatchMetrics;
import com.tiklog.delivery.repository.DeliveryRepository;
import com.tiklog.delivery.repository.NotificationRepository;
import com.tiklog.delivery.support.InMemoryMatchCache;
import com.tiklog.delivery.support.RecordingConnection;
import com.tiklog.delivery.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DriverResponseRelayTest {

    @Mock
    private MessageBus messageBus;
    @Mock
    private DispatchClaimService claimService;
    @Mock
    private DeliveryRepository deliveryRepository;
    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private ProcessedEventRepository processedEventRepository;

    private final InMemoryMatchCache matchCache = new InMemoryMatchCache();
    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RecordingConnection customerConnection = new RecordingConnection("customer-socket");

    private DriverResponseRelay relay;

    @BeforeEach
    void setUp() {
        relay = new DriverResponseRelay(messageBus, matchCache, connectionRegistry, claimService,
                deliveryRepository, notificationRepository, processedEventRepository,
                new DispatchMetrics(meterRegistry));
        matchCache.save(TestFixtures.match(1L, "rider-1", "cust-1"));
    }

    @Test
    @DisplayName("거절 - 고객에게 riderDeclined, 알림 기록 저장, 매칭 레코드는 더 이상 읽히지 않는다")
    void decline_NotifiesAndClearsMatch() {
        connectionRegistry.register("cust-1", customerConnection);
        given(processedEventRepository.existsById("evt-1")).willReturn(false);

        relay.relay(new DriverResponse("evt-1", 1L, "rider-1", "cust-1", false, null));

        assertThat(customerConnection.lastPayload(SocketEvents.RIDER_DECLINED))
                .contains("Rider declined your request");
        assertThat(matchCache.find(1L)).isEmpty();
        assertThat(matchCache.findByCustomer("cust-1")).isEmpty();
        verify(claimService).release(1L);

        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(saved.capture());
        assertThat(saved.getValue().isRiderAvailabilityStatus()).isFalse();
        assertThat(saved.getValue().getDeliveryRefNumber()).isEqualTo("REF-1");
        verifyNoInteractions(deliveryRepository);
    }

    @Test
    @DisplayName("수락 - 고객에게 riderResponse, 배달은 ASSIGNED, 처리 이벤트 기록")
    void accept_AssignsDelivery() {
        connectionRegistry.register("cust-1", customerConnection);
        Delivery delivery = TestFixtures.delivery(1L, "cust-1", BigDecimal.valueOf(100));
        given(processedEventRepository.existsById("evt-1")).willReturn(false);
        given(deliveryRepository.findById(1L)).willReturn(Optional.of(delivery));

        relay.relay(new DriverResponse("evt-1", 1L, "rider-1", "cust-1", true, 7));

        RiderResponseNotification notification = (RiderResponseNotification) customerConnection
                .lastPayload(SocketEvents.RIDER_RESPONSE).orElseThrow();
        assertThat(notification.title()).isEqualTo("Rider response");
        assertThat(notification.availability()).isTrue();
        assertThat(notification.riderId()).isEqualTo("rider-1");
        assertThat(notification.arrivalTime()).isEqualTo(7);

        assertThat(delivery.getStatus()).isEqualTo(DeliveryStatus.ASSIGNED);
        assertThat(delivery.getRiderId()).isEqualTo("rider-1");
        assertThat(matchCache.find(1L)).isPresent();
        verify(processedEventRepository).save(any(ProcessedEvent.class));
        assertThat(meterRegistry.get("dispatch.rider.responses").tag("outcome", "accepted")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 eventId가 다시 오면 고객 알림만 보내고 영속화는 건너뛴다")
    void duplicateEvent_SkipsPersistence() {
        connectionRegistry.register("cust-1", customerConnection);
        given(processedEventRepository.existsById("evt-1")).willReturn(true);

        relay.relay(new DriverResponse("evt-1", 1L, "rider-1", "cust-1", true, 7));

        assertThat(customerConnection.events()).containsExactly(SocketEvents.RIDER_RESPONSE);
        verify(notificationRepository, never()).save(any());
        verifyNoInteractions(deliveryRepository);
    }

    @Test
    @DisplayName("고객이 미접속이어도 알림 기록은 저장된다")
    void customerOffline_StillPersists() {
        given(processedEventRepository.existsById("evt-1")).willReturn(false);

        relay.relay(new DriverResponse("evt-1", null, "rider-1", "cust-1", false, null));

        verify(notificationRepository).save(any(Notification.class));
        assertThat(matchCache.find(1L)).isEmpty();
    }

    @Test
    @DisplayName("매칭된 라이더가 아닌 라이더의 수락은 고객에게 전달하지 않고 배달도 배정하지 않는다")
    void unmatchedRiderAccept_Ignored() {
        // Given: 매칭은 rider-1
        connectionRegistry.register("cust-1", customerConnection);

        // When: rider-9가 수락
        relay.relay(new DriverResponse("evt-9", 1L, "rider-9", "cust-1", true, 3));

        // Then
        assertThat(customerConnection.events()).isEmpty();
        assertThat(matchCache.find(1L).orElseThrow().riderId()).isEqualTo("rider-1");
        verifyNoInteractions(deliveryRepository, notificationRepository, processedEventRepository, claimService);
    }

    @Test
    @DisplayName("매칭된 라이더가 아닌 라이더의 거절은 매칭 레코드를 지우지 않는다")
    void unmatchedRiderDecline_KeepsMatch() {
        connectionRegistry.register("cust-1", customerConnection);

        relay.relay(new DriverResponse("evt-9", 1L, "rider-9", "cust-1", false, null));

        assertThat(customerConnection.events()).isEmpty();
        assertThat(matchCache.find(1L)).isPresent();
        verifyNoInteractions(claimService);
    }

    @Test
    @DisplayName("매칭이 없으면 경고만 남기고 영속화하지 않는다")
    void noMatch_IsLoggedOnly() {
        connectionRegistry.register("cust-2", customerConnection);

        relay.relay(new DriverResponse("evt-2", 99L, "rider-1", "cust-2", false, null));

        assertThat(customerConnection.events()).containsExactly(SocketEvents.RIDER_DECLINED);
        verifyNoInteractions(notificationRepository, processedEventRepository, claimService);
    }

    @Test
    @DisplayName("응답 발행 시 eventId를 부여해 driver_responses로 보낸다")
    void sendDriverResponse_StampsEventId() {
        DriverResponse sent = relay.sendDriverResponse(
                new DriverResponse(null, 1L, "rider-1", "cust-1", true, 5));

        assertThat(sent.eventId()).isNotBlank();
        verify(messageBus).publish(eq(Exchanges.DRIVER_RESPONSES), eq(sent));
    }
}
