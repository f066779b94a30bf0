package com.tiklog.delivery.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.common.event.DriverResponse;
import com.tiklog.common.event.PackageRequest;
import com.tiklog.common.exception.BusinessException;
import com.tiklog.delivery.dto.DeliveryProgress;
import com.tiklog.delivery.dto.RiderArrival;
import com.tiklog.delivery.metrics.DispatchMetrics;
import com.tiklog.delivery.service.AssignmentOutcome;
import com.tiklog.delivery.service.DeliveryLifecycleService;
import com.tiklog.delivery.service.DispatchService;
import com.tiklog.delivery.service.DriverResponseRelay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 배송 소켓 핸들러 - 라이더/고객 앱의 수신 이벤트를 배차 엔진으로 연결한다.
 *
 * <h3>수신 이벤트</h3>
 * <ul>
 *   <li>{@code riderId} / {@code customerId} - 연결을 참여자 ID로 등록</li>
 *   <li>{@code packageRequest} - 배송 요청 제출 (data 없음 또는 이미 배차됨 → requestAlreadySent)</li>
 *   <li>{@code driverResponse} - 라이더 수락/거절</li>
 *   <li>{@code arrived} - 라이더 도착 → 고객에게 riderArrivalNotification</li>
 *   <li>{@code startDelivery} / {@code endDelivery} - 배송 시작/종료</li>
 *   <li>{@code notificationAck} / {@code riderResponseNotificationAck} - 수신 확인 (로그만)</li>
 * </ul>
 *
 * <p>이벤트 처리 중 예외는 연결을 끊지 않는다. 보낸 쪽에 {@code error} 이벤트로 알리고 로그를 남긴다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliverySocketHandler extends TextWebSocketHandler {

    static final String REQUEST_ALREADY_SENT_MESSAGE = "Request has already been sent.";

    private final ConnectionRegistry connectionRegistry;
    private final DispatchService dispatchService;
    private final DriverResponseRelay driverResponseRelay;
    private final DeliveryLifecycleService lifecycleService;
    private final ObjectMapper objectMapper;
    private final DispatchMetrics metrics;

    private final Map<String, ParticipantConnection> sessionConnections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessionConnections.put(session.getId(), new WebSocketParticipantConnection(session, objectMapper));
        log.debug("Socket opened: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionConnections.remove(session.getId());
        int removed = connectionRegistry.unregister(session.getId());
        log.debug("Socket closed: {}, status={}, unregistered={}", session.getId(), status, removed);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ParticipantConnection connection = sessionConnections.computeIfAbsent(session.getId(),
                id -> new WebSocketParticipantConnection(session, objectMapper));

        SocketFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), SocketFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed socket frame from {}", session.getId());
            reply(connection, SocketEvents.ERROR, "Malformed message");
            return;
        }

        try {
            dispatch(connection, frame);
        } catch (BusinessException e) {
            log.warn("Socket event {} rejected: {}", frame.event(), e.getMessage());
            reply(connection, SocketEvents.ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Socket event {} failed", frame.event(), e);
            metrics.recordAsyncFailure("socket:" + frame.event());
            reply(connection, SocketEvents.ERROR, "Failed to process " + frame.event());
        }
    }

    private void dispatch(ParticipantConnection connection, SocketFrame frame) throws JsonProcessingException {
        String event = frame.event() == null ? "" : frame.event();
        switch (event) {
            case SocketEvents.RIDER_ID, SocketEvents.CUSTOMER_ID -> registerIdentity(connection, frame);
            case SocketEvents.PACKAGE_REQUEST -> {
                if (!frame.hasData()) {
                    reply(connection, SocketEvents.REQUEST_ALREADY_SENT, REQUEST_ALREADY_SENT_MESSAGE);
                    return;
                }
                AssignmentOutcome outcome = dispatchService.submitPackageRequest(
                        objectMapper.treeToValue(frame.data(), PackageRequest.class));
                if (outcome == AssignmentOutcome.ALREADY_CLAIMED) {
                    reply(connection, SocketEvents.REQUEST_ALREADY_SENT, REQUEST_ALREADY_SENT_MESSAGE);
                }
            }
            case SocketEvents.DRIVER_RESPONSE -> driverResponseRelay.sendDriverResponse(
                    objectMapper.treeToValue(frame.data(), DriverResponse.class));
            case SocketEvents.ARRIVED -> lifecycleService.riderArrived(
                    objectMapper.treeToValue(frame.data(), RiderArrival.class));
            case SocketEvents.START_DELIVERY -> lifecycleService.startDelivery(
                    objectMapper.treeToValue(frame.data(), DeliveryProgress.class));
            case SocketEvents.END_DELIVERY -> lifecycleService.endDelivery(
                    objectMapper.treeToValue(frame.data(), DeliveryProgress.class));
            case SocketEvents.NOTIFICATION_ACK, SocketEvents.RIDER_RESPONSE_NOTIFICATION_ACK ->
                    log.info("{} received from {}: {}", event, connection.id(), frame.data());
            default -> log.warn("Unknown socket event: {}", event);
        }
    }

    private void registerIdentity(ParticipantConnection connection, SocketFrame frame) {
        String participantId = frame.hasData() ? frame.data().asText() : null;
        if (participantId == null || participantId.isBlank()) {
            log.warn("Invalid or disconnected socket: {}", connection.id());
            return;
        }
        connectionRegistry.register(participantId, connection);
    }

    private void reply(ParticipantConnection connection, String event, Object payload) {
        try {
            connection.send(event, payload);
        } catch (IOException e) {
            log.warn("Failed to reply {} on {}", event, connection.id(), e);
        }
    }
}
