package com.tiklog.delivery.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 연결 레지스트리 - 참여자 ID → 현재 연결.
 *
 * <p>라이더와 고객이 같은 키 공간을 공유한다. 같은 ID로 다시 등록하면 최신 연결이 이전 연결을 대체한다.</p>
 *
 * <h3>연결 해제</h3>
 * <p>연결이 닫히면 {@link #unregister(String)}가 그 연결을 가리키는 항목만 지운다.
 * 이미 새 연결로 교체된 항목은 건드리지 않는다 ({@code Map.remove(key, value)}).</p>
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, ParticipantConnection> connections = new ConcurrentHashMap<>();

    public void register(String participantId, ParticipantConnection connection) {
        ParticipantConnection previous = connections.put(participantId, connection);
        if (previous != null && !previous.id().equals(connection.id())) {
            log.info("Participant {} reconnected: {} -> {}", participantId, previous.id(), connection.id());
        } else {
            log.info("Participant {} connected: {}", participantId, connection.id());
        }
    }

    public Optional<ParticipantConnection> lookup(String participantId) {
        if (participantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(participantId));
    }

    /** 연결 ID로 참여자 ID 역조회 */
    public Optional<String> reverseLookup(String connectionId) {
        return connections.entrySet().stream()
                .filter(entry -> entry.getValue().id().equals(connectionId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * 참여자에게 이벤트 전송. 연결이 없거나 닫혀 있으면 아무것도 하지 않는다.
     *
     * @return 실제로 전송했는지 여부
     */
    public boolean send(String participantId, String event, Object payload) {
        Optional<ParticipantConnection> connection = lookup(participantId);
        if (connection.isEmpty() || !connection.get().isOpen()) {
            log.debug("Participant {} is not connected, skipping event {}", participantId, event);
            return false;
        }
        try {
            connection.get().send(event, payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send event {} to participant {}", event, participantId, e);
            return false;
        }
    }

    /**
     * 닫힌 연결의 항목 제거.
     *
     * @return 제거된 항목 수
     */
    public int unregister(String connectionId) {
        int removed = 0;
        for (Map.Entry<String, ParticipantConnection> entry : connections.entrySet()) {
            ParticipantConnection connection = entry.getValue();
            if (connection.id().equals(connectionId) && connections.remove(entry.getKey(), connection)) {
                log.info("Participant {} disconnected: {}", entry.getKey(), connectionId);
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return connections.size();
    }
}
