package com.tiklog.delivery.support;

import com.tiklog.delivery.connection.ParticipantConnection;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/** 전송된 이벤트를 기록하는 연결 */
public class RecordingConnection implements ParticipantConnection {

    public record Sent(String event, Object payload) {
    }

    private final String id;
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String event, Object payload) {
        sent.add(new Sent(event, payload));
    }

    public void close() {
        this.open = false;
    }

    public List<String> events() {
        return sent.stream().map(Sent::event).toList();
    }

    public Optional<Object> lastPayload(String event) {
        Object found = null;
        for (Sent s : sent) {
            if (s.event().equals(event)) {
                found = s.payload();
            }
        }
        return Optional.ofNullable(found);
    }
}
