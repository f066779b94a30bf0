package com.tiklog.delivery.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * WebSocket 세션 기반 연결.
 *
 * <p>여러 스레드(버스 리스너, 다른 참여자의 소켓 이벤트)가 같은 세션에 동시에 보낼 수 있으므로
 * {@link ConcurrentWebSocketSessionDecorator}로 감싼다. 전송 시간/버퍼 한도를 넘으면 세션이 닫힌다.</p>
 */
public class WebSocketParticipantConnection implements ParticipantConnection {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketParticipantConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String event, Object payload) throws IOException {
        SocketFrame frame = new SocketFrame(event, objectMapper.valueToTree(payload));
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }
}
