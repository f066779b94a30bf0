package com.tiklog.delivery.connection;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 소켓 프레임 - {@code {"event": "...", "data": ...}} 형태로 주고받는다.
 */
public record SocketFrame(String event, JsonNode data) {

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
