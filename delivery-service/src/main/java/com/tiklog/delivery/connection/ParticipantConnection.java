package com.tiklog.delivery.connection;

import java.io.IOException;

/**
 * 참여자(라이더/고객)와의 양방향 연결 하나.
 */
public interface ParticipantConnection {

    /** 연결 고유 ID. 재연결하면 새 ID가 부여된다. */
    String id();

    boolean isOpen();

    /** 이름 붙은 이벤트와 페이로드를 전송한다 */
    void send(String event, Object payload) throws IOException;
}
