package com.tiklog.delivery.config;

import com.tiklog.delivery.connection.DeliverySocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 라이더/고객 양방향 연결 엔드포인트 ({@code /ws/deliveries}).
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DeliverySocketHandler deliverySocketHandler;
    private final DispatchProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(deliverySocketHandler, "/ws/deliveries")
                .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
    }
}
