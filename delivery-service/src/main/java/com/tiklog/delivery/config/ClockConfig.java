package com.tiklog.delivery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 메시지 만료 판정용 시계 - 테스트에서 고정 시계로 교체한다 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
