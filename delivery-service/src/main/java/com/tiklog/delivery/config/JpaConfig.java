package com.tiklog.delivery.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정 클래스.
 *
 * <p>{@code @CreatedDate} 필드(배달, 정산 기록, 알림 기록의 생성 시각)가 자동으로 채워지도록 한다.
 * 고객의 "가장 최근 배달"을 찾는 라이더 탐색이 이 값에 의존한다.</p>
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
