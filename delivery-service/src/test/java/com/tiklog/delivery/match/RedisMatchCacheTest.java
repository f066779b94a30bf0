package com.tiklog.delivery.match;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.delivery.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisMatchCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisMatchCache matchCache;

    @BeforeEach
    void setUp() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        matchCache = new RedisMatchCache(redisTemplate, new ObjectMapper(), TestFixtures.properties());
    }

    @Test
    @DisplayName("배달별 키와 고객 인덱스를 같은 TTL로 저장하고, 고객 ID로 다시 읽을 수 있다")
    void save_ThenFindByCustomer() {
        MatchRecord record = TestFixtures.match(1L, "rider-1", "cust-1");

        matchCache.save(record);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("match:delivery:1"), json.capture(), eq(Duration.ofHours(1)));
        verify(valueOperations).set("match:customer:cust-1", "1", Duration.ofHours(1));

        given(valueOperations.get("match:customer:cust-1")).willReturn("1");
        given(valueOperations.get("match:delivery:1")).willReturn(json.getValue());

        assertThat(matchCache.findByCustomer("cust-1")).contains(record);
    }

    @Test
    @DisplayName("만료되었거나 없는 매칭은 빈 값")
    void find_Missing() {
        given(valueOperations.get("match:delivery:9")).willReturn(null);

        assertThat(matchCache.find(9L)).isEmpty();
    }

    @Test
    @DisplayName("고객 인덱스가 다른 배달로 바뀌었으면 인덱스는 남기고 배달 키만 지운다")
    void evict_KeepsNewerCustomerIndex() {
        MatchRecord older = TestFixtures.match(1L, "rider-1", "cust-1");
        given(valueOperations.get("match:customer:cust-1")).willReturn("2");

        matchCache.evict(older);

        verify(redisTemplate).delete("match:delivery:1");
        verify(redisTemplate, never()).delete("match:customer:cust-1");
    }

    @Test
    @DisplayName("고객 인덱스가 같은 배달을 가리키면 함께 지운다")
    void evict_RemovesOwnCustomerIndex() {
        MatchRecord record = TestFixtures.match(1L, "rider-1", "cust-1");
        given(valueOperations.get("match:customer:cust-1")).willReturn("1");

        matchCache.evict(record);

        verify(redisTemplate).delete("match:delivery:1");
        verify(redisTemplate).delete("match:customer:cust-1");
    }
}
