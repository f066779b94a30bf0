package com.tiklog.delivery.service;

import com.tiklog.delivery.service.DispatchClaimService.ClaimResult;
import com.tiklog.delivery.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DispatchClaimServiceTest {

    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RBucket<String> bucket;

    private DispatchClaimService claimService;

    @BeforeEach
    void setUp() {
        given(redissonClient.<String>getBucket("dispatch:claim:1")).willReturn(bucket);
        claimService = new DispatchClaimService(redissonClient, TestFixtures.properties());
    }

    @Test
    @DisplayName("비어 있는 claim 키는 requestId로 획득한다 (TTL = claim-ttl)")
    void claim_Acquired() {
        given(bucket.trySet("req-1", 3_600_000L, TimeUnit.MILLISECONDS)).willReturn(true);

        assertThat(claimService.claim(1L, "req-1")).isEqualTo(ClaimResult.ACQUIRED);
    }

    @Test
    @DisplayName("같은 제출이 이미 claim했으면 SAME_REQUEST")
    void claim_SameRequest() {
        given(bucket.trySet("req-1", 3_600_000L, TimeUnit.MILLISECONDS)).willReturn(false);
        given(bucket.get()).willReturn("req-1");

        assertThat(claimService.claim(1L, "req-1")).isEqualTo(ClaimResult.SAME_REQUEST);
    }

    @Test
    @DisplayName("다른 제출이 claim을 가지고 있으면 OTHER_REQUEST")
    void claim_OtherRequest() {
        given(bucket.trySet("req-2", 3_600_000L, TimeUnit.MILLISECONDS)).willReturn(false);
        given(bucket.get()).willReturn("req-1");

        assertThat(claimService.claim(1L, "req-2")).isEqualTo(ClaimResult.OTHER_REQUEST);
    }

    @Test
    @DisplayName("해제하면 claim 키를 삭제한다")
    void release_DeletesKey() {
        claimService.release(1L);

        verify(bucket).delete();
    }
}
