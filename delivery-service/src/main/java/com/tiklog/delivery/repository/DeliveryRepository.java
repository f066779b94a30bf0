package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.Delivery;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * 배달(Delivery) 레포지토리.
 *
 * <p>라이더 탐색은 고객의 "가장 최근" 배달을 기준점으로 삼는다 ({@code createdAt} 내림차순 첫 행).</p>
 */
public interface DeliveryRepository extends JpaRepository<Delivery, Long> {

    Optional<Delivery> findFirstByCustomerIdOrderByCreatedAtDesc(String customerId);

    List<Delivery> findAllByCustomerIdOrderByCreatedAtDesc(String customerId);

    Optional<Delivery> findByDeliveryRefNumber(String deliveryRefNumber);
}
