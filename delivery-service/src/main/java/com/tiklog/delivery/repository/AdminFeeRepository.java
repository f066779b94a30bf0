package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.AdminFee;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AdminFeeRepository extends JpaRepository<AdminFee, Long> {

    Optional<AdminFee> findByDeliveryRefNumber(String deliveryRefNumber);
}
