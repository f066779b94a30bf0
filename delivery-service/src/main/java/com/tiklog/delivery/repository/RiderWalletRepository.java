package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.RiderWallet;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RiderWalletRepository extends JpaRepository<RiderWallet, Long> {

    /** 라이더 ID 기준 조회 (지갑 PK가 아님) */
    Optional<RiderWallet> findByRiderId(String riderId);
}
