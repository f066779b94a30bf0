package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.CustomerWallet;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CustomerWalletRepository extends JpaRepository<CustomerWallet, Long> {

    Optional<CustomerWallet> findByCustomerId(String customerId);
}
