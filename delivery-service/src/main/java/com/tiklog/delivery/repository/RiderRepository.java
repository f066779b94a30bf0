package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.Rider;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RiderRepository extends JpaRepository<Rider, String> {
}
