package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.Vehicle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    Optional<Vehicle> findFirstByRiderId(String riderId);
}
