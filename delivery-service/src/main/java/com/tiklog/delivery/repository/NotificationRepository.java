package com.tiklog.delivery.repository;

import com.tiklog.delivery.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findAllByDeliveryId(Long deliveryId);
}
