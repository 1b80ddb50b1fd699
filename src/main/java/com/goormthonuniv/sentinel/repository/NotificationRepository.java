package com.goormthonuniv.sentinel.repository;

import com.goormthonuniv.sentinel.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findFirstByOrderByCreatedAtDesc();
}
