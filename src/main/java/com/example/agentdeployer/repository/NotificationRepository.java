package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, String> {

    List<Notification> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Notification> findByReadFalse();

    long countByReadFalse();
}
