package com.example.spontaneous.notification.repository;

import com.example.spontaneous.notification.model.DeadLetterNotification;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeadLetterNotificationRepository extends CrudRepository<DeadLetterNotification, String> {

    List<DeadLetterNotification> findAllByOrderByFailedAtDesc();
}
