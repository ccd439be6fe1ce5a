package com.keywordalert.repository;

import com.keywordalert.domain.enums.ReminderStatus;
import com.keywordalert.domain.model.ActiveReminder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ActiveReminderRepository extends JpaRepository<ActiveReminder, String> {
    List<ActiveReminder> findByStatusOrderByNextFireAtAsc(ReminderStatus status);
}
