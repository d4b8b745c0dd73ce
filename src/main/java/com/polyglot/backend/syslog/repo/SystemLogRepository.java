package com.polyglot.backend.syslog.repo;

import com.polyglot.backend.syslog.entity.SystemLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SystemLogRepository extends JpaRepository<SystemLogEntity, Long> {

    List<SystemLogEntity> findByUserEmailOrderByIdAsc(String userEmail);
}
