package com.locplat.translation.repository;

import com.locplat.translation.model.FieldProcessingLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FieldProcessingLogRepository extends JpaRepository<FieldProcessingLog, Long> {
}
