package com.cnab.importer.repository;

import com.cnab.importer.entity.UserLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserLogRepository extends JpaRepository<UserLogEntity, Long> {

    List<UserLogEntity> findByUserIdOrderByCreatedAtDesc(Long userId);
}
