package com.cnab.importer.repository;

import com.cnab.importer.entity.TransactionTypeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionTypeRepository extends JpaRepository<TransactionTypeEntity, Long> {

    List<TransactionTypeEntity> findByActiveTrueOrderByIdAsc();
}
