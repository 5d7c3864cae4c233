package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.ExchangeBackend;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExchangeBackendRepository extends JpaRepository<ExchangeBackend, String> {
}
