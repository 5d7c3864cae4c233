package com.example.inventorytasks.domain.repository;

import com.example.inventorytasks.domain.entity.PartSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PartSubscriptionRepository extends JpaRepository<PartSubscription, Long> {

    /**
     * Distinct addresses subscribed to any of the given parts
     */
    @Query("SELECT DISTINCT s.email FROM PartSubscription s WHERE s.partId IN :partIds ORDER BY s.email")
    List<String> findEmailsByPartIds(@Param("partIds") Collection<Long> partIds);
}
