package com.vendinghive.repository;

import com.vendinghive.entity.ExcludedLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface ExcludedLocationRepository extends JpaRepository<ExcludedLocation, Long> {

    List<ExcludedLocation> findByOperatorIdOrderByCreatedAtDesc(String operatorId);

    Optional<ExcludedLocation> findByOperatorIdAndProviderId(String operatorId, String providerId);

    Optional<ExcludedLocation> findByIdAndOperatorId(Long id, String operatorId);

    boolean existsByOperatorIdAndProviderId(String operatorId, String providerId);

    long countByOperatorId(String operatorId);

    @Query("SELECT e.providerId FROM ExcludedLocation e WHERE e.operatorId = :operatorId")
    Set<String> findProviderIdsByOperatorId(@Param("operatorId") String operatorId);
}
