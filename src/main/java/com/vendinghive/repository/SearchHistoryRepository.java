package com.vendinghive.repository;

import com.vendinghive.entity.SearchHistory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SearchHistoryRepository extends JpaRepository<SearchHistory, UUID> {

    Page<SearchHistory> findByOperatorIdOrderByCreatedAtDesc(String operatorId, Pageable pageable);

    Optional<SearchHistory> findByIdAndOperatorId(UUID id, String operatorId);

    long countByOperatorId(String operatorId);

    long countByOperatorIdAndCreatedAtGreaterThanEqual(String operatorId, LocalDateTime since);

    @Query("SELECT AVG(s.resultCount) FROM SearchHistory s WHERE s.operatorId = :operatorId")
    Double averageResultCount(@Param("operatorId") String operatorId);

    /**
     * 자판기 종류별 검색 횟수 (많은 순)
     * @return [MachineType, Long]
     */
    @Query("SELECT s.machineType, COUNT(s) FROM SearchHistory s WHERE s.operatorId = :operatorId " +
            "GROUP BY s.machineType ORDER BY COUNT(s) DESC")
    List<Object[]> countByMachineType(@Param("operatorId") String operatorId);

    /**
     * 우편번호별 검색 횟수 (많은 순)
     * @return [String zipCode, Long]
     */
    @Query("SELECT s.zipCode, COUNT(s) FROM SearchHistory s WHERE s.operatorId = :operatorId " +
            "GROUP BY s.zipCode ORDER BY COUNT(s) DESC, s.zipCode ASC")
    List<Object[]> countByZipCode(@Param("operatorId") String operatorId, Pageable pageable);
}
