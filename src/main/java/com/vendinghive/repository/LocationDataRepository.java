package com.vendinghive.repository;

import com.vendinghive.entity.LocationData;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface LocationDataRepository extends JpaRepository<LocationData, Long> {

    List<LocationData> findBySearchHistoryIdOrderByRankPositionAsc(UUID searchHistoryId);

    /**
     * 운영자의 최근 검색 결과 (점수 높은 순)
     */
    @Query("SELECT l FROM LocationData l WHERE l.searchHistory.operatorId = :operatorId " +
            "AND l.searchHistory.createdAt >= :since ORDER BY l.priorityScore DESC, l.createdAt DESC")
    List<LocationData> findRecentForOperator(@Param("operatorId") String operatorId,
                                             @Param("since") LocalDateTime since,
                                             Pageable pageable);

    /**
     * 일괄 제외용. 다른 운영자의 결과는 조회되지 않음
     */
    @Query("SELECT l FROM LocationData l WHERE l.id IN :ids AND l.searchHistory.operatorId = :operatorId")
    List<LocationData> findOwnedByOperator(@Param("ids") Collection<Long> ids,
                                           @Param("operatorId") String operatorId);
}
