package com.vendinghive.entity;

import com.vendinghive.model.ExclusionReason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 운영자가 검색 결과에서 영구 제외한 장소 (생성/삭제만 가능)
 */
@Entity
@Table(name = "excluded_locations",
        uniqueConstraints = @UniqueConstraint(name = "uk_excluded_operator_provider", columnNames = {"operatorId", "providerId"}),
        indexes = @Index(name = "idx_excluded_operator", columnList = "operatorId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExcludedLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String operatorId;

    @Column(nullable = false)
    private String providerId; // Google place_id 또는 osm:<type>/<id>

    @Column(nullable = false)
    private String locationName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private ExclusionReason reason = ExclusionReason.OTHER;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
