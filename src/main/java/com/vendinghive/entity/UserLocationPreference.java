package com.vendinghive.entity;

import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import com.vendinghive.model.SearchRadius;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 운영자별 검색 기본값/필터 (운영자당 1개, upsert)
 */
@Entity
@Table(name = "user_location_preferences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserLocationPreference {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String operatorId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "preference_machine_types", joinColumns = @JoinColumn(name = "preference_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "machine_type", length = 40)
    @Builder.Default
    private Set<MachineType> preferredMachineTypes = new LinkedHashSet<>();

    @Column(nullable = false)
    @Builder.Default
    private Integer preferredRadius = SearchRadius.DEFAULT.getMiles(); // 마일

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "preference_building_types", joinColumns = @JoinColumn(name = "preference_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "building_type", length = 40)
    @Builder.Default
    private Set<BuildingType> preferredBuildingTypes = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "preference_excluded_categories", joinColumns = @JoinColumn(name = "preference_id"))
    @Column(name = "category", length = 100)
    @Builder.Default
    private Set<String> excludedCategories = new LinkedHashSet<>();

    @Column(nullable = false, precision = 3, scale = 2)
    @Builder.Default
    private BigDecimal minimumRating = BigDecimal.ZERO;

    @Column(nullable = false)
    @Builder.Default
    private Boolean requireContactInfo = false;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public SearchRadius getPreferredSearchRadius() {
        return preferredRadius != null ? SearchRadius.fromMiles(preferredRadius) : SearchRadius.DEFAULT;
    }
}
