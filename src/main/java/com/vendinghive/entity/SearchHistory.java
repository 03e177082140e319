package com.vendinghive.entity;

import com.vendinghive.entity.converter.JsonMapConverter;
import com.vendinghive.model.BuildingType;
import com.vendinghive.model.MachineType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 검색 1회 기록 (append-only)
 */
@Entity
@Table(name = "search_histories", indexes = {
    @Index(name = "idx_history_operator_created", columnList = "operatorId, createdAt"),
    @Index(name = "idx_history_zip", columnList = "zipCode")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String operatorId;

    @Column(nullable = false, length = 10)
    private String zipCode;

    @Column(nullable = false)
    private Integer radius; // 마일

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private MachineType machineType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "search_history_building_types", joinColumns = @JoinColumn(name = "search_history_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "building_type", length = 40)
    @Builder.Default
    private Set<BuildingType> buildingTypes = new LinkedHashSet<>();

    @Column(nullable = false)
    private Integer resultCount;

    // 중심 좌표, 적용된 필터, max_results, provider 오류
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> searchParameters = new LinkedHashMap<>();

    @OneToMany(mappedBy = "searchHistory", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("rankPosition ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private List<LocationData> locations = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public void addLocation(LocationData location) {
        location.setSearchHistory(this);
        locations.add(location);
    }
}
