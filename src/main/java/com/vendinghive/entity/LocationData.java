package com.vendinghive.entity;

import com.vendinghive.model.ContactCompleteness;
import com.vendinghive.model.FootTraffic;
import com.vendinghive.model.OperationalStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 검색 결과로 반환된 순위별 후보 장소
 * 같은 장소가 여러 검색에 등장할 수 있으므로 providerId 는 unique 가 아님
 */
@Entity
@Table(name = "location_data", indexes = {
    @Index(name = "idx_location_history", columnList = "search_history_id"),
    @Index(name = "idx_location_provider", columnList = "providerId"),
    @Index(name = "idx_location_score", columnList = "priorityScore")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "search_history_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SearchHistory searchHistory;

    @Column(nullable = false)
    private Integer rankPosition; // 1부터

    @Column(nullable = false)
    private String providerId;

    private String googlePlaceId;

    @Column(length = 100)
    private String osmId;

    @Column(length = 100)
    private String sources; // openstreetmap,google_places

    @Column(nullable = false)
    private String name;

    @Column(length = 100)
    private String category;

    private String detailedCategory;

    @Column(nullable = false, precision = 9, scale = 6)
    private BigDecimal latitude;

    @Column(nullable = false, precision = 9, scale = 6)
    private BigDecimal longitude;

    @Column(length = 500)
    private String address;

    @Column(length = 50)
    private String phone;

    private String email;

    @Column(length = 500)
    private String website;

    @Column(length = 500)
    private String mapsUrl;

    @Column(columnDefinition = "TEXT")
    private String businessHours;

    private Double rating;

    private Integer reviewCount;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private OperationalStatus operationalStatus;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private FootTraffic footTraffic;

    @Column(nullable = false)
    private Integer priorityScore;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ContactCompleteness contactCompleteness;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
