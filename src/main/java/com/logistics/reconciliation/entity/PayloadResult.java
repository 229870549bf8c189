package com.logistics.reconciliation.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A normalized order payload kept in the Target store, one row per do_number.
 * <p>
 * {@code payloadData} holds the serialized payload document as JSON text.
 */
@Entity
@Table(name = "order_clean_payload", indexes = {
        @Index(name = "idx_order_clean_payload_do_number", columnList = "do_number", unique = true),
        @Index(name = "idx_order_clean_payload_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "do_number", nullable = false, unique = true, length = 255)
    private String doNumber;

    @Column(name = "warehouse_id", length = 100)
    private String warehouseId;

    @Column(name = "client_id", length = 100)
    private String clientId;

    @Column(name = "faktur_date")
    private LocalDate fakturDate;

    @Column(name = "payload_data", nullable = false, columnDefinition = "TEXT")
    private String payloadData;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayloadStatus status;

    @Column(name = "item_count")
    private Integer itemCount;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "source_count")
    private Long sourceCount;

    @Column(name = "target_count")
    private Long targetCount;

    @Column(name = "discrepancy_count")
    private Long discrepancyCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
