package com.github.salilvnair.formflow.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(
        name = "ff_autofill_history",
        indexes = @Index(name = "ix_ff_autofill_user_field", columnList = "user_id, field_name, field_type"),
        uniqueConstraints = @UniqueConstraint(
                name = "uk_ff_autofill_value",
                columnNames = {"user_id", "field_name", "field_type", "field_value"}
        )
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FfAutofillHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "history_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "field_name", nullable = false)
    private String fieldName;

    @Column(name = "field_type", nullable = false)
    private String fieldType;

    @Column(name = "field_value", nullable = false, length = 2000)
    private String value;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "last_used_at", nullable = false)
    private OffsetDateTime lastUsedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Version
    @Column(name = "row_version")
    private Long version;

    @PrePersist
    private void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (lastUsedAt == null) {
            lastUsedAt = createdAt;
        }
    }
}
