package com.strategyvault.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Audit record of one committed vault event.
 * Written asynchronously; never read back into vault state.
 */
@Entity
@Table(name = "vault_events", indexes = {
    @Index(name = "idx_vault_event_timestamp", columnList = "timestamp"),
    @Index(name = "idx_vault_event_holder", columnList = "holder, timestamp"),
    @Index(name = "idx_vault_event_type", columnList = "eventType")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VaultEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 40)
    private String eventType;

    @Column(length = 128)
    private String holder; // null for pool-wide events

    @Column(nullable = false, length = 512)
    private String description;

    @Column(length = 64)
    private String actor; // X-User-Id of the request that caused it, if any

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private Instant recordedAt;
}
