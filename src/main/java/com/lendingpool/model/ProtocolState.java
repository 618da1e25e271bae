package com.lendingpool.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Protocol-wide switches. Single row with id {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "protocol_state")
@Data
@NoArgsConstructor
public class ProtocolState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    private boolean paused;

    @Column(nullable = false)
    private String feeRecipient;

    private Instant updatedAt;

    public ProtocolState(String feeRecipient) {
        this.feeRecipient = feeRecipient;
    }

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
