package org.caureq.caureqspeedboard.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "recipient_prefs")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class RecipientPref {

    @Id
    @Column(name = "recipient_id", length = 64)
    private String recipientId; // telegram chat id

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Language language;

    @Enumerated(EnumType.STRING)
    @Column(name = "view_mode", nullable = false, length = 16)
    private ViewMode viewMode;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        var now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }
}
