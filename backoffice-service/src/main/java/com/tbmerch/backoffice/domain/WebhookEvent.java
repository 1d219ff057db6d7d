package com.tbmerch.backoffice.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbound webhook call, kept verbatim for auditing and replay.
 */
@Entity
@Table(name = "webhook_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookEvent {

    public static final String SOURCE_STOREFRONT = "shopify";
    public static final String SOURCE_ENCODING = "zencoder";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 30)
    private String source;

    @Column(nullable = false, length = 100)
    private String topic;

    @Column(length = 1000000)
    private String payload;

    @Column(nullable = false, updatable = false)
    private Instant receivedAt;

    @PrePersist
    void onCreate() {
        receivedAt = Instant.now();
    }
}
