package com.marquee.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "content_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 2000)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private UpdateType updateType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Status status;

    @Column(nullable = false)
    private Instant generatedAt;

    private Instant sentAt;

    private String generatorId;

    private String generatorName;

    private Integer priority;

    private String aiProvider;

    private String aiModel;

    private Integer tokensUsed;

    private boolean failedOver;

    private String primaryProvider;

    private String errorType;

    @Column(length = 2000)
    private String errorMessage;

    public enum Status {
        SUCCESS,
        FAILED
    }
}
