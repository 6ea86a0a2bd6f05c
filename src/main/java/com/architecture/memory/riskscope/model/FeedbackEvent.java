package com.architecture.memory.riskscope.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Audit log entry for a single piece of user feedback on a signal.
 */
@Document(collection = "signal_feedback")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackEvent {

    @Id
    private String id;

    @Indexed
    private String signalName;

    private String filePath;

    private boolean falsePositive;

    private String reason;

    private Instant recordedAt;
}
