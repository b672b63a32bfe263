package com.github.salilvnair.convflow.engine.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One in-progress intent instance on a session's stack. The parent is kept as
 * a frame id so a stack serializes as a flat list.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IntentFrame {

    private String frameId;
    private String intentName;
    private String sessionId;
    private String userId;
    private FrameStatus status;

    @Builder.Default
    private Map<String, Object> savedContext = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> collectedSlots = new LinkedHashMap<>();
    @Builder.Default
    private List<String> missingSlots = new ArrayList<>();

    private double completionProgress;
    private InterruptionKind interruptionKind;
    private String interruptionReason;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;

    private String parentFrameId;
    private int depth;

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    @JsonIgnore
    public boolean isResumable(Instant now) {
        return status == FrameStatus.INTERRUPTED && !isExpired(now);
    }

    public void interrupt(InterruptionKind kind, String reason, Instant now) {
        this.status = FrameStatus.INTERRUPTED;
        this.interruptionKind = kind;
        this.interruptionReason = reason;
        this.updatedAt = now;
    }

    public void resume(Instant now) {
        this.status = FrameStatus.ACTIVE;
        this.updatedAt = now;
    }

    public void finish(FrameStatus terminal, Instant now) {
        this.status = terminal;
        this.updatedAt = now;
    }

    public void updateProgress(double progress, Instant now) {
        this.completionProgress = Math.max(0.0d, Math.min(1.0d, progress));
        this.updatedAt = now;
    }
}
