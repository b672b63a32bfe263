package com.github.salilvnair.convflow.engine.stack;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.stack.model.FrameStatus;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.engine.stack.model.InterruptionKind;
import com.github.salilvnair.convflow.engine.stack.model.PopResult;
import com.github.salilvnair.convflow.engine.stack.model.PushResult;
import com.github.salilvnair.convflow.engine.stack.model.StackStatistics;
import com.github.salilvnair.convflow.intent.RequiredSlotsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session intent stack. At most one frame is ACTIVE and it is always the
 * top; every other frame is INTERRUPTED. Each mutating call loads the stack,
 * changes the loaded copies and saves once under the session lock, so a call
 * either fully happens or leaves the stored stack untouched.
 */
@Slf4j
@Service
public class IntentStackService {

    private static final String DEFAULT_INTERRUPTION_REASON = "new intent pushed";

    private final IntentStackRepository repository;
    private final SessionLockRegistry locks;
    private final ConvFlowProperties properties;
    private final ObjectProvider<RequiredSlotsProvider> requiredSlotsProvider;
    private final Clock clock;
    private final Set<String> knownSessions = ConcurrentHashMap.newKeySet();

    public IntentStackService(IntentStackRepository repository,
                              SessionLockRegistry locks,
                              ConvFlowProperties properties,
                              ObjectProvider<RequiredSlotsProvider> requiredSlotsProvider,
                              Clock clock) {
        this.repository = repository;
        this.locks = locks;
        this.properties = properties;
        this.requiredSlotsProvider = requiredSlotsProvider;
        this.clock = clock;
    }

    public PushResult push(String sessionId, String userId, String intentName, Map<String, Object> context) {
        return push(sessionId, userId, intentName, context, null, null);
    }

    public PushResult push(String sessionId,
                           String userId,
                           String intentName,
                           Map<String, Object> context,
                           InterruptionKind interruptionKind,
                           String interruptionReason) {
        requireIntent(intentName);
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            IntentFrame pushed = pushOnto(frames, sessionId, userId, intentName, context, interruptionKind, interruptionReason);
            repository.save(sessionId, frames);
            knownSessions.add(sessionId);
            log.info("Pushed intent sessionId={} intent={} depth={}", sessionId, intentName, pushed.getDepth());
            return new PushResult(pushed, frames.size());
        });
    }

    /**
     * Returns {@code null} when the stack is empty.
     */
    public PopResult pop(String sessionId, String reason) {
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            if (frames.isEmpty()) {
                log.debug("Pop on empty intent stack sessionId={}", sessionId);
                return null;
            }
            Instant now = clock.instant();
            IntentFrame popped = removeTop(frames, FrameStatus.COMPLETED, now);
            List<IntentFrame> abandoned = resumeTop(frames, now);
            repository.save(sessionId, frames);
            if (frames.isEmpty()) {
                knownSessions.remove(sessionId);
            }
            log.info("Popped intent sessionId={} intent={} reason={} depth={}",
                    sessionId, popped.getIntentName(), reason, frames.size());
            return new PopResult(popped, frames.size(), abandoned);
        });
    }

    /**
     * Pop followed by push as one mutation. The intermediate resume of the frame
     * below is not observable: it is interrupted again by the push.
     */
    public PushResult replaceTop(String sessionId,
                                 String userId,
                                 String intentName,
                                 Map<String, Object> context,
                                 InterruptionKind interruptionKind,
                                 String interruptionReason) {
        requireIntent(intentName);
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            Instant now = clock.instant();
            String replaced = null;
            if (!frames.isEmpty()) {
                replaced = removeTop(frames, FrameStatus.COMPLETED, now).getIntentName();
                resumeTop(frames, now);
            }
            IntentFrame pushed = pushOnto(frames, sessionId, userId, intentName, context, interruptionKind, interruptionReason);
            repository.save(sessionId, frames);
            knownSessions.add(sessionId);
            log.info("Replaced intent sessionId={} from={} to={} depth={}", sessionId, replaced, intentName, frames.size());
            return new PushResult(pushed, frames.size());
        });
    }

    public Optional<IntentFrame> peek(String sessionId) {
        List<IntentFrame> frames = repository.load(sessionId);
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    public Optional<IntentFrame> getActive(String sessionId) {
        return activeFrame(repository.load(sessionId));
    }

    public List<IntentFrame> getStack(String sessionId) {
        return Collections.unmodifiableList(repository.load(sessionId));
    }

    public int depth(String sessionId) {
        return repository.load(sessionId).size();
    }

    public IntentFrame updateContext(String sessionId, String frameId, Map<String, Object> patch) {
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            IntentFrame frame = requireFrame(frames, sessionId, frameId);
            if (patch != null) {
                frame.getSavedContext().putAll(patch);
            }
            frame.setUpdatedAt(clock.instant());
            repository.save(sessionId, frames);
            log.debug("Updated frame context sessionId={} frameId={}", sessionId, frameId);
            return frame;
        });
    }

    /**
     * Merges slot values, optionally replaces the missing list, drops filled
     * names from it and recomputes progress.
     */
    public IntentFrame updateSlots(String sessionId,
                                   String frameId,
                                   Map<String, Object> slotPatch,
                                   List<String> missingSlots) {
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            IntentFrame frame = requireFrame(frames, sessionId, frameId);
            Instant now = clock.instant();
            if (missingSlots != null) {
                frame.setMissingSlots(new ArrayList<>(missingSlots));
            }
            if (slotPatch != null) {
                slotPatch.forEach((slot, value) -> {
                    frame.getCollectedSlots().put(slot, value);
                    if (value != null) {
                        frame.getMissingSlots().remove(slot);
                    }
                });
            }
            frame.setUpdatedAt(now);
            recomputeProgress(frame, now);
            repository.save(sessionId, frames);
            log.debug("Updated frame slots sessionId={} frameId={} progress={}",
                    sessionId, frameId, frame.getCompletionProgress());
            return frame;
        });
    }

    /**
     * Only the top frame is checked. An expired top is removed and the check
     * repeats on the frame below; the surviving top resumes as after a pop.
     *
     * @return number of frames removed
     */
    public int sweepExpired(String sessionId, Instant now) {
        return locks.withLock(sessionId, () -> {
            List<IntentFrame> frames = repository.load(sessionId);
            if (frames.isEmpty() || !frames.get(frames.size() - 1).isExpired(now)) {
                return 0;
            }
            int before = frames.size();
            resumeTop(frames, now);
            int removed = before - frames.size();
            repository.save(sessionId, frames);
            if (frames.isEmpty()) {
                knownSessions.remove(sessionId);
            }
            log.info("Swept expired frames sessionId={} removed={} depth={}", sessionId, removed, frames.size());
            return removed;
        });
    }

    public StackStatistics statistics(String sessionId) {
        List<IntentFrame> frames = repository.load(sessionId);
        int maxDepth = properties.getStack().getMaxDepth();
        Map<FrameStatus, Long> statusCounts = new EnumMap<>(FrameStatus.class);
        for (FrameStatus status : FrameStatus.values()) {
            statusCounts.put(status, 0L);
        }
        frames.forEach(f -> statusCounts.merge(f.getStatus(), 1L, Long::sum));

        if (frames.isEmpty()) {
            return new StackStatistics(0, 0, null, statusCounts, 0.0d, 0.0d, List.of(), null, null);
        }

        double averageProgress = frames.stream()
                .mapToDouble(IntentFrame::getCompletionProgress)
                .average()
                .orElse(0.0d);
        List<InterruptionKind> kinds = frames.stream()
                .map(IntentFrame::getInterruptionKind)
                .filter(kind -> kind != null)
                .toList();
        return new StackStatistics(
                frames.size(),
                frames.size(),
                activeFrame(frames).map(IntentFrame::getIntentName).orElse(null),
                statusCounts,
                averageProgress,
                (double) frames.size() / maxDepth,
                kinds,
                frames.get(0).getCreatedAt(),
                frames.get(frames.size() - 1).getCreatedAt()
        );
    }

    public boolean clear(String sessionId) {
        return locks.withLock(sessionId, () -> {
            knownSessions.remove(sessionId);
            boolean cleared = repository.clear(sessionId);
            log.info("Cleared intent stack sessionId={} existed={}", sessionId, cleared);
            return cleared;
        });
    }

    public Set<String> knownSessions() {
        return Set.copyOf(knownSessions);
    }

    void forget(String sessionId) {
        knownSessions.remove(sessionId);
    }

    // ------------------------------------------------------------------

    private IntentFrame pushOnto(List<IntentFrame> frames,
                                 String sessionId,
                                 String userId,
                                 String intentName,
                                 Map<String, Object> context,
                                 InterruptionKind interruptionKind,
                                 String interruptionReason) {
        int maxDepth = properties.getStack().getMaxDepth();
        if (frames.size() >= maxDepth) {
            log.warn("Intent stack full sessionId={} depth={} intent={}", sessionId, frames.size(), intentName);
            throw new ConvFlowException(
                    ConvFlowErrorCode.STACK_OVERFLOW,
                    "Intent stack depth limit " + maxDepth + " reached for session " + sessionId
            ).withMetaData(Map.of("sessionId", sessionId, "intent", intentName, "maxDepth", maxDepth));
        }

        Instant now = clock.instant();
        IntentFrame parent = frames.isEmpty() ? null : frames.get(frames.size() - 1);
        activeFrame(frames).ifPresent(active -> active.interrupt(
                interruptionKind == null ? InterruptionKind.USER_INITIATED : interruptionKind,
                interruptionReason == null ? DEFAULT_INTERRUPTION_REASON : interruptionReason,
                now
        ));

        IntentFrame frame = IntentFrame.builder()
                .frameId("frame_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .intentName(intentName)
                .sessionId(sessionId)
                .userId(userId)
                .status(FrameStatus.ACTIVE)
                .savedContext(context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context))
                .interruptionKind(interruptionKind)
                .interruptionReason(interruptionReason)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(properties.getStack().getFrameTtl()))
                .parentFrameId(parent == null ? null : parent.getFrameId())
                .depth(frames.size())
                .build();
        frames.add(frame);
        return frame;
    }

    private IntentFrame removeTop(List<IntentFrame> frames, FrameStatus terminal, Instant now) {
        IntentFrame top = frames.remove(frames.size() - 1);
        top.finish(terminal, now);
        return top;
    }

    /**
     * Drops expired frames from the top, then resumes the new top if it was interrupted.
     */
    private List<IntentFrame> resumeTop(List<IntentFrame> frames, Instant now) {
        List<IntentFrame> abandoned = new ArrayList<>();
        while (!frames.isEmpty() && frames.get(frames.size() - 1).isExpired(now)) {
            IntentFrame expired = removeTop(frames, FrameStatus.EXPIRED, now);
            abandoned.add(expired);
            log.info("Abandoned expired frame sessionId={} frameId={} intent={}",
                    expired.getSessionId(), expired.getFrameId(), expired.getIntentName());
        }
        if (!frames.isEmpty()) {
            IntentFrame top = frames.get(frames.size() - 1);
            if (top.isResumable(now)) {
                top.resume(now);
            }
        }
        return abandoned;
    }

    private Optional<IntentFrame> activeFrame(List<IntentFrame> frames) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).getStatus() == FrameStatus.ACTIVE) {
                return Optional.of(frames.get(i));
            }
        }
        return Optional.empty();
    }

    private IntentFrame requireFrame(List<IntentFrame> frames, String sessionId, String frameId) {
        return frames.stream()
                .filter(f -> f.getFrameId().equals(frameId))
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("Frame not found sessionId={} frameId={}", sessionId, frameId);
                    return new ConvFlowException(
                            ConvFlowErrorCode.FRAME_NOT_FOUND,
                            "Frame " + frameId + " not found in session " + sessionId
                    );
                });
    }

    private void recomputeProgress(IntentFrame frame, Instant now) {
        Set<String> required = requiredSlots(frame);
        if (required.isEmpty()) {
            return;
        }
        long filled = required.stream()
                .filter(slot -> frame.getCollectedSlots().get(slot) != null)
                .count();
        frame.updateProgress((double) filled / required.size(), now);
    }

    private Set<String> requiredSlots(IntentFrame frame) {
        RequiredSlotsProvider provider = requiredSlotsProvider.getIfAvailable();
        if (provider != null) {
            List<String> declared = provider.requiredSlots(frame.getIntentName());
            if (declared != null && !declared.isEmpty()) {
                return new LinkedHashSet<>(declared);
            }
        }
        Set<String> derived = new LinkedHashSet<>(frame.getCollectedSlots().keySet());
        derived.addAll(frame.getMissingSlots());
        return derived;
    }

    private void requireIntent(String intentName) {
        if (intentName == null || intentName.isBlank()) {
            throw new IllegalArgumentException("intentName must not be blank");
        }
    }
}
