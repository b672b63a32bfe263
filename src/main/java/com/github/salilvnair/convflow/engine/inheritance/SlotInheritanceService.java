package com.github.salilvnair.convflow.engine.inheritance;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.inheritance.cache.CachedInheritanceResult;
import com.github.salilvnair.convflow.engine.inheritance.cache.ContextFingerprint;
import com.github.salilvnair.convflow.engine.inheritance.cache.InheritanceCacheKey;
import com.github.salilvnair.convflow.engine.inheritance.cache.InheritanceCacheManager;
import com.github.salilvnair.convflow.engine.inheritance.cache.SlotPatternTracker;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRequest;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceResult;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceBundle;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceKind;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceValue;
import com.github.salilvnair.convflow.engine.inheritance.source.SessionContextProvider;
import com.github.salilvnair.convflow.engine.inheritance.source.SlotHistoryProvider;
import com.github.salilvnair.convflow.engine.inheritance.source.UserProfile;
import com.github.salilvnair.convflow.engine.inheritance.source.UserProfileProvider;
import com.github.salilvnair.convflow.engine.support.CollaboratorCallGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gathers the slot sources for a user and session, serves the result from the
 * inheritance cache when the fingerprint matches and otherwise runs the engine.
 * A collaborator that fails or times out only makes its own source unavailable.
 */
@Slf4j
@Service
public class SlotInheritanceService {

    private static final String TIMESTAMP_SUFFIX = "_timestamp";

    private final SlotInheritanceEngine engine;
    private final InheritanceCacheManager cacheManager;
    private final SlotPatternTracker patternTracker;
    private final CollaboratorCallGuard callGuard;
    private final ObjectProvider<SlotHistoryProvider> historyProvider;
    private final ObjectProvider<SessionContextProvider> sessionContextProvider;
    private final ObjectProvider<UserProfileProvider> userProfileProvider;
    private final ConvFlowProperties properties;
    private final Clock clock;

    public SlotInheritanceService(SlotInheritanceEngine engine,
                                  InheritanceCacheManager cacheManager,
                                  SlotPatternTracker patternTracker,
                                  CollaboratorCallGuard callGuard,
                                  ObjectProvider<SlotHistoryProvider> historyProvider,
                                  ObjectProvider<SessionContextProvider> sessionContextProvider,
                                  ObjectProvider<UserProfileProvider> userProfileProvider,
                                  ConvFlowProperties properties,
                                  Clock clock) {
        this.engine = engine;
        this.cacheManager = cacheManager;
        this.patternTracker = patternTracker;
        this.callGuard = callGuard;
        this.historyProvider = historyProvider;
        this.sessionContextProvider = sessionContextProvider;
        this.userProfileProvider = userProfileProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public InheritanceResult inherit(InheritanceRequest request) {
        Instant now = clock.instant();
        SourceBundle.Builder bundle = SourceBundle.builder(now);

        Map<String, SourceValue> conversation = new LinkedHashMap<>();
        Optional<Map<String, SourceValue>> history = fetchHistory(request.getUserId());
        history.ifPresent(conversation::putAll);
        request.getConversationContext().forEach((slot, value) -> conversation.put(slot, SourceValue.of(value, now)));
        if (history.isEmpty() && request.getConversationContext().isEmpty()) {
            bundle.unavailable(SourceKind.CONTEXT);
        }
        bundle.source(SourceKind.CONTEXT, conversation);

        Optional<Map<String, Object>> session = fetchSessionContext(request.getSessionId());
        session.ifPresentOrElse(
                context -> bundle.source(SourceKind.SESSION, withTimestamps(context, now)),
                () -> bundle.unavailable(SourceKind.SESSION));

        Optional<UserProfile> profile = fetchProfile(request.getUserId());
        profile.ifPresentOrElse(
                p -> bundle.values(SourceKind.USER_PROFILE, p.attributes(), p.lastModified()),
                () -> bundle.unavailable(SourceKind.USER_PROFILE));

        bundle.values(SourceKind.DEPENDENCY, request.getDependencyValues(), now);
        bundle.values(SourceKind.DEFAULT, request.getDefaultValues(), now);
        SourceBundle sources = bundle.build();

        boolean useCache = properties.getCache().isEnabled() && request.isUseCache();
        InheritanceCacheKey key = null;
        if (useCache) {
            String fingerprint = ContextFingerprint.compute(
                    request.getCurrentValues(),
                    profile.map(UserProfile::lastModified).orElse(null),
                    session.map(Map::keySet).orElse(null),
                    conversation.keySet()
            );
            key = InheritanceCacheKey.of(request.getUserId(), request.getIntentName(), request.getRequiredSlots(), fingerprint);
            Optional<CachedInheritanceResult> cached = cacheManager.get(key);
            if (cached.isPresent()) {
                return InheritanceResult.fromCache(cached.get().values(),
                        cached.get().sources() == null ? Map.of() : cached.get().sources());
            }
        }

        InheritanceResult result = engine.inherit(request.getRequiredSlots(), request.getCurrentValues(), sources);
        if (key != null && !result.values().isEmpty()) {
            cacheManager.set(key, result.values(), result.sources());
            patternTracker.record(request.getUserId(), request.getRequiredSlots());
        }
        log.info("Inheritance done userId={} intent={} inherited={} applied={} skipped={}",
                request.getUserId(), request.getIntentName(), result.sources().keySet(),
                result.appliedRules().size(), result.skippedRules().size());
        return result;
    }

    private Optional<Map<String, SourceValue>> fetchHistory(String userId) {
        SlotHistoryProvider provider = historyProvider.getIfAvailable();
        if (provider == null || userId == null) {
            return Optional.empty();
        }
        int limit = properties.getInheritance().getHistoryLimit();
        return guarded("slot history", () -> provider.recentSlotValues(userId, limit));
    }

    private Optional<Map<String, Object>> fetchSessionContext(String sessionId) {
        SessionContextProvider provider = sessionContextProvider.getIfAvailable();
        if (provider == null || sessionId == null) {
            return Optional.empty();
        }
        return guarded("session context", () -> provider.currentContext(sessionId));
    }

    private Optional<UserProfile> fetchProfile(String userId) {
        UserProfileProvider provider = userProfileProvider.getIfAvailable();
        if (provider == null || userId == null) {
            return Optional.empty();
        }
        return guarded("user profile", () -> provider.profile(userId));
    }

    private <T> Optional<T> guarded(String source, Supplier<T> call) {
        Duration timeout = properties.getInheritance().getSourceTimeout();
        try {
            return Optional.ofNullable(callGuard.call(source, timeout, call));
        } catch (ConvFlowException e) {
            log.warn("Slot source degraded source={} code={}", source, e.getErrorCode());
            return Optional.empty();
        }
    }

    /**
     * A session value may carry its observation time under {@code <slot>_timestamp};
     * otherwise it is taken as current.
     */
    private Map<String, SourceValue> withTimestamps(Map<String, Object> context, Instant now) {
        Map<String, SourceValue> values = new LinkedHashMap<>();
        context.forEach((slot, value) -> {
            if (!slot.endsWith(TIMESTAMP_SUFFIX)) {
                values.put(slot, SourceValue.of(value, timestamp(context.get(slot + TIMESTAMP_SUFFIX), now)));
            }
        });
        return values;
    }

    private Instant timestamp(Object raw, Instant fallback) {
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        if (raw instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unreadable slot timestamp value={}", text);
            }
        }
        return fallback;
    }
}
