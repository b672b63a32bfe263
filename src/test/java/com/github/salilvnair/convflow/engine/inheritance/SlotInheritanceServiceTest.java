package com.github.salilvnair.convflow.engine.inheritance;

import com.github.salilvnair.convflow.engine.inheritance.cache.InheritanceCacheManager;
import com.github.salilvnair.convflow.engine.inheritance.cache.SlotPatternTracker;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRequest;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceResult;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRule;
import com.github.salilvnair.convflow.engine.inheritance.model.SkippedRule;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceKind;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceValue;
import com.github.salilvnair.convflow.engine.inheritance.source.SessionContextProvider;
import com.github.salilvnair.convflow.engine.inheritance.source.SlotHistoryProvider;
import com.github.salilvnair.convflow.engine.inheritance.source.UserProfile;
import com.github.salilvnair.convflow.engine.inheritance.source.UserProfileProvider;
import com.github.salilvnair.convflow.support.ConvFlowFixture;
import com.github.salilvnair.convflow.support.Providers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convflow.support.TestConstants.BOOM;
import static com.github.salilvnair.convflow.support.TestConstants.CITY_BEIJING;
import static com.github.salilvnair.convflow.support.TestConstants.CITY_SHANGHAI;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_BOOK_FLIGHT;
import static com.github.salilvnair.convflow.support.TestConstants.PHONE_FORMATTED;
import static com.github.salilvnair.convflow.support.TestConstants.PHONE_RAW;
import static com.github.salilvnair.convflow.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_ARRIVAL_CITY;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_CARD_NUMBER;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_DEPARTURE_CITY;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_PASSENGER_NAME;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_PHONE_NUMBER;
import static com.github.salilvnair.convflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlotInheritanceServiceTest {

    @Mock
    private UserProfileProvider profileProvider;
    @Mock
    private SessionContextProvider sessionContextProvider;
    @Mock
    private SlotHistoryProvider historyProvider;

    private ConvFlowFixture fixture;
    private SlotInheritanceEngine engine;
    private InheritanceCacheManager cacheManager;
    private SlotPatternTracker patternTracker;
    private SlotInheritanceService service;

    @BeforeEach
    void setUp() {
        fixture = new ConvFlowFixture();
        engine = fixture.inheritanceEngine();
        engine.init();
        cacheManager = new InheritanceCacheManager(fixture.store, fixture.properties, fixture.clock);
        patternTracker = new SlotPatternTracker(fixture.properties);
        service = new SlotInheritanceService(
                engine,
                cacheManager,
                patternTracker,
                fixture.callGuard,
                Providers.of(SlotHistoryProvider.class, historyProvider),
                Providers.of(SessionContextProvider.class, sessionContextProvider),
                Providers.of(UserProfileProvider.class, profileProvider),
                fixture.properties,
                fixture.clock
        );
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private UserProfile profile() {
        return new UserProfile(
                Map.of(SLOT_PASSENGER_NAME, "li lei"),
                Map.of(SLOT_PHONE_NUMBER, Map.of("most_frequent", PHONE_RAW, "count", 7)),
                fixture.clock.instant().minus(Duration.ofDays(3))
        );
    }

    private InheritanceRequest request(List<String> slots) {
        return InheritanceRequest.builder()
                .userId(USER_ID)
                .sessionId(SESSION_ID)
                .intentName(INTENT_BOOK_FLIGHT)
                .requiredSlots(slots)
                .build();
    }

    @Test
    void fillsSlotsFromProfileAndSession() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of(SLOT_DEPARTURE_CITY, CITY_BEIJING));
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());

        InheritanceResult result = service.inherit(
                request(List.of(SLOT_DEPARTURE_CITY, SLOT_PASSENGER_NAME, SLOT_PHONE_NUMBER)));

        assertEquals(CITY_BEIJING, result.values().get(SLOT_DEPARTURE_CITY));
        assertEquals("Li Lei", result.values().get(SLOT_PASSENGER_NAME));
        assertEquals(PHONE_FORMATTED, result.values().get(SLOT_PHONE_NUMBER));
        assertEquals("user profile (phone_number)", result.sources().get(SLOT_PHONE_NUMBER));
        assertFalse(result.cached());
    }

    @Test
    void secondIdenticalRequestIsServedFromCache() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of(SLOT_DEPARTURE_CITY, CITY_BEIJING));
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());
        InheritanceRequest request = request(List.of(SLOT_PHONE_NUMBER, SLOT_DEPARTURE_CITY));

        InheritanceResult first = service.inherit(request);
        InheritanceResult second = service.inherit(request);

        assertFalse(first.cached());
        assertTrue(second.cached());
        assertEquals(first.values(), second.values());
        assertEquals(first.sources(), second.sources());
        assertEquals(1L, cacheManager.statistics().hits());
        assertEquals(1L, cacheManager.statistics().misses());
        assertEquals(Map.of("departure_city,phone_number", 1L), patternTracker.combinations(USER_ID));
        verify(profileProvider, times(2)).profile(USER_ID);
    }

    @Test
    void cachedResultEqualsComputedResultForNonTextValues() {
        engine.addRule(InheritanceRule.builder()
                .ruleId("session_passenger_count")
                .sourceSlot("passenger_count")
                .targetSlot("passenger_count")
                .sourceKind(SourceKind.SESSION)
                .priority(5)
                .build());
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of("passenger_count", 2L));
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());
        InheritanceRequest request = request(List.of("passenger_count"));

        InheritanceResult first = service.inherit(request);
        InheritanceResult second = service.inherit(request);

        assertTrue(second.cached());
        assertEquals(first.values(), second.values());
        assertEquals(2L, second.values().get("passenger_count"));
    }

    @Test
    void changedCurrentValuesMissTheCache() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of());
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());

        service.inherit(request(List.of(SLOT_PHONE_NUMBER)));
        InheritanceResult changed = service.inherit(request(List.of(SLOT_PHONE_NUMBER)).toBuilder()
                .currentValues(Map.of(SLOT_ARRIVAL_CITY, CITY_SHANGHAI))
                .build());

        assertFalse(changed.cached());
        assertEquals(0L, cacheManager.statistics().hits());
    }

    @Test
    void cacheCanBeBypassedPerRequest() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of());
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());
        InheritanceRequest request = request(List.of(SLOT_PHONE_NUMBER)).toBuilder().useCache(false).build();

        service.inherit(request);
        InheritanceResult second = service.inherit(request);

        assertFalse(second.cached());
        assertEquals(0L, cacheManager.statistics().requests());
        assertTrue(patternTracker.combinations(USER_ID).isEmpty());
    }

    @Test
    void failingSessionSourceOnlyDisablesItsOwnRules() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenThrow(new IllegalStateException(BOOM));
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());

        InheritanceResult result = service.inherit(request(List.of(SLOT_DEPARTURE_CITY, SLOT_PHONE_NUMBER)));

        assertEquals(PHONE_FORMATTED, result.values().get(SLOT_PHONE_NUMBER));
        assertFalse(result.values().containsKey(SLOT_DEPARTURE_CITY));
        assertTrue(result.skippedRules().contains(
                new SkippedRule("session_departure_city", SkippedRule.SOURCE_UNAVAILABLE)));
    }

    @Test
    void sessionTimestampsGateTimeSensitiveRules() {
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of(
                SLOT_CARD_NUMBER, "6222",
                SLOT_CARD_NUMBER + "_timestamp", fixture.clock.instant().minus(Duration.ofMinutes(40)),
                SLOT_DEPARTURE_CITY, CITY_BEIJING,
                SLOT_DEPARTURE_CITY + "_timestamp", fixture.clock.instant().minus(Duration.ofHours(2)).toEpochMilli()
        ));
        when(historyProvider.recentSlotValues(USER_ID, 10)).thenReturn(Map.of());

        InheritanceResult result = service.inherit(request(List.of(SLOT_CARD_NUMBER, SLOT_DEPARTURE_CITY)));

        assertTrue(result.inheritedValues().isEmpty());
        assertTrue(result.skippedRules().contains(new SkippedRule("session_card_number", SkippedRule.CONDITION_FALSE)));
        assertTrue(result.skippedRules().contains(new SkippedRule("session_departure_city", SkippedRule.TTL_EXPIRED)));
    }

    @Test
    void conversationContextComesFromHistoryAndRequest() {
        engine.addRule(InheritanceRule.builder()
                .ruleId("context_arrival")
                .sourceKind(SourceKind.CONTEXT)
                .sourceSlot(SLOT_ARRIVAL_CITY)
                .targetSlot(SLOT_ARRIVAL_CITY)
                .priority(1)
                .build());
        engine.addRule(InheritanceRule.builder()
                .ruleId("context_departure")
                .sourceKind(SourceKind.CONTEXT)
                .sourceSlot(SLOT_DEPARTURE_CITY)
                .targetSlot(SLOT_DEPARTURE_CITY)
                .priority(50)
                .build());
        when(profileProvider.profile(USER_ID)).thenReturn(profile());
        when(sessionContextProvider.currentContext(SESSION_ID)).thenReturn(Map.of());
        when(historyProvider.recentSlotValues(USER_ID, 10))
                .thenReturn(Map.of(SLOT_ARRIVAL_CITY, SourceValue.of(CITY_SHANGHAI, fixture.clock.instant())));

        InheritanceResult result = service.inherit(request(List.of(SLOT_ARRIVAL_CITY, SLOT_DEPARTURE_CITY)).toBuilder()
                .conversationContext(Map.of(SLOT_DEPARTURE_CITY, CITY_BEIJING))
                .useCache(false)
                .build());

        assertEquals(CITY_SHANGHAI, result.values().get(SLOT_ARRIVAL_CITY));
        assertEquals(CITY_BEIJING, result.values().get(SLOT_DEPARTURE_CITY));
        assertEquals("conversation context (departure_city)", result.sources().get(SLOT_DEPARTURE_CITY));
    }

    @Test
    void missingCollaboratorsLeaveOnlyRequestSources() {
        SlotInheritanceService bare = new SlotInheritanceService(
                engine,
                cacheManager,
                patternTracker,
                fixture.callGuard,
                Providers.empty(SlotHistoryProvider.class),
                Providers.empty(SessionContextProvider.class),
                Providers.empty(UserProfileProvider.class),
                fixture.properties,
                fixture.clock
        );
        engine.addRule(InheritanceRule.builder()
                .ruleId("default_city")
                .sourceKind(SourceKind.DEFAULT)
                .sourceSlot(SLOT_DEPARTURE_CITY)
                .targetSlot(SLOT_DEPARTURE_CITY)
                .priority(1)
                .build());

        InheritanceResult result = bare.inherit(request(List.of(SLOT_DEPARTURE_CITY, SLOT_PHONE_NUMBER)).toBuilder()
                .defaultValues(Map.of(SLOT_DEPARTURE_CITY, CITY_BEIJING))
                .build());

        assertEquals(CITY_BEIJING, result.values().get(SLOT_DEPARTURE_CITY));
        assertTrue(result.skippedRules().contains(new SkippedRule("profile_phone_number", SkippedRule.SOURCE_UNAVAILABLE)));
    }
}
