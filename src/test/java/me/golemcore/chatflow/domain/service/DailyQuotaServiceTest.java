package me.golemcore.chatflow.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DailyQuotaServiceTest {

    private static final String CHANNEL = "group_1";
    private static final Instant MORNING = Instant.parse("2026-03-10T08:00:00Z");

    private MutableClock clock;
    private DailyQuotaService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MORNING, ZoneOffset.UTC);
        service = new DailyQuotaService(clock);
    }

    @Test
    void shouldReturnZeroWithoutBoost() {
        assertEquals(0, service.getBoost(CHANNEL));
    }

    @Test
    void shouldSetAndReplaceBoost() {
        service.setBoost(CHANNEL, 5);
        assertEquals(5, service.getBoost(CHANNEL));

        service.setBoost(CHANNEL, 2);
        assertEquals(2, service.getBoost(CHANNEL));
    }

    @Test
    void shouldAccumulateBoostWithinSameDay() {
        assertEquals(3, service.addBoost(CHANNEL, 3));
        clock.advance(Duration.ofHours(10));

        assertEquals(7, service.addBoost(CHANNEL, 4));
        assertEquals(7, service.getBoost(CHANNEL));
    }

    @Test
    void shouldExpireBoostOnNextDay() {
        service.setBoost(CHANNEL, 5);

        clock.advance(Duration.ofDays(1));

        assertEquals(0, service.getBoost(CHANNEL));
    }

    @Test
    void shouldStartFromZeroWhenAddingAfterRollover() {
        service.addBoost(CHANNEL, 5);
        clock.advance(Duration.ofDays(1));

        assertEquals(2, service.addBoost(CHANNEL, 2));
    }

    @Test
    void shouldSaturateBoostInsteadOfOverflowing() {
        service.setBoost(CHANNEL, Integer.MAX_VALUE - 1);

        assertEquals(Integer.MAX_VALUE, service.addBoost(CHANNEL, 10));
        assertEquals(Integer.MAX_VALUE, service.getBoost(CHANNEL));
    }

    @Test
    void shouldClearBoostAndKeepOtherChannels() {
        service.setBoost(CHANNEL, 5);
        service.setBoost("group_2", 1);

        service.clearBoost(CHANNEL);
        service.clearBoost("unknown");

        assertEquals(0, service.getBoost(CHANNEL));
        assertEquals(1, service.getBoost("group_2"));
    }

    private static final class MutableClock extends Clock {

        private Instant currentInstant;
        private final ZoneId zone;

        private MutableClock(Instant instant, ZoneId zone) {
            this.currentInstant = instant;
            this.zone = zone;
        }

        private void advance(Duration duration) {
            currentInstant = currentInstant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(currentInstant, zone);
        }

        @Override
        public Instant instant() {
            return currentInstant;
        }
    }
}
