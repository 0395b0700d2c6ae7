package me.golemcore.chatflow.ratelimit;

import me.golemcore.chatflow.domain.model.ReplyLimitResult;
import me.golemcore.chatflow.domain.service.DailyQuotaService;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import me.golemcore.chatflow.port.outbound.ReplyCountPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DailyReplyLimiterTest {

    private static final String CHANNEL = "group_1";

    private ChatflowProperties properties;
    private DailyQuotaService dailyQuotaService;
    private ReplyCountPort replyCountPort;
    private ObjectProvider<ReplyCountPort> replyCountPortProvider;
    private DailyReplyLimiter limiter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new ChatflowProperties();
        properties.getQuota().setDailyReplyLimit(3);
        dailyQuotaService = mock(DailyQuotaService.class);
        replyCountPort = mock(ReplyCountPort.class);
        replyCountPortProvider = mock(ObjectProvider.class);
        when(replyCountPortProvider.getIfAvailable()).thenReturn(replyCountPort);
        limiter = new DailyReplyLimiter(properties, dailyQuotaService, replyCountPortProvider);
    }

    @Test
    void shouldAllowEverythingWhenLimitDisabled() {
        properties.getQuota().setDailyReplyLimit(0);
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(1000);

        ReplyLimitResult result = limiter.check(CHANNEL, "u1");

        assertTrue(result.isAllowed());
        assertEquals(Integer.MAX_VALUE, result.getEffectiveLimit());
        verify(replyCountPort, never()).getDailyReplyCount(anyString());
    }

    @Test
    void shouldAllowBelowLimit() {
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(2);

        ReplyLimitResult result = limiter.check(CHANNEL, "u1");

        assertTrue(result.isAllowed());
        assertEquals(2, result.getDailyCount());
        assertEquals(3, result.getEffectiveLimit());
    }

    @Test
    void shouldDenyWhenLimitReached() {
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(3);

        ReplyLimitResult result = limiter.check(CHANNEL, "u1");

        assertFalse(result.isAllowed());
        assertEquals("Daily reply limit reached (3/3)", result.getReason());
    }

    @Test
    void shouldRaiseLimitByTodaysBoost() {
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(4);
        when(dailyQuotaService.getBoost(CHANNEL)).thenReturn(2);

        ReplyLimitResult result = limiter.check(CHANNEL, "u1");

        assertTrue(result.isAllowed());
        assertEquals(5, result.getEffectiveLimit());
    }

    @Test
    void shouldKeepLimitPositiveWithHugeBoost() {
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(100);
        when(dailyQuotaService.getBoost(CHANNEL)).thenReturn(Integer.MAX_VALUE);

        ReplyLimitResult result = limiter.check(CHANNEL, "u1");

        assertTrue(result.isAllowed());
        assertEquals(Integer.MAX_VALUE, result.getEffectiveLimit());
    }

    @Test
    void shouldNotLimitExemptSenders() {
        properties.getQuota().setExemptSenders(List.of("admin"));
        when(replyCountPort.getDailyReplyCount(CHANNEL)).thenReturn(10);

        assertTrue(limiter.check(CHANNEL, "admin").isAllowed());
        assertFalse(limiter.check(CHANNEL, "u1").isAllowed());
    }

    @Test
    void shouldTreatMissingCountPortAsZeroReplies() {
        when(replyCountPortProvider.getIfAvailable()).thenReturn(null);

        ReplyLimitResult result = limiter.check(CHANNEL, null);

        assertTrue(result.isAllowed());
        assertEquals(0, result.getDailyCount());
    }
}
