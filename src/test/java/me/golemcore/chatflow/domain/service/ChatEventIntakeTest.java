package me.golemcore.chatflow.domain.service;

import me.golemcore.chatflow.broadcast.MessageBroadcaster;
import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.domain.model.InboundChatEvent;
import me.golemcore.chatflow.domain.model.ReplyLimitResult;
import me.golemcore.chatflow.ratelimit.DailyReplyLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChatEventIntakeTest {

    private static final String CHANNEL = "group_1";

    private MessageBroadcaster messageBroadcaster;
    private DailyReplyLimiter dailyReplyLimiter;
    private ChannelRunScheduler channelRunScheduler;
    private ChatEventIntake intake;

    @BeforeEach
    void setUp() {
        messageBroadcaster = mock(MessageBroadcaster.class);
        dailyReplyLimiter = mock(DailyReplyLimiter.class);
        channelRunScheduler = mock(ChannelRunScheduler.class);
        when(dailyReplyLimiter.check(anyString(), any())).thenReturn(ReplyLimitResult.unlimited());
        intake = new ChatEventIntake(messageBroadcaster, dailyReplyLimiter, channelRunScheduler);
    }

    @Test
    void shouldBroadcastAndScheduleTriggeringMessage() {
        ChatMessage message = message("m1");

        assertTrue(intake.onUserMessage(message, true));

        verify(messageBroadcaster).publish(message);
        verify(channelRunScheduler).submit(CHANNEL, message);
    }

    @Test
    void shouldOnlyBroadcastNonTriggeringMessage() {
        ChatMessage message = message("m1");

        assertFalse(intake.onUserMessage(message, false));

        verify(messageBroadcaster).publish(message);
        verifyNoInteractions(dailyReplyLimiter, channelRunScheduler);
    }

    @Test
    void shouldSkipRunWhenDailyLimitReached() {
        ChatMessage message = message("m1");
        when(dailyReplyLimiter.check(CHANNEL, "u1")).thenReturn(ReplyLimitResult.denied(5, 5));

        assertFalse(intake.onUserMessage(message, true));

        verify(messageBroadcaster).publish(message);
        verify(channelRunScheduler, never()).submit(anyString(), any());
    }

    @Test
    void shouldHandlePublishedInboundEvent() {
        ChatMessage message = message("m2");

        intake.onInboundChatEvent(new InboundChatEvent(message, true));

        verify(channelRunScheduler).submit(CHANNEL, message);
    }

    @Test
    void shouldForwardSystemTriggerWithoutLimitCheck() {
        intake.onSystemTrigger(CHANNEL);

        verify(channelRunScheduler).trigger(CHANNEL);
        verifyNoInteractions(dailyReplyLimiter);
    }

    private static ChatMessage message(String messageId) {
        return ChatMessage.builder()
                .channelKey(CHANNEL)
                .messageId(messageId)
                .senderId("u1")
                .content("hello")
                .build();
    }
}
