package me.golemcore.chatflow.broadcast;

import me.golemcore.chatflow.domain.model.ChannelEvent;
import me.golemcore.chatflow.domain.model.ChannelEventType;
import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ChannelBroadcasterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Test
    void shouldPublishChannelListEventsOnGlobalTopic() {
        ChannelBroadcaster broadcaster = new ChannelBroadcaster(new ChatflowProperties());
        TopicSubscription<ChannelEvent> subscription = broadcaster.subscribe();
        assertEquals(1, broadcaster.subscriberCount());
        assertEquals(ChannelBroadcaster.CHANNEL_LIST_TOPIC, subscription.getTopicKey());

        assertEquals(1, broadcaster.publishUpdate(ChannelEventType.DEACTIVATED, "group_42", "Book club", false));

        StepVerifier.create(subscription.events().take(1))
                .expectNext(new ChannelEvent(ChannelEventType.DEACTIVATED, "group_42", "Book club", false))
                .expectComplete()
                .verify(TIMEOUT);
        assertEquals(0, broadcaster.subscriberCount());
    }

    @Test
    void shouldRouteMessagesByChannelKey() {
        MessageBroadcaster broadcaster = new MessageBroadcaster(new ChatflowProperties());
        var groupSubscription = broadcaster.subscribe("group_1");
        var otherSubscription = broadcaster.subscribe("group_2");
        ChatMessage message = ChatMessage.builder()
                .channelKey("group_1")
                .senderId("u1")
                .content("hello")
                .build();

        assertEquals(1, broadcaster.publish(message));

        StepVerifier.create(groupSubscription.events().take(1))
                .expectNext(message)
                .expectComplete()
                .verify(TIMEOUT);
        assertEquals(1, broadcaster.subscriberCount("group_2"));
        otherSubscription.close();
        assertEquals(0, broadcaster.subscriberCount("group_2"));
    }
}
