package me.golemcore.chatflow.broadcast;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chatflow.domain.model.ChannelEvent;
import me.golemcore.chatflow.domain.model.ChannelEventType;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import org.springframework.stereotype.Component;

/**
 * Channel-list changes, delivered on a single global topic.
 */
@Component
public class ChannelBroadcaster extends TopicBroadcaster<ChannelEvent> {

    public static final String CHANNEL_LIST_TOPIC = "channel-list";

    public ChannelBroadcaster(ChatflowProperties properties) {
        super("channels", properties.getBroadcast().getInboxCapacity());
    }

    public TopicSubscription<ChannelEvent> subscribe() {
        return subscribe(CHANNEL_LIST_TOPIC);
    }

    public int publish(ChannelEvent event) {
        return publish(CHANNEL_LIST_TOPIC, event);
    }

    public int publishUpdate(ChannelEventType type, String channelKey, String channelName, Boolean active) {
        return publish(ChannelEvent.builder()
                .type(type)
                .channelKey(channelKey)
                .channelName(channelName)
                .active(active)
                .build());
    }

    public int subscriberCount() {
        return subscriberCount(CHANNEL_LIST_TOPIC);
    }
}
