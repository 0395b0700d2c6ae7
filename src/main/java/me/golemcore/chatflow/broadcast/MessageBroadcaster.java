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

import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import org.springframework.stereotype.Component;

/**
 * New chat messages, one topic per channel.
 */
@Component
public class MessageBroadcaster extends TopicBroadcaster<ChatMessage> {

    public MessageBroadcaster(ChatflowProperties properties) {
        super("messages", properties.getBroadcast().getInboxCapacity());
    }

    public int publish(ChatMessage message) {
        return publish(message.getChannelKey(), message);
    }
}
