package me.golemcore.chatflow.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A chat message flowing through the pipeline: scheduled for an agent run and
 * broadcast to live observers of its channel.
 *
 * <p>
 * A message without a platform message id and without content is an
 * <em>empty</em> trigger, used when a run is requested by the system rather
 * than by a user.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String id;
    private String channelKey;
    private String messageId;
    private String senderId;
    private String senderName;
    private String content;
    private Instant timestamp;
    private Map<String, Object> metadata;

    public static ChatMessage empty(String channelKey) {
        return ChatMessage.builder()
                .channelKey(channelKey)
                .build();
    }

    public boolean isEmpty() {
        return messageId == null && (content == null || content.isBlank());
    }

    public boolean hasMessageId() {
        return messageId != null && !messageId.isBlank();
    }
}
