package me.golemcore.chatflow.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatflow.broadcast.MessageBroadcaster;
import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.domain.model.InboundChatEvent;
import me.golemcore.chatflow.domain.model.ReplyLimitResult;
import me.golemcore.chatflow.ratelimit.DailyReplyLimiter;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Entry point for inbound chat traffic: broadcasts every message to live
 * observers and schedules an agent run for messages that ask for one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatEventIntake {

    private final MessageBroadcaster messageBroadcaster;
    private final DailyReplyLimiter dailyReplyLimiter;
    private final ChannelRunScheduler channelRunScheduler;

    @EventListener
    public void onInboundChatEvent(InboundChatEvent event) {
        onUserMessage(event.message(), event.trigger());
    }

    /**
     * @return {@code true} if an agent run was scheduled
     */
    public boolean onUserMessage(ChatMessage message, boolean trigger) {
        String channelKey = message.getChannelKey();
        messageBroadcaster.publish(message);
        if (!trigger) {
            return false;
        }

        ReplyLimitResult limit = dailyReplyLimiter.check(channelKey, message.getSenderId());
        if (!limit.isAllowed()) {
            log.info("[Intake] run skipped for channel {}: {}", channelKey, limit.getReason());
            return false;
        }

        log.debug("[Intake] scheduling run (channel={}, sender={})", channelKey, message.getSenderId());
        channelRunScheduler.submit(channelKey, message);
        return true;
    }

    /**
     * System-originated runs are not subject to the daily reply limit.
     */
    public void onSystemTrigger(String channelKey) {
        log.debug("[Intake] system trigger (channel={})", channelKey);
        channelRunScheduler.trigger(channelKey);
    }
}
