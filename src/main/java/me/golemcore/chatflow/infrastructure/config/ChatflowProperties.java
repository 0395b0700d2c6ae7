package me.golemcore.chatflow.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "chatflow")
@Data
public class ChatflowProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private BroadcastProperties broadcast = new BroadcastProperties();
    private QuotaProperties quota = new QuotaProperties();

    /**
     * Debounce window for a channel: the per-channel override when configured,
     * the scheduler default otherwise.
     */
    public Duration resolveDebounce(String channelKey) {
        ChannelProperties channel = channels.get(channelKey);
        if (channel != null && channel.getDebounce() != null && !channel.getDebounce().isNegative()) {
            return channel.getDebounce();
        }
        return scheduler.getDebounce();
    }

    @Data
    public static class SchedulerProperties {
        private Duration debounce = Duration.ofSeconds(2);
        private int maxAttempts = 3;
        private Duration cancelAwaitTimeout = Duration.ofSeconds(10);
        private boolean presenceEnabled = true;
    }

    @Data
    public static class ChannelProperties {
        private Duration debounce;
    }

    @Data
    public static class BroadcastProperties {
        private int inboxCapacity = 256;
    }

    // ==================== QUOTA ====================

    @Data
    public static class QuotaProperties {
        private int dailyReplyLimit = 0;
        private List<String> exemptSenders = new ArrayList<>();
    }
}
