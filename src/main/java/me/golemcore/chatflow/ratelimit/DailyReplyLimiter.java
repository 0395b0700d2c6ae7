package me.golemcore.chatflow.ratelimit;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatflow.domain.model.ReplyLimitResult;
import me.golemcore.chatflow.domain.service.DailyQuotaService;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import me.golemcore.chatflow.port.outbound.ReplyCountPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Daily bot-reply limit per channel.
 *
 * <p>
 * The effective limit is {@code chatflow.quota.daily-reply-limit} plus the
 * channel's same-day boost from {@link DailyQuotaService}. A limit of zero or
 * less disables the check; senders listed in
 * {@code chatflow.quota.exempt-senders} are never limited.
 *
 * @see DailyQuotaService
 */
@Component
@Slf4j
public class DailyReplyLimiter {

    private final ChatflowProperties properties;
    private final DailyQuotaService dailyQuotaService;
    private final ObjectProvider<ReplyCountPort> replyCountPortProvider;

    public DailyReplyLimiter(ChatflowProperties properties, DailyQuotaService dailyQuotaService,
            ObjectProvider<ReplyCountPort> replyCountPortProvider) {
        this.properties = properties;
        this.dailyQuotaService = dailyQuotaService;
        this.replyCountPortProvider = replyCountPortProvider;
    }

    public ReplyLimitResult check(String channelKey, String senderId) {
        ChatflowProperties.QuotaProperties quota = properties.getQuota();
        if (quota.getDailyReplyLimit() <= 0) {
            return ReplyLimitResult.unlimited();
        }
        if (senderId != null && quota.getExemptSenders().contains(senderId)) {
            return ReplyLimitResult.unlimited();
        }

        int effectiveLimit = saturatedAdd(quota.getDailyReplyLimit(), dailyQuotaService.getBoost(channelKey));
        int dailyCount = resolveDailyCount(channelKey);
        if (dailyCount >= effectiveLimit) {
            log.info("[Quota] daily reply limit reached for channel {} ({}/{})", channelKey, dailyCount,
                    effectiveLimit);
            return ReplyLimitResult.denied(dailyCount, effectiveLimit);
        }
        return ReplyLimitResult.allowed(dailyCount, effectiveLimit);
    }

    private static int saturatedAdd(int left, int right) {
        long sum = (long) left + right;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, sum));
    }

    private int resolveDailyCount(String channelKey) {
        ReplyCountPort replyCountPort = replyCountPortProvider.getIfAvailable();
        if (replyCountPort == null) {
            return 0;
        }
        return replyCountPort.getDailyReplyCount(channelKey);
    }
}
