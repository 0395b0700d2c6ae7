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
import me.golemcore.chatflow.domain.model.QuotaRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Temporary same-day quota boosts per channel.
 *
 * <p>
 * Boosts live in memory only and are lost on restart. A boost recorded on an
 * earlier day reads as zero; stale records are not purged, only ignored until
 * overwritten.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyQuotaService {

    private final Clock clock;

    private final Map<String, QuotaRecord> boosts = new ConcurrentHashMap<>();

    public int getBoost(String channelKey) {
        QuotaRecord quotaRecord = boosts.get(channelKey);
        if (quotaRecord == null) {
            return 0;
        }
        return quotaRecord.effectiveBoost(today());
    }

    public void setBoost(String channelKey, int amount) {
        boosts.put(channelKey, new QuotaRecord(today(), amount));
        log.info("[Quota] boost for channel {} set to {} for today", channelKey, amount);
    }

    /**
     * @return the boost after adding {@code amount} to today's value, saturated
     *         at the {@code int} range
     */
    public int addBoost(String channelKey, int amount) {
        LocalDate today = today();
        QuotaRecord updated = boosts.compute(channelKey, (key, existing) -> {
            int current = existing != null ? existing.effectiveBoost(today) : 0;
            long total = (long) current + amount;
            return new QuotaRecord(today, (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, total)));
        });
        log.info("[Quota] boost for channel {} raised by {} to {}", channelKey, amount, updated.boostAmount());
        return updated.boostAmount();
    }

    public void clearBoost(String channelKey) {
        if (boosts.remove(channelKey) != null) {
            log.info("[Quota] boost for channel {} cleared", channelKey);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
