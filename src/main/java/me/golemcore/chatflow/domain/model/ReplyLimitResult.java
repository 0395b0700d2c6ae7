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

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReplyLimitResult {

    private boolean allowed;
    private int dailyCount;
    private int effectiveLimit;
    private String reason;

    public static ReplyLimitResult allowed(int dailyCount, int effectiveLimit) {
        return ReplyLimitResult.builder()
                .allowed(true)
                .dailyCount(dailyCount)
                .effectiveLimit(effectiveLimit)
                .build();
    }

    public static ReplyLimitResult unlimited() {
        return ReplyLimitResult.builder()
                .allowed(true)
                .effectiveLimit(Integer.MAX_VALUE)
                .build();
    }

    public static ReplyLimitResult denied(int dailyCount, int effectiveLimit) {
        return ReplyLimitResult.builder()
                .allowed(false)
                .dailyCount(dailyCount)
                .effectiveLimit(effectiveLimit)
                .reason("Daily reply limit reached (" + dailyCount + "/" + effectiveLimit + ")")
                .build();
    }
}
