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

import java.time.Instant;

/**
 * Point-in-time view of a channel's scheduling state.
 *
 * @param channelKey
 *            channel identity
 * @param running
 *            an agent run is executing for the channel
 * @param pending
 *            an event is buffered and waits for the next run
 * @param debouncing
 *            a debounce timer is armed for the channel
 * @param lastSubmittedAt
 *            time of the latest submission, {@code null} when none is tracked
 */
public record ChannelRunStatus(String channelKey, boolean running, boolean pending, boolean debouncing,
        Instant lastSubmittedAt) {

    public static ChannelRunStatus idle(String channelKey) {
        return new ChannelRunStatus(channelKey, false, false, false, null);
    }

    public boolean isBusy() {
        return running || pending || debouncing;
    }
}
