package me.golemcore.chatflow.adapter.outbound.agent;

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
import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.port.outbound.AgentRunnerPort;

/**
 * Fallback runner used when no agent is configured. Logs and returns.
 */
@Slf4j
public class NoOpAgentRunnerAdapter implements AgentRunnerPort {

    @Override
    public void run(String channelKey, ChatMessage message) {
        log.warn("NoOpAgentRunnerAdapter: run() called for channel {} - no agent configured", channelKey);
    }
}
