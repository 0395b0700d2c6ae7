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

/**
 * Raised inside an agent run when the run was cancelled. Never retried.
 */
public class AgentRunCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String channelKey;

    public AgentRunCancelledException(String channelKey) {
        super("Agent run cancelled: channel=" + channelKey);
        this.channelKey = channelKey;
    }

    public AgentRunCancelledException(String channelKey, Throwable cause) {
        super("Agent run cancelled: channel=" + channelKey, cause);
        this.channelKey = channelKey;
    }

    public String getChannelKey() {
        return channelKey;
    }
}
