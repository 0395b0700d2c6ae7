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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatflow.adapter.outbound.agent.NoOpAgentRunnerAdapter;
import me.golemcore.chatflow.port.outbound.AgentRunnerPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ChatflowProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService channelRunExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("channel-run"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService debounceExecutor() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("channel-debounce"));
    }

    @Bean
    @ConditionalOnMissingBean(AgentRunnerPort.class)
    public AgentRunnerPort noOpAgentRunner() {
        return new NoOpAgentRunnerAdapter();
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Chatflow v{} starting...", version);
        log.info("Debounce window: {}", properties.getScheduler().getDebounce());
        log.info("Max agent attempts: {}", properties.getScheduler().getMaxAttempts());
        log.info("Broadcast inbox capacity: {}", properties.getBroadcast().getInboxCapacity());
        if (properties.getQuota().getDailyReplyLimit() > 0) {
            log.info("Daily reply limit: {}", properties.getQuota().getDailyReplyLimit());
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
