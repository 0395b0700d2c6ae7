package me.golemcore.chatflow.broadcast;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic-keyed fan-out to live subscribers.
 *
 * <p>
 * Every subscriber owns a bounded inbox drained on a delivery scheduler, so
 * publishing never blocks on a slow consumer. When an inbox is full the event
 * is dropped for that subscriber only. Events reach only the subscribers
 * registered when {@link #publish} is called; nothing is replayed. A topic
 * disappears with its last subscriber.
 * </p>
 *
 * @param <E>
 *            event type
 */
@Slf4j
public class TopicBroadcaster<E> {

    private final String name;
    private final int inboxCapacity;
    private final Scheduler deliveryScheduler;
    private final Map<String, Set<TopicSubscription<E>>> topics = new ConcurrentHashMap<>();

    public TopicBroadcaster(String name, int inboxCapacity) {
        this(name, inboxCapacity, Schedulers.boundedElastic());
    }

    public TopicBroadcaster(String name, int inboxCapacity, Scheduler deliveryScheduler) {
        if (inboxCapacity <= 0) {
            throw new IllegalArgumentException("inboxCapacity must be positive: " + inboxCapacity);
        }
        this.name = name;
        this.inboxCapacity = inboxCapacity;
        this.deliveryScheduler = deliveryScheduler;
    }

    public TopicSubscription<E> subscribe(String topicKey) {
        requireTopicKey(topicKey);
        TopicSubscription<E> subscription = new TopicSubscription<>(topicKey, inboxCapacity, deliveryScheduler,
                this::unregister);
        Set<TopicSubscription<E>> subscribers = topics.compute(topicKey, (key, existing) -> {
            Set<TopicSubscription<E>> set = existing != null ? existing : ConcurrentHashMap.newKeySet();
            set.add(subscription);
            return set;
        });
        log.debug("[Broadcast] {}: subscriber joined topic {} (subscribers={})", name, topicKey, subscribers.size());
        return subscription;
    }

    /**
     * @return number of subscribers the event was delivered to
     */
    public int publish(String topicKey, E event) {
        requireTopicKey(topicKey);
        Set<TopicSubscription<E>> subscribers = topics.get(topicKey);
        if (subscribers == null) {
            return 0;
        }

        List<TopicSubscription<E>> snapshot = List.copyOf(subscribers);
        log.debug("[Broadcast] {}: publishing to topic {} (subscribers={})", name, topicKey, snapshot.size());
        int delivered = 0;
        for (TopicSubscription<E> subscription : snapshot) {
            Sinks.EmitResult result = subscription.offer(event);
            if (result.isSuccess()) {
                delivered++;
            } else if (result == Sinks.EmitResult.FAIL_OVERFLOW
                    || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                // a not yet consumed inbox reports a full queue as zero-subscriber
                log.warn("[Broadcast] {}: inbox full on topic {}, event dropped for one subscriber", name, topicKey);
            } else if (result == Sinks.EmitResult.FAIL_CANCELLED || result == Sinks.EmitResult.FAIL_TERMINATED) {
                subscription.close();
            } else {
                log.warn("[Broadcast] {}: delivery failed on topic {}: {}", name, topicKey, result);
            }
        }
        return delivered;
    }

    public int subscriberCount(String topicKey) {
        Set<TopicSubscription<E>> subscribers = topics.get(topicKey);
        return subscribers != null ? subscribers.size() : 0;
    }

    public Set<String> subscribedTopics() {
        return Set.copyOf(topics.keySet());
    }

    /**
     * End every live subscription with a completion signal.
     */
    @PreDestroy
    public void completeAll() {
        List<TopicSubscription<E>> all = new ArrayList<>();
        for (Set<TopicSubscription<E>> subscribers : topics.values()) {
            all.addAll(subscribers);
        }
        all.forEach(TopicSubscription::close);
        if (!all.isEmpty()) {
            log.info("[Broadcast] {}: completed {} subscriptions", name, all.size());
        }
    }

    private void unregister(TopicSubscription<E> subscription) {
        String topicKey = subscription.getTopicKey();
        topics.computeIfPresent(topicKey, (key, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
        log.debug("[Broadcast] {}: subscriber left topic {} (subscribers={})", name, topicKey,
                subscriberCount(topicKey));
    }

    private static void requireTopicKey(String topicKey) {
        if (topicKey == null || topicKey.isBlank()) {
            throw new IllegalArgumentException("topicKey must not be blank");
        }
    }
}
