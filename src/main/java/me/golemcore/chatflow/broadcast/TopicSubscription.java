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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A subscriber's bounded inbox on one topic.
 *
 * <p>
 * Offering an event only enqueues it; the consumer receives events on the
 * delivery scheduler. The inbox holds up to {@code capacity} undelivered
 * events plus the one currently handed to the consumer.
 * </p>
 *
 * <p>
 * {@link #events()} may be subscribed once. Cancelling that stream, or calling
 * {@link #close()}, removes the inbox from its topic.
 * </p>
 *
 * @param <E>
 *            event type
 */
@Slf4j
public final class TopicSubscription<E> implements AutoCloseable {

    private final String topicKey;
    private final Sinks.Many<E> inbox;
    private final Flux<E> events;
    private final Consumer<TopicSubscription<E>> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    TopicSubscription(String topicKey, int capacity, Scheduler deliveryScheduler,
            Consumer<TopicSubscription<E>> onClose) {
        this.topicKey = topicKey;
        this.onClose = onClose;
        this.inbox = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));
        // prefetch of one keeps the queue above as the only real buffer
        this.events = inbox.asFlux()
                .publishOn(deliveryScheduler, 1)
                .doFinally(signal -> close());
    }

    public String getTopicKey() {
        return topicKey;
    }

    public Flux<E> events() {
        return events;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        onClose.accept(this);
        synchronized (this) {
            inbox.tryEmitComplete();
        }
    }

    synchronized Sinks.EmitResult offer(E event) {
        if (closed.get()) {
            return Sinks.EmitResult.FAIL_TERMINATED;
        }
        return inbox.tryEmitNext(event);
    }
}
