/*
 * SortTimer.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
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
 */

package org.extsort.common;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records the number of occurrences and the cumulative time of sort events.
 *
 * A timer may be shared between several sorters, so counters are thread-safe.
 */
@API(API.Status.UNSTABLE)
public class SortTimer {
    @Nonnull
    private final Map<Event, Counter> counters = new ConcurrentHashMap<>();

    /**
     * An identifier for occurrences that need to be timed.
     */
    public interface Event {
        /**
         * Get the name of this event for machine processing.
         * @return the name
         */
        String name();

        /**
         * Get the title of this event for user displays.
         * @return the user-visible title
         */
        String title();

        /**
         * Get the key of this event for logging with {@link org.extsort.logging.KeyValueLogMessage}.
         * @return the key to use for logging
         */
        default String logKey() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * An event that is only counted, never timed.
     */
    public interface Count extends Event {
        /**
         * Get whether the count is a number of bytes rather than a number of occurrences.
         * @return {@code true} if the counter accumulates a size
         */
        boolean isSize();
    }

    /**
     * The number of occurrences and the cumulative value of an event.
     */
    public static class Counter {
        private final AtomicInteger count = new AtomicInteger();
        private final AtomicLong cumulativeValue = new AtomicLong();

        public int getCount() {
            return count.get();
        }

        public long getTimeNanos() {
            return cumulativeValue.get();
        }

        public long getCumulativeValue() {
            return cumulativeValue.get();
        }

        public void record(long occurrenceValue) {
            cumulativeValue.addAndGet(occurrenceValue);
            count.incrementAndGet();
        }

        public void increment(int amount) {
            count.addAndGet(amount);
        }
    }

    @Nullable
    public Counter getCounter(@Nonnull Event event) {
        return counters.get(event);
    }

    /**
     * Record the amount of time an event took to run.
     * @param event the event being recorded
     * @param timeDifferenceNanos how long the event took
     */
    public void record(@Nonnull Event event, long timeDifferenceNanos) {
        counters.computeIfAbsent(event, ignore -> new Counter()).record(timeDifferenceNanos);
    }

    /**
     * Record time since given time.
     * @param event the event being recorded
     * @param startTime the {@code System.nanoTime()} when the event started
     */
    public void recordSinceNanoTime(@Nonnull Event event, long startTime) {
        record(event, System.nanoTime() - startTime);
    }

    /**
     * Record that an event occurred once.
     * @param event the event being recorded
     */
    public void increment(@Nonnull Count event) {
        increment(event, 1);
    }

    /**
     * Record that an event occurred one or more times.
     * For {@linkplain Count#isSize() size} counts, {@code amount} is also added to the cumulative value.
     * @param event the event being recorded
     * @param amount the number of times the event occurred, or the number of bytes
     */
    public void increment(@Nonnull Count event, int amount) {
        final Counter counter = counters.computeIfAbsent(event, ignore -> new Counter());
        if (event.isSize()) {
            counter.record(amount);
        } else {
            counter.increment(amount);
        }
    }

    public int getCount(@Nonnull Event event) {
        final Counter counter = counters.get(event);
        return counter == null ? 0 : counter.getCount();
    }

    public long getTimeNanos(@Nonnull Event event) {
        final Counter counter = counters.get(event);
        return counter == null ? 0L : counter.getTimeNanos();
    }

    public long getSize(@Nonnull Count event) {
        final Counter counter = counters.get(event);
        return counter == null ? 0L : counter.getCumulativeValue();
    }

    @Nonnull
    public Collection<Event> getEvents() {
        return counters.keySet();
    }

    /**
     * Suitable for {@link org.extsort.logging.KeyValueLogMessage#addKeysAndValues}.
     * @return a map of recorded times and counts for logging
     */
    @Nonnull
    public Map<String, Number> getKeysAndValues() {
        final Map<String, Number> result = new HashMap<>(counters.size() * 2);
        for (Map.Entry<Event, Counter> entry : counters.entrySet()) {
            final Event event = entry.getKey();
            final Counter counter = entry.getValue();
            result.put(event.logKey() + "_count", counter.getCount());
            if (event instanceof Count) {
                if (((Count)event).isSize()) {
                    result.put(event.logKey() + "_size", counter.getCumulativeValue());
                }
            } else {
                result.put(event.logKey() + "_micros", counter.getTimeNanos() / 1000L);
            }
        }
        return result;
    }

    /**
     * Clear all recorded information.
     */
    public void reset() {
        counters.clear();
    }
}
