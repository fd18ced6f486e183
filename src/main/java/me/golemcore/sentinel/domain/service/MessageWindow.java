package me.golemcore.sentinel.domain.service;

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

import me.golemcore.sentinel.domain.model.ChatMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bounded FIFO of recent chat messages plus a per-user history of message
 * timestamps.
 *
 * <p>
 * The message buffer never exceeds its capacity; the oldest message is evicted
 * first. User histories are pruned to the configured horizon and feed
 * {@link #userRates()}, the messages-per-minute signal used by spam detection.
 *
 * <p>
 * All methods are thread-safe: chat transports push messages while the monitor
 * cycle takes snapshots.
 */
public class MessageWindow {

    static final String UNKNOWN_USER = "unknown";

    private final int capacity;
    private final Duration userHistoryHorizon;
    private final Duration rateWindow;
    private final Clock clock;

    private final Deque<ChatMessage> messages = new ArrayDeque<>();
    private final Map<String, Deque<Instant>> userHistory = new HashMap<>();

    public MessageWindow(int capacity, Duration userHistoryHorizon, Duration rateWindow, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.userHistoryHorizon = userHistoryHorizon;
        this.rateWindow = rateWindow;
        this.clock = clock;
    }

    public synchronized void ingest(ChatMessage message) {
        if (message == null) {
            return;
        }
        messages.addLast(message);
        while (messages.size() > capacity) {
            messages.removeFirst();
        }

        Instant timestamp = message.timestamp() != null ? message.timestamp() : clock.instant();
        userHistory.computeIfAbsent(historyKey(message.username()), key -> new ArrayDeque<>()).addLast(timestamp);
        pruneUserHistory(clock.instant());
    }

    private static String historyKey(String username) {
        return username == null || username.isBlank() ? UNKNOWN_USER : username;
    }

    public synchronized void ingestAll(Collection<ChatMessage> batch) {
        if (batch == null) {
            return;
        }
        for (ChatMessage message : batch) {
            ingest(message);
        }
    }

    /**
     * Returns the buffered messages in arrival order.
     */
    public synchronized List<ChatMessage> snapshot() {
        return new ArrayList<>(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    public synchronized void clear() {
        messages.clear();
        userHistory.clear();
    }

    /**
     * Counts messages per user over the trailing rate window. Users with no
     * message in that window are omitted.
     */
    public synchronized Map<String, Integer> userRates() {
        Instant now = clock.instant();
        pruneUserHistory(now);

        Instant rateCutoff = now.minus(rateWindow);
        Map<String, Integer> rates = new TreeMap<>();
        for (Map.Entry<String, Deque<Instant>> entry : userHistory.entrySet()) {
            int count = 0;
            for (Instant timestamp : entry.getValue()) {
                if (!timestamp.isBefore(rateCutoff)) {
                    count++;
                }
            }
            if (count > 0) {
                rates.put(entry.getKey(), count);
            }
        }
        return rates;
    }

    private void pruneUserHistory(Instant now) {
        Instant horizon = now.minus(userHistoryHorizon);
        Iterator<Map.Entry<String, Deque<Instant>>> iterator = userHistory.entrySet().iterator();
        while (iterator.hasNext()) {
            Deque<Instant> timestamps = iterator.next().getValue();
            timestamps.removeIf(timestamp -> timestamp.isBefore(horizon));
            if (timestamps.isEmpty()) {
                iterator.remove();
            }
        }
    }
}
