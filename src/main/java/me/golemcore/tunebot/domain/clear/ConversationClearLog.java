package me.golemcore.tunebot.domain.clear;

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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered, unique, bounded log of bot-authored message ids for one
 * conversation. All access goes through the instance lock.
 */
class ConversationClearLog {

    private final Object lock = new Object();
    private final LinkedHashSet<Integer> messageIds = new LinkedHashSet<>();
    private final int capacity;

    ConversationClearLog(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @return number of oldest ids dropped to stay within capacity
     */
    int append(int messageId) {
        synchronized (lock) {
            messageIds.add(messageId);
            int dropped = 0;
            Iterator<Integer> oldest = messageIds.iterator();
            while (messageIds.size() > capacity && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
                dropped++;
            }
            return dropped;
        }
    }

    /**
     * Empties the log and returns what it held, oldest first.
     */
    List<Integer> drain() {
        synchronized (lock) {
            List<Integer> drained = new ArrayList<>(messageIds);
            messageIds.clear();
            return drained;
        }
    }

    List<Integer> snapshot() {
        synchronized (lock) {
            return List.copyOf(messageIds);
        }
    }
}
