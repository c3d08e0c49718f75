/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.aggregate;

import org.eventfold.eventstore.api.DomainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An append-only buffer of the events an aggregate has emitted since it was created or loaded. Every aggregate owns
 * its own instance. The buffer is never persisted, it's cleared by {@link #clear()} once the events have been written
 * to the event store.
 *
 * @param <T> The domain event type
 */
public final class PendingEvents<T extends DomainEvent> {

    private final List<T> events = new ArrayList<>();

    public void add(T event) {
        requireNonNull(event, "Event cannot be null");
        events.add(event);
    }

    /**
     * @return An unmodifiable view of the pending events, in the order they were added
     */
    public List<T> asList() {
        return Collections.unmodifiableList(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }

    @Override
    public String toString() {
        return "PendingEvents" + events;
    }
}
