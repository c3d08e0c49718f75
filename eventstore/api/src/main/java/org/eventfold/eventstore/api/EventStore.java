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

package org.eventfold.eventstore.api;

import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * An append-only log of domain events. There's intentionally no way to delete or update an event.
 *
 * @param <T> The domain event type
 */
@NullMarked
public interface EventStore<T extends DomainEvent> {

    /**
     * Append an event to the end of the log.
     *
     * @param event The event to append
     * @throws StorageWriteException If the event couldn't be written (never thrown by in-memory implementations)
     */
    void append(T event);

    /**
     * Read all events in the log, in the order they were appended. The returned list is owned by the caller,
     * modifying it has no effect on the event store.
     *
     * @return All events in append order
     * @throws UnknownEventKindException If a stored record cannot be converted back into a domain event
     */
    List<T> listAll();
}
