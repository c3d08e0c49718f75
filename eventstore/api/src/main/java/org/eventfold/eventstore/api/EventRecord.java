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

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.time.ZoneOffset.UTC;

/**
 * The storage shape of a domain event. This is the only serialization contract of the event store, a durable event
 * store only needs to be able to persist and restore these four values.
 *
 * @param name        The kind tag of the event
 * @param aggregateId The id of the aggregate the event belongs to
 * @param createdAt   The time the event was created
 * @param changes     The fields changed by the event (unmodifiable, insertion ordered, may contain {@code null} values)
 */
public record EventRecord(String name, String aggregateId, OffsetDateTime createdAt, Map<String, Object> changes) {

    public EventRecord {
        if (name == null) throw new IllegalArgumentException("name cannot be null");
        if (aggregateId == null) throw new IllegalArgumentException("aggregateId cannot be null");
        if (createdAt == null) throw new IllegalArgumentException("createdAt cannot be null");
        changes = changes == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    /**
     * Create a new {@link EventRecord} stamped with the current time (UTC).
     */
    public static EventRecord of(String name, String aggregateId, Map<String, Object> changes) {
        return new EventRecord(name, aggregateId, OffsetDateTime.now(UTC), changes);
    }
}
