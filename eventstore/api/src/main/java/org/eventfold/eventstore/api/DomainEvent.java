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

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * An immutable fact describing one state change of one aggregate. Implementations are typically records with a
 * structured payload, the generic {@link #changes()} map is only used when the event crosses the serialization
 * boundary (see {@link EventRecord}) or when state is folded from several events.
 */
@NullMarked
public interface DomainEvent {

    /**
     * @return The kind tag of the event, stored as {@link EventRecord#name()}.
     */
    String name();

    /**
     * @return The id of the aggregate that this event mutates
     */
    String aggregateId();

    /**
     * @return The time when the event was created
     */
    OffsetDateTime createdAt();

    /**
     * @return The fields changed by this event. Values may be {@code null}.
     */
    Map<String, Object> changes();

    /**
     * Convert this event into its plain record form.
     *
     * @return An {@link EventRecord} with the same name, aggregate id, creation time and changes as this event.
     */
    default EventRecord toRecord() {
        return new EventRecord(name(), aggregateId(), createdAt(), changes());
    }
}
