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

package org.eventfold.domain.formation.domainevents;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.time.ZoneOffset.UTC;

/**
 * A formation was created.
 *
 * @param formationName Stored under the {@code name} field, the record component is named differently since
 *                      {@link #name()} is the event's tag.
 */
public record FormationCreated(String aggregateId, OffsetDateTime createdAt, @Nullable String formationName, int durationHours) implements FormationEvent {
    static final String ID = "id";
    static final String NAME = "name";
    static final String DURATION_HOURS = "durationHours";

    public static FormationCreated create(String aggregateId, @Nullable String formationName, int durationHours) {
        return create(Clock.systemUTC(), aggregateId, formationName, durationHours);
    }

    public static FormationCreated create(Clock clock, String aggregateId, @Nullable String formationName, int durationHours) {
        return new FormationCreated(aggregateId, OffsetDateTime.now(clock).withOffsetSameInstant(UTC), formationName, durationHours);
    }

    @Override
    public EventKind kind() {
        return EventKind.FORMATION_CREATED;
    }

    @Override
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(ID, aggregateId);
        changes.put(NAME, formationName);
        changes.put(DURATION_HOURS, durationHours);
        return Collections.unmodifiableMap(changes);
    }
}
