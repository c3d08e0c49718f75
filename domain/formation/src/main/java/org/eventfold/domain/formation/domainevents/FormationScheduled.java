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
 * A formation was scheduled on a date with an instructor. Rescheduling emits a new event.
 */
public record FormationScheduled(String aggregateId, OffsetDateTime createdAt, @Nullable String date, @Nullable String instructorName) implements FormationEvent {
    static final String DATE = "date";
    static final String INSTRUCTOR_NAME = "instructorName";

    public static FormationScheduled create(String aggregateId, @Nullable String date, @Nullable String instructorName) {
        return create(Clock.systemUTC(), aggregateId, date, instructorName);
    }

    public static FormationScheduled create(Clock clock, String aggregateId, @Nullable String date, @Nullable String instructorName) {
        return new FormationScheduled(aggregateId, OffsetDateTime.now(clock).withOffsetSameInstant(UTC), date, instructorName);
    }

    @Override
    public EventKind kind() {
        return EventKind.FORMATION_SCHEDULED;
    }

    @Override
    public Map<String, Object> changes() {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(DATE, date);
        changes.put(INSTRUCTOR_NAME, instructorName);
        return Collections.unmodifiableMap(changes);
    }
}
