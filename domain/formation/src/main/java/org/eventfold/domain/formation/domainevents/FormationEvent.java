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

import org.eventfold.eventstore.api.DomainEvent;
import org.eventfold.eventstore.api.EventRecord;
import org.eventfold.eventstore.api.UnknownEventKindException;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public sealed interface FormationEvent extends DomainEvent permits FormationCreated, FormationScheduled {

    EventKind kind();

    @Override
    default String name() {
        return kind().name();
    }

    /**
     * Reconstruct a formation event from its stored form. The creation time of the record is kept, and
     * {@code fromRecord(event.toRecord())} equals {@code event}. Records that {@link #toRecord()} could not have
     * produced are rejected rather than silently narrowed.
     *
     * @param eventRecord The stored event
     * @return The formation event
     * @throws UnknownEventKindException If the record's name isn't an {@link EventKind}
     * @throws IllegalArgumentException  If the record's changes contain a field the kind doesn't define, a field of the
     *                                   wrong type, a {@code durationHours} that isn't an {@code int}, or an {@code id}
     *                                   other than the record's aggregate id
     */
    static FormationEvent fromRecord(EventRecord eventRecord) {
        EventKind kind = EventKind.fromTag(eventRecord.name());
        String aggregateId = eventRecord.aggregateId();
        Map<String, Object> changes = eventRecord.changes();
        return switch (kind) {
            case FORMATION_CREATED -> {
                requireOnlyFields(kind, aggregateId, changes, FormationCreated.ID, FormationCreated.NAME, FormationCreated.DURATION_HOURS);
                String id = stringOrNull(kind, aggregateId, changes, FormationCreated.ID);
                if (!aggregateId.equals(id)) {
                    throw new IllegalArgumentException(kind + " event of formation " + aggregateId + " has " + FormationCreated.ID + " " + id);
                }
                yield new FormationCreated(aggregateId, eventRecord.createdAt(),
                        stringOrNull(kind, aggregateId, changes, FormationCreated.NAME), requiredInt(kind, aggregateId, changes, FormationCreated.DURATION_HOURS));
            }
            case FORMATION_SCHEDULED -> {
                requireOnlyFields(kind, aggregateId, changes, FormationScheduled.DATE, FormationScheduled.INSTRUCTOR_NAME);
                yield new FormationScheduled(aggregateId, eventRecord.createdAt(),
                        stringOrNull(kind, aggregateId, changes, FormationScheduled.DATE), stringOrNull(kind, aggregateId, changes, FormationScheduled.INSTRUCTOR_NAME));
            }
        };
    }

    private static void requireOnlyFields(EventKind kind, String aggregateId, Map<String, Object> changes, String... fields) {
        Set<String> unknown = new LinkedHashSet<>(changes.keySet());
        unknown.removeAll(Set.of(fields));
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(kind + " event of formation " + aggregateId + " has unknown field(s) " + unknown);
        }
    }

    private static @Nullable String stringOrNull(EventKind kind, String aggregateId, Map<String, Object> changes, String field) {
        Object value = changes.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException(kind + " event of formation " + aggregateId + " has a non-text " + field + " (was " + value + " of type " + value.getClass().getName() + ")");
    }

    private static int requiredInt(EventKind kind, String aggregateId, Map<String, Object> changes, String field) {
        Object value = changes.get(field);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(kind + " event of formation " + aggregateId + " has no numeric " + field + " (was " + value + ")");
        }
        try {
            return new BigDecimal(Objects.toString(value)).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(kind + " event of formation " + aggregateId + " has a " + field + " that is not a whole number within int range (was " + value + ")", e);
        }
    }
}
