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
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged state of an aggregate, obtained by folding the {@link DomainEvent#changes()} of all its events.
 * This is the memento that an aggregate is rehydrated from, it's never stored.
 *
 * @param fields  The merged fields (unmodifiable, may contain {@code null} values)
 * @param version The number of events that were folded
 */
public record ProjectionState(Map<String, Object> fields, long version) {

    private static final Comparator<DomainEvent> BY_CREATION_TIME = Comparator.comparing(e -> e.createdAt().toInstant());

    public ProjectionState {
        fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Fold the changes of {@code events}. The events are first sorted by creation time. The sort is stable, so events
     * created at the same instant are folded in the order they are given. A field changed by several events gets the
     * value of the last one.
     *
     * @param events The events of a single aggregate
     * @return The folded state
     */
    public static ProjectionState fold(List<? extends DomainEvent> events) {
        List<DomainEvent> sorted = new ArrayList<>(events);
        sorted.sort(BY_CREATION_TIME);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (DomainEvent event : sorted) {
            fields.putAll(event.changes());
        }
        return new ProjectionState(fields, sorted.size());
    }

    public boolean isEmpty() {
        return version == 0;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public @Nullable String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    /**
     * @return The field as an {@code Integer}, or {@code null} if the field is missing or {@code null}.
     * @throws IllegalStateException If the field is not a number
     */
    public @Nullable Integer getInteger(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        throw new IllegalStateException("Field " + field + " is not a number: " + value);
    }
}
