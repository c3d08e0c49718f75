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

import org.eventfold.eventstore.api.UnknownEventKindException;

/**
 * The kinds of events a formation emits. The constant name is the tag written to the event store.
 */
public enum EventKind {
    FORMATION_CREATED,
    FORMATION_SCHEDULED;

    /**
     * @param tag The tag of a stored event
     * @return The matching kind
     * @throws UnknownEventKindException If no kind has the given tag
     */
    public static EventKind fromTag(String tag) {
        for (EventKind kind : values()) {
            if (kind.name().equals(tag)) {
                return kind;
            }
        }
        throw new UnknownEventKindException(tag);
    }
}
