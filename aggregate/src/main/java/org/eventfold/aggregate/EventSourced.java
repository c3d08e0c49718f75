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
import org.jspecify.annotations.NullMarked;

import java.util.List;

/**
 * An aggregate whose state changes are only ever expressed as emitted domain events.
 *
 * @param <E> The domain event type emitted by the aggregate
 */
@NullMarked
public interface EventSourced<E extends DomainEvent> {

    /**
     * @return The id of the aggregate, never changes
     */
    String id();

    /**
     * @return The number of stored events this instance was derived from, {@code 0} for a new aggregate.
     */
    long version();

    /**
     * @return The events emitted since the aggregate was created or loaded, in emission order
     */
    List<E> pendingEvents();

    /**
     * Called when the pending events have been written to the event store. Clears the pending events.
     *
     * @param newVersion The version of the aggregate after the write
     */
    void markCommitted(long newVersion);
}
