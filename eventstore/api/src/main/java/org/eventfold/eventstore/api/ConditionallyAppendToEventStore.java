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

import java.util.List;

import static org.eventfold.eventstore.api.WriteCondition.versionEq;

/**
 * An event store that can append the events of an aggregate only if the aggregate is at an expected version.
 * The version of an aggregate is the number of events stored for it ({@code 0} if there are none).
 *
 * @param <T> The domain event type
 */
public interface ConditionallyAppendToEventStore<T extends DomainEvent> {

    /**
     * A convenience function that appends events if the aggregate version is equal to {@code expectedVersion}.
     *
     * @param aggregateId     The id of the aggregate
     * @param expectedVersion The aggregate must be at this version in order for the events to be appended
     * @param events          The events to append
     * @throws WriteConditionNotFulfilledException When the aggregate is not at the expected version
     * @see #append(String, WriteCondition, List) for the general case
     */
    default WriteResult append(String aggregateId, long expectedVersion, List<T> events) {
        return append(aggregateId, versionEq(expectedVersion), events);
    }

    /**
     * Conditionally append events of an aggregate. Either all events are appended or none of them.
     *
     * @param aggregateId    The id of the aggregate. All {@code events} must belong to this aggregate.
     * @param writeCondition The write condition that must be fulfilled for the events to be appended
     * @param events         The events to append
     * @return The versions of the aggregate before and after the append
     * @throws WriteConditionNotFulfilledException When the <code>writeCondition</code> was not fulfilled and the events couldn't be appended
     */
    WriteResult append(String aggregateId, WriteCondition writeCondition, List<T> events);

    /**
     * @param aggregateId The id of the aggregate
     * @return The current version of the aggregate, {@code 0} if no events are stored for it.
     */
    long version(String aggregateId);
}
