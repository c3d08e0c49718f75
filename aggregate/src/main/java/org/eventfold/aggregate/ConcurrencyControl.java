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

import org.eventfold.eventstore.api.ConditionallyAppendToEventStore;
import org.eventfold.eventstore.api.WriteConditionNotFulfilledException;

/**
 * How an {@link EventSourcedRepository} guards against two writers persisting changes derived from the same snapshot.
 */
public enum ConcurrencyControl {
    /**
     * Pending events are appended only if the aggregate is still at the version it was loaded at, otherwise
     * {@link WriteConditionNotFulfilledException} is thrown. Requires a {@link ConditionallyAppendToEventStore}.
     */
    OPTIMISTIC,
    /**
     * Pending events are always appended. When two writers persist changes derived from the same snapshot, both writes
     * succeed and the event with the latest creation time wins when the aggregate is folded.
     */
    NONE
}
