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

package org.eventfold.domain.formation.application;

import org.eventfold.aggregate.ConcurrencyControl;
import org.eventfold.aggregate.EventSourcedRepository;
import org.eventfold.aggregate.ProjectionState;
import org.eventfold.domain.formation.Formation;
import org.eventfold.domain.formation.domainevents.FormationEvent;
import org.eventfold.eventstore.api.EventStore;

import java.time.Clock;

/**
 * Loads and persists {@link Formation}s. Uses {@link ConcurrencyControl#OPTIMISTIC} unless told otherwise.
 */
public class FormationRepository extends EventSourcedRepository<Formation, FormationEvent> {

    public FormationRepository(EventStore<FormationEvent> eventStore) {
        this(eventStore, ConcurrencyControl.OPTIMISTIC);
    }

    public FormationRepository(EventStore<FormationEvent> eventStore, ConcurrencyControl concurrencyControl) {
        this(eventStore, concurrencyControl, Clock.systemUTC());
    }

    /**
     * @param clock The clock given to loaded formations, used to timestamp the events they emit
     */
    public FormationRepository(EventStore<FormationEvent> eventStore, ConcurrencyControl concurrencyControl, Clock clock) {
        super(eventStore, state -> Formation.rehydrate(clock, state), concurrencyControl);
    }

    /**
     * A formation that only has {@code FORMATION_SCHEDULED} events was never created and is treated as missing.
     */
    @Override
    protected boolean isCreated(ProjectionState state) {
        return super.isCreated(state) && Formation.isCreated(state);
    }
}
