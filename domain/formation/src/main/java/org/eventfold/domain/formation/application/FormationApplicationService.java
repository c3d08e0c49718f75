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

import org.eventfold.domain.formation.Formation;
import org.eventfold.eventstore.api.WriteConditionNotFulfilledException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs commands against formations: load, call the domain model, persist.
 * <p>
 * When a formation was changed by someone else between loading and persisting, the {@link FormationRepository} rejects
 * the write with a {@link WriteConditionNotFulfilledException}. The command is then applied again to a freshly loaded
 * formation, at most {@code maxAttempts} times in total.
 */
public class FormationApplicationService {
    private static final Logger log = LoggerFactory.getLogger(FormationApplicationService.class);

    private static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final FormationRepository formationRepository;
    private final int maxAttempts;

    public FormationApplicationService(FormationRepository formationRepository) {
        this(formationRepository, DEFAULT_MAX_ATTEMPTS);
    }

    public FormationApplicationService(FormationRepository formationRepository, int maxAttempts) {
        if (formationRepository == null) throw new IllegalArgumentException(FormationRepository.class.getSimpleName() + " cannot be null");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be greater than 0");
        this.formationRepository = formationRepository;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Create and persist a new formation
     *
     * @throws WriteConditionNotFulfilledException If a formation with the same id already exists. Not retried.
     */
    public Formation create(String id, @Nullable String name, int durationHours) {
        Formation formation = Formation.create(id, name, durationHours);
        formationRepository.persist(formation);
        return formation;
    }

    /**
     * Apply {@code command} to the formation with the given id and persist the events it emits.
     *
     * @param id      The id of the formation
     * @param command Calls the domain model, may be invoked more than once
     * @return The persisted formation
     * @throws WriteConditionNotFulfilledException If the write still conflicts after {@code maxAttempts} attempts
     */
    public Formation execute(String id, Consumer<Formation> command) {
        Objects.requireNonNull(id, "Formation id cannot be null");
        Objects.requireNonNull(command, "Command cannot be null");
        int attempt = 1;
        while (true) {
            Formation formation = formationRepository.getById(id);
            command.accept(formation);
            try {
                formationRepository.persist(formation);
                return formation;
            } catch (WriteConditionNotFulfilledException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Formation {} was changed concurrently (attempt {} of {}): {}. Retrying.", id, attempt, maxAttempts, e.getMessage());
                attempt++;
            }
        }
    }

    public Formation scheduleOn(String id, @Nullable String date, @Nullable String instructorName) {
        return execute(id, formation -> formation.scheduleOn(date, instructorName));
    }
}
