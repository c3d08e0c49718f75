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

package org.eventfold.domain.formation;

import org.eventfold.aggregate.EventSourced;
import org.eventfold.aggregate.PendingEvents;
import org.eventfold.aggregate.ProjectionState;
import org.eventfold.domain.formation.domainevents.FormationCreated;
import org.eventfold.domain.formation.domainevents.FormationEvent;
import org.eventfold.domain.formation.domainevents.FormationScheduled;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * A training course. Every change to a formation is recorded as a {@link FormationEvent} that stays pending until the
 * formation is persisted.
 * <p>
 * The name and duration are set when the formation is created and never change afterwards, since there is no
 * operation that renames a formation or changes its duration. The schedule changes with every {@link #scheduleOn(String, String)}.
 */
public class Formation implements EventSourced<FormationEvent> {
    private static final String ID = "id";

    private final String id;
    private final @Nullable String name;
    private final int durationHours;
    private @Nullable String scheduledDate;
    private @Nullable String instructorName;

    private final PendingEvents<FormationEvent> pendingEvents = new PendingEvents<>();
    private final Clock clock;
    private long version;

    private Formation(Clock clock, String id, @Nullable String name, int durationHours, @Nullable String scheduledDate, @Nullable String instructorName, long version) {
        this.clock = clock;
        this.id = id;
        this.name = name;
        this.durationHours = durationHours;
        this.scheduledDate = scheduledDate;
        this.instructorName = instructorName;
        this.version = version;
    }

    public static Formation create(String id, @Nullable String name, int durationHours) {
        return create(Clock.systemUTC(), id, name, durationHours);
    }

    /**
     * Create a new formation
     *
     * @param clock         The clock used to timestamp the events of this formation
     * @param id            The id of the formation, must not be blank
     * @param name          The name of the formation
     * @param durationHours The duration of the formation in hours
     * @return A new formation with a pending {@link FormationCreated} event
     */
    public static Formation create(Clock clock, String id, @Nullable String name, int durationHours) {
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Formation id cannot be null or blank");
        }
        Formation formation = new Formation(clock, id, name, durationHours, null, null, 0);
        formation.pendingEvents.add(FormationCreated.create(clock, id, name, durationHours));
        return formation;
    }

    public static Formation rehydrate(ProjectionState state) {
        return rehydrate(Clock.systemUTC(), state);
    }

    /**
     * Recreate a formation from the folded changes of its stored events. No events are emitted.
     *
     * @throws IllegalArgumentException If the events never created the formation, see {@link #isCreated(ProjectionState)}
     */
    public static Formation rehydrate(Clock clock, ProjectionState state) {
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(state, ProjectionState.class.getSimpleName() + " cannot be null");
        if (!isCreated(state)) {
            throw new IllegalArgumentException("Cannot rehydrate a formation without id from " + state);
        }
        String id = state.getString(ID);
        Integer durationHours = state.getInteger("durationHours");
        return new Formation(clock, id, state.getString("name"), durationHours == null ? 0 : durationHours,
                state.getString("date"), state.getString("instructorName"), state.version());
    }

    /**
     * @return {@code true} if the folded events contain the {@link FormationCreated} id, that is, the formation was created
     * and not only scheduled
     */
    public static boolean isCreated(ProjectionState state) {
        return state.getString(ID) != null;
    }

    /**
     * Schedule the formation. Any value is accepted, including {@code null}.
     */
    public void scheduleOn(@Nullable String date, @Nullable String instructorName) {
        this.scheduledDate = date;
        this.instructorName = instructorName;
        pendingEvents.add(FormationScheduled.create(clock, id, date, instructorName));
    }

    @Override
    public String id() {
        return id;
    }

    public @Nullable String name() {
        return name;
    }

    public int durationHours() {
        return durationHours;
    }

    public @Nullable String scheduledDate() {
        return scheduledDate;
    }

    public @Nullable String instructorName() {
        return instructorName;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public List<FormationEvent> pendingEvents() {
        return pendingEvents.asList();
    }

    @Override
    public void markCommitted(long newVersion) {
        pendingEvents.clear();
        version = newVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formation)) return false;
        Formation formation = (Formation) o;
        return durationHours == formation.durationHours &&
                Objects.equals(id, formation.id) &&
                Objects.equals(name, formation.name) &&
                Objects.equals(scheduledDate, formation.scheduledDate) &&
                Objects.equals(instructorName, formation.instructorName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, durationHours, scheduledDate, instructorName);
    }

    @Override
    public String toString() {
        return "Formation{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", durationHours=" + durationHours +
                ", scheduledDate='" + scheduledDate + '\'' +
                ", instructorName='" + instructorName + '\'' +
                ", version=" + version +
                '}';
    }
}
