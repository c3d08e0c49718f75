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

import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.eventfold.aggregate.ProjectionState;
import org.eventfold.domain.formation.domainevents.FormationCreated;
import org.eventfold.domain.formation.domainevents.FormationScheduled;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
@ExtendWith(SoftAssertionsExtension.class)
public class FormationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2021-01-01T10:00:00Z"), UTC);
    private static final OffsetDateTime NOW = OffsetDateTime.now(CLOCK);

    @InjectSoftAssertions
    private SoftAssertions softly;

    @Test
    void create_emits_formation_created() {
        // When
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);

        // Then
        softly.assertThat(formation.id()).isEqualTo("f1");
        softly.assertThat(formation.name()).isEqualTo("Java");
        softly.assertThat(formation.durationHours()).isEqualTo(14);
        softly.assertThat(formation.scheduledDate()).isNull();
        softly.assertThat(formation.instructorName()).isNull();
        softly.assertThat(formation.version()).isZero();
        softly.assertThat(formation.pendingEvents()).containsExactly(new FormationCreated("f1", NOW, "Java", 14));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "  "})
    void create_throws_iae_when_id_is_missing(String id) {
        // When
        Throwable throwable = catchThrowable(() -> Formation.create(CLOCK, id, "Java", 14));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Formation id cannot be null or blank");
    }

    @Test
    void schedule_on_changes_state_and_emits_formation_scheduled_after_formation_created() {
        // Given
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);

        // When
        formation.scheduleOn("2020", "Alice");

        // Then
        softly.assertThat(formation.scheduledDate()).isEqualTo("2020");
        softly.assertThat(formation.instructorName()).isEqualTo("Alice");
        softly.assertThat(formation.pendingEvents()).containsExactly(
                new FormationCreated("f1", NOW, "Java", 14),
                new FormationScheduled("f1", NOW, "2020", "Alice"));
    }

    @Test
    void name_and_duration_keep_their_creation_values_through_rescheduling() {
        // Given
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);

        // When
        formation.scheduleOn("2020", "Alice");
        formation.scheduleOn("2021", "Bob");

        // Then
        softly.assertThat(formation.name()).isEqualTo("Java");
        softly.assertThat(formation.durationHours()).isEqualTo(14);
        softly.assertThat(formation.pendingEvents()).filteredOn(FormationCreated.class::isInstance).hasSize(1);
    }

    @Test
    void is_created_requires_the_id_of_formation_created() {
        // Given
        ProjectionState onlyScheduled = new ProjectionState(Map.of("date", "2020", "instructorName", "Alice"), 1);
        ProjectionState created = new ProjectionState(Map.of("id", "f1", "name", "Java", "durationHours", 14), 1);

        // Then
        softly.assertThat(Formation.isCreated(onlyScheduled)).isFalse();
        softly.assertThat(Formation.isCreated(created)).isTrue();
        softly.assertThat(catchThrowable(() -> Formation.rehydrate(CLOCK, onlyScheduled))).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void schedule_on_accepts_null_values() {
        // Given
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);
        formation.scheduleOn("2020", "Alice");

        // When
        formation.scheduleOn(null, null);

        // Then
        softly.assertThat(formation.scheduledDate()).isNull();
        softly.assertThat(formation.pendingEvents()).hasSize(3).last().isEqualTo(new FormationScheduled("f1", NOW, null, null));
    }

    @Test
    void rehydrate_restores_state_without_emitting_events() {
        // Given
        ProjectionState state = new ProjectionState(Map.of("id", "f1", "name", "Java", "durationHours", 14, "date", "2021", "instructorName", "Bob"), 2);

        // When
        Formation formation = Formation.rehydrate(CLOCK, state);

        // Then
        softly.assertThat(formation.id()).isEqualTo("f1");
        softly.assertThat(formation.name()).isEqualTo("Java");
        softly.assertThat(formation.durationHours()).isEqualTo(14);
        softly.assertThat(formation.scheduledDate()).isEqualTo("2021");
        softly.assertThat(formation.instructorName()).isEqualTo("Bob");
        softly.assertThat(formation.version()).isEqualTo(2);
        softly.assertThat(formation.pendingEvents()).isEmpty();
    }

    @Test
    void rehydrate_leaves_missing_schedule_unset() {
        // Given
        ProjectionState state = new ProjectionState(Map.of("id", "f1", "name", "Java", "durationHours", 14), 1);

        // When
        Formation formation = Formation.rehydrate(CLOCK, state);

        // Then
        softly.assertThat(formation.scheduledDate()).isNull();
        softly.assertThat(formation.instructorName()).isNull();
    }

    @Test
    void mark_committed_clears_pending_events_and_sets_version() {
        // Given
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);
        formation.scheduleOn("2020", "Alice");

        // When
        formation.markCommitted(2);

        // Then
        softly.assertThat(formation.pendingEvents()).isEmpty();
        softly.assertThat(formation.version()).isEqualTo(2);
    }

    @Test
    void pending_events_cannot_be_modified_from_outside() {
        // Given
        Formation formation = Formation.create(CLOCK, "f1", "Java", 14);

        // When
        Throwable throwable = catchThrowable(() -> formation.pendingEvents().clear());

        // Then
        assertThat(throwable).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void formations_with_the_same_state_are_equal_regardless_of_pending_events() {
        // Given
        Formation created = Formation.create(CLOCK, "f1", "Java", 14);
        Formation rehydrated = Formation.rehydrate(CLOCK, new ProjectionState(Map.of("id", "f1", "name", "Java", "durationHours", 14), 1));

        // Then
        assertThat(List.of(created)).containsExactly(rehydrated);
    }
}
