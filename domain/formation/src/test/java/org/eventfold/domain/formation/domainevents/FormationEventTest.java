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

import org.eventfold.eventstore.api.EventRecord;
import org.eventfold.eventstore.api.UnknownEventKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
public class FormationEventTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2021-06-01T09:30:00Z"), UTC);

    @Nested
    @DisplayName("to record")
    class ToRecord {

        @Test
        void formation_created_records_id_name_and_duration() {
            // Given
            FormationCreated event = FormationCreated.create(CLOCK, "f1", "Java", 14);

            // When
            EventRecord eventRecord = event.toRecord();

            // Then
            assertAll(
                    () -> assertThat(eventRecord.name()).isEqualTo("FORMATION_CREATED"),
                    () -> assertThat(eventRecord.aggregateId()).isEqualTo("f1"),
                    () -> assertThat(eventRecord.createdAt()).isEqualTo(OffsetDateTime.of(2021, 6, 1, 9, 30, 0, 0, UTC)),
                    () -> assertThat(eventRecord.changes()).containsExactly(entry("id", "f1"), entry("name", "Java"), entry("durationHours", 14))
            );
        }

        @Test
        void formation_scheduled_records_date_and_instructor_name() {
            // Given
            FormationScheduled event = FormationScheduled.create(CLOCK, "f1", "2020", "Alice");

            // When
            EventRecord eventRecord = event.toRecord();

            // Then
            assertAll(
                    () -> assertThat(eventRecord.name()).isEqualTo("FORMATION_SCHEDULED"),
                    () -> assertThat(eventRecord.changes()).containsExactly(entry("date", "2020"), entry("instructorName", "Alice"))
            );
        }

        @Test
        void null_values_are_recorded() {
            // Given
            FormationScheduled event = FormationScheduled.create(CLOCK, "f1", null, null);

            // When
            EventRecord eventRecord = event.toRecord();

            // Then
            assertThat(eventRecord.changes()).containsExactly(entry("date", null), entry("instructorName", null));
        }
    }

    @Nested
    @DisplayName("from record")
    class FromRecord {

        @Test
        void every_kind_survives_a_round_trip() {
            // Given
            FormationEvent created = FormationCreated.create(CLOCK, "f1", "Java", 14);
            FormationEvent scheduled = FormationScheduled.create(CLOCK, "f1", "2021", "Bob");

            // Then
            assertAll(
                    () -> assertThat(FormationEvent.fromRecord(created.toRecord())).isEqualTo(created),
                    () -> assertThat(FormationEvent.fromRecord(scheduled.toRecord())).isEqualTo(scheduled)
            );
        }

        @Test
        void creation_time_of_the_record_is_kept() {
            // Given
            OffsetDateTime createdAt = OffsetDateTime.of(2019, 12, 24, 18, 0, 0, 0, UTC);
            EventRecord eventRecord = new EventRecord("FORMATION_SCHEDULED", "f1", createdAt, Map.of("date", "2020", "instructorName", "Alice"));

            // When
            FormationEvent event = FormationEvent.fromRecord(eventRecord);

            // Then
            assertThat(event).isEqualTo(new FormationScheduled("f1", createdAt, "2020", "Alice"));
        }

        @Test
        void throws_unknown_event_kind_exception_when_name_is_not_a_known_kind() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CANCELLED", "f1", Map.of());

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(UnknownEventKindException.class),
                    () -> assertThat(((UnknownEventKindException) throwable).name).isEqualTo("FORMATION_CANCELLED")
            );
        }

        @Test
        void throws_iae_when_formation_created_has_no_duration() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CREATED", "f1", Map.of("id", "f1", "name", "Java"));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("durationHours");
        }

        @Test
        void a_stored_record_is_restored_unchanged() {
            // Given
            OffsetDateTime createdAt = OffsetDateTime.of(2020, 9, 1, 8, 0, 0, 0, UTC);
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("id", "f1");
            changes.put("name", null);
            changes.put("durationHours", 14);
            EventRecord created = new EventRecord("FORMATION_CREATED", "f1", createdAt, changes);
            EventRecord scheduled = new EventRecord("FORMATION_SCHEDULED", "f1", createdAt, Map.of("date", "2020", "instructorName", "Alice"));

            // Then
            assertAll(
                    () -> assertThat(FormationEvent.fromRecord(created).toRecord()).isEqualTo(created),
                    () -> assertThat(FormationEvent.fromRecord(scheduled).toRecord()).isEqualTo(scheduled)
            );
        }

        @Test
        void whole_duration_stored_as_another_number_type_is_accepted() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CREATED", "f1", Map.of("id", "f1", "name", "Java", "durationHours", 14L));

            // When
            FormationEvent event = FormationEvent.fromRecord(eventRecord);

            // Then
            assertThat(((FormationCreated) event).durationHours()).isEqualTo(14);
        }

        @Test
        void throws_iae_when_duration_is_outside_int_range() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CREATED", "f1", Map.of("id", "f1", "name", "Java", "durationHours", 3_000_000_000L));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("FORMATION_CREATED event of formation f1 has a durationHours that is not a whole number within int range (was 3000000000)")
                    .hasCauseExactlyInstanceOf(ArithmeticException.class);
        }

        @Test
        void throws_iae_when_duration_is_fractional() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CREATED", "f1", Map.of("id", "f1", "name", "Java", "durationHours", 1.5));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("(was 1.5)");
        }

        @Test
        void throws_iae_when_the_record_has_a_field_the_kind_doesnt_define() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_SCHEDULED", "f1", Map.of("date", "2020", "instructorName", "Alice", "room", "B12"));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("FORMATION_SCHEDULED event of formation f1 has unknown field(s) [room]");
        }

        @Test
        void throws_iae_when_a_text_field_has_another_type() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_SCHEDULED", "f1", Map.of("date", 2020, "instructorName", "Alice"));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageStartingWith("FORMATION_SCHEDULED event of formation f1 has a non-text date (was 2020");
        }

        @Test
        void throws_iae_when_id_differs_from_the_aggregate_id() {
            // Given
            EventRecord eventRecord = EventRecord.of("FORMATION_CREATED", "f1", Map.of("id", "f2", "name", "Java", "durationHours", 14));

            // When
            Throwable throwable = catchThrowable(() -> FormationEvent.fromRecord(eventRecord));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("FORMATION_CREATED event of formation f1 has id f2");
        }
    }
}
