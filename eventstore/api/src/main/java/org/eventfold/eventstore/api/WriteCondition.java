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

/**
 * A write condition may be applied when appending events to an event store. If the write condition is not fulfilled the events
 * will not be appended.
 */
public sealed interface WriteCondition {

    /**
     * Aggregate version doesn't matter, essentially the same as an unconditional append.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition anyVersion() {
        return AnyVersion.INSTANCE;
    }

    /**
     * Aggregate version must be equal to the specified {@code version} in order for the events to be appended
     * to the event store.
     *
     * @return A {@link WriteCondition} with the behavior specified above.
     */
    static WriteCondition versionEq(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        return new VersionEq(version);
    }

    /**
     * @param currentVersion The current version of the aggregate
     * @return {@code true} if events may be appended to an aggregate at {@code currentVersion}
     */
    boolean isFulfilledBy(long currentVersion);

    enum AnyVersion implements WriteCondition {
        INSTANCE;

        @Override
        public boolean isFulfilledBy(long currentVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record VersionEq(long version) implements WriteCondition {

        @Override
        public boolean isFulfilledBy(long currentVersion) {
            return currentVersion == version;
        }

        @Override
        public String toString() {
            return String.format("to be equal to %s", version);
        }
    }
}
