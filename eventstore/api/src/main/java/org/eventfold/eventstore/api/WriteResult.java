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
 * The outcome of a successful conditional append.
 *
 * @param aggregateId     The aggregate the events were appended to
 * @param previousVersion The version of the aggregate before the append
 * @param newVersion      The version of the aggregate after the append, equal to {@code previousVersion} when no events were given
 */
public record WriteResult(String aggregateId, long previousVersion, long newVersion) {

    public WriteResult {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        } else if (newVersion < previousVersion) {
            throw new IllegalArgumentException("newVersion (" + newVersion + ") cannot be less than previousVersion (" + previousVersion + ")");
        }
    }

    /**
     * @return The number of events that were appended
     */
    public long appendedEvents() {
        return newVersion - previousVersion;
    }
}
