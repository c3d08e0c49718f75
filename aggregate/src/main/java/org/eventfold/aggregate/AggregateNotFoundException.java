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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an aggregate is loaded but the event store contains no events for it.
 */
public class AggregateNotFoundException extends RuntimeException {
    public final String aggregateId;

    public AggregateNotFoundException(String aggregateId) {
        super("Couldn't find aggregate " + aggregateId);
        this.aggregateId = aggregateId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateNotFoundException)) return false;
        AggregateNotFoundException that = (AggregateNotFoundException) o;
        return Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AggregateNotFoundException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .toString();
    }
}
