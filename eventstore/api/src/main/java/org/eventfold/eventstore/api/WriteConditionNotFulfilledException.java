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

import java.util.StringJoiner;

/**
 * Thrown when events are appended to an aggregate whose version doesn't fulfill the {@link WriteCondition}. Nothing is
 * appended in this case. Typically the aggregate was changed by someone else after it was loaded, or an aggregate
 * with the same id was already created.
 */
public class WriteConditionNotFulfilledException extends RuntimeException {
    public final String aggregateId;
    public final long actualVersion;
    public final WriteCondition writeCondition;

    public WriteConditionNotFulfilledException(String aggregateId, long actualVersion, WriteCondition writeCondition) {
        super(describe(aggregateId, actualVersion, writeCondition));
        this.aggregateId = aggregateId;
        this.actualVersion = actualVersion;
        this.writeCondition = writeCondition;
    }

    /**
     * @return {@code true} if the write expected a new aggregate but events already exist for {@code aggregateId}
     */
    public boolean isAlreadyCreated() {
        return isAlreadyCreated(actualVersion, writeCondition);
    }

    private static boolean isAlreadyCreated(long actualVersion, WriteCondition writeCondition) {
        return writeCondition.equals(WriteCondition.versionEq(0)) && actualVersion > 0;
    }

    private static String describe(String aggregateId, long actualVersion, WriteCondition writeCondition) {
        if (isAlreadyCreated(actualVersion, writeCondition)) {
            return String.format("Aggregate %s already exists (version %s), it cannot be created again.", aggregateId, actualVersion);
        }
        return String.format("%s was not fulfilled for aggregate %s. Expected version %s but was %s.", WriteCondition.class.getSimpleName(), aggregateId, writeCondition, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteConditionNotFulfilledException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("actualVersion=" + actualVersion)
                .add("writeCondition=" + writeCondition)
                .toString();
    }
}
