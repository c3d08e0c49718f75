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
 * Thrown by durable {@link EventStore} implementations when events couldn't be written to the underlying storage.
 * Appends are at-most-once, the event store never retries on its own.
 */
public class StorageWriteException extends RuntimeException {
    public final String aggregateId;

    public StorageWriteException(String aggregateId, String message, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
    }
}
