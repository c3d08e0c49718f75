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

import io.cloudevents.CloudEvent;

/**
 * Converts between {@link EventRecord}s and the {@link CloudEvent}s that an event store keeps in its log.
 */
public interface EventRecordConverter {

    /**
     * Convert an event record into a cloud event
     *
     * @param eventRecord The event record to convert
     * @return The {@link CloudEvent} instance, converted from the event record.
     */
    CloudEvent toCloudEvent(EventRecord eventRecord);

    /**
     * Convert a cloud event back into an event record
     *
     * @param cloudEvent The cloud event to convert
     * @return The event record instance, converted from the cloud event.
     */
    EventRecord toEventRecord(CloudEvent cloudEvent);
}
