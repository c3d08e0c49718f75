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

package org.eventfold.eventstore.inmemory;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import org.eventfold.eventstore.api.*;
import org.eventfold.eventstore.converter.jackson.JacksonEventRecordConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. It also supports the {@link ConditionallyAppendToEventStore} contract.
 * <p>
 * Events are kept as {@link CloudEvent}s, i.e. in the same form as a durable event store would write them, and are
 * converted back into domain events each time they are read.
 *
 * @param <T> The domain event type
 */
public class InMemoryEventStore<T extends DomainEvent> implements EventStore<T>, ConditionallyAppendToEventStore<T> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);
    private static final URI DEFAULT_SOURCE = URI.create("urn:eventfold:inmemory");

    private final List<CloudEvent> cloudEvents = new ArrayList<>();
    private final Map<String, Long> versions = new HashMap<>();
    private final EventRecordMapper<T> eventRecordMapper;
    private final EventRecordConverter eventRecordConverter;

    /**
     * Create an instance of {@link InMemoryEventStore} that converts event records to cloud events using a
     * {@link JacksonEventRecordConverter} with a default {@link ObjectMapper}.
     *
     * @param eventRecordMapper Reconstructs domain events from event records
     */
    public InMemoryEventStore(EventRecordMapper<T> eventRecordMapper) {
        this(eventRecordMapper, new JacksonEventRecordConverter(new ObjectMapper(), DEFAULT_SOURCE));
    }

    /**
     * Create an instance of {@link InMemoryEventStore}
     *
     * @param eventRecordMapper    Reconstructs domain events from event records
     * @param eventRecordConverter Converts event records to and from the cloud events kept in memory
     */
    public InMemoryEventStore(EventRecordMapper<T> eventRecordMapper, EventRecordConverter eventRecordConverter) {
        if (eventRecordMapper == null) throw new IllegalArgumentException(EventRecordMapper.class.getSimpleName() + " cannot be null");
        if (eventRecordConverter == null) throw new IllegalArgumentException(EventRecordConverter.class.getSimpleName() + " cannot be null");
        this.eventRecordMapper = eventRecordMapper;
        this.eventRecordConverter = eventRecordConverter;
    }

    @Override
    public void append(T event) {
        requireNonNull(event, "Event cannot be null");
        CloudEvent cloudEvent = eventRecordConverter.toCloudEvent(event.toRecord());
        long version;
        synchronized (cloudEvents) {
            cloudEvents.add(cloudEvent);
            version = versions.merge(event.aggregateId(), 1L, Long::sum);
        }
        log.debug("Appended {} to aggregate {} (version {})", event.name(), event.aggregateId(), version);
    }

    @Override
    public List<T> listAll() {
        final List<CloudEvent> snapshot;
        synchronized (cloudEvents) {
            snapshot = new ArrayList<>(cloudEvents);
        }
        return snapshot.stream()
                .map(eventRecordConverter::toEventRecord)
                .map(eventRecordMapper::fromRecord)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public WriteResult append(String aggregateId, WriteCondition writeCondition, List<T> events) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireTrue(writeCondition != null, WriteCondition.class.getSimpleName() + " cannot be null");
        requireTrue(events != null, "Events cannot be null");
        events.forEach(e -> requireTrue(aggregateId.equals(e.aggregateId()), "Event " + e.name() + " belongs to aggregate " + e.aggregateId() + " and cannot be appended to aggregate " + aggregateId));

        List<CloudEvent> newCloudEvents = events.stream().map(DomainEvent::toRecord).map(eventRecordConverter::toCloudEvent).collect(Collectors.toList());
        final long currentVersion;
        final long newVersion;
        synchronized (cloudEvents) {
            currentVersion = versions.getOrDefault(aggregateId, 0L);
            if (!writeCondition.isFulfilledBy(currentVersion)) {
                throw new WriteConditionNotFulfilledException(aggregateId, currentVersion, writeCondition);
            }
            cloudEvents.addAll(newCloudEvents);
            newVersion = currentVersion + newCloudEvents.size();
            if (!newCloudEvents.isEmpty()) {
                versions.put(aggregateId, newVersion);
            }
        }
        log.debug("Appended {} event(s) to aggregate {} (version {})", newCloudEvents.size(), aggregateId, newVersion);
        return new WriteResult(aggregateId, currentVersion, newVersion);
    }

    @Override
    public long version(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        synchronized (cloudEvents) {
            return versions.getOrDefault(aggregateId, 0L);
        }
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }
}
