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

import org.eventfold.eventstore.api.ConditionallyAppendToEventStore;
import org.eventfold.eventstore.api.DomainEvent;
import org.eventfold.eventstore.api.EventStore;
import org.eventfold.eventstore.api.StorageWriteException;
import org.eventfold.eventstore.api.UnknownEventKindException;
import org.eventfold.eventstore.api.WriteConditionNotFulfilledException;
import org.eventfold.eventstore.api.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.eventfold.eventstore.api.WriteCondition.versionEq;

/**
 * Loads aggregates by folding their events and persists the events that an aggregate has emitted.
 * <p>
 * Loading reads all events from the {@link EventStore}, keeps the ones belonging to the requested aggregate, sorts them
 * by creation time and folds their changes into a {@link ProjectionState} (see {@link ProjectionState#fold(List)}) that
 * the aggregate is then rehydrated from.
 *
 * @param <A> The aggregate type
 * @param <E> The domain event type of the aggregate
 */
public class EventSourcedRepository<A extends EventSourced<E>, E extends DomainEvent> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore<E> eventStore;
    private final Function<ProjectionState, A> rehydrate;
    private final ConcurrencyControl concurrencyControl;

    /**
     * @param eventStore         The event store to use. Must implement {@link ConditionallyAppendToEventStore} if {@code concurrencyControl} is {@link ConcurrencyControl#OPTIMISTIC}.
     * @param rehydrate          Creates an aggregate from its folded state
     * @param concurrencyControl How to guard against concurrent writers
     */
    public EventSourcedRepository(EventStore<E> eventStore, Function<ProjectionState, A> rehydrate, ConcurrencyControl concurrencyControl) {
        if (eventStore == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (rehydrate == null) throw new IllegalArgumentException("rehydrate cannot be null");
        if (concurrencyControl == null) throw new IllegalArgumentException(ConcurrencyControl.class.getSimpleName() + " cannot be null");
        if (concurrencyControl == ConcurrencyControl.OPTIMISTIC && !(eventStore instanceof ConditionallyAppendToEventStore)) {
            throw new IllegalArgumentException(eventStore.getClass().getName() + " doesn't implement " + ConditionallyAppendToEventStore.class.getSimpleName() + ", cannot use " + ConcurrencyControl.OPTIMISTIC + " concurrency control");
        }
        this.eventStore = eventStore;
        this.rehydrate = rehydrate;
        this.concurrencyControl = concurrencyControl;
    }

    /**
     * Load an aggregate
     *
     * @param aggregateId The id of the aggregate
     * @return The aggregate rehydrated from all its events
     * @throws AggregateNotFoundException If there are no events for {@code aggregateId}, or none of them created the aggregate
     * @throws UnknownEventKindException  If a stored event cannot be converted into a domain event
     */
    public A getById(String aggregateId) {
        return findById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId));
    }

    /**
     * Load an aggregate if it exists
     *
     * @param aggregateId The id of the aggregate
     * @return The aggregate rehydrated from all its events, or an empty {@code Optional} if there are no events for
     * {@code aggregateId} or {@link #isCreated(ProjectionState)} says the events never created it.
     */
    public Optional<A> findById(String aggregateId) {
        ProjectionState state = fold(aggregateId);
        if (!isCreated(state)) {
            if (!state.isEmpty()) {
                log.debug("Aggregate {} has {} event(s) but none of them created it", aggregateId, state.version());
            }
            return Optional.empty();
        }
        log.debug("Rehydrating aggregate {} from {} event(s)", aggregateId, state.version());
        return Optional.of(rehydrate.apply(state));
    }

    /**
     * @return {@code true} if {@link #findById(String)} would find the aggregate, {@code false} otherwise.
     */
    public boolean exists(String aggregateId) {
        return isCreated(fold(aggregateId));
    }

    /**
     * Decides whether the folded events of an aggregate describe an aggregate that was created. By default any
     * aggregate with at least one event is. Override to require the fields that only a creation event sets.
     *
     * @param state The folded events of a single aggregate
     */
    protected boolean isCreated(ProjectionState state) {
        return !state.isEmpty();
    }

    /**
     * Append the pending events of the {@code aggregate} to the event store, in the order they were emitted, and mark
     * them as committed. Persisting an aggregate without pending events does nothing.
     *
     * <p>
     * If the write fails the aggregate keeps all its pending events and its version. With
     * {@link ConcurrencyControl#OPTIMISTIC} nothing was appended. With {@link ConcurrencyControl#NONE} the events are
     * appended one at a time, so a {@link StorageWriteException} thrown part way leaves the events before the failing
     * one in the store even though they are still pending.
     *
     * @param aggregate The aggregate to persist
     * @throws WriteConditionNotFulfilledException If {@link ConcurrencyControl#OPTIMISTIC} is used and the aggregate has been changed by someone else since it was loaded.
     * @throws StorageWriteException               If the event store failed to write, rethrown as is
     */
    public void persist(A aggregate) {
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        List<E> pendingEvents = List.copyOf(aggregate.pendingEvents());
        if (pendingEvents.isEmpty()) {
            return;
        }

        final long newVersion;
        if (concurrencyControl == ConcurrencyControl.OPTIMISTIC) {
            @SuppressWarnings("unchecked")
            ConditionallyAppendToEventStore<E> conditionalEventStore = (ConditionallyAppendToEventStore<E>) eventStore;
            WriteResult writeResult = conditionalEventStore.append(aggregate.id(), versionEq(aggregate.version()), pendingEvents);
            newVersion = writeResult.newVersion();
        } else {
            pendingEvents.forEach(eventStore::append);
            newVersion = aggregate.version() + pendingEvents.size();
        }
        log.debug("Persisted {} event(s) of aggregate {}, version {} -> {}", pendingEvents.size(), aggregate.id(), aggregate.version(), newVersion);
        aggregate.markCommitted(newVersion);
    }

    private ProjectionState fold(String aggregateId) {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        List<E> events = eventStore.listAll().stream()
                .filter(e -> aggregateId.equals(e.aggregateId()))
                .collect(Collectors.toList());
        return ProjectionState.fold(events);
    }
}
