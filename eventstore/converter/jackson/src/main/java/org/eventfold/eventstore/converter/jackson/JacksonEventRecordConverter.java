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

package org.eventfold.eventstore.converter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.eventfold.eventstore.api.EventRecord;
import org.eventfold.eventstore.api.EventRecordConverter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventRecordConverter} that stores the {@link EventRecord#changes()} as JSON using Jackson. The record is mapped like this:
 * <ol>
 *     <li>{@link EventRecord#name()} is used as cloud event type</li>
 *     <li>{@link EventRecord#aggregateId()} is used as cloud event subject</li>
 *     <li>{@link EventRecord#createdAt()} is used as cloud event time</li>
 *     <li>{@link EventRecord#changes()} is used as cloud event data (content type {@value #DEFAULT_CONTENT_TYPE})</li>
 *     <li>A random UUID is used as cloud event id (configurable, see {@link Builder})</li>
 * </ol>
 */
public class JacksonEventRecordConverter implements EventRecordConverter {
    private static final String DEFAULT_CONTENT_TYPE = "application/json";
    private static final TypeReference<Map<String, Object>> CHANGES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final URI cloudEventSource;
    private final Function<EventRecord, String> idMapper;
    private final String contentType;

    /**
     * Create a new instance of the {@link JacksonEventRecordConverter} that uses a random UUID as cloud event id and
     * {@value #DEFAULT_CONTENT_TYPE} as content type.
     *
     * @param objectMapper     The ObjectMapper instance to use
     * @param cloudEventSource The cloud event source.
     * @see Builder The Builder for more advanced configuration
     */
    public JacksonEventRecordConverter(ObjectMapper objectMapper, URI cloudEventSource) {
        this(objectMapper, cloudEventSource, defaultIdMapperFunction(), DEFAULT_CONTENT_TYPE);
    }

    private JacksonEventRecordConverter(ObjectMapper objectMapper, URI cloudEventSource, Function<EventRecord, String> idMapper, String contentType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventSource, "cloudEventSource cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        requireNonNull(contentType, "contentType cannot be null");
        this.objectMapper = objectMapper;
        this.cloudEventSource = cloudEventSource;
        this.idMapper = idMapper;
        this.contentType = contentType;
    }

    @Override
    public CloudEvent toCloudEvent(EventRecord eventRecord) {
        requireNonNull(eventRecord, "Event record cannot be null");
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(eventRecord.changes(), objectMapper::writeValueAsBytes);
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(eventRecord))
                .withSource(cloudEventSource)
                .withType(eventRecord.name())
                .withSubject(eventRecord.aggregateId())
                .withTime(eventRecord.createdAt())
                .withDataContentType(contentType)
                .withData(cloudEventData)
                .build();
    }

    @SuppressWarnings("unchecked")
    @Override
    public EventRecord toEventRecord(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, "Cloud event cannot be null");
        if (cloudEvent.getSubject() == null) {
            throw new IllegalArgumentException("Cloud event " + cloudEvent.getId() + " has no subject, cannot determine aggregate id");
        } else if (cloudEvent.getTime() == null) {
            throw new IllegalArgumentException("Cloud event " + cloudEvent.getId() + " has no time, cannot determine when it was created");
        }

        CloudEventData data = cloudEvent.getData();
        final Map<String, Object> changes;
        if (data == null) {
            changes = Collections.emptyMap();
        } else if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            changes = (Map<String, Object>) ((PojoCloudEventData<?>) data).getValue();
        } else {
            try {
                changes = objectMapper.readValue(data.toBytes(), CHANGES_TYPE);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        return new EventRecord(cloudEvent.getType(), cloudEvent.getSubject(), cloudEvent.getTime(), changes);
    }

    public static final class Builder {
        private final ObjectMapper objectMapper;
        private final URI cloudEventSource;
        private String contentType = DEFAULT_CONTENT_TYPE;
        private Function<EventRecord, String> idMapper = defaultIdMapperFunction();

        public Builder(ObjectMapper objectMapper, URI cloudEventSource) {
            this.objectMapper = objectMapper;
            this.cloudEventSource = cloudEventSource;
        }

        /**
         * @param contentType Specify the content type to use in the generated cloud event
         */
        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * @param idMapper A function that generates the cloud event id based on the event record. By default, a random UUID is used.
         */
        public Builder idMapper(Function<EventRecord, String> idMapper) {
            this.idMapper = idMapper;
            return this;
        }

        /**
         * @return A {@link JacksonEventRecordConverter} instance with the configured settings
         */
        public JacksonEventRecordConverter build() {
            return new JacksonEventRecordConverter(objectMapper, cloudEventSource, idMapper, contentType);
        }
    }

    private static Function<EventRecord, String> defaultIdMapperFunction() {
        return __ -> UUID.randomUUID().toString();
    }
}
