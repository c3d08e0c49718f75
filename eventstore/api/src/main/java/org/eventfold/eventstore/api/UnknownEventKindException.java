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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown when an {@link EventRecord} has a kind tag that doesn't correspond to any known domain event.
 * A projection built from a log containing such a record cannot be trusted, so this exception is never retried.
 */
public class UnknownEventKindException extends RuntimeException {
    public final String name;

    public UnknownEventKindException(String name) {
        super("Unknown event kind: " + name);
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnknownEventKindException)) return false;
        UnknownEventKindException that = (UnknownEventKindException) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", UnknownEventKindException.class.getSimpleName() + "[", "]")
                .add("name='" + name + "'")
                .toString();
    }
}
