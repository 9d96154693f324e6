package me.golemcore.pipeline.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw tool output classified into the shapes the result shaper knows how to
 * render.
 */
public sealed interface ShapeableValue {

    /**
     * The underlying value, used when the payload is serialized.
     */
    Object raw();

    record MapValue(Map<String, Object> entries) implements ShapeableValue {
        @Override
        public Object raw() {
            return entries;
        }
    }

    record SequenceValue(List<Object> items) implements ShapeableValue {
        @Override
        public Object raw() {
            return items;
        }
    }

    record TextValue(String text) implements ShapeableValue {
        @Override
        public Object raw() {
            return text;
        }
    }

    record ScalarValue(Object value) implements ShapeableValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record NullValue() implements ShapeableValue {
        @Override
        public Object raw() {
            return null;
        }
    }

    static ShapeableValue of(Object raw) {
        if (raw == null) {
            return new NullValue();
        }
        if (raw instanceof CharSequence text) {
            return new TextValue(text.toString());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), v));
            return new MapValue(Collections.unmodifiableMap(entries));
        }
        if (raw instanceof Collection<?> collection) {
            return new SequenceValue(Collections.unmodifiableList(new ArrayList<>(collection)));
        }
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(raw, i));
            }
            return new SequenceValue(Collections.unmodifiableList(items));
        }
        return new ScalarValue(raw);
    }
}
