package com.gt.dailyprep.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A partial update of a problem as an ordered set of (field, value) pairs. Values are checked against the
 * field's declared type when they are added, so a built update only ever names known columns with values
 * of the right type.
 */
public final class ProblemUpdate {

    private final Map<ProblemField, Object> values;

    private ProblemUpdate(Map<ProblemField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<ProblemField, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(ProblemField field) {
        return values.containsKey(field);
    }

    public Object get(ProblemField field) {
        return values.get(field);
    }

    @Override
    public String toString() {
        return "ProblemUpdate" + values;
    }

    public static final class Builder {
        private final Map<ProblemField, Object> values = new EnumMap<>(ProblemField.class);

        public Builder set(ProblemField field, Object value) {
            if (value == null && !field.isNullable()) {
                throw new IllegalArgumentException("Field " + field + " cannot be cleared");
            }
            if (value != null && !field.getValueType().isInstance(value)) {
                throw new IllegalArgumentException("Field " + field + " expects " + field.getValueType().getSimpleName()
                        + " but was given " + value.getClass().getSimpleName());
            }

            values.put(field, value);
            return this;
        }

        public ProblemUpdate build() {
            return new ProblemUpdate(new EnumMap<>(values));
        }
    }
}
