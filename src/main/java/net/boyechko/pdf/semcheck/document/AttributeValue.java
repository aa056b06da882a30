/*
 * PDF-SemCheck - Semantic Structure Validation for Tagged PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.semcheck.document;

import java.util.List;
import java.util.Objects;

/** A typed structure attribute value. */
public sealed interface AttributeValue {
    record Str(String value) implements AttributeValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }
    }

    record Bool(boolean value) implements AttributeValue {}

    record Int(long value) implements AttributeValue {}

    record Num(double value) implements AttributeValue {}

    record Array(List<AttributeValue> values) implements AttributeValue {
        public Array {
            values = List.copyOf(values);
        }
    }

    record Null() implements AttributeValue {}

    static AttributeValue of(String value) {
        return value != null ? new Str(value) : new Null();
    }

    static AttributeValue of(boolean value) {
        return new Bool(value);
    }

    static AttributeValue of(long value) {
        return new Int(value);
    }

    static AttributeValue of(double value) {
        return new Num(value);
    }

    static AttributeValue ofArray(AttributeValue... values) {
        return new Array(List.of(values));
    }

    static AttributeValue nullValue() {
        return new Null();
    }

    /** Returns the string payload, or null for every other variant. */
    default String asString() {
        return this instanceof Str s ? s.value() : null;
    }

    default Boolean asBoolean() {
        return this instanceof Bool b ? b.value() : null;
    }

    /**
     * Returns an integer reading of the value: integers as-is, doubles with no fractional part,
     * and strings that parse as integers. Null otherwise.
     */
    default Integer asInteger() {
        if (this instanceof Int i) {
            long v = i.value();
            return (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) ? (int) v : null;
        }
        if (this instanceof Num n) {
            double d = n.value();
            boolean whole = d == Math.rint(d) && !Double.isInfinite(d);
            return (whole && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) ? (int) d : null;
        }
        if (this instanceof Str s) {
            try {
                return Integer.parseInt(s.value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    default Double asDouble() {
        if (this instanceof Num n) return n.value();
        if (this instanceof Int i) return (double) i.value();
        return null;
    }

    default boolean isNull() {
        return this instanceof Null;
    }
}
