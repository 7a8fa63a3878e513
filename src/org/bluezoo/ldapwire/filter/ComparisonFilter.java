/*
 * ComparisonFilter.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of ldapwire, an LDAP filter and BER codec library.
 *
 * ldapwire is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ldapwire is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ldapwire.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.ldapwire.filter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An attribute value assertion: equality, greater-or-equal,
 * less-or-equal or approximate match.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ComparisonFilter extends Filter {

    private final FilterType type;
    private final String attribute;
    private final byte[] value;

    /**
     * Creates an attribute value assertion.
     *
     * @param type one of the comparison filter types
     * @param attribute the attribute description
     * @param value the assertion value
     */
    public ComparisonFilter(FilterType type, String attribute, byte[] value) {
        if (type == null || !type.isComparison()) {
            throw new IllegalArgumentException("Not a comparison filter type: " + type);
        }
        if (value == null) {
            throw new IllegalArgumentException("Null assertion value");
        }
        this.type = type;
        this.attribute = checkAttribute(attribute);
        this.value = value.clone();
    }

    /**
     * Creates an attribute value assertion with a UTF-8 encoded value.
     *
     * @param type one of the comparison filter types
     * @param attribute the attribute description
     * @param value the assertion value
     */
    public ComparisonFilter(FilterType type, String attribute, String value) {
        this(type, attribute, utf8(value));
    }

    @Override
    public FilterType getType() {
        return type;
    }

    public String getAttribute() {
        return attribute;
    }

    /**
     * Returns a copy of the assertion value.
     *
     * @return the value octets
     */
    public byte[] getValue() {
        return value.clone();
    }

    /**
     * Returns the assertion value decoded as UTF-8.
     *
     * @return the value
     */
    public String getValueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ComparisonFilter)) {
            return false;
        }
        ComparisonFilter f = (ComparisonFilter) other;
        return type == f.type && attribute.equals(f.attribute) && Arrays.equals(value, f.value);
    }

    @Override
    public int hashCode() {
        return (type.hashCode() * 31 + attribute.hashCode()) * 31 + Arrays.hashCode(value);
    }
}
