/*
 * FilterType.java
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

/**
 * The alternatives of the LDAP Filter CHOICE (RFC 4511 section 4.5.1),
 * numbered by their context-specific tag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum FilterType {

    AND(0, "&"),
    OR(1, "|"),
    NOT(2, "!"),
    EQUALITY_MATCH(3, "="),
    SUBSTRINGS(4, "="),
    GREATER_OR_EQUAL(5, ">="),
    LESS_OR_EQUAL(6, "<="),
    PRESENT(7, "=*"),
    APPROX_MATCH(8, "~="),
    EXTENSIBLE_MATCH(9, ":=");

    private final int tagNumber;
    private final String operator;

    FilterType(int tagNumber, String operator) {
        this.tagNumber = tagNumber;
        this.operator = operator;
    }

    /**
     * Returns the context-specific tag number of this alternative.
     *
     * @return the tag number
     */
    public int getTagNumber() {
        return tagNumber;
    }

    /**
     * Returns the operator text used in the string form.
     *
     * @return the operator
     */
    public String getOperator() {
        return operator;
    }

    /**
     * Returns whether this is one of the attribute value assertions
     * (equality, ordering or approximate match).
     *
     * @return true for the four comparison types
     */
    public boolean isComparison() {
        return this == EQUALITY_MATCH || this == GREATER_OR_EQUAL
                || this == LESS_OR_EQUAL || this == APPROX_MATCH;
    }

    /**
     * Returns whether this type combines other filters.
     *
     * @return true for AND, OR and NOT
     */
    public boolean isNested() {
        return this == AND || this == OR || this == NOT;
    }

    /**
     * Returns the filter type for a tag number.
     *
     * @param tagNumber the context-specific tag number
     * @return the filter type, or null if unknown
     */
    public static FilterType fromTagNumber(int tagNumber) {
        for (FilterType type : values()) {
            if (type.tagNumber == tagNumber) {
                return type;
            }
        }
        return null;
    }
}
