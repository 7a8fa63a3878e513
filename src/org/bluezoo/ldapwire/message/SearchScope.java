/*
 * SearchScope.java
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

package org.bluezoo.ldapwire.message;

/**
 * The scope of a search, carried as an ENUMERATED in the request.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SearchScope {

    /** The base object only. */
    BASE(0),

    /** The immediate subordinates of the base object. */
    ONE(1),

    /** The base object and all its subordinates. */
    SUBTREE(2);

    private final int value;

    SearchScope(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the scope with the given protocol value.
     *
     * @param value the ENUMERATED value
     * @return the scope, or null if the value is not defined
     */
    public static SearchScope fromValue(long value) {
        for (SearchScope scope : values()) {
            if (scope.value == value) {
                return scope;
            }
        }
        return null;
    }
}
