/*
 * DerefAliases.java
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
 * When the server dereferences aliases during a search.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DerefAliases {

    NEVER(0),
    IN_SEARCHING(1),
    FINDING_BASE_OBJ(2),
    ALWAYS(3);

    private final int value;

    DerefAliases(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the policy with the given protocol value.
     *
     * @param value the ENUMERATED value
     * @return the policy, or null if the value is not defined
     */
    public static DerefAliases fromValue(long value) {
        for (DerefAliases deref : values()) {
            if (deref.value == value) {
                return deref;
            }
        }
        return null;
    }
}
