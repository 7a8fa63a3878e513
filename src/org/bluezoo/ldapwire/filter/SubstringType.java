/*
 * SubstringType.java
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
 * Position of a substring component, numbered by its context tag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SubstringType {

    INITIAL(0),
    ANY(1),
    FINAL(2);

    private final int tagNumber;

    SubstringType(int tagNumber) {
        this.tagNumber = tagNumber;
    }

    public int getTagNumber() {
        return tagNumber;
    }

    /**
     * Returns the substring type for a tag number.
     *
     * @param tagNumber the context-specific tag number
     * @return the substring type, or null if unknown
     */
    public static SubstringType fromTagNumber(int tagNumber) {
        for (SubstringType type : values()) {
            if (type.tagNumber == tagNumber) {
                return type;
            }
        }
        return null;
    }
}
