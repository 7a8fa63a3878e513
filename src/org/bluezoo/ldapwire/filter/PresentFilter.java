/*
 * PresentFilter.java
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
 * Matches entries that have a value for an attribute.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PresentFilter extends Filter {

    private final String attribute;

    public PresentFilter(String attribute) {
        this.attribute = checkAttribute(attribute);
    }

    @Override
    public FilterType getType() {
        return FilterType.PRESENT;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PresentFilter && attribute.equals(((PresentFilter) other).attribute);
    }

    @Override
    public int hashCode() {
        return attribute.hashCode();
    }
}
