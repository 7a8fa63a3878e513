/*
 * NotFilter.java
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
 * The negation of a filter.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class NotFilter extends Filter {

    private final Filter child;

    public NotFilter(Filter child) {
        if (child == null) {
            throw new IllegalArgumentException("Null operand");
        }
        this.child = child;
    }

    @Override
    public FilterType getType() {
        return FilterType.NOT;
    }

    public Filter getChild() {
        return child;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof NotFilter && child.equals(((NotFilter) other).child);
    }

    @Override
    public int hashCode() {
        return ~child.hashCode();
    }
}
