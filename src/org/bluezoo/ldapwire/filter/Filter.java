/*
 * Filter.java
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

/**
 * An LDAP search filter.
 *
 * <p>Filters form an immutable tree. They are produced by
 * {@link FilterParser} from the RFC 2254 string form, by
 * {@link FilterBuilder} programmatically, or by {@link FilterCodec} from
 * BER. {@link #toString()} renders the string form.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Filter {

    Filter() {
    }

    /**
     * Returns which alternative of the Filter CHOICE this is.
     *
     * @return the filter type
     */
    public abstract FilterType getType();

    /**
     * Returns the RFC 2254 string form of this filter.
     */
    @Override
    public String toString() {
        return FilterRenderer.render(this);
    }

    static String checkAttribute(String attribute) {
        if (attribute == null || attribute.isEmpty()) {
            throw new IllegalArgumentException("Missing attribute description");
        }
        return attribute;
    }

    static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
