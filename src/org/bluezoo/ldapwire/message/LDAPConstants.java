/*
 * LDAPConstants.java
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
 * LDAP protocol constants used to frame search requests.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LDAPConstants {

    /** Protocol operation number of SearchRequest. */
    public static final int OP_SEARCH_REQUEST = 3;

    /** SearchRequest tag (0x63, application 3, constructed). */
    public static final int TAG_SEARCH_REQUEST = 0x63;

    /** Largest message ID (RFC 4511 maxInt). */
    public static final int MAX_MESSAGE_ID = Integer.MAX_VALUE;

    private LDAPConstants() {
    }
}
