/*
 * package-info.java
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

/**
 * The LDAP search request, the message that carries an encoded filter
 * to the server.
 *
 * <p>{@link org.bluezoo.ldapwire.message.SearchRequestCodec} frames a
 * {@link org.bluezoo.ldapwire.message.SearchRequest} in its LDAPMessage
 * envelope. Connection handling and the other protocol operations are
 * left to the caller.</p>
 */
package org.bluezoo.ldapwire.message;
