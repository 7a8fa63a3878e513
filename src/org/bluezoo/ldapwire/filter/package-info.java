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
 * LDAP search filters (RFC 2254, RFC 4511 section 4.5.1).
 *
 * <p>A {@link org.bluezoo.ldapwire.filter.Filter} is an immutable tree
 * with one class per alternative of the Filter CHOICE. Filters are
 * obtained in three ways:</p>
 *
 * <ul>
 *   <li>{@link org.bluezoo.ldapwire.filter.FilterParser} parses the
 *       string form, using {@link org.bluezoo.ldapwire.filter.FilterTokenizer}</li>
 *   <li>{@link org.bluezoo.ldapwire.filter.FilterBuilder} assembles a
 *       filter from a sequence of calls</li>
 *   <li>{@link org.bluezoo.ldapwire.filter.FilterCodec} decodes the BER
 *       form received on the wire</li>
 * </ul>
 *
 * <p>{@link org.bluezoo.ldapwire.filter.FilterRenderer} produces the
 * string form again and {@link org.bluezoo.ldapwire.filter.FilterCodec}
 * the BER form.</p>
 *
 * <pre>{@code
 * Filter filter = FilterParser.parse("(&(objectClass=person)(cn=Jo*n*th))");
 * byte[] ber = FilterCodec.encode(filter);
 * String text = filter.toString();
 * }</pre>
 */
package org.bluezoo.ldapwire.filter;
