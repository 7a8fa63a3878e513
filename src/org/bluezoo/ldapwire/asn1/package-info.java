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
 * ASN.1 BER (Basic Encoding Rules) codec for LDAP.
 *
 * <p>LDAP messages are encoded with the definite-length subset of BER
 * defined in ITU-T X.690. This package provides the value model and the
 * codec:</p>
 *
 * <ul>
 *   <li>{@link org.bluezoo.ldapwire.asn1.ASN1Identifier} - tag class, form and tag number</li>
 *   <li>{@link org.bluezoo.ldapwire.asn1.ASN1Element} - an immutable primitive or constructed value</li>
 *   <li>{@link org.bluezoo.ldapwire.asn1.BEREncoder} - streaming writer and single-value encoders</li>
 *   <li>{@link org.bluezoo.ldapwire.asn1.BERDecoder} - streaming and single-pass decoders</li>
 *   <li>{@link org.bluezoo.ldapwire.asn1.ASN1Exception} - decode failures, classified by reason</li>
 * </ul>
 *
 * <h2>Encoding rules</h2>
 *
 * <ul>
 *   <li>Tag numbers below 30 share the leading identifier octet with the
 *       class and form bits. Larger numbers follow in base 128.</li>
 *   <li>Lengths below 128 use the short form, larger lengths the long
 *       form with the fewest magnitude octets. The indefinite form is
 *       never written and is rejected on input.</li>
 *   <li>INTEGER and ENUMERATED use minimal two's complement.</li>
 *   <li>BOOLEAN is {@code 0xFF} for true and {@code 0x00} for false.</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 *
 * <p>The system properties {@code ldapwire.ber.maxDepth} (default 64)
 * and {@code ldapwire.ber.maxLength} (default 10485760) bound the nesting
 * and declared lengths the codec accepts.</p>
 */
package org.bluezoo.ldapwire.asn1;
