/*
 * ASN1Exception.java
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

package org.bluezoo.ldapwire.asn1;

/**
 * Exception thrown when BER data cannot be decoded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ASN1Exception extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The reason a decode failed.
     */
    public enum Reason {

        /** The input ended inside identifier or length octets. */
        TRUNCATED,

        /** A declared length runs past the available or enclosing input. */
        LENGTH_EXCEEDS_INPUT,

        /** A long-form length was not encoded in the minimum number of octets. */
        NON_CANONICAL_LENGTH,

        /** The indefinite length form, which LDAP forbids. */
        INDEFINITE_LENGTH,

        /** Any other structural fault in the encoding. */
        MALFORMED
    }

    private final Reason reason;

    /**
     * Creates a new ASN.1 exception describing malformed input.
     *
     * @param message the error message
     */
    public ASN1Exception(String message) {
        this(Reason.MALFORMED, message);
    }

    /**
     * Creates a new ASN.1 exception.
     *
     * @param reason the reason for the failure
     * @param message the error message
     */
    public ASN1Exception(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Creates a new ASN.1 exception with a cause.
     *
     * @param reason the reason for the failure
     * @param message the error message
     * @param cause the underlying cause
     */
    public ASN1Exception(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Returns the reason for the failure.
     *
     * @return the reason
     */
    public Reason getReason() {
        return reason;
    }

}
