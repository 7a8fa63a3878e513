/*
 * ASN1Type.java
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
 * Constants for the leading identifier octet of a BER encoding, and
 * helpers that take such an octet apart or put one together.
 *
 * <pre>
 *   8 7 | 6 | 5 4 3 2 1
 *  class| C |  number
 * </pre>
 *
 * <p>The two class bits select universal, application, context-specific
 * or private tags. Bit 6 is set for constructed values. The low five
 * bits hold the tag number, or {@link #MULTI_OCTET_TAG} when the number
 * follows in base-128 octets.</p>
 *
 * <p>The universal constants below are whole leading octets as they
 * appear on the wire, so {@link #SEQUENCE} and {@link #SET} already carry
 * the constructed bit. Identifiers that need more than one octet are
 * modelled by {@link ASN1Identifier}.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ASN1Type {

    private ASN1Type() {
    }

    // Classes

    public static final int CLASS_UNIVERSAL = 0x00;
    public static final int CLASS_APPLICATION = 0x40;
    public static final int CLASS_CONTEXT = 0x80;
    public static final int CLASS_PRIVATE = 0xC0;

    // Forms

    public static final int PRIMITIVE = 0x00;
    public static final int CONSTRUCTED = 0x20;

    // The universal types an LDAP message is built from

    public static final int BOOLEAN = 0x01;
    public static final int INTEGER = 0x02;
    public static final int OCTET_STRING = 0x04;
    public static final int NULL = 0x05;
    public static final int ENUMERATED = 0x0A;
    public static final int SEQUENCE = 0x30;
    public static final int SET = 0x31;

    /** Low bits of a leading octet whose tag number follows in further octets. */
    public static final int MULTI_OCTET_TAG = 0x1F;

    /** Tag numbers from this value upwards are always written in multi-octet form. */
    public static final int FIRST_MULTI_OCTET_TAG_NUMBER = 30;

    static final int CLASS_MASK = 0xC0;
    static final int CONSTRUCTED_MASK = 0x20;
    static final int TAG_MASK = 0x1F;

    public static int getTagClass(int tag) {
        return tag & CLASS_MASK;
    }

    public static boolean isConstructed(int tag) {
        return (tag & CONSTRUCTED_MASK) != 0;
    }

    /**
     * Returns the low five bits of a leading octet.
     *
     * @param tag the leading octet
     * @return the tag number, or {@link #MULTI_OCTET_TAG} if the number
     *         is carried in subsequent octets
     */
    public static int getTagNumber(int tag) {
        return tag & TAG_MASK;
    }

    /**
     * Builds the leading octet of a context-specific tag such as a
     * Filter alternative.
     *
     * @param tagNumber a tag number below 30
     * @param constructed the form
     * @return the leading octet
     */
    public static int contextTag(int tagNumber, boolean constructed) {
        return leadingOctet(CLASS_CONTEXT, constructed, tagNumber);
    }

    /**
     * Builds the leading octet of an application tag such as a protocol
     * operation.
     *
     * @param tagNumber a tag number below 30
     * @param constructed the form
     * @return the leading octet
     */
    public static int applicationTag(int tagNumber, boolean constructed) {
        return leadingOctet(CLASS_APPLICATION, constructed, tagNumber);
    }

    private static int leadingOctet(int tagClass, boolean constructed, int tagNumber) {
        return tagClass | (constructed ? CONSTRUCTED : PRIMITIVE) | tagNumber;
    }

    /**
     * Describes an identifier for logs and error messages, for example
     * {@code SEQUENCE} or {@code CONTEXT 3 (constructed)}.
     *
     * @param tagClass the class bits
     * @param constructed the form
     * @param tagNumber the full tag number
     * @return the description
     */
    public static String getTagName(int tagClass, boolean constructed, int tagNumber) {
        String className;
        switch (tagClass) {
            case CLASS_UNIVERSAL:
                return universalName(tagNumber);
            case CLASS_APPLICATION:
                className = "APPLICATION";
                break;
            case CLASS_CONTEXT:
                className = "CONTEXT";
                break;
            default:
                className = "PRIVATE";
        }
        return className + " " + tagNumber + (constructed ? " (constructed)" : " (primitive)");
    }

    /**
     * Describes a single-octet tag.
     *
     * @param tag the leading octet
     * @return the description
     */
    public static String getTagName(int tag) {
        return getTagName(getTagClass(tag), isConstructed(tag), getTagNumber(tag));
    }

    private static String universalName(int tagNumber) {
        switch (tagNumber) {
            case BOOLEAN:
                return "BOOLEAN";
            case INTEGER:
                return "INTEGER";
            case OCTET_STRING:
                return "OCTET STRING";
            case NULL:
                return "NULL";
            case ENUMERATED:
                return "ENUMERATED";
            case SEQUENCE & TAG_MASK:
                return "SEQUENCE";
            case SET & TAG_MASK:
                return "SET";
            default:
                return "UNIVERSAL " + tagNumber;
        }
    }
}
