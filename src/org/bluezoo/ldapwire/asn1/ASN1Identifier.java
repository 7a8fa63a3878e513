/*
 * ASN1Identifier.java
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
 * The identifier of a BER encoded value: tag class, primitive or
 * constructed form, and tag number.
 *
 * <p>Tag numbers below 30 fit in the leading identifier octet. Larger
 * tag numbers set the low five bits of the leading octet to
 * {@code 11111} and follow it with the number in base 128, most
 * significant group first, with the high bit set on every octet but
 * the last.</p>
 *
 * <p>Identifiers are immutable.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ASN1Identifier {

    /** Universal BOOLEAN. */
    public static final ASN1Identifier BOOLEAN =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, false, ASN1Type.BOOLEAN);
    /** Universal INTEGER. */
    public static final ASN1Identifier INTEGER =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, false, ASN1Type.INTEGER);
    /** Universal OCTET STRING. */
    public static final ASN1Identifier OCTET_STRING =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, false, ASN1Type.OCTET_STRING);
    /** Universal NULL. */
    public static final ASN1Identifier NULL =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, false, ASN1Type.NULL);
    /** Universal ENUMERATED. */
    public static final ASN1Identifier ENUMERATED =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, false, ASN1Type.ENUMERATED);
    /** Universal SEQUENCE (constructed). */
    public static final ASN1Identifier SEQUENCE =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, true, ASN1Type.SEQUENCE & ASN1Type.TAG_MASK);
    /** Universal SET (constructed). */
    public static final ASN1Identifier SET =
            new ASN1Identifier(ASN1Type.CLASS_UNIVERSAL, true, ASN1Type.SET & ASN1Type.TAG_MASK);

    private final int tagClass;
    private final boolean constructed;
    private final int tagNumber;

    /**
     * Creates an identifier.
     *
     * @param tagClass the tag class (CLASS_UNIVERSAL, CLASS_APPLICATION,
     *        CLASS_CONTEXT or CLASS_PRIVATE)
     * @param constructed whether the value is constructed
     * @param tagNumber the tag number
     * @throws IllegalArgumentException if the class or tag number is invalid
     */
    public ASN1Identifier(int tagClass, boolean constructed, int tagNumber) {
        if ((tagClass & ~ASN1Type.CLASS_MASK) != 0) {
            throw new IllegalArgumentException("Invalid tag class: 0x" + Integer.toHexString(tagClass));
        }
        if (tagNumber < 0) {
            throw new IllegalArgumentException("Negative tag number: " + tagNumber);
        }
        this.tagClass = tagClass;
        this.constructed = constructed;
        this.tagNumber = tagNumber;
    }

    /**
     * Returns the identifier described by a single leading octet such as
     * {@link ASN1Type#SEQUENCE} or {@code 0xA3}.
     *
     * @param tag the identifier octet
     * @return the identifier
     * @throws IllegalArgumentException if the octet announces a multi-octet tag
     */
    public static ASN1Identifier fromTag(int tag) {
        if ((tag & ~0xFF) != 0 || ASN1Type.getTagNumber(tag) == ASN1Type.MULTI_OCTET_TAG) {
            throw new IllegalArgumentException("Not a single-octet tag: 0x" + Integer.toHexString(tag));
        }
        return new ASN1Identifier(ASN1Type.getTagClass(tag), ASN1Type.isConstructed(tag),
                ASN1Type.getTagNumber(tag));
    }

    /**
     * Creates a context-specific identifier.
     *
     * @param tagNumber the tag number
     * @param constructed whether the value is constructed
     * @return the identifier
     */
    public static ASN1Identifier context(int tagNumber, boolean constructed) {
        return new ASN1Identifier(ASN1Type.CLASS_CONTEXT, constructed, tagNumber);
    }

    /**
     * Creates an application identifier.
     *
     * @param tagNumber the tag number
     * @param constructed whether the value is constructed
     * @return the identifier
     */
    public static ASN1Identifier application(int tagNumber, boolean constructed) {
        return new ASN1Identifier(ASN1Type.CLASS_APPLICATION, constructed, tagNumber);
    }

    /**
     * Returns the tag class.
     *
     * @return CLASS_UNIVERSAL, CLASS_APPLICATION, CLASS_CONTEXT, or CLASS_PRIVATE
     */
    public int getTagClass() {
        return tagClass;
    }

    /**
     * Returns whether this identifier denotes a constructed value.
     *
     * @return true if constructed
     */
    public boolean isConstructed() {
        return constructed;
    }

    /**
     * Returns the tag number.
     *
     * @return the tag number
     */
    public int getTagNumber() {
        return tagNumber;
    }

    /**
     * Returns whether this is a universal class identifier.
     *
     * @return true if universal
     */
    public boolean isUniversal() {
        return tagClass == ASN1Type.CLASS_UNIVERSAL;
    }

    /**
     * Returns whether the tag number requires the multi-octet form.
     *
     * @return true if the tag number is 30 or more
     */
    public boolean isMultiOctet() {
        return tagNumber >= ASN1Type.FIRST_MULTI_OCTET_TAG_NUMBER;
    }

    /**
     * Returns the leading identifier octet.
     *
     * @return the first octet of the encoded identifier
     */
    public int getLeadingOctet() {
        int ccf = tagClass | (constructed ? ASN1Type.CONSTRUCTED : ASN1Type.PRIMITIVE);
        return isMultiOctet() ? ccf | ASN1Type.MULTI_OCTET_TAG : ccf | tagNumber;
    }

    /**
     * Returns an identifier with the same class and tag number and the
     * given form.
     *
     * @param constructed the form of the returned identifier
     * @return the identifier
     */
    public ASN1Identifier withConstructed(boolean constructed) {
        if (this.constructed == constructed) {
            return this;
        }
        return new ASN1Identifier(tagClass, constructed, tagNumber);
    }

    /**
     * Returns whether this identifier has the given class and tag number,
     * regardless of form.
     *
     * @param tagClass the tag class
     * @param tagNumber the tag number
     * @return true if both match
     */
    public boolean matches(int tagClass, int tagNumber) {
        return this.tagClass == tagClass && this.tagNumber == tagNumber;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ASN1Identifier)) {
            return false;
        }
        ASN1Identifier id = (ASN1Identifier) other;
        return tagClass == id.tagClass && constructed == id.constructed && tagNumber == id.tagNumber;
    }

    @Override
    public int hashCode() {
        return (tagNumber * 31 + tagClass) * 2 + (constructed ? 1 : 0);
    }

    @Override
    public String toString() {
        return ASN1Type.getTagName(tagClass, constructed, tagNumber);
    }
}
