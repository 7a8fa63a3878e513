/*
 * ASN1Element.java
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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ASN.1 value together with its identifier.
 *
 * <p>Primitive elements hold their content octets. Constructed elements
 * hold their child elements, which they own exclusively. Elements are
 * immutable: the content octets are copied on the way in and on the way
 * out.</p>
 *
 * <p>The factory methods build each of the value shapes LDAP needs.
 * Tagging is expressed with {@link #explicit} and {@link #implicit}:
 * an explicit tag wraps the inner element as the single child of a
 * constructed element, an implicit tag replaces the inner element's
 * identifier and keeps its content.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ASN1Element {

    /**
     * The shape of an element, derived from its identifier.
     */
    public enum Kind {
        /** Universal BOOLEAN. */
        BOOLEAN,
        /** Universal INTEGER or ENUMERATED. */
        INTEGER,
        /** Universal NULL. */
        NULL,
        /** Universal OCTET STRING. */
        OCTET_STRING,
        /** Universal SEQUENCE. */
        SEQUENCE,
        /** Universal SET. */
        SET,
        /** Any application, context-specific or private identifier. */
        TAGGED
    }

    private static final byte[] EMPTY = new byte[0];

    private final ASN1Identifier identifier;
    private final byte[] value;
    private final List<ASN1Element> children;

    /**
     * Creates a primitive element.
     *
     * @param identifier the identifier, which must be primitive
     * @param value the content octets
     */
    public ASN1Element(ASN1Identifier identifier, byte[] value) {
        if (identifier.isConstructed()) {
            throw new IllegalArgumentException("Constructed identifier for primitive content: " + identifier);
        }
        this.identifier = identifier;
        this.value = value != null ? value.clone() : EMPTY;
        this.children = null;
    }

    /**
     * Creates a constructed element.
     *
     * @param identifier the identifier, which must be constructed
     * @param children the child elements
     */
    public ASN1Element(ASN1Identifier identifier, List<ASN1Element> children) {
        if (!identifier.isConstructed()) {
            throw new IllegalArgumentException("Primitive identifier for constructed content: " + identifier);
        }
        this.identifier = identifier;
        this.value = null;
        this.children = Collections.unmodifiableList(new ArrayList<ASN1Element>(children));
    }

    /**
     * Creates a primitive element from a single-octet tag.
     *
     * @param tag the tag byte
     * @param value the content octets
     */
    public ASN1Element(int tag, byte[] value) {
        this(ASN1Identifier.fromTag(tag), value);
    }

    /**
     * Creates a constructed element from a single-octet tag.
     *
     * @param tag the tag byte
     * @param children the child elements
     */
    public ASN1Element(int tag, List<ASN1Element> children) {
        this(ASN1Identifier.fromTag(tag), children);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Factories
    // ─────────────────────────────────────────────────────────────────────────

    public static ASN1Element booleanValue(boolean value) {
        return new ASN1Element(ASN1Identifier.BOOLEAN, new byte[] { (byte) (value ? 0xFF : 0x00) });
    }

    public static ASN1Element integer(long value) {
        return new ASN1Element(ASN1Identifier.INTEGER, BEREncoder.integerContent(value));
    }

    public static ASN1Element enumerated(long value) {
        return new ASN1Element(ASN1Identifier.ENUMERATED, BEREncoder.integerContent(value));
    }

    public static ASN1Element nullValue() {
        return new ASN1Element(ASN1Identifier.NULL, EMPTY);
    }

    public static ASN1Element octetString(byte[] value) {
        return new ASN1Element(ASN1Identifier.OCTET_STRING, value);
    }

    /**
     * Creates an OCTET STRING holding the UTF-8 encoding of a string.
     *
     * @param value the string
     * @return the element
     */
    public static ASN1Element octetString(String value) {
        return octetString(value.getBytes(StandardCharsets.UTF_8));
    }

    public static ASN1Element sequence(List<ASN1Element> children) {
        return new ASN1Element(ASN1Identifier.SEQUENCE, children);
    }

    /**
     * Creates a SET. Children keep their insertion order on the wire
     * although the order carries no meaning.
     *
     * @param children the members
     * @return the element
     */
    public static ASN1Element set(List<ASN1Element> children) {
        return new ASN1Element(ASN1Identifier.SET, children);
    }

    /**
     * Wraps an element under an explicit tag. The result is always
     * constructed and has the inner element as its only child.
     *
     * @param identifier the tag to apply, whose form is ignored
     * @param inner the wrapped element
     * @return the tagged element
     */
    public static ASN1Element explicit(ASN1Identifier identifier, ASN1Element inner) {
        return new ASN1Element(identifier.withConstructed(true), Collections.singletonList(inner));
    }

    /**
     * Re-tags an element with an implicit tag. The content is reused
     * unchanged and the form follows the inner element.
     *
     * @param identifier the tag to apply, whose form is ignored
     * @param inner the element to re-tag
     * @return the tagged element
     */
    public static ASN1Element implicit(ASN1Identifier identifier, ASN1Element inner) {
        return inner.withIdentifier(identifier.withConstructed(inner.isConstructed()));
    }

    /**
     * Returns this element's content under another identifier of the
     * same form. This is how an implicitly tagged value is read back as
     * its underlying type.
     *
     * @param identifier the identifier
     * @return the re-tagged element
     * @throws IllegalArgumentException if the form does not match
     */
    public ASN1Element withIdentifier(ASN1Identifier identifier) {
        if (identifier.equals(this.identifier)) {
            return this;
        }
        return isConstructed() ? new ASN1Element(identifier, children) : new ASN1Element(identifier, value);
    }

    /**
     * Returns the element wrapped by an explicit tag.
     *
     * @return the single child
     * @throws ASN1Exception if this element does not hold exactly one child
     */
    public ASN1Element getExplicitContent() throws ASN1Exception {
        if (children == null || children.size() != 1) {
            throw new ASN1Exception("Expected exactly one element under explicit tag " + identifier);
        }
        return children.get(0);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Identifier accessors
    // ─────────────────────────────────────────────────────────────────────────

    public ASN1Identifier getIdentifier() {
        return identifier;
    }

    /**
     * Returns the leading identifier octet.
     *
     * @return the tag
     */
    public int getTag() {
        return identifier.getLeadingOctet();
    }

    /**
     * Returns the tag class.
     *
     * @return CLASS_UNIVERSAL, CLASS_APPLICATION, CLASS_CONTEXT, or CLASS_PRIVATE
     */
    public int getTagClass() {
        return identifier.getTagClass();
    }

    public int getTagNumber() {
        return identifier.getTagNumber();
    }

    public boolean isConstructed() {
        return identifier.isConstructed();
    }

    /**
     * Returns the shape of this element.
     *
     * @return the kind
     */
    public Kind getKind() {
        if (!identifier.isUniversal()) {
            return Kind.TAGGED;
        }
        switch (identifier.getTagNumber()) {
            case ASN1Type.BOOLEAN:
                return Kind.BOOLEAN;
            case ASN1Type.INTEGER:
            case ASN1Type.ENUMERATED:
                return Kind.INTEGER;
            case ASN1Type.NULL:
                return Kind.NULL;
            case ASN1Type.OCTET_STRING:
                return Kind.OCTET_STRING;
            case ASN1Type.SEQUENCE & ASN1Type.TAG_MASK:
                return Kind.SEQUENCE;
            case ASN1Type.SET & ASN1Type.TAG_MASK:
                return Kind.SET;
            default:
                return Kind.TAGGED;
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Content accessors
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns a copy of the content octets.
     *
     * @return the value bytes, or null for constructed elements
     */
    public byte[] getValue() {
        return value != null ? value.clone() : null;
    }

    /**
     * Returns the child elements.
     *
     * @return unmodifiable list of children, or null for primitive elements
     */
    public List<ASN1Element> getChildren() {
        return children;
    }

    /**
     * Returns the number of children.
     *
     * @return the child count, or 0 for primitive elements
     */
    public int getChildCount() {
        return children != null ? children.size() : 0;
    }

    /**
     * Returns a specific child element.
     *
     * @param index the child index
     * @return the child element
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public ASN1Element getChild(int index) {
        if (children == null) {
            throw new IndexOutOfBoundsException("Primitive element has no children");
        }
        return children.get(index);
    }

    /**
     * Returns the value as a boolean. Any non-zero octet is true.
     *
     * @return the boolean value
     * @throws ASN1Exception if not a valid boolean
     */
    public boolean asBoolean() throws ASN1Exception {
        if (value == null || value.length != 1) {
            throw new ASN1Exception("Invalid BOOLEAN encoding");
        }
        return value[0] != 0;
    }

    /**
     * Returns the value as an integer.
     *
     * @return the integer value
     * @throws ASN1Exception if not a valid integer or out of int range
     */
    public int asInt() throws ASN1Exception {
        long result = asLong();
        if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
            throw new ASN1Exception("INTEGER out of range: " + result);
        }
        return (int) result;
    }

    /**
     * Returns the value as a long integer.
     *
     * @return the long value
     * @throws ASN1Exception if not a valid integer
     */
    public long asLong() throws ASN1Exception {
        if (value == null || value.length == 0 || value.length > 8) {
            throw new ASN1Exception("Invalid INTEGER encoding");
        }
        return BERDecoder.integerValue(value, 0, value.length);
    }

    /**
     * Returns the value as a UTF-8 string.
     *
     * @return the string value, or null for constructed elements
     */
    public String asString() {
        if (value == null) {
            return null;
        }
        return new String(value, StandardCharsets.UTF_8);
    }

    /**
     * Returns the value as an octet string (raw bytes).
     *
     * @return a copy of the content octets
     * @throws ASN1Exception if this element is constructed
     */
    public byte[] asOctetString() throws ASN1Exception {
        if (value == null) {
            throw new ASN1Exception("Constructed " + identifier + " where OCTET STRING expected");
        }
        return value.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ASN1Element)) {
            return false;
        }
        ASN1Element e = (ASN1Element) other;
        if (!identifier.equals(e.identifier)) {
            return false;
        }
        return children != null ? children.equals(e.children) : Arrays.equals(value, e.value);
    }

    @Override
    public int hashCode() {
        return identifier.hashCode() * 31 + (children != null ? children.hashCode() : Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        toString(sb, 0);
        return sb.toString();
    }

    private void toString(StringBuilder sb, int indent) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(identifier);
        if (children != null) {
            sb.append(" {\n");
            for (ASN1Element child : children) {
                child.toString(sb, indent + 1);
            }
            for (int i = 0; i < indent; i++) {
                sb.append("  ");
            }
            sb.append("}\n");
        } else {
            sb.append(" = ");
            if (value.length > 32) {
                sb.append("[").append(value.length).append(" bytes]");
            } else if (isPrintable(value)) {
                sb.append('"').append(asString()).append('"');
            } else {
                sb.append(hexDump(value));
            }
            sb.append("\n");
        }
    }

    private static boolean isPrintable(byte[] data) {
        for (byte b : data) {
            if (b < 0x20 || b > 0x7E) {
                return false;
            }
        }
        return true;
    }

    static String hexDump(byte[] data) {
        StringBuilder sb = new StringBuilder();
        for (byte b : data) {
            sb.append(String.format("%02X ", b & 0xFF));
        }
        return sb.toString().trim();
    }
}
