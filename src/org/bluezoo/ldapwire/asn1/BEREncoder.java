/*
 * BEREncoder.java
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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * BER (Basic Encoding Rules) encoder for ASN.1 data.
 *
 * <p>This encoder produces the definite-length BER subset used by LDAP.
 * Constructed values are written between matching {@code begin} and
 * {@code end} calls: each open construct collects its content in a
 * scratch buffer, and closing it emits identifier, length and content
 * into the enclosing construct.</p>
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * BEREncoder encoder = new BEREncoder();
 *
 * encoder.beginSequence();
 * encoder.writeInteger(messageId);
 * encoder.beginApplication(3, true);   // SearchRequest
 * encoder.writeOctetString(baseDN);
 * encoder.writeEnumerated(scope);
 * ...
 * encoder.endApplication();
 * encoder.endSequence();
 *
 * byte[] pdu = encoder.toByteArray();
 * }</pre>
 *
 * <p>The static {@code encode*} methods produce a complete encoding of a
 * single value and are independent of any encoder instance.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BEREncoder {

    /** Default nesting limit, from {@code ldapwire.ber.maxDepth}. */
    public static final int DEFAULT_MAX_DEPTH = Integer.getInteger("ldapwire.ber.maxDepth", 64);

    private static final long MAX_LENGTH = 0xFFFFFFFFL;

    private final ByteArrayOutputStream output;
    private final Deque<Frame> stack;
    private final int maxDepth;

    /**
     * Creates a new BER encoder.
     */
    public BEREncoder() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a new BER encoder with the given nesting limit.
     *
     * @param maxDepth the maximum number of simultaneously open constructs
     */
    public BEREncoder(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        output = new ByteArrayOutputStream();
        stack = new ArrayDeque<Frame>();
    }

    /**
     * Resets the encoder for reuse.
     */
    public void reset() {
        output.reset();
        stack.clear();
    }

    /**
     * Returns the number of constructs that have been begun but not ended.
     *
     * @return the current depth
     */
    public int getDepth() {
        return stack.size();
    }

    /**
     * Returns the encoded data as a byte array.
     *
     * @return the encoded bytes
     * @throws IllegalStateException if a construct is still open
     */
    public byte[] toByteArray() {
        if (!stack.isEmpty()) {
            throw new IllegalStateException(stack.size() + " construct(s) not ended");
        }
        return output.toByteArray();
    }

    /**
     * Returns the encoded data as a ByteBuffer.
     *
     * @return the encoded data wrapped in a ByteBuffer
     */
    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toByteArray());
    }

    /**
     * Writes a complete ASN1Element to the output.
     *
     * @param element the element to encode
     */
    public void write(ASN1Element element) {
        if (element.isConstructed()) {
            beginConstructed(element.getIdentifier());
            for (ASN1Element child : element.getChildren()) {
                write(child);
            }
            endConstructed();
        } else {
            writePrimitive(element.getIdentifier(), element.getValue());
        }
    }

    // Primitive type encoders

    public void writeBoolean(boolean value) {
        writePrimitive(ASN1Identifier.BOOLEAN, new byte[] { (byte) (value ? 0xFF : 0x00) });
    }

    public void writeInteger(long value) {
        writePrimitive(ASN1Identifier.INTEGER, integerContent(value));
    }

    public void writeEnumerated(long value) {
        writePrimitive(ASN1Identifier.ENUMERATED, integerContent(value));
    }

    public void writeOctetString(byte[] value) {
        writePrimitive(ASN1Identifier.OCTET_STRING, value);
    }

    /**
     * Writes an octet string from a string (UTF-8 encoded).
     *
     * @param value the string value
     */
    public void writeOctetString(String value) {
        writeOctetString(value.getBytes(StandardCharsets.UTF_8));
    }

    public void writeNull() {
        writePrimitive(ASN1Identifier.NULL, new byte[0]);
    }

    // Constructed type support

    public void beginSequence() {
        beginConstructed(ASN1Identifier.SEQUENCE);
    }

    public void endSequence() {
        endConstructed();
    }

    public void beginSet() {
        beginConstructed(ASN1Identifier.SET);
    }

    public void endSet() {
        endConstructed();
    }

    /**
     * Begins a context-specific tagged element. Primitive context tags
     * are written with {@link #writeContext(int, byte[])} instead.
     *
     * @param tagNumber the context tag number
     * @param constructed must be true; accepted for symmetry with
     *        {@link ASN1Type#contextTag}
     */
    public void beginContext(int tagNumber, boolean constructed) {
        if (!constructed) {
            throw new IllegalArgumentException("Primitive context tag cannot hold nested elements");
        }
        beginConstructed(ASN1Identifier.context(tagNumber, true));
    }

    public void endContext() {
        endConstructed();
    }

    /**
     * Begins an application-specific tagged element.
     *
     * @param tagNumber the application tag number
     * @param constructed must be true
     */
    public void beginApplication(int tagNumber, boolean constructed) {
        if (!constructed) {
            throw new IllegalArgumentException("Primitive application tag cannot hold nested elements");
        }
        beginConstructed(ASN1Identifier.application(tagNumber, true));
    }

    public void endApplication() {
        endConstructed();
    }

    /**
     * Writes an application-specific primitive value.
     *
     * @param tagNumber the application tag number
     * @param value the value bytes
     */
    public void writeApplication(int tagNumber, byte[] value) {
        writePrimitive(ASN1Identifier.application(tagNumber, false), value);
    }

    /**
     * Writes a context-specific primitive value.
     *
     * @param tagNumber the context tag number
     * @param value the value bytes
     */
    public void writeContext(int tagNumber, byte[] value) {
        writePrimitive(ASN1Identifier.context(tagNumber, false), value);
    }

    /**
     * Writes a context-specific primitive string value.
     *
     * @param tagNumber the context tag number
     * @param value the string value (UTF-8 encoded)
     */
    public void writeContext(int tagNumber, String value) {
        writeContext(tagNumber, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Begins a constructed element with an arbitrary identifier.
     *
     * @param identifier the identifier, which is written in constructed form
     * @throws IllegalStateException if the nesting limit would be exceeded
     */
    public void beginConstructed(ASN1Identifier identifier) {
        if (stack.size() >= maxDepth) {
            throw new IllegalStateException("Nesting too deep: " + maxDepth);
        }
        stack.push(new Frame(identifier.withConstructed(true)));
    }

    /**
     * Ends the innermost open constructed element.
     *
     * @throws IllegalStateException if no construct is open
     */
    public void endConstructed() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("No construct to end");
        }
        Frame frame = stack.pop();
        writeTLV(currentOutput(), frame.identifier, frame.content.toByteArray());
    }

    /**
     * Writes a primitive element with an arbitrary identifier.
     *
     * @param identifier the identifier, which is written in primitive form
     * @param value the content octets
     */
    public void writePrimitive(ASN1Identifier identifier, byte[] value) {
        writeTLV(currentOutput(), identifier.withConstructed(false), value != null ? value : new byte[0]);
    }

    private ByteArrayOutputStream currentOutput() {
        return stack.isEmpty() ? output : stack.peek().content;
    }

    private static void writeTLV(ByteArrayOutputStream out, ASN1Identifier identifier, byte[] content) {
        byte[] id = encodeIdentifier(identifier);
        out.write(id, 0, id.length);
        byte[] length = encodeLength(content.length);
        out.write(length, 0, length.length);
        out.write(content, 0, content.length);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Single-value encoders
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Encodes identifier octets.
     *
     * @param identifier the identifier
     * @return the identifier octets
     */
    public static byte[] encodeIdentifier(ASN1Identifier identifier) {
        int leading = identifier.getLeadingOctet();
        if (!identifier.isMultiOctet()) {
            return new byte[] { (byte) leading };
        }
        int tagNumber = identifier.getTagNumber();
        int groups = 1;
        for (int t = tagNumber >>> 7; t != 0; t >>>= 7) {
            groups++;
        }
        byte[] result = new byte[groups + 1];
        result[0] = (byte) leading;
        for (int i = groups; i >= 1; i--) {
            int bits = tagNumber & 0x7F;
            result[i] = (byte) (i == groups ? bits : bits | 0x80);
            tagNumber >>>= 7;
        }
        return result;
    }

    /**
     * Encodes definite length octets: the short form below 128, otherwise
     * the long form with the fewest magnitude octets.
     *
     * @param length the length, between 0 and 2^32-1
     * @return the length octets
     */
    public static byte[] encodeLength(long length) {
        if (length < 0 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Length out of range: " + length);
        }
        if (length < 128) {
            return new byte[] { (byte) length };
        }
        int n = 0;
        for (long l = length; l != 0; l >>>= 8) {
            n++;
        }
        byte[] result = new byte[n + 1];
        result[0] = (byte) (0x80 | n);
        for (int i = n; i >= 1; i--) {
            result[i] = (byte) length;
            length >>>= 8;
        }
        return result;
    }

    /**
     * Encodes a complete BOOLEAN.
     *
     * @param value the value
     * @return identifier, length and content octets
     */
    public static byte[] encodeBoolean(boolean value) {
        return new byte[] { (byte) ASN1Type.BOOLEAN, 1, (byte) (value ? 0xFF : 0x00) };
    }

    /**
     * Encodes a complete INTEGER in the minimal two's complement form.
     *
     * @param value the value
     * @return identifier, length and content octets
     */
    public static byte[] encodeInteger(long value) {
        return encode(ASN1Element.integer(value));
    }

    /**
     * Encodes a complete OCTET STRING.
     *
     * @param value the raw bytes
     * @return identifier, length and content octets
     */
    public static byte[] encodeOctetString(byte[] value) {
        return encode(ASN1Element.octetString(value));
    }

    /**
     * Encodes an element and all of its children under the default
     * nesting limit, so that {@link BERDecoder#decode(byte[])} accepts
     * the result.
     *
     * @param element the element
     * @return the encoding
     * @throws IllegalStateException if the element is nested deeper than
     *         {@link #DEFAULT_MAX_DEPTH}
     */
    public static byte[] encode(ASN1Element element) {
        BEREncoder encoder = new BEREncoder();
        encoder.write(element);
        return encoder.toByteArray();
    }

    /**
     * Returns the minimal two's complement content octets of a value.
     * Leading octets are dropped while they only repeat the sign of the
     * following octet.
     */
    static byte[] integerContent(long value) {
        int n = 8;
        while (n > 1) {
            int top = (int) (value >> ((n - 1) * 8)) & 0xFF;
            int nextSign = (int) (value >> ((n - 2) * 8)) & 0x80;
            if ((top == 0x00 && nextSign == 0) || (top == 0xFF && nextSign != 0)) {
                n--;
            } else {
                break;
            }
        }
        byte[] result = new byte[n];
        for (int i = n - 1; i >= 0; i--) {
            result[i] = (byte) value;
            value >>= 8;
        }
        return result;
    }

    private static final class Frame {

        final ASN1Identifier identifier;
        final ByteArrayOutputStream content = new ByteArrayOutputStream();

        Frame(ASN1Identifier identifier) {
            this.identifier = identifier;
        }
    }
}
