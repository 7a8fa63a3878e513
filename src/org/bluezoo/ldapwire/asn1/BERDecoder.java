/*
 * BERDecoder.java
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

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * BER (Basic Encoding Rules) decoder for ASN.1 data.
 *
 * <p>The decoder can be used in two ways. For non-blocking I/O it
 * accepts data incrementally via {@link #receive(ByteBuffer)} and
 * returns complete top-level elements via {@link #next()}. For data that
 * is already in memory, {@link #parse(byte[])} and the static
 * {@link #decode(byte[])} walk the input once, left to right, bounding
 * each constructed value's children by its declared length.</p>
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * BERDecoder decoder = new BERDecoder();
 *
 * // In receive callback
 * decoder.receive(buffer);
 *
 * ASN1Element element;
 * while ((element = decoder.next()) != null) {
 *     // Process complete element
 * }
 * }</pre>
 *
 * <p>Only definite lengths are accepted. Universal types are checked
 * against the shapes LDAP uses: BOOLEAN has one content octet, INTEGER
 * and ENUMERATED have one to eight, NULL has none, OCTET STRING is
 * primitive, and SEQUENCE and SET are constructed.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BERDecoder {

    private static final Logger logger = Logger.getLogger(BERDecoder.class.getName());

    /** Default length cap, from {@code ldapwire.ber.maxLength}. */
    static final int DEFAULT_MAX_LENGTH = Integer.getInteger("ldapwire.ber.maxLength", 10 * 1024 * 1024);

    private static final long MAX_ENCODABLE_LENGTH = 0xFFFFFFFFL;

    // Decoder states
    private static final int STATE_TAG = 0;
    private static final int STATE_TAG_MULTI = 1;
    private static final int STATE_LENGTH = 2;
    private static final int STATE_LENGTH_MULTI = 3;
    private static final int STATE_VALUE = 4;

    /**
     * A decoded value and the number of octets it occupied.
     *
     * @param <T> the value type
     */
    public static final class Decoded<T> {

        private final T value;
        private final int length;

        Decoded(T value, int length) {
            this.value = value;
            this.length = length;
        }

        public T getValue() {
            return value;
        }

        /**
         * Returns the number of input octets consumed.
         *
         * @return the octet count
         */
        public int getLength() {
            return length;
        }
    }

    private final int maxDepth;
    private final int maxLength;
    private boolean strictLengths;

    // Internal buffer for accumulating data
    private ByteBuffer buffer;

    // Current decode state
    private int state;
    private int tagLeading;
    private long tagNumber;
    private long length;
    private int lengthOctets;
    private int lengthBytesRemaining;
    private int lengthFirstOctet;
    private byte[] valueBuffer;
    private int valueOffset;

    // Completed elements ready for retrieval
    private final List<ASN1Element> completed;

    /**
     * Creates a new BER decoder with default buffer size (8KB) and the
     * configured limits.
     */
    public BERDecoder() {
        this(8192);
    }

    /**
     * Creates a new BER decoder with the specified initial buffer size.
     *
     * @param bufferSize initial buffer capacity
     */
    public BERDecoder(int bufferSize) {
        this(bufferSize, BEREncoder.DEFAULT_MAX_DEPTH, DEFAULT_MAX_LENGTH);
    }

    /**
     * Creates a new BER decoder with explicit limits.
     *
     * @param bufferSize initial buffer capacity
     * @param maxDepth maximum nesting of constructed values
     * @param maxLength maximum declared length of any value
     */
    public BERDecoder(int bufferSize, int maxDepth, int maxLength) {
        if (maxDepth < 1 || maxLength < 0) {
            throw new IllegalArgumentException("Invalid limits: depth " + maxDepth + ", length " + maxLength);
        }
        this.maxDepth = maxDepth;
        this.maxLength = maxLength;
        buffer = ByteBuffer.allocate(bufferSize);
        buffer.flip(); // Start empty, ready for reading
        completed = new ArrayList<ASN1Element>();
        resetState();
    }

    /**
     * Sets whether long-form lengths must use the fewest octets.
     * Lenient by default, since many servers always send four-octet lengths.
     *
     * @param strictLengths true to reject non-canonical lengths
     */
    public void setStrictLengths(boolean strictLengths) {
        this.strictLengths = strictLengths;
    }

    public boolean isStrictLengths() {
        return strictLengths;
    }

    /**
     * Resets the decoder state, discarding any partial data.
     */
    public void reset() {
        if (hasPartialData()) {
            logger.warning("Discarding " + (buffer.remaining() + valueOffset) + " bytes of partial BER data");
        }
        resetState();
        buffer.clear();
        buffer.flip();
        completed.clear();
    }

    private void resetState() {
        state = STATE_TAG;
        tagLeading = 0;
        tagNumber = 0;
        length = 0;
        lengthOctets = 0;
        lengthBytesRemaining = 0;
        lengthFirstOctet = 0;
        valueBuffer = null;
        valueOffset = 0;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Streaming interface
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Receives data for decoding.
     *
     * @param data the data to decode
     * @throws ASN1Exception if the data is malformed
     */
    public void receive(ByteBuffer data) throws ASN1Exception {
        // Append new data to our buffer
        ensureCapacity(data.remaining());
        int pos = buffer.position();
        int lim = buffer.limit();
        buffer.position(lim);
        buffer.limit(buffer.capacity());
        buffer.put(data);
        buffer.limit(buffer.position());
        buffer.position(pos);

        // Process as much as we can
        decode();
    }

    /**
     * Returns the next complete element, or null if none available.
     *
     * @return the next element, or null
     */
    public ASN1Element next() {
        if (completed.isEmpty()) {
            return null;
        }
        return completed.remove(0);
    }

    /**
     * Returns whether there is data still being accumulated.
     *
     * @return true if partial data exists
     */
    public boolean hasPartialData() {
        return state != STATE_TAG || buffer.hasRemaining();
    }

    private void ensureCapacity(int additional) {
        int required = buffer.remaining() + additional;
        if (required > buffer.capacity()) {
            int newCapacity = Math.max(buffer.capacity() * 2, required);
            ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
            newBuffer.put(buffer);
            newBuffer.flip();
            buffer = newBuffer;
        }
    }

    private void decode() throws ASN1Exception {
        while (buffer.hasRemaining()) {
            switch (state) {
                case STATE_TAG:
                    decodeTag();
                    break;
                case STATE_TAG_MULTI:
                    decodeTagMulti();
                    break;
                case STATE_LENGTH:
                    decodeLengthOctet();
                    break;
                case STATE_LENGTH_MULTI:
                    decodeLengthMulti();
                    break;
                case STATE_VALUE:
                    decodeValue();
                    break;
                default:
                    throw new IllegalStateException("state " + state);
            }
        }

        // Compact the buffer to free up space
        buffer.compact();
        buffer.flip();
    }

    private void decodeTag() {
        tagLeading = buffer.get() & 0xFF;
        tagNumber = 0;
        if ((tagLeading & ASN1Type.TAG_MASK) == ASN1Type.MULTI_OCTET_TAG) {
            state = STATE_TAG_MULTI;
        } else {
            tagNumber = tagLeading & ASN1Type.TAG_MASK;
            state = STATE_LENGTH;
        }
    }

    private void decodeTagMulti() throws ASN1Exception {
        while (buffer.hasRemaining()) {
            int b = buffer.get() & 0xFF;
            tagNumber = (tagNumber << 7) | (b & 0x7F);
            if (tagNumber > Integer.MAX_VALUE) {
                throw new ASN1Exception("Tag number too large");
            }
            if ((b & 0x80) == 0) {
                // Last byte of multi-byte tag
                state = STATE_LENGTH;
                return;
            }
        }
    }

    private void decodeLengthOctet() throws ASN1Exception {
        int b = buffer.get() & 0xFF;
        if ((b & 0x80) == 0) {
            // Short form
            length = b;
            startValue();
        } else {
            lengthBytesRemaining = checkLengthOfLength(b);
            lengthOctets = lengthBytesRemaining;
            length = 0;
            state = STATE_LENGTH_MULTI;
        }
    }

    private void decodeLengthMulti() throws ASN1Exception {
        while (buffer.hasRemaining() && lengthBytesRemaining > 0) {
            int b = buffer.get() & 0xFF;
            if (lengthBytesRemaining == lengthOctets) {
                lengthFirstOctet = b;
            }
            length = (length << 8) | b;
            lengthBytesRemaining--;
        }
        if (lengthBytesRemaining == 0) {
            checkLongFormLength(length, lengthFirstOctet, strictLengths);
            startValue();
        }
    }

    private void startValue() throws ASN1Exception {
        if (length > maxLength) {
            throw new ASN1Exception(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT,
                    "Value too large: " + length + " bytes");
        }
        valueBuffer = new byte[(int) length];
        valueOffset = 0;
        if (length == 0) {
            completeElement();
        } else {
            state = STATE_VALUE;
        }
    }

    private void decodeValue() throws ASN1Exception {
        int available = buffer.remaining();
        int needed = valueBuffer.length - valueOffset;
        int toCopy = Math.min(available, needed);

        buffer.get(valueBuffer, valueOffset, toCopy);
        valueOffset += toCopy;

        if (valueOffset == valueBuffer.length) {
            completeElement();
        }
    }

    private void completeElement() throws ASN1Exception {
        ASN1Identifier id = new ASN1Identifier(ASN1Type.getTagClass(tagLeading),
                ASN1Type.isConstructed(tagLeading), (int) tagNumber);
        ASN1Element element = buildElement(id, valueBuffer, 0, valueBuffer.length, 0);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Decoded element:\n" + element);
        }
        completed.add(element);
        resetState();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Single-pass interface
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Decodes exactly one element occupying all of the given data.
     *
     * @param data the encoding
     * @return the element
     * @throws ASN1Exception if the data is malformed or has trailing octets
     */
    public ASN1Element parse(byte[] data) throws ASN1Exception {
        Decoded<ASN1Element> decoded = readElement(data, 0, data.length, 0);
        if (decoded.getLength() != data.length) {
            throw new ASN1Exception((data.length - decoded.getLength()) + " trailing bytes after element");
        }
        return decoded.getValue();
    }

    /**
     * Decodes content octets whose identifier has already been read.
     *
     * @param identifier the identifier of the enclosing value
     * @param content the content octets
     * @return the element
     * @throws ASN1Exception if the content is malformed
     */
    public ASN1Element parse(ASN1Identifier identifier, byte[] content) throws ASN1Exception {
        if (content.length > maxLength) {
            throw new ASN1Exception(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT,
                    "Value too large: " + content.length + " bytes");
        }
        return buildElement(identifier, content, 0, content.length, 0);
    }

    /**
     * Decodes exactly one element using the default limits and lenient
     * length checking.
     *
     * @param data the encoding
     * @return the element
     * @throws ASN1Exception if the data is malformed
     */
    public static ASN1Element decode(byte[] data) throws ASN1Exception {
        return new BERDecoder(0).parse(data);
    }

    /**
     * Decodes content octets whose identifier has already been read,
     * using the default limits.
     *
     * @param identifier the identifier hint
     * @param content the content octets
     * @return the element
     * @throws ASN1Exception if the content is malformed
     */
    public static ASN1Element decode(ASN1Identifier identifier, byte[] content) throws ASN1Exception {
        return new BERDecoder(0).parse(identifier, content);
    }

    private Decoded<ASN1Element> readElement(byte[] data, int offset, int end, int depth)
            throws ASN1Exception {
        Decoded<ASN1Identifier> id = decodeIdentifier(data, offset, end);
        int pos = offset + id.getLength();
        Decoded<Long> len = decodeLength(data, pos, end, strictLengths);
        pos += len.getLength();
        long contentLength = len.getValue().longValue();
        if (contentLength > maxLength) {
            throw new ASN1Exception(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT,
                    "Value too large: " + contentLength + " bytes");
        }
        if (contentLength > end - pos) {
            throw new ASN1Exception(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT,
                    "Declared length " + contentLength + " exceeds " + (end - pos) + " available bytes");
        }
        ASN1Element element = buildElement(id.getValue(), data, pos, (int) contentLength, depth);
        return new Decoded<ASN1Element>(element, pos + (int) contentLength - offset);
    }

    private ASN1Element buildElement(ASN1Identifier id, byte[] data, int offset, int length, int depth)
            throws ASN1Exception {
        checkUniversal(id, length);
        if (!id.isConstructed()) {
            return new ASN1Element(id, Arrays.copyOfRange(data, offset, offset + length));
        }
        if (depth >= maxDepth) {
            throw new ASN1Exception("Nesting too deep: " + maxDepth);
        }
        List<ASN1Element> children = new ArrayList<ASN1Element>();
        int end = offset + length;
        int pos = offset;
        while (pos < end) {
            Decoded<ASN1Element> child = readElement(data, pos, end, depth + 1);
            children.add(child.getValue());
            pos += child.getLength();
        }
        return new ASN1Element(id, children);
    }

    private static void checkUniversal(ASN1Identifier id, int length) throws ASN1Exception {
        if (!id.isUniversal()) {
            return;
        }
        boolean valid;
        switch (id.getTagNumber()) {
            case ASN1Type.BOOLEAN:
                valid = !id.isConstructed() && length == 1;
                break;
            case ASN1Type.INTEGER:
            case ASN1Type.ENUMERATED:
                valid = !id.isConstructed() && length >= 1 && length <= 8;
                break;
            case ASN1Type.NULL:
                valid = !id.isConstructed() && length == 0;
                break;
            case ASN1Type.OCTET_STRING:
                valid = !id.isConstructed();
                break;
            case ASN1Type.SEQUENCE & ASN1Type.TAG_MASK:
            case ASN1Type.SET & ASN1Type.TAG_MASK:
                valid = id.isConstructed();
                break;
            default:
                throw new ASN1Exception("Unsupported universal type " + id.getTagNumber());
        }
        if (!valid) {
            throw new ASN1Exception("Invalid " + id + " encoding with " + length + " content bytes");
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Single-value decoders
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Decodes identifier octets.
     *
     * @param data the input
     * @param offset the position of the leading identifier octet
     * @return the identifier and the number of octets it occupied
     * @throws ASN1Exception if the identifier is truncated or its tag
     *         number exceeds the int range
     */
    public static Decoded<ASN1Identifier> decodeIdentifier(byte[] data, int offset) throws ASN1Exception {
        return decodeIdentifier(data, offset, data.length);
    }

    private static Decoded<ASN1Identifier> decodeIdentifier(byte[] data, int offset, int end)
            throws ASN1Exception {
        if (offset >= end) {
            throw new ASN1Exception(ASN1Exception.Reason.TRUNCATED, "Missing identifier octet");
        }
        int leading = data[offset] & 0xFF;
        int tagClass = ASN1Type.getTagClass(leading);
        boolean constructed = ASN1Type.isConstructed(leading);
        if (ASN1Type.getTagNumber(leading) != ASN1Type.MULTI_OCTET_TAG) {
            return new Decoded<ASN1Identifier>(
                    new ASN1Identifier(tagClass, constructed, ASN1Type.getTagNumber(leading)), 1);
        }
        long tagNumber = 0;
        int pos = offset + 1;
        while (true) {
            if (pos >= end) {
                throw new ASN1Exception(ASN1Exception.Reason.TRUNCATED, "Truncated multi-octet tag");
            }
            int b = data[pos++] & 0xFF;
            tagNumber = (tagNumber << 7) | (b & 0x7F);
            if (tagNumber > Integer.MAX_VALUE) {
                throw new ASN1Exception("Tag number too large");
            }
            if ((b & 0x80) == 0) {
                break;
            }
        }
        return new Decoded<ASN1Identifier>(
                new ASN1Identifier(tagClass, constructed, (int) tagNumber), pos - offset);
    }

    /**
     * Decodes definite length octets, accepting non-minimal long forms.
     *
     * @param data the input
     * @param offset the position of the first length octet
     * @return the length and the number of octets it occupied
     * @throws ASN1Exception if the length is truncated, indefinite or malformed
     */
    public static Decoded<Long> decodeLength(byte[] data, int offset) throws ASN1Exception {
        return decodeLength(data, offset, data.length, false);
    }

    /**
     * Decodes definite length octets.
     *
     * @param data the input
     * @param offset the position of the first length octet
     * @param strict whether long forms must use the fewest octets
     * @return the length and the number of octets it occupied
     * @throws ASN1Exception if the length is truncated, indefinite,
     *         malformed, or non-canonical in strict mode
     */
    public static Decoded<Long> decodeLength(byte[] data, int offset, boolean strict) throws ASN1Exception {
        return decodeLength(data, offset, data.length, strict);
    }

    private static Decoded<Long> decodeLength(byte[] data, int offset, int end, boolean strict)
            throws ASN1Exception {
        if (offset >= end) {
            throw new ASN1Exception(ASN1Exception.Reason.TRUNCATED, "Missing length octet");
        }
        int b = data[offset] & 0xFF;
        if ((b & 0x80) == 0) {
            return new Decoded<Long>(Long.valueOf(b), 1);
        }
        int n = checkLengthOfLength(b);
        if (offset + 1 + n > end) {
            throw new ASN1Exception(ASN1Exception.Reason.TRUNCATED, "Truncated long-form length");
        }
        long length = 0;
        for (int i = 1; i <= n; i++) {
            length = (length << 8) | (data[offset + i] & 0xFF);
        }
        checkLongFormLength(length, data[offset + 1] & 0xFF, strict);
        return new Decoded<Long>(Long.valueOf(length), n + 1);
    }

    private static int checkLengthOfLength(int b) throws ASN1Exception {
        if (b == 0x80) {
            throw new ASN1Exception(ASN1Exception.Reason.INDEFINITE_LENGTH,
                    "Indefinite length encoding not supported");
        }
        if (b == 0xFF) {
            throw new ASN1Exception("Reserved length octet 0xFF");
        }
        int n = b & 0x7F;
        if (n > 8) {
            throw new ASN1Exception("Length too large: " + n + " bytes");
        }
        return n;
    }

    private static void checkLongFormLength(long length, int firstOctet, boolean strict)
            throws ASN1Exception {
        if (length < 0 || length > MAX_ENCODABLE_LENGTH) {
            throw new ASN1Exception("Length too large: " + Long.toUnsignedString(length));
        }
        if (strict && (length < 128 || firstOctet == 0)) {
            throw new ASN1Exception(ASN1Exception.Reason.NON_CANONICAL_LENGTH,
                    "Non-canonical long-form length " + length);
        }
    }

    /**
     * Decodes a complete BOOLEAN. Any non-zero content octet is true.
     *
     * @param data the input
     * @param offset the position of the identifier
     * @return the value and the number of octets it occupied
     * @throws ASN1Exception if the input is not a valid BOOLEAN
     */
    public static Decoded<Boolean> decodeBoolean(byte[] data, int offset) throws ASN1Exception {
        Decoded<ASN1Element> e = readUniversal(data, offset, ASN1Element.Kind.BOOLEAN);
        return new Decoded<Boolean>(Boolean.valueOf(e.getValue().asBoolean()), e.getLength());
    }

    /**
     * Decodes a complete INTEGER or ENUMERATED.
     *
     * @param data the input
     * @param offset the position of the identifier
     * @return the value and the number of octets it occupied
     * @throws ASN1Exception if the input is not a valid INTEGER
     */
    public static Decoded<Long> decodeInteger(byte[] data, int offset) throws ASN1Exception {
        Decoded<ASN1Element> e = readUniversal(data, offset, ASN1Element.Kind.INTEGER);
        return new Decoded<Long>(Long.valueOf(e.getValue().asLong()), e.getLength());
    }

    /**
     * Decodes a complete OCTET STRING.
     *
     * @param data the input
     * @param offset the position of the identifier
     * @return the raw bytes and the number of octets the encoding occupied
     * @throws ASN1Exception if the input is not a valid OCTET STRING
     */
    public static Decoded<byte[]> decodeOctetString(byte[] data, int offset) throws ASN1Exception {
        Decoded<ASN1Element> e = readUniversal(data, offset, ASN1Element.Kind.OCTET_STRING);
        return new Decoded<byte[]>(e.getValue().asOctetString(), e.getLength());
    }

    private static Decoded<ASN1Element> readUniversal(byte[] data, int offset, ASN1Element.Kind kind)
            throws ASN1Exception {
        Decoded<ASN1Element> e = new BERDecoder(0).readElement(data, offset, data.length, 0);
        if (e.getValue().getKind() != kind) {
            throw new ASN1Exception("Expected " + kind + ", found " + e.getValue().getIdentifier());
        }
        return e;
    }

    /**
     * Returns the value of big-endian two's complement content octets.
     */
    static long integerValue(byte[] data, int offset, int length) {
        long result = data[offset]; // sign-extended
        for (int i = 1; i < length; i++) {
            result = (result << 8) | (data[offset + i] & 0xFF);
        }
        return result;
    }
}
