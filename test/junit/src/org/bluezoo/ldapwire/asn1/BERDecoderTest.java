/*
 * BERDecoderTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Unit tests for BERDecoder.
 */
public class BERDecoderTest {

    // Streaming decoder

    @Test
    public void testDecodeBoolean() throws ASN1Exception {
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(new byte[] {0x01, 0x01, (byte) 0xFF}));

        ASN1Element element = decoder.next();
        assertNotNull(element);
        assertEquals(ASN1Type.BOOLEAN, element.getTag());
        assertEquals(ASN1Element.Kind.BOOLEAN, element.getKind());
        assertTrue(element.asBoolean());
        assertNull(decoder.next());
    }

    @Test
    public void testDecodeIntegerNegative() throws ASN1Exception {
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(new byte[] {0x02, 0x01, (byte) 0xFF}));
        assertEquals(-1, decoder.next().asInt());
    }

    @Test
    public void testDecodeEnumerated() throws ASN1Exception {
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(new byte[] {0x0A, 0x01, 0x02}));

        ASN1Element element = decoder.next();
        assertEquals(ASN1Type.ENUMERATED, element.getTag());
        assertEquals(ASN1Element.Kind.INTEGER, element.getKind());
        assertEquals(2, element.asInt());
    }

    @Test
    public void testIncrementalDecode() throws ASN1Exception {
        // SEQUENCE { INTEGER 1, OCTET STRING "ab" } delivered one byte at a time
        byte[] data = {0x30, 0x07, 0x02, 0x01, 0x01, 0x04, 0x02, 0x61, 0x62};
        BERDecoder decoder = new BERDecoder(4);
        for (int i = 0; i < data.length - 1; i++) {
            decoder.receive(ByteBuffer.wrap(data, i, 1));
            assertNull(decoder.next());
            assertTrue(decoder.hasPartialData());
        }
        decoder.receive(ByteBuffer.wrap(data, data.length - 1, 1));
        ASN1Element element = decoder.next();
        assertNotNull(element);
        assertFalse(decoder.hasPartialData());
        assertEquals(2, element.getChildCount());
        assertEquals(1, element.getChild(0).asInt());
        assertEquals("ab", element.getChild(1).asString());
    }

    @Test
    public void testMultipleElements() throws ASN1Exception {
        byte[] data = {0x02, 0x01, 0x05, 0x01, 0x01, 0x00, 0x05, 0x00};
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(data));

        assertEquals(5, decoder.next().asInt());
        assertFalse(decoder.next().asBoolean());
        assertEquals(ASN1Element.Kind.NULL, decoder.next().getKind());
        assertNull(decoder.next());
    }

    @Test
    public void testStreamingMultiOctetTag() throws ASN1Exception {
        // [APPLICATION 200] primitive, one content octet
        byte[] data = {0x5F, (byte) 0x81, 0x48, 0x01, 0x07};
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(data, 0, 2));
        assertNull(decoder.next());
        decoder.receive(ByteBuffer.wrap(data, 2, 3));

        ASN1Element element = decoder.next();
        assertEquals(ASN1Type.CLASS_APPLICATION, element.getTagClass());
        assertEquals(200, element.getTagNumber());
        assertArrayEquals(new byte[] {0x07}, element.getValue());
    }

    @Test
    public void testStreamingLongFormLength() throws ASN1Exception {
        byte[] content = new byte[300];
        Arrays.fill(content, (byte) 'x');
        byte[] data = BEREncoder.encodeOctetString(content);
        assertEquals(0x82, data[1] & 0xFF);

        BERDecoder decoder = new BERDecoder(16);
        decoder.receive(ByteBuffer.wrap(data, 0, 100));
        assertNull(decoder.next());
        decoder.receive(ByteBuffer.wrap(data, 100, data.length - 100));
        assertArrayEquals(content, decoder.next().getValue());
    }

    @Test
    public void testReset() throws ASN1Exception {
        BERDecoder decoder = new BERDecoder();
        decoder.receive(ByteBuffer.wrap(new byte[] {0x30, 0x05, 0x02}));
        assertTrue(decoder.hasPartialData());

        decoder.reset();
        assertFalse(decoder.hasPartialData());
        decoder.receive(ByteBuffer.wrap(new byte[] {0x02, 0x01, 0x2A}));
        assertEquals(42, decoder.next().asInt());
    }

    @Test
    public void testIndefiniteLengthRejected() {
        BERDecoder decoder = new BERDecoder();
        try {
            decoder.receive(ByteBuffer.wrap(new byte[] {0x30, (byte) 0x80, 0x00, 0x00}));
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.INDEFINITE_LENGTH, e.getReason());
        }
    }

    @Test
    public void testStreamingValueTooLarge() {
        BERDecoder decoder = new BERDecoder(64, 8, 100);
        try {
            decoder.receive(ByteBuffer.wrap(new byte[] {0x04, (byte) 0x81, (byte) 0xC8}));
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT, e.getReason());
        }
    }

    // Single-pass decoder

    @Test
    public void testDecodeNestedSequence() throws ASN1Exception {
        // SEQUENCE { SEQUENCE { INTEGER 1 }, SET { NULL } }
        byte[] data = {0x30, 0x09, 0x30, 0x03, 0x02, 0x01, 0x01, 0x31, 0x02, 0x05, 0x00};
        ASN1Element element = BERDecoder.decode(data);

        assertEquals(ASN1Element.Kind.SEQUENCE, element.getKind());
        assertEquals(2, element.getChildCount());
        assertEquals(1, element.getChild(0).getChild(0).asInt());
        assertEquals(ASN1Element.Kind.SET, element.getChild(1).getKind());
        assertEquals(ASN1Element.Kind.NULL, element.getChild(1).getChild(0).getKind());
    }

    @Test
    public void testDecodeContextTags() throws ASN1Exception {
        // [3] { OCTET STRING "cn", OCTET STRING "x" } then [7] "cn"
        ASN1Element equality = BERDecoder.decode(new byte[] {
            (byte) 0xA3, 0x07, 0x04, 0x02, 0x63, 0x6E, 0x04, 0x01, 0x78
        });
        assertEquals(ASN1Type.CLASS_CONTEXT, equality.getTagClass());
        assertEquals(3, equality.getTagNumber());
        assertTrue(equality.isConstructed());
        assertEquals(ASN1Element.Kind.TAGGED, equality.getKind());

        ASN1Element present = BERDecoder.decode(new byte[] {(byte) 0x87, 0x02, 0x63, 0x6E});
        assertFalse(present.isConstructed());
        assertEquals("cn", present.asString());
    }

    @Test
    public void testDecodeWithIdentifierHint() throws ASN1Exception {
        byte[] content = {0x04, 0x02, 0x63, 0x6E, 0x04, 0x01, 0x78};
        ASN1Element element = BERDecoder.decode(ASN1Identifier.context(3, true), content);
        assertEquals(0xA3, element.getTag());
        assertEquals(2, element.getChildCount());
        assertEquals("x", element.getChild(1).asString());
    }

    @Test
    public void testTrailingDataRejected() {
        try {
            BERDecoder.decode(new byte[] {0x05, 0x00, 0x00});
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.MALFORMED, e.getReason());
        }
    }

    @Test
    public void testChildOverrunsParent() {
        // SEQUENCE of length 3 whose child claims 5 content octets
        try {
            BERDecoder.decode(new byte[] {0x30, 0x03, 0x04, 0x05, 0x61, 0x62, 0x63, 0x64});
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT, e.getReason());
        }
    }

    @Test
    public void testLengthExceedsInput() {
        try {
            BERDecoder.decode(new byte[] {0x04, 0x05, 0x61});
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.LENGTH_EXCEEDS_INPUT, e.getReason());
        }
    }

    @Test
    public void testTruncatedLength() {
        try {
            BERDecoder.decode(new byte[] {0x04, (byte) 0x82, 0x01});
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.TRUNCATED, e.getReason());
        }
    }

    @Test
    public void testTruncatedIdentifier() {
        try {
            BERDecoder.decode(new byte[] {0x30, 0x02, 0x1F, (byte) 0x81});
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.TRUNCATED, e.getReason());
        }
    }

    @Test
    public void testNonCanonicalLength() throws ASN1Exception {
        // OCTET STRING "a" with a four-octet length
        byte[] data = {0x04, (byte) 0x84, 0x00, 0x00, 0x00, 0x01, 0x61};
        assertEquals("a", BERDecoder.decode(data).asString());

        BERDecoder strict = new BERDecoder(0);
        strict.setStrictLengths(true);
        try {
            strict.parse(data);
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.NON_CANONICAL_LENGTH, e.getReason());
        }
    }

    @Test
    public void testInvalidUniversalShapes() {
        byte[][] invalid = {
            {0x01, 0x02, 0x00, 0x00},       // two-octet BOOLEAN
            {0x02, 0x00},                   // empty INTEGER
            {0x05, 0x01, 0x00},             // NULL with content
            {0x24, 0x00},                   // constructed OCTET STRING
            {0x10, 0x00},                   // primitive SEQUENCE
            {0x00, 0x00},                   // end-of-contents
        };
        for (byte[] data : invalid) {
            try {
                BERDecoder.decode(data);
                fail("Expected ASN1Exception for " + Arrays.toString(data));
            } catch (ASN1Exception e) {
                assertEquals(ASN1Exception.Reason.MALFORMED, e.getReason());
            }
        }
    }

    @Test
    public void testNestingLimit() throws ASN1Exception {
        byte[] data = {0x30, 0x04, 0x30, 0x02, 0x30, 0x00};
        new BERDecoder(0, 3, 1024).parse(data);
        try {
            new BERDecoder(0, 2, 1024).parse(data);
            fail("Expected ASN1Exception");
        } catch (ASN1Exception e) {
            assertEquals(ASN1Exception.Reason.MALFORMED, e.getReason());
        }
    }

    // Single-value decoders

    @Test
    public void testDecodeLength() throws ASN1Exception {
        BERDecoder.Decoded<Long> shortForm = BERDecoder.decodeLength(new byte[] {0x7F}, 0);
        assertEquals(127L, shortForm.getValue().longValue());
        assertEquals(1, shortForm.getLength());

        BERDecoder.Decoded<Long> longForm = BERDecoder.decodeLength(new byte[] {0x00, (byte) 0x81, (byte) 0x80}, 1);
        assertEquals(128L, longForm.getValue().longValue());
        assertEquals(2, longForm.getLength());
    }

    @Test
    public void testLengthRoundTrip() throws ASN1Exception {
        long[] lengths = {0, 1, 127, 128, 255, 256, 65535, 65536, 16777215, 16777216, 0xFFFFFFFFL};
        for (long length : lengths) {
            byte[] encoded = BEREncoder.encodeLength(length);
            BERDecoder.Decoded<Long> decoded = BERDecoder.decodeLength(encoded, 0, true);
            assertEquals(length, decoded.getValue().longValue());
            assertEquals(encoded.length, decoded.getLength());
        }
    }

    @Test
    public void testDecodeIdentifier() throws ASN1Exception {
        BERDecoder.Decoded<ASN1Identifier> single = BERDecoder.decodeIdentifier(new byte[] {(byte) 0xA9}, 0);
        assertEquals(ASN1Identifier.context(9, true), single.getValue());
        assertEquals(1, single.getLength());

        byte[] encoded = BEREncoder.encodeIdentifier(ASN1Identifier.context(1000, false));
        BERDecoder.Decoded<ASN1Identifier> multi = BERDecoder.decodeIdentifier(encoded, 0);
        assertEquals(1000, multi.getValue().getTagNumber());
        assertEquals(encoded.length, multi.getLength());
    }

    @Test
    public void testDecodeScalars() throws ASN1Exception {
        byte[] data = {0x01, 0x01, (byte) 0xFF, 0x02, 0x02, 0x00, (byte) 0x80, 0x04, 0x01, 0x7A};
        BERDecoder.Decoded<Boolean> b = BERDecoder.decodeBoolean(data, 0);
        assertTrue(b.getValue().booleanValue());
        assertEquals(3, b.getLength());

        BERDecoder.Decoded<Long> i = BERDecoder.decodeInteger(data, 3);
        assertEquals(128L, i.getValue().longValue());
        assertEquals(4, i.getLength());

        BERDecoder.Decoded<byte[]> s = BERDecoder.decodeOctetString(data, 7);
        assertArrayEquals(new byte[] {0x7A}, s.getValue());
        assertEquals(3, s.getLength());
    }

    @Test(expected = ASN1Exception.class)
    public void testDecodeIntegerWrongType() throws ASN1Exception {
        BERDecoder.decodeInteger(new byte[] {0x04, 0x01, 0x01}, 0);
    }

    @Test
    public void testRoundTripNestedStructure() throws ASN1Exception {
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeInteger(7);
        encoder.beginApplication(3, true);
        encoder.writeOctetString("dc=example,dc=com");
        encoder.writeEnumerated(2);
        encoder.writeBoolean(false);
        encoder.beginContext(0, true);
        encoder.writeContext(7, "objectClass");
        encoder.endContext();
        encoder.endApplication();
        encoder.endSequence();

        ASN1Element message = BERDecoder.decode(encoder.toByteArray());
        assertEquals(7, message.getChild(0).asInt());
        ASN1Element op = message.getChild(1);
        assertEquals(0x63, op.getTag());
        assertEquals("dc=example,dc=com", op.getChild(0).asString());
        assertEquals(2, op.getChild(1).asInt());
        assertFalse(op.getChild(2).asBoolean());
        assertEquals("objectClass", op.getChild(3).getChild(0).asString());
        assertArrayEquals(encoder.toByteArray(), BEREncoder.encode(message));
    }
}
