/*
 * BEREncoderTest.java
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
import java.util.Collections;

/**
 * Unit tests for BEREncoder.
 */
public class BEREncoderTest {

    @Test
    public void testEncodeBoolean() {
        assertArrayEquals(new byte[] {0x01, 0x01, (byte) 0xFF}, BEREncoder.encodeBoolean(true));
        assertArrayEquals(new byte[] {0x01, 0x01, 0x00}, BEREncoder.encodeBoolean(false));
    }

    @Test
    public void testEncodeIntegerMinimal() {
        assertArrayEquals(new byte[] {0x02, 0x01, 0x00}, BEREncoder.encodeInteger(0));
        assertArrayEquals(new byte[] {0x02, 0x01, 0x7F}, BEREncoder.encodeInteger(127));
        assertArrayEquals(new byte[] {0x02, 0x02, 0x00, (byte) 0x80}, BEREncoder.encodeInteger(128));
        assertArrayEquals(new byte[] {0x02, 0x01, (byte) 0xFF}, BEREncoder.encodeInteger(-1));
        assertArrayEquals(new byte[] {0x02, 0x01, (byte) 0x80}, BEREncoder.encodeInteger(-128));
        assertArrayEquals(new byte[] {0x02, 0x02, (byte) 0xFF, 0x7F}, BEREncoder.encodeInteger(-129));
        assertArrayEquals(new byte[] {0x02, 0x02, 0x01, 0x00}, BEREncoder.encodeInteger(256));
    }

    @Test
    public void testEncodeIntegerExtremes() throws ASN1Exception {
        byte[] max = BEREncoder.encodeInteger(Long.MAX_VALUE);
        assertEquals(8, max[1]);
        assertEquals(Long.MAX_VALUE, BERDecoder.decodeInteger(max, 0).getValue().longValue());

        byte[] min = BEREncoder.encodeInteger(Long.MIN_VALUE);
        assertEquals(8, min[1]);
        assertEquals(Long.MIN_VALUE, BERDecoder.decodeInteger(min, 0).getValue().longValue());
    }

    @Test
    public void testEncodeLength() {
        assertArrayEquals(new byte[] {0x00}, BEREncoder.encodeLength(0));
        assertArrayEquals(new byte[] {0x7F}, BEREncoder.encodeLength(127));
        assertArrayEquals(new byte[] {(byte) 0x81, (byte) 0x80}, BEREncoder.encodeLength(128));
        assertArrayEquals(new byte[] {(byte) 0x81, (byte) 0xFF}, BEREncoder.encodeLength(255));
        assertArrayEquals(new byte[] {(byte) 0x82, 0x01, 0x00}, BEREncoder.encodeLength(256));
        assertArrayEquals(new byte[] {(byte) 0x84, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
                BEREncoder.encodeLength(0xFFFFFFFFL));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEncodeLengthTooLarge() {
        BEREncoder.encodeLength(0x100000000L);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEncodeLengthNegative() {
        BEREncoder.encodeLength(-1);
    }

    @Test
    public void testEncodeIdentifier() {
        assertArrayEquals(new byte[] {(byte) 0xA3},
                BEREncoder.encodeIdentifier(ASN1Identifier.context(3, true)));
        assertArrayEquals(new byte[] {0x5D},
                BEREncoder.encodeIdentifier(ASN1Identifier.application(29, false)));
        // 30 and above use the multi-octet form
        assertArrayEquals(new byte[] {0x5F, 0x1E},
                BEREncoder.encodeIdentifier(ASN1Identifier.application(30, false)));
        assertArrayEquals(new byte[] {(byte) 0xBF, (byte) 0x81, 0x00},
                BEREncoder.encodeIdentifier(ASN1Identifier.context(128, true)));
    }

    @Test
    public void testEncodeOctetString() {
        BEREncoder encoder = new BEREncoder();
        encoder.writeOctetString("cn");
        encoder.writeOctetString(new byte[0]);
        assertArrayEquals(new byte[] {0x04, 0x02, 0x63, 0x6E, 0x04, 0x00}, encoder.toByteArray());
    }

    @Test
    public void testEncodeNullAndEnumerated() {
        BEREncoder encoder = new BEREncoder();
        encoder.writeNull();
        encoder.writeEnumerated(3);
        assertArrayEquals(new byte[] {0x05, 0x00, 0x0A, 0x01, 0x03}, encoder.toByteArray());
    }

    @Test
    public void testEncodeSequence() {
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeInteger(1);
        encoder.beginSet();
        encoder.writeBoolean(true);
        encoder.endSet();
        encoder.endSequence();
        assertArrayEquals(new byte[] {0x30, 0x08, 0x02, 0x01, 0x01, 0x31, 0x03, 0x01, 0x01, (byte) 0xFF},
                encoder.toByteArray());
    }

    @Test
    public void testEncodeContextTags() {
        // An equality filter: [3] { "cn", "x" } followed by a presence filter [7] "cn"
        BEREncoder encoder = new BEREncoder();
        encoder.beginContext(3, true);
        encoder.writeOctetString("cn");
        encoder.writeOctetString("x");
        encoder.endContext();
        encoder.writeContext(7, "cn");
        assertArrayEquals(new byte[] {
            (byte) 0xA3, 0x07, 0x04, 0x02, 0x63, 0x6E, 0x04, 0x01, 0x78,
            (byte) 0x87, 0x02, 0x63, 0x6E
        }, encoder.toByteArray());
    }

    @Test
    public void testEncodeApplicationPrimitive() {
        BEREncoder encoder = new BEREncoder();
        encoder.writeApplication(2, new byte[0]);
        assertArrayEquals(new byte[] {0x42, 0x00}, encoder.toByteArray());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBeginPrimitiveContextRejected() {
        new BEREncoder().beginContext(7, false);
    }

    @Test
    public void testLongContentUsesLongFormLength() {
        byte[] content = new byte[200];
        Arrays.fill(content, (byte) 'a');
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeOctetString(content);
        encoder.endSequence();

        byte[] data = encoder.toByteArray();
        assertEquals(0x30, data[0] & 0xFF);
        assertEquals(0x81, data[1] & 0xFF);
        assertEquals(203, data[2] & 0xFF);
        assertEquals(0x04, data[3] & 0xFF);
        assertEquals(0x81, data[4] & 0xFF);
        assertEquals(200, data[5] & 0xFF);
        assertEquals(206, data.length);
    }

    @Test
    public void testUnendedConstruct() {
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        assertEquals(1, encoder.getDepth());
        try {
            encoder.toByteArray();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        encoder.endSequence();
        assertEquals(0, encoder.getDepth());
        assertArrayEquals(new byte[] {0x30, 0x00}, encoder.toByteArray());
    }

    @Test(expected = IllegalStateException.class)
    public void testEndWithoutBegin() {
        new BEREncoder().endSequence();
    }

    @Test(expected = IllegalStateException.class)
    public void testNestingLimit() {
        BEREncoder encoder = new BEREncoder(2);
        encoder.beginSequence();
        encoder.beginSequence();
        encoder.beginSequence();
    }

    @Test
    public void testStaticEncodeAtDefaultDepth() throws ASN1Exception {
        ASN1Element element = nestedSequences(BEREncoder.DEFAULT_MAX_DEPTH);
        byte[] data = BEREncoder.encode(element);
        assertEquals(element, BERDecoder.decode(data));
    }

    @Test(expected = IllegalStateException.class)
    public void testStaticEncodeBeyondDefaultDepth() {
        BEREncoder.encode(nestedSequences(BEREncoder.DEFAULT_MAX_DEPTH + 1));
    }

    private static ASN1Element nestedSequences(int depth) {
        ASN1Element element = ASN1Element.nullValue();
        for (int i = 0; i < depth; i++) {
            element = ASN1Element.sequence(Collections.singletonList(element));
        }
        return element;
    }

    @Test
    public void testReset() {
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeInteger(5);
        encoder.reset();
        assertEquals(0, encoder.getDepth());
        encoder.writeNull();
        assertArrayEquals(new byte[] {0x05, 0x00}, encoder.toByteArray());
    }

    @Test
    public void testToByteBuffer() {
        BEREncoder encoder = new BEREncoder();
        encoder.writeBoolean(true);
        ByteBuffer buffer = encoder.toByteBuffer();
        assertEquals(3, buffer.remaining());
        assertEquals(0x01, buffer.get(0));
    }

    @Test
    public void testWriteElementMatchesStreamingCalls() {
        ASN1Element element = ASN1Element.sequence(Arrays.asList(
                ASN1Element.integer(42),
                ASN1Element.explicit(ASN1Identifier.context(2, true), ASN1Element.octetString("x")),
                ASN1Element.implicit(ASN1Identifier.context(0, false), ASN1Element.octetString("y"))));

        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeInteger(42);
        encoder.beginContext(2, true);
        encoder.writeOctetString("x");
        encoder.endContext();
        encoder.writeContext(0, "y");
        encoder.endSequence();

        assertArrayEquals(encoder.toByteArray(), BEREncoder.encode(element));
    }
}
