/*
 * ASN1ElementTest.java
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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Unit tests for ASN1Element.
 */
public class ASN1ElementTest {

    @Test
    public void testBooleanElement() throws ASN1Exception {
        ASN1Element element = ASN1Element.booleanValue(true);
        assertEquals(ASN1Type.BOOLEAN, element.getTag());
        assertEquals(ASN1Element.Kind.BOOLEAN, element.getKind());
        assertTrue(element.asBoolean());
        assertFalse(ASN1Element.booleanValue(false).asBoolean());
    }

    @Test
    public void testNonZeroBooleanIsTrue() throws ASN1Exception {
        ASN1Element element = new ASN1Element(ASN1Type.BOOLEAN, new byte[] {0x01});
        assertTrue(element.asBoolean());
    }

    @Test
    public void testIntegerElement() throws ASN1Exception {
        assertEquals(-129, ASN1Element.integer(-129).asInt());
        assertEquals(1L << 40, ASN1Element.integer(1L << 40).asLong());
        assertEquals(ASN1Type.ENUMERATED, ASN1Element.enumerated(2).getTag());
        assertEquals(ASN1Element.Kind.INTEGER, ASN1Element.enumerated(2).getKind());
    }

    @Test(expected = ASN1Exception.class)
    public void testIntegerOutOfIntRange() throws ASN1Exception {
        ASN1Element.integer(1L << 40).asInt();
    }

    @Test
    public void testOctetString() throws ASN1Exception {
        ASN1Element element = ASN1Element.octetString("dc=example");
        assertEquals(ASN1Element.Kind.OCTET_STRING, element.getKind());
        assertEquals("dc=example", element.asString());
        assertArrayEquals("dc=example".getBytes(StandardCharsets.UTF_8), element.asOctetString());
    }

    @Test
    public void testValueIsCopied() {
        byte[] value = {0x61, 0x62};
        ASN1Element element = ASN1Element.octetString(value);
        value[0] = 0x7A;
        assertEquals("ab", element.asString());
        element.getValue()[1] = 0x7A;
        assertEquals("ab", element.asString());
    }

    @Test
    public void testChildrenAreUnmodifiable() {
        List<ASN1Element> children = new ArrayList<ASN1Element>();
        children.add(ASN1Element.nullValue());
        ASN1Element element = ASN1Element.sequence(children);
        children.add(ASN1Element.nullValue());
        assertEquals(1, element.getChildCount());
        try {
            element.getChildren().add(ASN1Element.nullValue());
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testPrimitiveHasNoChildren() {
        ASN1Element element = ASN1Element.integer(1);
        assertNull(element.getChildren());
        assertEquals(0, element.getChildCount());
        assertFalse(element.isConstructed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrimitiveIdentifierWithChildren() {
        new ASN1Element(ASN1Identifier.OCTET_STRING, Collections.<ASN1Element>emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructedIdentifierWithValue() {
        new ASN1Element(ASN1Identifier.SEQUENCE, new byte[0]);
    }

    @Test(expected = ASN1Exception.class)
    public void testConstructedIsNotOctetString() throws ASN1Exception {
        ASN1Element.sequence(Collections.<ASN1Element>emptyList()).asOctetString();
    }

    @Test
    public void testExplicitTagging() throws ASN1Exception {
        ASN1Element inner = ASN1Element.integer(5);
        ASN1Element tagged = ASN1Element.explicit(ASN1Identifier.context(2, false), inner);
        assertTrue(tagged.isConstructed());
        assertEquals(0xA2, tagged.getTag());
        assertEquals(ASN1Element.Kind.TAGGED, tagged.getKind());
        assertEquals(inner, tagged.getExplicitContent());
    }

    @Test(expected = ASN1Exception.class)
    public void testExplicitContentOfPrimitive() throws ASN1Exception {
        ASN1Element.octetString("x").getExplicitContent();
    }

    @Test
    public void testImplicitTagging() throws ASN1Exception {
        ASN1Element tagged = ASN1Element.implicit(ASN1Identifier.context(7, true),
                ASN1Element.octetString("cn"));
        assertFalse(tagged.isConstructed());
        assertEquals(0x87, tagged.getTag());
        assertEquals("cn", tagged.asString());

        ASN1Element plain = tagged.withIdentifier(ASN1Identifier.OCTET_STRING);
        assertEquals(ASN1Element.octetString("cn"), plain);
    }

    @Test
    public void testImplicitConstructed() {
        ASN1Element set = ASN1Element.set(Arrays.asList(ASN1Element.octetString("a")));
        ASN1Element tagged = ASN1Element.implicit(ASN1Identifier.context(0, false), set);
        assertTrue(tagged.isConstructed());
        assertEquals(0xA0, tagged.getTag());
        assertEquals(set.getChildren(), tagged.getChildren());
    }

    @Test
    public void testEqualsAndHashCode() {
        ASN1Element a = ASN1Element.sequence(Arrays.asList(ASN1Element.integer(1), ASN1Element.octetString("x")));
        ASN1Element b = ASN1Element.sequence(Arrays.asList(ASN1Element.integer(1), ASN1Element.octetString("x")));
        ASN1Element c = ASN1Element.set(Arrays.asList(ASN1Element.integer(1), ASN1Element.octetString("x")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    public void testMultiOctetTag() {
        ASN1Element element = new ASN1Element(ASN1Identifier.application(300, false), new byte[] {1});
        assertEquals(300, element.getTagNumber());
        assertEquals(ASN1Type.CLASS_APPLICATION, element.getTagClass());
        assertEquals(0x5F, element.getTag());
    }

    @Test
    public void testToString() {
        ASN1Element element = ASN1Element.sequence(Arrays.asList(
                ASN1Element.octetString("cn"), ASN1Element.octetString(new byte[] {0x00, (byte) 0xFF})));
        String s = element.toString();
        assertTrue(s, s.startsWith("SEQUENCE {"));
        assertTrue(s, s.contains("\"cn\""));
        assertTrue(s, s.contains("00 FF"));
    }
}
