/*
 * FilterRenderer.java
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

package org.bluezoo.ldapwire.filter;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Produces the RFC 2254 string form of a filter.
 *
 * <p>The output parses back to an equal filter, although it need not
 * match the text the filter was parsed from: values are escaped
 * canonically and the redundant outer forms of the legacy syntax are
 * never produced. The characters {@code *}, {@code (}, {@code )},
 * {@code \} and NUL are written as {@code \xx}. Values that are not
 * valid UTF-8 have every octet above 0x7F escaped as well.</p>
 *
 * <p>One tree does not survive the round trip: a substring filter whose
 * initial or final component is present but empty renders exactly like
 * one without that component, so the text parses back without it. The
 * parser never produces such a filter, but the builder and the BER
 * decoder can.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FilterRenderer {

    private FilterRenderer() {
    }

    /**
     * Renders a filter.
     *
     * @param filter the filter
     * @return the string form
     */
    public static String render(Filter filter) {
        StringBuilder sb = new StringBuilder();
        Iterator<String> tokens = tokens(filter);
        while (tokens.hasNext()) {
            sb.append(tokens.next());
        }
        return sb.toString();
    }

    /**
     * Returns the pieces of the string form in order, depth first.
     * Each nested filter contributes its opening parenthesis and
     * operator, then its operands, then its closing parenthesis. Each
     * leaf is a single piece. The iterator walks the tree lazily and
     * can be consumed once.
     *
     * @param filter the filter
     * @return the pieces of the string form
     */
    public static Iterator<String> tokens(Filter filter) {
        return new TokenIterator(filter);
    }

    private static final class TokenIterator implements Iterator<String> {

        // Filters still to expand and text still to emit
        private final Deque<Object> work = new ArrayDeque<Object>();

        TokenIterator(Filter root) {
            work.push(root);
        }

        @Override
        public boolean hasNext() {
            return !work.isEmpty();
        }

        @Override
        public String next() {
            if (work.isEmpty()) {
                throw new NoSuchElementException();
            }
            Object item = work.pop();
            if (item instanceof String) {
                return (String) item;
            }
            Filter filter = (Filter) item;
            switch (filter.getType()) {
                case AND:
                case OR:
                    work.push(")");
                    List<Filter> children = ((CompositeFilter) filter).getChildren();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        work.push(children.get(i));
                    }
                    return "(" + filter.getType().getOperator();
                case NOT:
                    work.push(")");
                    work.push(((NotFilter) filter).getChild());
                    return "(!";
                default:
                    StringBuilder sb = new StringBuilder("(");
                    appendItem(sb, filter);
                    return sb.append(')').toString();
            }
        }
    }

    private static void appendItem(StringBuilder sb, Filter filter) {
        switch (filter.getType()) {
            case PRESENT:
                sb.append(((PresentFilter) filter).getAttribute()).append("=*");
                break;
            case SUBSTRINGS:
                appendSubstrings(sb, (SubstringFilter) filter);
                break;
            case EXTENSIBLE_MATCH:
                appendExtensibleMatch(sb, (ExtensibleMatchFilter) filter);
                break;
            default:
                ComparisonFilter comparison = (ComparisonFilter) filter;
                sb.append(comparison.getAttribute());
                sb.append(comparison.getType().getOperator());
                appendValue(sb, comparison.getValue());
        }
    }

    private static void appendSubstrings(StringBuilder sb, SubstringFilter filter) {
        sb.append(filter.getAttribute()).append('=');
        byte[] initial = filter.getInitial();
        if (initial != null) {
            appendValue(sb, initial);
        }
        sb.append('*');
        for (byte[] any : filter.getAny()) {
            appendValue(sb, any);
            sb.append('*');
        }
        byte[] finalValue = filter.getFinal();
        if (finalValue != null) {
            appendValue(sb, finalValue);
        }
    }

    private static void appendExtensibleMatch(StringBuilder sb, ExtensibleMatchFilter filter) {
        if (filter.getAttributeType() != null) {
            sb.append(filter.getAttributeType());
        }
        if (filter.isDnAttributes()) {
            sb.append(":dn");
        }
        if (filter.getMatchingRule() != null) {
            sb.append(':').append(filter.getMatchingRule());
        }
        sb.append(":=");
        appendValue(sb, filter.getValue());
    }

    static void appendValue(StringBuilder sb, byte[] value) {
        String text = decodeUTF8(value);
        if (text == null) {
            for (byte b : value) {
                int c = b & 0xFF;
                if (c >= 0x80) {
                    appendEscape(sb, c);
                } else {
                    appendChar(sb, (char) c);
                }
            }
        } else {
            for (int i = 0; i < text.length(); i++) {
                appendChar(sb, text.charAt(i));
            }
        }
    }

    private static void appendChar(StringBuilder sb, char c) {
        switch (c) {
            case '*':
            case '(':
            case ')':
            case '\\':
            case '\u0000':
                appendEscape(sb, c);
                break;
            default:
                sb.append(c);
        }
    }

    private static void appendEscape(StringBuilder sb, int octet) {
        sb.append(String.format("\\%02x", octet));
    }

    // null if the octets are not valid UTF-8
    private static String decodeUTF8(byte[] value) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(value))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
