/*
 * FilterParser.java
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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive descent parser for the RFC 2254 string form of search
 * filters.
 *
 * <pre>
 * filter     = "(" filtercomp ")"
 * filtercomp = and / or / not / item
 * and        = "&amp;" filterlist
 * or         = "|" filterlist
 * not        = "!" filter
 * filterlist = 1*filter
 * item       = attr filtertype value / attr ":=" value
 * </pre>
 *
 * <p>Before tokenizing, the legacy LDAPv2 escapes {@code \*},
 * {@code \(}, {@code \)} and {@code \\} are rewritten to their hex form,
 * a filter without both outer parentheses is wrapped in one pair, and
 * the parentheses are checked for balance. An empty filter means
 * {@code (objectclass=*)}.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FilterParser {

    private static final Logger logger = Logger.getLogger(FilterParser.class.getName());

    /** The filter used when none is given. */
    public static final String DEFAULT_FILTER = "(objectclass=*)";

    private final FilterTokenizer tokenizer;

    private FilterParser(FilterTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Parses a search filter.
     *
     * @param filter the filter text
     * @return the filter
     * @throws FilterException if the filter is malformed
     */
    public static Filter parse(String filter) throws FilterException {
        String text = filter != null ? filter.trim() : "";
        if (text.isEmpty()) {
            logger.fine("Empty filter, using " + DEFAULT_FILTER);
            text = DEFAULT_FILTER;
        }
        text = convertV2Escapes(text);
        if (text.charAt(0) != '(' && text.charAt(text.length() - 1) != ')') {
            text = "(" + text + ")";
        }
        checkParentheses(text);

        FilterTokenizer tokenizer = new FilterTokenizer(text);
        Filter result = new FilterParser(tokenizer).parseFilter(0);
        if (tokenizer.hasMore()) {
            throw new FilterException(FilterException.Kind.UNEXPECTED_CHARACTER,
                    "Unexpected \"" + tokenizer.peek() + "\" after end of filter");
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Parsed filter " + text + " as " + result.getType());
        }
        return result;
    }

    // \*, \(, \) and \\ become \2a, \28, \29 and \5c
    private static String convertV2Escapes(String text) {
        int idx = text.indexOf('\\');
        if (idx == -1) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text);
        int i = idx;
        while (i < sb.length() - 1) {
            char c = sb.charAt(i++);
            if (c != '\\') {
                continue;
            }
            c = sb.charAt(i);
            if (c == '*' || c == '(' || c == ')' || c == '\\') {
                sb.replace(i, i + 1, Integer.toHexString(c));
                i += 2;
            }
        }
        return sb.toString();
    }

    private static void checkParentheses(String text) throws FilterException {
        if (text.charAt(0) != '(') {
            throw missingLeftParen();
        }
        if (text.charAt(text.length() - 1) != ')') {
            throw missingRightParen();
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                count++;
            } else if (c == ')') {
                count--;
            }
        }
        if (count > 0) {
            throw missingRightParen();
        }
        if (count < 0) {
            throw missingLeftParen();
        }
    }

    private static FilterException missingLeftParen() {
        return new FilterException(FilterException.Kind.MISSING_LEFT_PAREN,
                "Unmatched parentheses, left parenthesis missing");
    }

    private static FilterException missingRightParen() {
        return new FilterException(FilterException.Kind.MISSING_RIGHT_PAREN,
                "Unmatched parentheses, right parenthesis missing");
    }

    // nesting counts the and, or and not filters enclosing this one
    private Filter parseFilter(int nesting) throws FilterException {
        tokenizer.expectLeftParen();
        Filter filter = parseFilterComp(nesting);
        tokenizer.expectRightParen();
        return filter;
    }

    private Filter parseFilterComp(int nesting) throws FilterException {
        FilterType operator = tokenizer.nextOperatorOrAttribute();
        if (operator != null && operator.isNested() && nesting >= FilterCodec.MAX_NESTING) {
            throw new FilterException(FilterException.Kind.NESTING_TOO_DEEP,
                    "Filter nested deeper than " + FilterCodec.MAX_NESTING + " levels");
        }
        if (operator == FilterType.AND || operator == FilterType.OR) {
            return new CompositeFilter(operator, parseFilterList(nesting + 1));
        }
        if (operator == FilterType.NOT) {
            return new NotFilter(parseFilter(nesting + 1));
        }
        String attribute = tokenizer.getAttribute();
        FilterType type = tokenizer.nextFilterType();
        String value = tokenizer.nextValue();
        switch (type) {
            case EQUALITY_MATCH:
                if (value.equals("*")) {
                    return new PresentFilter(attribute);
                }
                if (value.indexOf('*') != -1) {
                    return parseSubstrings(attribute, value);
                }
                return new ComparisonFilter(type, attribute, unescape(value));
            case EXTENSIBLE_MATCH:
                return parseExtensibleMatch(attribute, value);
            default:
                return new ComparisonFilter(type, attribute, unescape(value));
        }
    }

    private List<Filter> parseFilterList(int nesting) throws FilterException {
        List<Filter> filters = new ArrayList<Filter>();
        filters.add(parseFilter(nesting)); // at least one
        while (tokenizer.peek() == '(') {
            filters.add(parseFilter(nesting));
        }
        return filters;
    }

    /*
     * Text before the first star is the initial component only when it is
     * the first token, text after the last star is the final component
     * only when it is the last token. A star directly following another
     * star adds an empty middle component.
     */
    private static Filter parseSubstrings(String attribute, String value) throws FilterException {
        List<String> tokens = splitOnStars(value);
        int count = tokens.size();
        byte[] initial = null;
        byte[] finalValue = null;
        List<byte[]> any = new ArrayList<byte[]>();
        String last = "";
        for (int i = 0; i < count; i++) {
            String token = tokens.get(i);
            if (token.equals("*")) {
                if (last.equals("*")) {
                    any.add(new byte[0]);
                }
            } else if (i == 0) {
                initial = unescape(token);
            } else if (i < count - 1) {
                any.add(unescape(token));
            } else {
                finalValue = unescape(token);
            }
            last = token;
        }
        return new SubstringFilter(attribute, initial, any, finalValue);
    }

    // Stars are returned as tokens of their own, empty text is dropped
    private static List<String> splitOnStars(String value) {
        List<String> tokens = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '*') {
                if (i > start) {
                    tokens.add(value.substring(start, i));
                }
                tokens.add("*");
                start = i + 1;
            }
        }
        if (start < value.length()) {
            tokens.add(value.substring(start));
        }
        return tokens;
    }

    /*
     * The description before ":=" is split on colons. A leading segment
     * names the attribute type, "dn" sets dnAttributes, anything else is
     * the matching rule.
     */
    private static Filter parseExtensibleMatch(String description, String value) throws FilterException {
        String attributeType = null;
        String matchingRule = null;
        boolean dnAttributes = false;
        boolean first = description.charAt(0) != ':';
        for (String segment : description.split(":")) {
            String s = segment.trim();
            if (s.isEmpty()) {
                continue;
            }
            if (first) {
                attributeType = s;
            } else if (s.equalsIgnoreCase("dn")) {
                dnAttributes = true;
            } else {
                matchingRule = s;
            }
            first = false;
        }
        if (attributeType == null && matchingRule == null) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "Neither matching rule nor attribute type specified");
        }
        return new ExtensibleMatchFilter(matchingRule, attributeType, unescape(value), dnAttributes);
    }

    /**
     * Decodes the escaped text of an assertion value into octets.
     *
     * <p>A backslash introduces two hex digits. Characters in the ranges
     * U+0001-U+0027, U+002B-U+005B and from U+005D up are copied as
     * UTF-8. NUL, {@code (}, {@code )} and {@code *} must be escaped.</p>
     *
     * @param value the escaped value text
     * @return the value octets
     * @throws FilterException if an escape is malformed or incomplete, or
     *         a character must be escaped
     */
    public static byte[] unescape(String value) throws FilterException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length());
        boolean escape = false;
        boolean escapeStart = false;
        int high = 0;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            if (escape) {
                int digit = hexValue(cp);
                if (digit < 0) {
                    throw new FilterException(FilterException.Kind.INVALID_ESCAPE,
                            "Invalid value in escape sequence \"" + new String(Character.toChars(cp)) + "\"");
                }
                if (escapeStart) {
                    high = digit << 4;
                    escapeStart = false;
                } else {
                    out.write(high | digit);
                    escape = false;
                }
            } else if (cp == '\\') {
                escape = true;
                escapeStart = true;
            } else if ((cp >= 0x01 && cp <= 0x27) || (cp >= 0x2B && cp <= 0x5B) || cp >= 0x5D) {
                if (cp < 0x80) {
                    out.write(cp);
                } else {
                    byte[] utf8 = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
                    out.write(utf8, 0, utf8.length);
                }
            } else {
                StringBuilder escaped = new StringBuilder();
                escaped.append('\\');
                if (cp < 0x10) {
                    escaped.append('0');
                }
                escaped.append(Integer.toHexString(cp));
                throw new FilterException(FilterException.Kind.INVALID_ESCAPE,
                        "The invalid character \"" + (char) cp + "\" needs to be escaped as \""
                        + escaped + "\"");
            }
        }
        if (escape) {
            throw new FilterException(FilterException.Kind.INVALID_ESCAPE, "Incomplete escape sequence");
        }
        return out.toByteArray();
    }

    private static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
