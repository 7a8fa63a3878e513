/*
 * FilterTokenizer.java
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

/**
 * A cursor over the string form of a search filter.
 *
 * <p>The tokenizer hands out the pieces of the grammar one at a time:
 * a boolean operator or attribute description, a comparison operator,
 * raw value text, and parentheses. Each method fails with
 * {@link FilterException.Kind#UNEXPECTED_END} when the filter ends where
 * a token is required.</p>
 *
 * <p>A tokenizer is used by a single parse and is not thread-safe.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterTokenizer {

    // Characters that end an attribute description
    private static final String ATTRIBUTE_DELIMITERS = "=~<>()";

    private final String filter;
    private int offset;
    private String attribute;

    /**
     * Creates a tokenizer positioned at the start of the filter.
     *
     * @param filter the filter text
     */
    public FilterTokenizer(String filter) {
        this.filter = filter;
    }

    /**
     * Reads a boolean operator or an attribute description, whichever
     * comes next.
     *
     * @return {@link FilterType#AND}, {@link FilterType#OR} or
     *         {@link FilterType#NOT}, or null if an attribute description
     *         was read, in which case it is available from
     *         {@link #getAttribute()}
     * @throws FilterException if the input ends or the description is invalid
     */
    public FilterType nextOperatorOrAttribute() throws FilterException {
        requireMore();
        switch (filter.charAt(offset)) {
            case '&':
                offset++;
                return FilterType.AND;
            case '|':
                offset++;
                return FilterType.OR;
            case '!':
                offset++;
                return FilterType.NOT;
            default:
                break;
        }
        if (filter.startsWith(":=", offset)) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "Missing matching rule");
        }
        if (filter.startsWith("::=", offset) || filter.startsWith(":::=", offset)) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "DN and matching rule not specified");
        }
        int start = offset;
        while (true) {
            requireMore();
            if (ATTRIBUTE_DELIMITERS.indexOf(filter.charAt(offset)) != -1
                    || filter.startsWith(":=", offset)) {
                break;
            }
            offset++;
        }
        attribute = filter.substring(start, offset).trim();
        checkAttributeDescription(attribute);
        return null;
    }

    /**
     * Returns the attribute description read by the last call to
     * {@link #nextOperatorOrAttribute()}.
     *
     * @return the attribute description
     */
    public String getAttribute() {
        return attribute;
    }

    /**
     * Reads a comparison operator. The operators are tried in the order
     * {@code >=}, {@code <=}, {@code ~=}, {@code :=}, {@code =}.
     *
     * @return the filter type the operator introduces
     * @throws FilterException if the input ends or no operator is found
     */
    public FilterType nextFilterType() throws FilterException {
        requireMore();
        if (filter.startsWith(">=", offset)) {
            offset += 2;
            return FilterType.GREATER_OR_EQUAL;
        }
        if (filter.startsWith("<=", offset)) {
            offset += 2;
            return FilterType.LESS_OR_EQUAL;
        }
        if (filter.startsWith("~=", offset)) {
            offset += 2;
            return FilterType.APPROX_MATCH;
        }
        if (filter.startsWith(":=", offset)) {
            offset += 2;
            return FilterType.EXTENSIBLE_MATCH;
        }
        if (filter.charAt(offset) == '=') {
            offset++;
            return FilterType.EQUALITY_MATCH;
        }
        throw new FilterException(FilterException.Kind.INVALID_COMPARISON_OPERATOR,
                "Invalid comparison operator");
    }

    /**
     * Reads raw value text up to the next unescaped right parenthesis,
     * or to the end of the filter.
     *
     * @return the value text, still escaped
     * @throws FilterException if the input has already ended
     */
    public String nextValue() throws FilterException {
        requireMore();
        int end = offset;
        while (end < filter.length() && filter.charAt(end) != ')') {
            if (filter.charAt(end) == '\\') {
                end++;
            }
            end++;
        }
        end = Math.min(end, filter.length());
        String value = filter.substring(offset, end);
        offset = end;
        return value;
    }

    /**
     * Consumes a left parenthesis.
     *
     * @throws FilterException if the next character is something else
     */
    public void expectLeftParen() throws FilterException {
        requireMore();
        char c = filter.charAt(offset);
        if (c != '(') {
            throw new FilterException(FilterException.Kind.UNEXPECTED_CHARACTER,
                    "Expecting left parenthesis, found \"" + c + "\"");
        }
        offset++;
    }

    /**
     * Consumes a right parenthesis.
     *
     * @throws FilterException if the next character is something else
     */
    public void expectRightParen() throws FilterException {
        requireMore();
        char c = filter.charAt(offset);
        if (c != ')') {
            throw new FilterException(FilterException.Kind.UNEXPECTED_CHARACTER,
                    "Expecting right parenthesis, found \"" + c + "\"");
        }
        offset++;
    }

    /**
     * Returns the next character without consuming it.
     *
     * @return the next character
     * @throws FilterException if the input has ended
     */
    public char peek() throws FilterException {
        requireMore();
        return filter.charAt(offset);
    }

    public boolean hasMore() {
        return offset < filter.length();
    }

    public int getOffset() {
        return offset;
    }

    private void requireMore() throws FilterException {
        if (offset >= filter.length()) {
            throw new FilterException(FilterException.Kind.UNEXPECTED_END, "Unexpected end of filter");
        }
    }

    /**
     * Checks an attribute description: it must be non-empty, must not
     * start with a semicolon, may only contain letters, digits,
     * {@code -}, {@code .}, {@code ;} and {@code :}, and every option
     * introduced by a semicolon must be non-empty.
     *
     * @param attribute the attribute description
     * @throws FilterException if the description is invalid
     */
    public static void checkAttributeDescription(String attribute) throws FilterException {
        if (attribute.isEmpty() || attribute.charAt(0) == ';') {
            throw new FilterException(FilterException.Kind.INVALID_ATTRIBUTE_DESCRIPTION,
                    "Missing attribute description");
        }
        for (int i = 0; i < attribute.length(); i++) {
            char c = attribute.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '.' || c == ';' || c == ':') {
                continue;
            }
            if (c == '\\') {
                throw new FilterException(FilterException.Kind.INVALID_ATTRIBUTE_DESCRIPTION,
                        "Escape sequence not allowed in attribute description");
            }
            throw new FilterException(FilterException.Kind.INVALID_ATTRIBUTE_DESCRIPTION,
                    "Invalid character \"" + c + "\" in attribute description");
        }
        if (attribute.endsWith(";") || attribute.contains(";;")) {
            throw new FilterException(FilterException.Kind.INVALID_ATTRIBUTE_DESCRIPTION,
                    "Semicolon present, but no option specified");
        }
    }

    /**
     * Checks the attribute type of an extensible match. Besides being a
     * valid attribute description it must not contain a colon, which
     * would separate it from the matching rule.
     *
     * @param attributeType the attribute type
     * @throws FilterException if the type is invalid
     */
    public static void checkExtensibleAttributeType(String attributeType) throws FilterException {
        checkAttributeDescription(attributeType);
        if (attributeType.indexOf(':') != -1) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "Colon in extensible match attribute type \"" + attributeType + "\"");
        }
    }

    /**
     * Checks a matching rule identifier. It must not contain a colon and
     * must not be {@code dn}, which the string form reserves for
     * dnAttributes.
     *
     * @param matchingRule the matching rule
     * @throws FilterException if the rule is invalid
     */
    public static void checkMatchingRule(String matchingRule) throws FilterException {
        checkAttributeDescription(matchingRule);
        if (matchingRule.indexOf(':') != -1 || matchingRule.equalsIgnoreCase("dn")) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "Invalid matching rule \"" + matchingRule + "\"");
        }
    }
}
