/*
 * FilterException.java
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
 * Exception thrown when a search filter cannot be parsed, built or
 * decoded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The category of a filter failure.
     */
    public enum Kind {

        /** The filter text ended where a token was required. */
        UNEXPECTED_END,

        /** A left parenthesis is missing. */
        MISSING_LEFT_PAREN,

        /** A right parenthesis is missing. */
        MISSING_RIGHT_PAREN,

        /** A character other than the one the grammar requires. */
        UNEXPECTED_CHARACTER,

        /** An empty or malformed attribute description. */
        INVALID_ATTRIBUTE_DESCRIPTION,

        /** None of the comparison operators was found. */
        INVALID_COMPARISON_OPERATOR,

        /** An extensible match without matching rule or attribute type. */
        INVALID_EXTENSIBLE_MATCH,

        /** A malformed escape sequence or a character that must be escaped. */
        INVALID_ESCAPE,

        /** More nested and, or and not filters than {@link FilterCodec#MAX_NESTING}. */
        NESTING_TOO_DEEP,

        /** Builder methods called in an order the grammar does not allow. */
        BUILDER_PROTOCOL_VIOLATION,

        /** A BER encoded filter that does not have the shape of a Filter. */
        INVALID_ENCODING
    }

    private final Kind kind;

    /**
     * Creates a new filter exception.
     *
     * @param kind the kind of failure
     * @param message the error message
     */
    public FilterException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates a new filter exception with a cause.
     *
     * @param kind the kind of failure
     * @param message the error message
     * @param cause the underlying cause
     */
    public FilterException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }

}
