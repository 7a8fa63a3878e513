/*
 * ExtensibleMatchFilter.java
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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An extensible match assertion (RFC 4511 MatchingRuleAssertion).
 *
 * <p>At least one of the matching rule and the attribute type is
 * present. When {@code dnAttributes} is set the attributes of the entry's
 * distinguished name are also matched.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExtensibleMatchFilter extends Filter {

    private final String matchingRule;
    private final String attributeType;
    private final byte[] value;
    private final boolean dnAttributes;

    /**
     * Creates an extensible match filter.
     *
     * @param matchingRule the matching rule, or null
     * @param attributeType the attribute description, or null
     * @param value the assertion value
     * @param dnAttributes whether to match DN attributes too
     */
    public ExtensibleMatchFilter(String matchingRule, String attributeType, byte[] value,
            boolean dnAttributes) {
        if (matchingRule == null && attributeType == null) {
            throw new IllegalArgumentException("Neither matching rule nor attribute type specified");
        }
        if (value == null) {
            throw new IllegalArgumentException("Null assertion value");
        }
        this.matchingRule = matchingRule != null ? checkAttribute(matchingRule) : null;
        this.attributeType = attributeType != null ? checkAttribute(attributeType) : null;
        this.value = value.clone();
        this.dnAttributes = dnAttributes;
    }

    public ExtensibleMatchFilter(String matchingRule, String attributeType, String value,
            boolean dnAttributes) {
        this(matchingRule, attributeType, utf8(value), dnAttributes);
    }

    @Override
    public FilterType getType() {
        return FilterType.EXTENSIBLE_MATCH;
    }

    /**
     * Returns the matching rule.
     *
     * @return the matching rule, or null
     */
    public String getMatchingRule() {
        return matchingRule;
    }

    /**
     * Returns the attribute type.
     *
     * @return the attribute description, or null
     */
    public String getAttributeType() {
        return attributeType;
    }

    public byte[] getValue() {
        return value.clone();
    }

    public String getValueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public boolean isDnAttributes() {
        return dnAttributes;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ExtensibleMatchFilter)) {
            return false;
        }
        ExtensibleMatchFilter f = (ExtensibleMatchFilter) other;
        return dnAttributes == f.dnAttributes
                && (matchingRule == null ? f.matchingRule == null : matchingRule.equals(f.matchingRule))
                && (attributeType == null ? f.attributeType == null : attributeType.equals(f.attributeType))
                && Arrays.equals(value, f.value);
    }

    @Override
    public int hashCode() {
        int h = matchingRule != null ? matchingRule.hashCode() : 0;
        h = h * 31 + (attributeType != null ? attributeType.hashCode() : 0);
        h = h * 31 + Arrays.hashCode(value);
        return h * 2 + (dnAttributes ? 1 : 0);
    }
}
