/*
 * SubstringFilter.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A substring assertion: an optional initial component, any number of
 * middle components and an optional final component, matched in order.
 *
 * <p>At least one component must be present. Middle components may be
 * empty, which is how {@code (cn=a**b)} is represented.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SubstringFilter extends Filter {

    private final String attribute;
    private final byte[] initial;
    private final List<byte[]> any;
    private final byte[] finalValue;

    /**
     * Creates a substring filter.
     *
     * @param attribute the attribute description
     * @param initial the initial component, or null
     * @param any the middle components, possibly empty
     * @param finalValue the final component, or null
     */
    public SubstringFilter(String attribute, byte[] initial, List<byte[]> any, byte[] finalValue) {
        this.attribute = checkAttribute(attribute);
        List<byte[]> copy = new ArrayList<byte[]>();
        if (any != null) {
            for (byte[] part : any) {
                if (part == null) {
                    throw new IllegalArgumentException("Null substring component");
                }
                copy.add(part.clone());
            }
        }
        if (initial == null && copy.isEmpty() && finalValue == null) {
            throw new IllegalArgumentException("Empty substring filter");
        }
        this.initial = initial != null ? initial.clone() : null;
        this.any = Collections.unmodifiableList(copy);
        this.finalValue = finalValue != null ? finalValue.clone() : null;
    }

    @Override
    public FilterType getType() {
        return FilterType.SUBSTRINGS;
    }

    public String getAttribute() {
        return attribute;
    }

    /**
     * Returns the initial component.
     *
     * @return a copy of the initial component, or null
     */
    public byte[] getInitial() {
        return initial != null ? initial.clone() : null;
    }

    /**
     * Returns the middle components.
     *
     * @return copies of the middle components in order
     */
    public List<byte[]> getAny() {
        List<byte[]> result = new ArrayList<byte[]>(any.size());
        for (byte[] part : any) {
            result.add(part.clone());
        }
        return result;
    }

    /**
     * Returns the final component.
     *
     * @return a copy of the final component, or null
     */
    public byte[] getFinal() {
        return finalValue != null ? finalValue.clone() : null;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SubstringFilter)) {
            return false;
        }
        SubstringFilter f = (SubstringFilter) other;
        if (!attribute.equals(f.attribute) || !Arrays.equals(initial, f.initial)
                || !Arrays.equals(finalValue, f.finalValue) || any.size() != f.any.size()) {
            return false;
        }
        for (int i = 0; i < any.size(); i++) {
            if (!Arrays.equals(any.get(i), f.any.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = attribute.hashCode();
        h = h * 31 + Arrays.hashCode(initial);
        for (byte[] part : any) {
            h = h * 31 + Arrays.hashCode(part);
        }
        return h * 31 + Arrays.hashCode(finalValue);
    }
}
