/*
 * CompositeFilter.java
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
 * A conjunction or disjunction of one or more filters.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CompositeFilter extends Filter {

    private final FilterType type;
    private final List<Filter> children;

    /**
     * Creates an AND or OR filter.
     *
     * @param type {@link FilterType#AND} or {@link FilterType#OR}
     * @param children the operands, at least one
     */
    public CompositeFilter(FilterType type, List<Filter> children) {
        if (type != FilterType.AND && type != FilterType.OR) {
            throw new IllegalArgumentException("Not a composite filter type: " + type);
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Empty " + type + " filter");
        }
        for (Filter child : children) {
            if (child == null) {
                throw new IllegalArgumentException("Null operand");
            }
        }
        this.type = type;
        this.children = Collections.unmodifiableList(new ArrayList<Filter>(children));
    }

    public static CompositeFilter and(Filter... children) {
        return new CompositeFilter(FilterType.AND, Arrays.asList(children));
    }

    public static CompositeFilter or(Filter... children) {
        return new CompositeFilter(FilterType.OR, Arrays.asList(children));
    }

    @Override
    public FilterType getType() {
        return type;
    }

    /**
     * Returns the operands in their original order.
     *
     * @return unmodifiable list of operands
     */
    public List<Filter> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof CompositeFilter)) {
            return false;
        }
        CompositeFilter f = (CompositeFilter) other;
        return type == f.type && children.equals(f.children);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + children.hashCode();
    }
}
