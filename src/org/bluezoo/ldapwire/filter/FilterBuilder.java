/*
 * FilterBuilder.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles a filter from a sequence of calls that mirrors the filter
 * grammar.
 *
 * <pre>{@code
 * FilterBuilder builder = new FilterBuilder();
 * builder.startNested(FilterType.AND);
 * builder.addAttributeAssertion(FilterType.EQUALITY_MATCH, "objectClass", utf8("person"));
 * builder.startSubstrings("cn");
 * builder.addSubstring(SubstringType.INITIAL, utf8("Jo"));
 * builder.addSubstring(SubstringType.FINAL, utf8("th"));
 * builder.endSubstrings();
 * builder.endNested(FilterType.AND);
 * Filter filter = builder.getFilter();   // (&(objectClass=person)(cn=Jo*th))
 * }</pre>
 *
 * <p>Calls that the grammar does not allow fail immediately with
 * {@link FilterException.Kind#BUILDER_PROTOCOL_VIOLATION}. After a
 * failure the builder should be discarded.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterBuilder {

    private final Deque<Frame> stack = new ArrayDeque<Frame>();
    private Filter root;

    /**
     * Opens an AND, OR or NOT filter. Its operands are the filters added
     * until the matching {@link #endNested}.
     *
     * @param type {@link FilterType#AND}, {@link FilterType#OR} or
     *        {@link FilterType#NOT}
     * @throws FilterException if a nested filter cannot start here
     */
    public void startNested(FilterType type) throws FilterException {
        if (type == null || !type.isNested()) {
            throw violation("Not a nested filter type: " + type);
        }
        checkNotInSubstrings("Cannot start a nested filter in a substring");
        checkCanAdd();
        if (stack.size() >= FilterCodec.MAX_NESTING) {
            throw new FilterException(FilterException.Kind.NESTING_TOO_DEEP,
                    "Filter nested deeper than " + FilterCodec.MAX_NESTING + " levels");
        }
        stack.push(new NestedFrame(type));
    }

    /**
     * Closes the innermost nested filter.
     *
     * @param type the type it was opened with
     * @throws FilterException if the innermost open filter is of another
     *         type or has no operands
     */
    public void endNested(FilterType type) throws FilterException {
        Frame top = stack.peek();
        if (!(top instanceof NestedFrame) || ((NestedFrame) top).type != type) {
            throw violation("Mismatched ending of nested filter");
        }
        NestedFrame frame = (NestedFrame) top;
        if (frame.children.isEmpty()) {
            throw violation("Empty " + type + " filter");
        }
        stack.pop();
        Filter filter;
        if (type == FilterType.NOT) {
            filter = new NotFilter(frame.children.get(0));
        } else {
            filter = new CompositeFilter(type, frame.children);
        }
        add(filter);
    }

    /**
     * Opens a substring filter on an attribute.
     *
     * @param attribute the attribute description
     * @throws FilterException if the attribute is invalid or a filter
     *         cannot start here
     */
    public void startSubstrings(String attribute) throws FilterException {
        checkNotInSubstrings("Cannot start a substring filter in a substring");
        FilterTokenizer.checkAttributeDescription(attribute);
        checkCanAdd();
        stack.push(new SubstringFrame(attribute));
    }

    /**
     * Adds a component to the open substring filter. An initial
     * component must come first, a final component last.
     *
     * @param type the position of the component
     * @param value the component octets
     * @throws FilterException if no substring filter is open or the
     *         component is out of place
     */
    public void addSubstring(SubstringType type, byte[] value) throws FilterException {
        Frame top = stack.peek();
        if (!(top instanceof SubstringFrame)) {
            throw violation("A call to addSubstring occured without calling startSubstring");
        }
        SubstringFrame frame = (SubstringFrame) top;
        if (frame.finalValue != null) {
            throw violation("Attempt to add a substring match after a final substring match");
        }
        if (type == SubstringType.INITIAL && frame.count > 0) {
            throw violation("Attempt to add an initial substring match after the first substring");
        }
        byte[] copy = value.clone();
        switch (type) {
            case INITIAL:
                frame.initial = copy;
                break;
            case ANY:
                frame.any.add(copy);
                break;
            default:
                frame.finalValue = copy;
        }
        frame.count++;
    }

    /**
     * Closes the open substring filter.
     *
     * @throws FilterException if no substring filter is open or it has
     *         no components
     */
    public void endSubstrings() throws FilterException {
        Frame top = stack.peek();
        if (!(top instanceof SubstringFrame)) {
            throw violation("Missmatched ending of substrings");
        }
        SubstringFrame frame = (SubstringFrame) top;
        if (frame.count == 0) {
            throw violation("Empty substring filter");
        }
        stack.pop();
        add(new SubstringFilter(frame.attribute, frame.initial, frame.any, frame.finalValue));
    }

    /**
     * Adds an equality, ordering or approximate match assertion.
     *
     * @param type one of the comparison filter types
     * @param attribute the attribute description
     * @param value the assertion value
     * @throws FilterException if the arguments are invalid or a filter
     *         cannot be added here
     */
    public void addAttributeAssertion(FilterType type, String attribute, byte[] value)
            throws FilterException {
        if (type == null || !type.isComparison()) {
            throw violation("Not an attribute assertion type: " + type);
        }
        checkNotInSubstrings("Cannot insert an attribute assertion in a substring");
        FilterTokenizer.checkAttributeDescription(attribute);
        checkCanAdd();
        add(new ComparisonFilter(type, attribute, value));
    }

    /**
     * Adds a presence test.
     *
     * @param attribute the attribute description
     * @throws FilterException if the attribute is invalid or a filter
     *         cannot be added here
     */
    public void addPresent(String attribute) throws FilterException {
        checkNotInSubstrings("Cannot insert an attribute assertion in a substring");
        FilterTokenizer.checkAttributeDescription(attribute);
        checkCanAdd();
        add(new PresentFilter(attribute));
    }

    /**
     * Adds an extensible match assertion.
     *
     * @param matchingRule the matching rule, or null
     * @param attributeType the attribute description, or null
     * @param value the assertion value
     * @param dnAttributes whether DN attributes are matched too
     * @throws FilterException if neither rule nor type is given, or a
     *         filter cannot be added here
     */
    public void addExtensibleMatch(String matchingRule, String attributeType, byte[] value,
            boolean dnAttributes) throws FilterException {
        checkNotInSubstrings("Cannot insert an attribute assertion in a substring");
        if (matchingRule == null && attributeType == null) {
            throw new FilterException(FilterException.Kind.INVALID_EXTENSIBLE_MATCH,
                    "Neither matching rule nor attribute type specified");
        }
        if (attributeType != null) {
            FilterTokenizer.checkExtensibleAttributeType(attributeType);
        }
        if (matchingRule != null) {
            FilterTokenizer.checkMatchingRule(matchingRule);
        }
        checkCanAdd();
        add(new ExtensibleMatchFilter(matchingRule, attributeType, value, dnAttributes));
    }

    /**
     * Returns whether a complete filter has been built.
     *
     * @return true once the outermost filter is closed
     */
    public boolean isComplete() {
        return root != null && stack.isEmpty();
    }

    /**
     * Returns the completed filter.
     *
     * @return the filter
     * @throws FilterException if the filter is not complete
     */
    public Filter getFilter() throws FilterException {
        if (!isComplete()) {
            throw violation("Filter is not complete");
        }
        return root;
    }

    private void checkNotInSubstrings(String message) throws FilterException {
        if (stack.peek() instanceof SubstringFrame) {
            throw violation(message);
        }
    }

    private void checkCanAdd() throws FilterException {
        Frame top = stack.peek();
        if (top == null) {
            if (root != null) {
                throw violation("Filter is already complete");
            }
        } else if (top instanceof NestedFrame) {
            NestedFrame frame = (NestedFrame) top;
            if (frame.type == FilterType.NOT && !frame.children.isEmpty()) {
                throw violation("Attemp to create more than one 'not' sub-filter");
            }
        }
    }

    private void add(Filter filter) {
        Frame top = stack.peek();
        if (top == null) {
            root = filter;
        } else {
            ((NestedFrame) top).children.add(filter);
        }
    }

    private static FilterException violation(String message) {
        return new FilterException(FilterException.Kind.BUILDER_PROTOCOL_VIOLATION, message);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Frames
    // ─────────────────────────────────────────────────────────────────────────

    private abstract static class Frame {
    }

    private static final class NestedFrame extends Frame {

        final FilterType type;
        final List<Filter> children = new ArrayList<Filter>();

        NestedFrame(FilterType type) {
            this.type = type;
        }
    }

    private static final class SubstringFrame extends Frame {

        final String attribute;
        byte[] initial;
        final List<byte[]> any = new ArrayList<byte[]>();
        byte[] finalValue;
        int count;

        SubstringFrame(String attribute) {
            this.attribute = attribute;
        }
    }
}
