/*
 * FilterCodec.java
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
import java.util.ArrayList;
import java.util.List;

import org.bluezoo.ldapwire.asn1.ASN1Element;
import org.bluezoo.ldapwire.asn1.ASN1Exception;
import org.bluezoo.ldapwire.asn1.ASN1Identifier;
import org.bluezoo.ldapwire.asn1.ASN1Type;
import org.bluezoo.ldapwire.asn1.BERDecoder;
import org.bluezoo.ldapwire.asn1.BEREncoder;

/**
 * Converts filters to and from their BER form (RFC 4511 section 4.5.1).
 *
 * <pre>
 * Filter ::= CHOICE {
 *     and             [0] SET SIZE (1..MAX) OF filter Filter,
 *     or              [1] SET SIZE (1..MAX) OF filter Filter,
 *     not             [2] Filter,
 *     equalityMatch   [3] AttributeValueAssertion,
 *     substrings      [4] SubstringFilter,
 *     greaterOrEqual  [5] AttributeValueAssertion,
 *     lessOrEqual     [6] AttributeValueAssertion,
 *     present         [7] AttributeDescription,
 *     approxMatch     [8] AttributeValueAssertion,
 *     extensibleMatch [9] MatchingRuleAssertion }
 * </pre>
 *
 * <p>{@code not} is explicitly tagged. The other alternatives are
 * implicitly tagged. {@code dnAttributes} is omitted when false.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FilterCodec {

    // MatchingRuleAssertion component tags
    private static final int MATCHING_RULE = 1;
    private static final int TYPE = 2;
    private static final int MATCH_VALUE = 3;
    private static final int DN_ATTRIBUTES = 4;

    /**
     * The maximum number of and, or and not filters enclosing any part of
     * a filter. The remaining levels of the BER nesting limit hold a
     * substrings leaf and the LDAPMessage and SearchRequest envelope.
     */
    public static final int MAX_NESTING = Math.max(0, BEREncoder.DEFAULT_MAX_DEPTH - 4);

    private FilterCodec() {
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Encoding
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the ASN.1 form of a filter.
     *
     * @param filter the filter
     * @return the element
     */
    public static ASN1Element toASN1(Filter filter) {
        FilterType type = filter.getType();
        switch (type) {
            case AND:
            case OR: {
                List<ASN1Element> children = new ArrayList<ASN1Element>();
                for (Filter child : ((CompositeFilter) filter).getChildren()) {
                    children.add(toASN1(child));
                }
                return new ASN1Element(context(type, true), children);
            }
            case NOT:
                return ASN1Element.explicit(context(type, true), toASN1(((NotFilter) filter).getChild()));
            case PRESENT:
                return new ASN1Element(context(type, false),
                        ((PresentFilter) filter).getAttribute().getBytes(StandardCharsets.UTF_8));
            case SUBSTRINGS: {
                SubstringFilter substrings = (SubstringFilter) filter;
                List<ASN1Element> parts = new ArrayList<ASN1Element>();
                byte[] initial = substrings.getInitial();
                if (initial != null) {
                    parts.add(substring(SubstringType.INITIAL, initial));
                }
                for (byte[] any : substrings.getAny()) {
                    parts.add(substring(SubstringType.ANY, any));
                }
                byte[] finalValue = substrings.getFinal();
                if (finalValue != null) {
                    parts.add(substring(SubstringType.FINAL, finalValue));
                }
                List<ASN1Element> sequence = new ArrayList<ASN1Element>();
                sequence.add(ASN1Element.octetString(substrings.getAttribute()));
                sequence.add(ASN1Element.sequence(parts));
                return new ASN1Element(context(type, true), sequence);
            }
            case EXTENSIBLE_MATCH: {
                ExtensibleMatchFilter match = (ExtensibleMatchFilter) filter;
                List<ASN1Element> sequence = new ArrayList<ASN1Element>();
                if (match.getMatchingRule() != null) {
                    sequence.add(ASN1Element.implicit(ASN1Identifier.context(MATCHING_RULE, false),
                            ASN1Element.octetString(match.getMatchingRule())));
                }
                if (match.getAttributeType() != null) {
                    sequence.add(ASN1Element.implicit(ASN1Identifier.context(TYPE, false),
                            ASN1Element.octetString(match.getAttributeType())));
                }
                sequence.add(ASN1Element.implicit(ASN1Identifier.context(MATCH_VALUE, false),
                        ASN1Element.octetString(match.getValue())));
                if (match.isDnAttributes()) {
                    sequence.add(ASN1Element.implicit(ASN1Identifier.context(DN_ATTRIBUTES, false),
                            ASN1Element.booleanValue(true)));
                }
                return new ASN1Element(context(type, true), sequence);
            }
            default: {
                ComparisonFilter comparison = (ComparisonFilter) filter;
                List<ASN1Element> assertion = new ArrayList<ASN1Element>();
                assertion.add(ASN1Element.octetString(comparison.getAttribute()));
                assertion.add(ASN1Element.octetString(comparison.getValue()));
                return ASN1Element.implicit(context(type, true), ASN1Element.sequence(assertion));
            }
        }
    }

    /**
     * Returns the BER encoding of a filter.
     *
     * @param filter the filter
     * @return the encoding
     * @throws IllegalStateException if the filter is nested too deeply
     *         to encode
     */
    public static byte[] encode(Filter filter) {
        return BEREncoder.encode(toASN1(filter));
    }

    /**
     * Writes a filter into an encoder, for example inside a search request.
     *
     * @param encoder the encoder
     * @param filter the filter
     */
    public static void write(BEREncoder encoder, Filter filter) {
        encoder.write(toASN1(filter));
    }

    private static ASN1Identifier context(FilterType type, boolean constructed) {
        return ASN1Identifier.context(type.getTagNumber(), constructed);
    }

    private static ASN1Element substring(SubstringType type, byte[] value) {
        return new ASN1Element(ASN1Identifier.context(type.getTagNumber(), false), value);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Decoding
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Decodes the BER encoding of a filter.
     *
     * @param data the encoding
     * @return the filter
     * @throws ASN1Exception if the data is not well-formed BER
     * @throws FilterException if the data does not encode a filter
     */
    public static Filter decode(byte[] data) throws ASN1Exception, FilterException {
        return fromASN1(BERDecoder.decode(data));
    }

    /**
     * Decodes the content octets of a filter whose identifier has
     * already been read. Only {@code present} is primitive.
     *
     * @param tagNumber the context tag number of the Filter alternative
     * @param content the content octets
     * @return the filter
     * @throws ASN1Exception if the content is not well-formed BER
     * @throws FilterException if the content does not encode a filter
     */
    public static Filter decode(int tagNumber, byte[] content) throws ASN1Exception, FilterException {
        boolean constructed = tagNumber != FilterType.PRESENT.getTagNumber();
        return fromASN1(BERDecoder.decode(ASN1Identifier.context(tagNumber, constructed), content));
    }

    /**
     * Returns the filter an ASN.1 element encodes.
     *
     * @param element the element
     * @return the filter
     * @throws FilterException if the element does not encode a filter
     */
    public static Filter fromASN1(ASN1Element element) throws FilterException {
        return fromASN1(element, 0);
    }

    private static Filter fromASN1(ASN1Element element, int nesting) throws FilterException {
        if (element.getTagClass() != ASN1Type.CLASS_CONTEXT) {
            throw invalid("Filter must be context-specific, found " + element.getIdentifier());
        }
        FilterType type = FilterType.fromTagNumber(element.getTagNumber());
        if (type == null) {
            throw invalid("Unknown filter tag " + element.getTagNumber());
        }
        if (element.isConstructed() == (type == FilterType.PRESENT)) {
            throw invalid("Wrong form for " + type + " filter: " + element.getIdentifier());
        }
        if (type.isNested() && nesting >= MAX_NESTING) {
            throw invalid("Filter nested deeper than " + MAX_NESTING + " levels");
        }
        switch (type) {
            case AND:
            case OR: {
                if (element.getChildCount() == 0) {
                    throw invalid("Empty " + type + " filter");
                }
                List<Filter> children = new ArrayList<Filter>();
                for (ASN1Element child : element.getChildren()) {
                    children.add(fromASN1(child, nesting + 1));
                }
                return new CompositeFilter(type, children);
            }
            case NOT:
                if (element.getChildCount() != 1) {
                    throw invalid("'not' filter must hold exactly one filter");
                }
                return new NotFilter(fromASN1(element.getChild(0), nesting + 1));
            case PRESENT:
                return new PresentFilter(attribute(element));
            case SUBSTRINGS:
                return decodeSubstrings(element);
            case EXTENSIBLE_MATCH:
                return decodeExtensibleMatch(element);
            default: {
                if (element.getChildCount() != 2) {
                    throw invalid("AttributeValueAssertion must have 2 components");
                }
                return new ComparisonFilter(type, attribute(expectOctetString(element.getChild(0))),
                        octets(expectOctetString(element.getChild(1))));
            }
        }
    }

    private static Filter decodeSubstrings(ASN1Element element) throws FilterException {
        if (element.getChildCount() != 2) {
            throw invalid("SubstringFilter must have 2 components");
        }
        String attribute = attribute(expectOctetString(element.getChild(0)));
        ASN1Element parts = element.getChild(1);
        if (parts.getKind() != ASN1Element.Kind.SEQUENCE || parts.getChildCount() == 0) {
            throw invalid("SubstringFilter must have a non-empty sequence of substrings");
        }
        byte[] initial = null;
        byte[] finalValue = null;
        List<byte[]> any = new ArrayList<byte[]>();
        int count = parts.getChildCount();
        for (int i = 0; i < count; i++) {
            ASN1Element part = parts.getChild(i);
            SubstringType type = SubstringType.fromTagNumber(part.getTagNumber());
            if (part.getTagClass() != ASN1Type.CLASS_CONTEXT || part.isConstructed() || type == null) {
                throw invalid("Invalid substring component " + part.getIdentifier());
            }
            switch (type) {
                case INITIAL:
                    if (i != 0) {
                        throw invalid("Initial substring must come first");
                    }
                    initial = octets(part);
                    break;
                case ANY:
                    any.add(octets(part));
                    break;
                default:
                    if (i != count - 1) {
                        throw invalid("Final substring must come last");
                    }
                    finalValue = octets(part);
            }
        }
        return new SubstringFilter(attribute, initial, any, finalValue);
    }

    private static Filter decodeExtensibleMatch(ASN1Element element) throws FilterException {
        String matchingRule = null;
        String attributeType = null;
        byte[] value = null;
        boolean dnAttributes = false;
        int last = 0;
        for (ASN1Element component : element.getChildren()) {
            int tag = component.getTagNumber();
            if (component.getTagClass() != ASN1Type.CLASS_CONTEXT || component.isConstructed()
                    || tag < MATCHING_RULE || tag > DN_ATTRIBUTES || tag <= last) {
                throw invalid("Invalid MatchingRuleAssertion component " + component.getIdentifier());
            }
            last = tag;
            switch (tag) {
                case MATCHING_RULE:
                    matchingRule = text(component);
                    checkText(matchingRule, true);
                    break;
                case TYPE:
                    attributeType = text(component);
                    checkText(attributeType, false);
                    break;
                case MATCH_VALUE:
                    value = octets(component);
                    break;
                default:
                    try {
                        dnAttributes = component.asBoolean();
                    } catch (ASN1Exception e) {
                        throw new FilterException(FilterException.Kind.INVALID_ENCODING,
                                "Invalid dnAttributes", e);
                    }
            }
        }
        if (value == null) {
            throw invalid("MatchingRuleAssertion without matchValue");
        }
        if (matchingRule == null && attributeType == null) {
            throw invalid("MatchingRuleAssertion without matchingRule or type");
        }
        return new ExtensibleMatchFilter(matchingRule, attributeType, value, dnAttributes);
    }

    private static ASN1Element expectOctetString(ASN1Element element) throws FilterException {
        if (element.getKind() != ASN1Element.Kind.OCTET_STRING) {
            throw invalid("Expected OCTET STRING, found " + element.getIdentifier());
        }
        return element;
    }

    private static byte[] octets(ASN1Element element) throws FilterException {
        if (element.isConstructed()) {
            throw invalid("Expected primitive value, found " + element.getIdentifier());
        }
        return element.getValue();
    }

    private static String text(ASN1Element element) throws FilterException {
        return new String(octets(element), StandardCharsets.UTF_8);
    }

    private static String attribute(ASN1Element element) throws FilterException {
        String attribute = text(element);
        try {
            FilterTokenizer.checkAttributeDescription(attribute);
        } catch (FilterException e) {
            throw new FilterException(FilterException.Kind.INVALID_ENCODING, e.getMessage(), e);
        }
        return attribute;
    }

    // Extensible match components that could not be told apart when rendered
    private static void checkText(String text, boolean matchingRule) throws FilterException {
        try {
            if (matchingRule) {
                FilterTokenizer.checkMatchingRule(text);
            } else {
                FilterTokenizer.checkExtensibleAttributeType(text);
            }
        } catch (FilterException e) {
            throw new FilterException(FilterException.Kind.INVALID_ENCODING, e.getMessage(), e);
        }
    }

    private static FilterException invalid(String message) {
        return new FilterException(FilterException.Kind.INVALID_ENCODING, message);
    }
}
