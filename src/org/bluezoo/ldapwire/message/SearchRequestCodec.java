/*
 * SearchRequestCodec.java
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

package org.bluezoo.ldapwire.message;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.ldapwire.asn1.ASN1Element;
import org.bluezoo.ldapwire.asn1.ASN1Exception;
import org.bluezoo.ldapwire.asn1.ASN1Identifier;
import org.bluezoo.ldapwire.asn1.BERDecoder;
import org.bluezoo.ldapwire.asn1.BEREncoder;
import org.bluezoo.ldapwire.filter.FilterCodec;
import org.bluezoo.ldapwire.filter.FilterException;

/**
 * Encodes a search request in its LDAPMessage envelope and decodes it
 * back.
 *
 * <pre>
 * LDAPMessage ::= SEQUENCE {
 *     messageID  INTEGER (0..maxInt),
 *     protocolOp [APPLICATION 3] SEQUENCE {
 *         baseObject   LDAPDN,
 *         scope        ENUMERATED,
 *         derefAliases ENUMERATED,
 *         sizeLimit    INTEGER (0..maxInt),
 *         timeLimit    INTEGER (0..maxInt),
 *         typesOnly    BOOLEAN,
 *         filter       Filter,
 *         attributes   SEQUENCE OF LDAPString } }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SearchRequestCodec {

    private static final Logger logger = Logger.getLogger(SearchRequestCodec.class.getName());

    private static final ASN1Identifier SEARCH_REQUEST =
            ASN1Identifier.application(LDAPConstants.OP_SEARCH_REQUEST, true);

    private SearchRequestCodec() {
    }

    /**
     * Encodes a search request.
     *
     * @param messageId the message ID
     * @param request the request
     * @return the LDAPMessage encoding
     */
    public static byte[] encode(int messageId, SearchRequest request) {
        if (messageId < 0) {
            throw new IllegalArgumentException("Negative message ID: " + messageId);
        }
        BEREncoder encoder = new BEREncoder();
        encoder.beginSequence();
        encoder.writeInteger(messageId);
        encoder.beginApplication(LDAPConstants.OP_SEARCH_REQUEST, true);

        encoder.writeOctetString(request.getBaseDN());
        encoder.writeEnumerated(request.getScope().getValue());
        encoder.writeEnumerated(request.getDerefAliases().getValue());
        encoder.writeInteger(request.getSizeLimit());
        encoder.writeInteger(request.getTimeLimit());
        encoder.writeBoolean(request.isTypesOnly());
        FilterCodec.write(encoder, request.getFilter());

        encoder.beginSequence();
        for (String attr : request.getAttributes()) {
            encoder.writeOctetString(attr);
        }
        encoder.endSequence();

        encoder.endApplication();
        encoder.endSequence();

        byte[] pdu = encoder.toByteArray();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Encoded SearchRequest (messageId=" + messageId + ", " + pdu.length + " bytes)");
        }
        return pdu;
    }

    /**
     * Decodes a search request from its LDAPMessage encoding.
     *
     * @param data the encoding
     * @return the request
     * @throws ASN1Exception if the data is not a well-formed LDAPMessage
     * @throws FilterException if the filter is invalid
     */
    public static SearchRequest decode(byte[] data) throws ASN1Exception, FilterException {
        return decode(BERDecoder.decode(data));
    }

    /**
     * Returns the message ID of an LDAPMessage.
     *
     * @param message the decoded envelope
     * @return the message ID
     * @throws ASN1Exception if the envelope is malformed
     */
    public static int decodeMessageId(ASN1Element message) throws ASN1Exception {
        checkEnvelope(message);
        int messageId = expect(message.getChild(0), ASN1Element.Kind.INTEGER).asInt();
        if (messageId < 0) {
            throw new ASN1Exception("Negative message ID: " + messageId);
        }
        return messageId;
    }

    /**
     * Decodes the search request carried by an LDAPMessage.
     *
     * @param message the decoded envelope
     * @return the request
     * @throws ASN1Exception if the envelope or request is malformed
     * @throws FilterException if the filter is invalid
     */
    public static SearchRequest decode(ASN1Element message) throws ASN1Exception, FilterException {
        int messageId = decodeMessageId(message);
        ASN1Element op = message.getChild(1);
        if (!op.getIdentifier().equals(SEARCH_REQUEST)) {
            throw new ASN1Exception("Not a SearchRequest: " + op.getIdentifier());
        }
        if (op.getChildCount() != 8) {
            throw new ASN1Exception("SearchRequest has " + op.getChildCount() + " components, expected 8");
        }
        SearchRequest request = new SearchRequest();
        request.setBaseDN(expect(op.getChild(0), ASN1Element.Kind.OCTET_STRING).asString());

        long scopeValue = expect(op.getChild(1), ASN1Element.Kind.INTEGER).asLong();
        SearchScope scope = SearchScope.fromValue(scopeValue);
        if (scope == null) {
            throw new ASN1Exception("Invalid search scope: " + scopeValue);
        }
        request.setScope(scope);

        long derefValue = expect(op.getChild(2), ASN1Element.Kind.INTEGER).asLong();
        DerefAliases deref = DerefAliases.fromValue(derefValue);
        if (deref == null) {
            throw new ASN1Exception("Invalid derefAliases: " + derefValue);
        }
        request.setDerefAliases(deref);

        request.setSizeLimit(expect(op.getChild(3), ASN1Element.Kind.INTEGER).asInt());
        request.setTimeLimit(expect(op.getChild(4), ASN1Element.Kind.INTEGER).asInt());
        request.setTypesOnly(expect(op.getChild(5), ASN1Element.Kind.BOOLEAN).asBoolean());
        request.setFilter(FilterCodec.fromASN1(op.getChild(6)));

        List<String> attributes = new ArrayList<String>();
        for (ASN1Element attr : expect(op.getChild(7), ASN1Element.Kind.SEQUENCE).getChildren()) {
            attributes.add(expect(attr, ASN1Element.Kind.OCTET_STRING).asString());
        }
        request.setAttributes(attributes);

        logger.fine("Decoded SearchRequest (messageId=" + messageId + ")");
        return request;
    }

    private static void checkEnvelope(ASN1Element message) throws ASN1Exception {
        if (message.getKind() != ASN1Element.Kind.SEQUENCE || message.getChildCount() < 2) {
            throw new ASN1Exception("Not an LDAPMessage: " + message.getIdentifier());
        }
    }

    private static ASN1Element expect(ASN1Element element, ASN1Element.Kind kind) throws ASN1Exception {
        if (element.getKind() != kind) {
            throw new ASN1Exception("Expected " + kind + ", found " + element.getIdentifier());
        }
        return element;
    }
}
