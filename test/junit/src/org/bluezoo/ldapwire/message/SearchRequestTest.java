/*
 * SearchRequestTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.bluezoo.ldapwire.filter.Filter;
import org.bluezoo.ldapwire.filter.FilterException;
import org.bluezoo.ldapwire.filter.FilterParser;
import org.bluezoo.ldapwire.filter.PresentFilter;

/**
 * Unit tests for SearchRequest.
 */
public class SearchRequestTest {

    @Test
    public void testDefaults() {
        SearchRequest request = new SearchRequest();
        assertEquals("", request.getBaseDN());
        assertEquals(SearchScope.SUBTREE, request.getScope());
        assertEquals(DerefAliases.NEVER, request.getDerefAliases());
        assertEquals(0, request.getSizeLimit());
        assertEquals(0, request.getTimeLimit());
        assertFalse(request.isTypesOnly());
        assertEquals(new PresentFilter("objectClass"), request.getFilter());
        assertTrue(request.getAttributes().isEmpty());
    }

    @Test
    public void testNullsRestoreDefaults() {
        SearchRequest request = new SearchRequest();
        request.setBaseDN(null);
        request.setScope(null);
        request.setDerefAliases(null);
        request.setFilter((Filter) null);
        request.setAttributes((List<String>) null);
        assertEquals("", request.getBaseDN());
        assertEquals(SearchScope.SUBTREE, request.getScope());
        assertEquals(DerefAliases.NEVER, request.getDerefAliases());
        assertEquals(new PresentFilter("objectClass"), request.getFilter());
        assertTrue(request.getAttributes().isEmpty());
    }

    @Test
    public void testNegativeLimitsClamped() {
        SearchRequest request = new SearchRequest();
        request.setSizeLimit(-5);
        request.setTimeLimit(-1);
        assertEquals(0, request.getSizeLimit());
        assertEquals(0, request.getTimeLimit());
    }

    @Test
    public void testSetFilterString() throws FilterException {
        SearchRequest request = new SearchRequest();
        request.setFilter("(&(objectClass=person)(cn=Jo*))");
        assertEquals(FilterParser.parse("(&(objectClass=person)(cn=Jo*))"), request.getFilter());
    }

    @Test(expected = FilterException.class)
    public void testSetMalformedFilter() throws FilterException {
        new SearchRequest().setFilter("(cn=John");
    }

    @Test
    public void testAttributesAreCopied() {
        List<String> attrs = new ArrayList<String>();
        attrs.add("cn");
        SearchRequest request = new SearchRequest();
        request.setAttributes(attrs);
        attrs.add("mail");
        assertEquals(1, request.getAttributes().size());
        try {
            request.getAttributes().add("sn");
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testToString() throws FilterException {
        SearchRequest request = new SearchRequest();
        request.setBaseDN("dc=example,dc=com");
        request.setScope(SearchScope.ONE);
        request.setFilter("(uid=jdoe)");
        request.setAttributes("cn", "mail");
        request.setSizeLimit(10);
        assertEquals("SearchRequest[base=dc=example,dc=com, scope=ONE, filter=(uid=jdoe), "
                + "attrs=[cn, mail], sizeLimit=10]", request.toString());
    }

    @Test
    public void testEnumValues() {
        assertEquals(SearchScope.BASE, SearchScope.fromValue(0));
        assertEquals(SearchScope.SUBTREE, SearchScope.fromValue(2));
        assertNull(SearchScope.fromValue(3));
        assertEquals(3, DerefAliases.ALWAYS.getValue());
        assertEquals(DerefAliases.FINDING_BASE_OBJ, DerefAliases.fromValue(2));
        assertNull(DerefAliases.fromValue(-1));
    }
}
