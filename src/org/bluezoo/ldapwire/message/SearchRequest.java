/*
 * SearchRequest.java
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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.bluezoo.ldapwire.filter.Filter;
import org.bluezoo.ldapwire.filter.FilterException;
import org.bluezoo.ldapwire.filter.FilterParser;
import org.bluezoo.ldapwire.filter.PresentFilter;

/**
 * The parameters of an LDAP search.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * SearchRequest search = new SearchRequest();
 * search.setBaseDN("dc=example,dc=com");
 * search.setScope(SearchScope.SUBTREE);
 * search.setFilter("(&(objectClass=person)(uid=jdoe))");
 * search.setAttributes("cn", "mail");
 * byte[] pdu = SearchRequestCodec.encode(messageId, search);
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SearchRequest {

    private static final Filter ALL_OBJECTS = new PresentFilter("objectClass");

    private String baseDN = "";
    private SearchScope scope = SearchScope.SUBTREE;
    private DerefAliases derefAliases = DerefAliases.NEVER;
    private int sizeLimit = 0;  // 0 = no limit
    private int timeLimit = 0;  // 0 = no limit
    private boolean typesOnly = false;
    private Filter filter = ALL_OBJECTS;
    private List<String> attributes = Collections.emptyList();

    public String getBaseDN() {
        return baseDN;
    }

    public void setBaseDN(String baseDN) {
        this.baseDN = baseDN != null ? baseDN : "";
    }

    public SearchScope getScope() {
        return scope;
    }

    public void setScope(SearchScope scope) {
        this.scope = scope != null ? scope : SearchScope.SUBTREE;
    }

    public DerefAliases getDerefAliases() {
        return derefAliases;
    }

    public void setDerefAliases(DerefAliases derefAliases) {
        this.derefAliases = derefAliases != null ? derefAliases : DerefAliases.NEVER;
    }

    /**
     * Returns the maximum number of entries to return.
     *
     * @return the size limit (0 = no limit)
     */
    public int getSizeLimit() {
        return sizeLimit;
    }

    public void setSizeLimit(int sizeLimit) {
        this.sizeLimit = Math.max(0, sizeLimit);
    }

    /**
     * Returns the time limit in seconds.
     *
     * @return the time limit (0 = no limit)
     */
    public int getTimeLimit() {
        return timeLimit;
    }

    public void setTimeLimit(int timeLimit) {
        this.timeLimit = Math.max(0, timeLimit);
    }

    public boolean isTypesOnly() {
        return typesOnly;
    }

    public void setTypesOnly(boolean typesOnly) {
        this.typesOnly = typesOnly;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * Sets the search filter.
     *
     * @param filter the filter, or null for {@code (objectClass=*)}
     */
    public void setFilter(Filter filter) {
        this.filter = filter != null ? filter : ALL_OBJECTS;
    }

    /**
     * Parses and sets the search filter.
     *
     * @param filter the filter string
     * @throws FilterException if the filter is malformed
     */
    public void setFilter(String filter) throws FilterException {
        this.filter = FilterParser.parse(filter);
    }

    /**
     * Returns the list of attributes to return.
     *
     * @return unmodifiable list of attribute descriptions
     */
    public List<String> getAttributes() {
        return attributes;
    }

    /**
     * Sets the attributes to return. An empty list returns all user
     * attributes.
     *
     * @param attributes the attribute descriptions
     */
    public void setAttributes(String... attributes) {
        setAttributes(attributes != null ? Arrays.asList(attributes) : null);
    }

    public void setAttributes(List<String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            this.attributes = Collections.emptyList();
        } else {
            this.attributes = Collections.unmodifiableList(new ArrayList<String>(attributes));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchRequest[base=").append(baseDN);
        sb.append(", scope=").append(scope);
        sb.append(", filter=").append(filter);
        if (!attributes.isEmpty()) {
            sb.append(", attrs=").append(attributes);
        }
        if (sizeLimit > 0) {
            sb.append(", sizeLimit=").append(sizeLimit);
        }
        if (timeLimit > 0) {
            sb.append(", timeLimit=").append(timeLimit);
        }
        sb.append("]");
        return sb.toString();
    }
}
