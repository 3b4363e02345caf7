/*
 * Copyright 2018,2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.abnfregex.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import uk.ac.lancs.abnfregex.regex.Element;

/**
 * Holds rules under identifiers, in an order in which each rule follows
 * the rules it refers to. References within the rules use the
 * identifiers.
 * 
 * @author simpsons
 */
public final class RuleTable {
    /**
     * The rules' expressions indexed by identifier, in dependency order
     */
    public final Map<String, Element> rules;

    /**
     * The identifier of each rule, indexed by the rule's original name,
     * in the order the rules were supplied
     */
    public final Map<String, String> identifiers;

    RuleTable(Map<String, Element> rules, Map<String, String> identifiers) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.identifiers =
            Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
    }

    /**
     * Get the original name of a rule.
     * 
     * @param identifier the rule's identifier
     * 
     * @return the rule's original name, or {@code null} if the
     * identifier is unknown
     */
    public String nameOf(String identifier) {
        for (Map.Entry<String, String> entry : identifiers.entrySet())
            if (entry.getValue().equals(identifier)) return entry.getKey();
        return null;
    }

    @Override
    public String toString() {
        return rules.toString();
    }
}
