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

package uk.ac.lancs.abnfregex.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Holds an ordered set of rules. Rule names are case-insensitive. Names
 * not defined here may be resolved by a fallback grammar, normally the
 * core rules of RFC 5234.
 * 
 * @author simpsons
 */
public final class Grammar {
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final Grammar fallback;

    /**
     * Create a grammar.
     * 
     * @param rules the rules in definition order, the first being the
     * root
     * 
     * @param fallback a grammar to resolve names not defined here, or
     * {@code null} if there is none
     * 
     * @throws IllegalArgumentException if two rules have the same name
     */
    public Grammar(List<Rule> rules, Grammar fallback) {
        for (Rule rule : rules) {
            Rule old = this.rules.putIfAbsent(key(rule.name), rule);
            if (old != null)
                throw new IllegalArgumentException("duplicate rule: "
                    + rule.name);
        }
        this.fallback = fallback;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Get the rules defined by this grammar, excluding any from the
     * fallback.
     * 
     * @return the rules in definition order
     */
    public List<Rule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    /**
     * Get the first rule of the grammar.
     * 
     * @return the root rule
     * 
     * @throws IllegalStateException if the grammar defines no rules
     */
    public Rule root() {
        if (rules.isEmpty())
            throw new IllegalStateException("grammar defines no rules");
        return rules.values().iterator().next();
    }

    /**
     * Find a rule by name, consulting the fallback grammar if this one
     * does not define it.
     * 
     * @param name the rule's name, in any case
     * 
     * @return the rule, or {@code null} if not found
     */
    public Rule rule(String name) {
        Rule result = rules.get(key(name));
        if (result == null && fallback != null)
            result = fallback.rule(name);
        return result;
    }

    /**
     * Determine whether this grammar itself defines a rule.
     * 
     * @param name the rule's name, in any case
     * 
     * @return {@code true} if the rule is defined here
     */
    public boolean defines(String name) {
        return rules.containsKey(key(name));
    }

    @Override
    public String toString() {
        return rules.values().toString();
    }
}
