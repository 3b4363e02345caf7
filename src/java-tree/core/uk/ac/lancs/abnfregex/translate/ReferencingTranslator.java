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

package uk.ac.lancs.abnfregex.translate;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.grammar.Rule;
import uk.ac.lancs.abnfregex.grammar.RuleRef;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Translates each rule of a grammar separately, leaving references to
 * other rules symbolic. References to the simpler core rules are
 * replaced by their expressions.
 * 
 * @author simpsons
 */
public final class ReferencingTranslator extends GrammarTranslator {
    @Detail(ShadowLevel.FINE)
    private interface Logger extends FormattedLogger {
        @Format("translated rule %s")
        void translated(String name);

        @Format("including core rule %s")
        void includingCore(String name);
    }

    private static final Logger logger = FormattedLogger
        .get(ReferencingTranslator.class.getName(), Logger.class);

    private static final Map<String, Element> SHORT_CIRCUITS;

    static {
        Map<String, Element> map = new HashMap<>();
        map.put("CR", Literal.of("\r"));
        map.put("LF", Literal.of("\n"));
        map.put("CRLF", Literal.of("\r\n"));
        map.put("HTAB", Literal.of("\t"));
        map.put("DQUOTE", Literal.of("\""));
        map.put("SP", Literal.of(" "));
        map.put("WSP", Element.chars(Literal.of(' '), Literal.of('\t')));
        map.put("VCHAR", Range.of(0x21, 0x7e));
        map.put("ALPHA", Element.chars(Range.of('a', 'z'),
                                       Range.of('A', 'Z')));
        map.put("DIGIT", Range.of('0', '9'));
        map.put("HEXDIG", Element.chars(Range.of('0', '9'),
                                        Range.of('A', 'F'),
                                        Range.of('a', 'f')));
        map.put("BIT", Element.chars(Literal.of('0'), Literal.of('1')));
        SHORT_CIRCUITS = Collections.unmodifiableMap(map);
    }

    private final Deque<Rule> pending = new ArrayDeque<>();

    private final Set<String> included = new HashSet<>();

    /**
     * Create a translator for a grammar.
     * 
     * @param grammar the grammar whose rules are translated
     */
    public ReferencingTranslator(Grammar grammar) {
        super(grammar);
    }

    /**
     * Determine whether references to a rule are replaced by a fixed
     * expression.
     * 
     * @param name the rule's name, in any case
     * 
     * @return {@code true} if the rule is short-circuited
     */
    public static boolean isShortCircuited(String name) {
        return SHORT_CIRCUITS.containsKey(upper(name));
    }

    /**
     * Translate every rule of the grammar, in definition order,
     * followed by any rules that they refer to but the grammar does not
     * define itself.
     * 
     * @return a map from each rule's name to its translation
     */
    public Map<String, Element> translateRules() {
        Map<String, Element> result = new LinkedHashMap<>();
        pending.addAll(grammar.rules());
        while (!pending.isEmpty()) {
            Rule rule = pending.removeFirst();
            if (result.containsKey(rule.name)) continue;
            try {
                result.put(rule.name, translateRule(rule));
            } catch (DependencyCycleException ex) {
                throw new AssertionError("unreachable", ex);
            }
            logger.translated(rule.name);
        }
        return result;
    }

    @Override
    protected Element translateReference(RuleRef ref) {
        Element shortCircuit = SHORT_CIRCUITS.get(upper(ref.name));
        if (shortCircuit != null) return shortCircuit;
        Rule rule = resolve(ref.name);
        if (!grammar.defines(rule.name) && included.add(upper(rule.name))) {
            logger.includingCore(rule.name);
            pending.addLast(rule);
        }
        return Reference.of(rule.name);
    }
}
