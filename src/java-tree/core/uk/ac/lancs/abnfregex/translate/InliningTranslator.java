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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.grammar.Rule;
import uk.ac.lancs.abnfregex.grammar.RuleRef;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Translates a grammar into a single self-contained expression, by
 * inlining every referenced rule. Some core rules are replaced by
 * compact character classes.
 * 
 * @author simpsons
 */
public final class InliningTranslator extends GrammarTranslator {
    @Detail(ShadowLevel.FINER)
    private interface Logger extends FormattedLogger {
        @Format("inlining %s at depth %d")
        void inlining(String name, int depth);

        @Detail(ShadowLevel.WARNING)
        @Format("rule %s contains itself")
        void recursive(String name);
    }

    private static final Logger logger = FormattedLogger
        .get(InliningTranslator.class.getName(), Logger.class);

    private static final Map<String, Element> SPECIALS;

    static {
        Map<String, Element> map = new HashMap<>();
        map.put("ALPHA", Element.chars(Range.of('a', 'z'),
                                       Range.of('A', 'Z')));
        map.put("DIGIT", Range.of('0', '9'));
        map.put("HEXDIG", Element.chars(Range.of('0', '9'),
                                        Range.of('A', 'F'),
                                        Range.of('a', 'f')));
        map.put("BIT", Element.chars(Literal.of('0'), Literal.of('1')));
        map.put("DQUOTE", Literal.of('"'));
        SPECIALS = Collections.unmodifiableMap(map);
    }

    private final List<String> inProgress = new ArrayList<>();

    /**
     * Create a translator for a grammar.
     * 
     * @param grammar the grammar whose rules are inlined
     */
    public InliningTranslator(Grammar grammar) {
        super(grammar);
    }

    /**
     * Translate the grammar's first rule.
     * 
     * @return an expression matching the grammar's root rule
     * 
     * @throws DependencyCycleException if a rule contains itself
     */
    public Element translateRoot() throws DependencyCycleException {
        return translateRule(grammar.root());
    }

    @Override
    public Element translateRule(Rule rule) throws DependencyCycleException {
        Element special = SPECIALS.get(upper(rule.name));
        if (special != null) return special;

        for (int i = 0; i < inProgress.size(); i++) {
            if (!inProgress.get(i).equalsIgnoreCase(rule.name)) continue;
            List<String> cycle =
                new ArrayList<>(inProgress.subList(i, inProgress.size()));
            cycle.add(rule.name);
            logger.recursive(rule.name);
            throw new DependencyCycleException(rule.name, cycle);
        }

        logger.inlining(rule.name, inProgress.size());
        inProgress.add(rule.name);
        try {
            return translate(rule.definition);
        } finally {
            inProgress.remove(inProgress.size() - 1);
        }
    }

    @Override
    protected Element translateReference(RuleRef ref)
        throws DependencyCycleException {
        return translateRule(resolve(ref.name));
    }
}
