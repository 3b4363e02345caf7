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

package uk.ac.lancs.abnfregex;

import java.util.LinkedHashMap;
import java.util.Map;

import uk.ac.lancs.abnfregex.compress.Compression;
import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.render.PatternRenderer;
import uk.ac.lancs.abnfregex.render.TableFormatter;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;
import uk.ac.lancs.abnfregex.table.RuleTable;
import uk.ac.lancs.abnfregex.table.RuleTableAssembler;
import uk.ac.lancs.abnfregex.translate.InliningTranslator;
import uk.ac.lancs.abnfregex.translate.ReferencingTranslator;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Translates grammars into regular expressions, combining translation,
 * compression, assembly and rendering.
 * 
 * @author simpsons
 */
public final class Translation {
    private Translation() {}

    @Detail(ShadowLevel.FINE)
    private interface Logger extends FormattedLogger {
        @Format("flattening grammar rooted at %s")
        void flattening(String root);

        @Format("tabulating %d rule(s)")
        void tabulating(int count);
    }

    private static final Logger logger =
        FormattedLogger.get(Translation.class.getName(), Logger.class);

    /**
     * Translate a grammar into a single compressed expression, rooted
     * at its first rule.
     * 
     * @param grammar the grammar
     * 
     * @return the compressed expression
     * 
     * @throws DependencyCycleException if a rule contains itself
     */
    public static Element flattenTree(Grammar grammar)
        throws DependencyCycleException {
        logger.flattening(grammar.root().name);
        Element tree = new InliningTranslator(grammar).translateRoot();
        return Compression.compress(tree);
    }

    /**
     * Translate a grammar into a single regular expression, rooted at
     * its first rule.
     * 
     * @param grammar the grammar
     * 
     * @return the regular expression
     * 
     * @throws DependencyCycleException if a rule contains itself
     */
    public static String flatten(Grammar grammar)
        throws DependencyCycleException {
        return PatternRenderer.render(flattenTree(grammar));
    }

    /**
     * Translate a grammar into a table of compressed expressions.
     * 
     * @param grammar the grammar
     * 
     * @return the table of rules
     * 
     * @throws DependencyCycleException if rules refer to each other
     * cyclically
     */
    public static RuleTable table(Grammar grammar)
        throws DependencyCycleException {
        Map<String, Element> rules = new LinkedHashMap<>();
        for (Map.Entry<String, Element> entry : new ReferencingTranslator(grammar)
            .translateRules().entrySet())
            rules.put(entry.getKey(), Compression.compress(entry.getValue()));
        logger.tabulating(rules.size());
        return RuleTableAssembler.assemble(rules);
    }

    /**
     * Translate a grammar into text.
     * 
     * @param grammar the grammar
     * 
     * @param mode the shape of the translation
     * 
     * @param formatter the formatter of rule tables, used only in
     * {@link Mode#NESTED} mode
     * 
     * @return the translated grammar
     * 
     * @throws DependencyCycleException if rules refer to each other
     * cyclically
     */
    public static String render(Grammar grammar, Mode mode,
                                TableFormatter formatter)
        throws DependencyCycleException {
        switch (mode) {
        case SINGLE_REGEXP:
            return flatten(grammar);
        case NESTED:
            return formatter.format(table(grammar));
        default:
            throw new AssertionError("unreachable");
        }
    }
}
