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
import java.util.List;
import java.util.Locale;

import uk.ac.lancs.abnfregex.grammar.Choice;
import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.grammar.Node;
import uk.ac.lancs.abnfregex.grammar.Option;
import uk.ac.lancs.abnfregex.grammar.Repeat;
import uk.ac.lancs.abnfregex.grammar.Rule;
import uk.ac.lancs.abnfregex.grammar.RuleRef;
import uk.ac.lancs.abnfregex.grammar.Sequence;
import uk.ac.lancs.abnfregex.grammar.Terminal;
import uk.ac.lancs.abnfregex.regex.Alternation;
import uk.ac.lancs.abnfregex.regex.CaseInsensitivity;
import uk.ac.lancs.abnfregex.regex.Concatenation;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.LetterRanges;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Repetition;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;

/**
 * Translates grammar trees into regular-expression trees. Subclasses
 * decide what a rule reference becomes.
 * 
 * @author simpsons
 */
public abstract class GrammarTranslator {
    /**
     * The grammar whose rules are resolved by name
     */
    protected final Grammar grammar;

    /**
     * Create a translator.
     * 
     * @param grammar the grammar whose rules are resolved by name
     */
    protected GrammarTranslator(Grammar grammar) {
        if (grammar == null) throw new NullPointerException("grammar");
        this.grammar = grammar;
    }

    /**
     * Translate a grammar node.
     * 
     * @param node the node to translate
     * 
     * @return the equivalent regular expression
     * 
     * @throws DependencyCycleException if translation requires a rule
     * to contain itself
     * 
     * @throws UnsupportedGrammarException if the node is of an unknown
     * kind, or is malformed
     */
    public final Element translate(Node node) throws DependencyCycleException {
        Node.Kind kind = node.kind();
        if (kind != null) switch (kind) {
        case TERMINAL:
            if (node instanceof Terminal)
                return translateTerminal((Terminal) node);
            break;

        case SEQUENCE:
            if (node instanceof Sequence) {
                Sequence seq = (Sequence) node;
                return Concatenation.of(translateAll(seq.parts));
            }
            break;

        case CHOICE:
            if (node instanceof Choice) {
                Choice choice = (Choice) node;
                return Alternation.of(translateAll(choice.options));
            }
            break;

        case OPTION:
            if (node instanceof Option)
                return Repetition.optional(translate(((Option) node).body));
            break;

        case REPEAT:
            if (node instanceof Repeat) {
                Repeat rep = (Repeat) node;
                return Repetition.of(translate(rep.body), rep.min, rep.max);
            }
            break;

        case RULE:
            if (node instanceof RuleRef)
                return translateReference((RuleRef) node);
            break;
        }
        throw new UnsupportedGrammarException("unsupported grammar node: "
            + node.getClass().getName() + " of kind " + kind);
    }

    private List<Element> translateAll(List<Node> nodes)
        throws DependencyCycleException {
        List<Element> result = new ArrayList<>(nodes.size());
        for (Node node : nodes)
            result.add(translate(node));
        return result;
    }

    /**
     * Translate a terminal. Case-insensitivity is expressed only where
     * the terminal involves a letter.
     * 
     * @param terminal the terminal
     * 
     * @return the equivalent regular expression
     * 
     * @throws UnsupportedGrammarException if the terminal has neither
     * text nor a valid range
     */
    protected Element translateTerminal(Terminal terminal) {
        final Element result;
        final boolean lettered;
        if (terminal.text != null) {
            Literal lit = Literal.of(terminal.text);
            result = lit;
            lettered = LetterRanges.containsLetter(lit.value);
        } else if (Character.isValidCodePoint(terminal.start)
            && Character.isValidCodePoint(terminal.end)
            && terminal.start <= terminal.end) {
            result = Range.of(terminal.start, terminal.end);
            lettered = LetterRanges.overlaps(terminal.start, terminal.end);
        } else {
            throw new UnsupportedGrammarException("malformed terminal: "
                + terminal);
        }
        if (!terminal.caseSensitive && lettered)
            return CaseInsensitivity.of(result);
        return result;
    }

    /**
     * Translate a rule's definition.
     * 
     * @param rule the rule
     * 
     * @return the equivalent regular expression
     * 
     * @throws DependencyCycleException if translation requires a rule
     * to contain itself
     */
    public Element translateRule(Rule rule) throws DependencyCycleException {
        return translate(rule.definition);
    }

    /**
     * Translate a reference to a rule.
     * 
     * @param ref the reference
     * 
     * @return the equivalent regular expression
     * 
     * @throws DependencyCycleException if translation requires a rule
     * to contain itself
     */
    protected abstract Element translateReference(RuleRef ref)
        throws DependencyCycleException;

    /**
     * Resolve a referenced rule through the grammar.
     * 
     * @param name the rule's name
     * 
     * @return the rule
     * 
     * @throws UnsupportedGrammarException if the rule is not defined
     */
    protected final Rule resolve(String name) {
        Rule rule = grammar.rule(name);
        if (rule == null)
            throw new UnsupportedGrammarException("undefined rule: " + name);
        return rule;
    }

    /**
     * Normalize a rule name for case-insensitive comparison.
     * 
     * @param name the rule name
     * 
     * @return the name in upper case
     */
    protected static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
