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

package uk.ac.lancs.abnfregex.regex;

import java.util.Arrays;
import java.util.List;

/**
 * Represents a regular expression structurally. Elements form an
 * immutable tree; each element owns its children exclusively. Named
 * links between trees are expressed with {@link Reference}, and are
 * resolved separately.
 *
 * <p>
 * The set of element kinds is closed. Code that needs to distinguish
 * them supplies a {@link Cases} to {@link #match(Cases)}, or extends
 * one of {@link Transformer}, {@link Visitor} or {@link Convertor}.
 *
 * @author simpsons
 */
public abstract class Element {
    Element() {}

    /**
     * Handles each kind of element.
     *
     * @param <R> the result type
     */
    public interface Cases<R> {
        /**
         * Handle a literal.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R literal(Literal element);

        /**
         * Handle a range.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R range(Range element);

        /**
         * Handle a concatenation.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R concatenation(Concatenation element);

        /**
         * Handle an alternation.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R alternation(Alternation element);

        /**
         * Handle a repetition.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R repetition(Repetition element);

        /**
         * Handle a case-insensitive group.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R caseInsensitivity(CaseInsensitivity element);

        /**
         * Handle a character class.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R characterClass(CharacterClass element);

        /**
         * Handle a reference.
         *
         * @param element the element to handle
         *
         * @return the result of handling the element
         */
        R reference(Reference element);
    }

    /**
     * Invoke the handler for this element's kind.
     *
     * @param <R> the result type
     *
     * @param cases the handlers
     *
     * @return the result of the selected handler
     */
    public abstract <R> R match(Cases<R> cases);

    /**
     * Create an expression matching literal text.
     *
     * @param text the literal text to match
     *
     * @return an expression matching the literal text
     */
    public static Literal literal(CharSequence text) {
        return Literal.of(text);
    }

    /**
     * Create an expression matching a single code point from an
     * inclusive range.
     *
     * @param from the first code point
     *
     * @param to the last code point
     *
     * @return an expression matching any code point in the range
     */
    public static Range range(int from, int to) {
        return Range.of(from, to);
    }

    /**
     * Create a sequence of expressions.
     *
     * @param parts the expressions in order
     *
     * @return an expression matching each of the parts in turn
     */
    public static Concatenation sequence(Element... parts) {
        return Concatenation.of(Arrays.asList(parts));
    }

    /**
     * Create a choice of expressions.
     *
     * @param options the options in order
     *
     * @return an expression matching any of the options
     */
    public static Alternation choice(Element... options) {
        return Alternation.of(Arrays.asList(options));
    }

    /**
     * Create a character class.
     *
     * @param members the ranges and single-code-point literals
     *
     * @return an expression matching any of the members
     */
    public static CharacterClass chars(ClassMember... members) {
        return CharacterClass.of(Arrays.asList(members));
    }

    /**
     * Create a reference to a named expression.
     *
     * @param name the name of the referenced expression
     *
     * @return a reference to the named expression
     */
    public static Reference reference(String name) {
        return Reference.of(name);
    }

    static void appendAll(StringBuilder buf, String kind,
                          List<? extends Element> items) {
        buf.append(kind).append('(');
        String sep = "";
        for (Element item : items) {
            buf.append(sep).append(item);
            sep = ", ";
        }
        buf.append(')');
    }
}
