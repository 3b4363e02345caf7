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

package uk.ac.lancs.abnfregex.render;

import uk.ac.lancs.abnfregex.regex.Alternation;
import uk.ac.lancs.abnfregex.regex.CaseInsensitivity;
import uk.ac.lancs.abnfregex.regex.CharacterClass;
import uk.ac.lancs.abnfregex.regex.ClassMember;
import uk.ac.lancs.abnfregex.regex.Concatenation;
import uk.ac.lancs.abnfregex.regex.Convertor;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Repetition;

/**
 * Renders self-contained expressions as regular-expression text.
 * 
 * @author simpsons
 */
public final class PatternRenderer extends Convertor<String> {
    /**
     * Render an expression.
     * 
     * @param element the expression
     * 
     * @return the expression's text
     * 
     * @throws IllegalStateException if the expression contains a
     * reference
     */
    public static String render(Element element) {
        return new PatternRenderer().convert(element);
    }

    /**
     * Get the quantifier expressing a repetition's bounds.
     * 
     * @param rep the repetition
     * 
     * @return the quantifier
     */
    public static String quantifier(Repetition rep) {
        final int min = rep.minimum();
        final Integer max = rep.max;
        if (max == null) {
            if (min == 0) return "*";
            if (min == 1) return "+";
            return "{" + min + ",}";
        }
        if (min == 0 && max == 1) return "?";
        if (min == max) return "{" + min + "}";
        return "{" + min + "," + max + "}";
    }

    /**
     * Determine whether the inner expression of a repetition must be
     * parenthesized.
     * 
     * @param inner the repeated expression
     * 
     * @return {@code true} if parentheses are required
     */
    public static boolean needsGroup(Element inner) {
        return !(inner instanceof Alternation) && !(inner instanceof Range)
            && !(inner instanceof CharacterClass);
    }

    /**
     * Append a class member.
     * 
     * @param out the destination
     * 
     * @param member the member to append
     * 
     * @param previous the last code point of the preceding member, or
     * {@link Escaping#CLASS_START} if there is none
     * 
     * @return the last code point of this member
     */
    static int appendMember(StringBuilder out, ClassMember member,
                            int previous) {
        if (member instanceof Range) {
            Range range = (Range) member;
            Escaping.appendClassMember(out, range.start, previous);
            out.append('-');
            Escaping.appendClassMember(out, range.end, '-');
            return range.end;
        }
        int cp = member.first();
        Escaping.appendClassMember(out, cp, previous);
        return cp;
    }

    @Override
    protected String convertConcatenation(Concatenation element) {
        StringBuilder result = new StringBuilder();
        for (Element item : element.items)
            result.append(convert(item));
        return result.toString();
    }

    @Override
    protected String convertAlternation(Alternation element) {
        StringBuilder result = new StringBuilder("(");
        String sep = "";
        for (Element item : element.items) {
            result.append(sep).append(convert(item));
            sep = "|";
        }
        return result.append(')').toString();
    }

    @Override
    protected String convertRepetition(Repetition element) {
        String inner = convert(element.inner);
        if (needsGroup(element.inner)) inner = "(" + inner + ")";
        return inner + quantifier(element);
    }

    @Override
    protected String convertCaseInsensitivity(CaseInsensitivity element) {
        return "(?i:" + convert(element.inner) + ")";
    }

    @Override
    protected String convertLiteral(Literal element) {
        return Escaping.literal(element.value);
    }

    @Override
    protected String convertRange(Range element) {
        StringBuilder result = new StringBuilder("[");
        appendMember(result, element, Escaping.CLASS_START);
        return result.append(']').toString();
    }

    @Override
    protected String convertCharacterClass(CharacterClass element) {
        StringBuilder result = new StringBuilder("[");
        int previous = Escaping.CLASS_START;
        for (ClassMember member : element.items)
            previous = appendMember(result, member, previous);
        return result.append(']').toString();
    }
}
