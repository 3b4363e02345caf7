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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uk.ac.lancs.abnfregex.regex.Alternation;
import uk.ac.lancs.abnfregex.regex.CaseInsensitivity;
import uk.ac.lancs.abnfregex.regex.CharacterClass;
import uk.ac.lancs.abnfregex.regex.ClassMember;
import uk.ac.lancs.abnfregex.regex.Concatenation;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.regex.Repetition;
import uk.ac.lancs.abnfregex.regex.Visitor;

/**
 * Renders an expression as a sequence of tokens, marking where lines
 * may be broken and where other rules are referenced.
 * 
 * @author simpsons
 */
public final class TokenWriter extends Visitor {
    private final List<Token> tokens = new ArrayList<>();

    /**
     * Render an expression as tokens.
     * 
     * @param element the expression
     * 
     * @return the tokens
     */
    public static List<Token> tokenize(Element element) {
        TokenWriter writer = new TokenWriter();
        writer.visit(element);
        return writer.tokens();
    }

    /**
     * Get the tokens written so far.
     * 
     * @return an immutable copy of the tokens
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    private void text(String value) {
        tokens.add(Token.text(value));
    }

    @Override
    protected void visitConcatenation(Concatenation element) {
        boolean first = true;
        for (Element item : element.items) {
            if (!first) tokens.add(Token.BREAKPOINT);
            visit(item);
            first = false;
        }
    }

    @Override
    protected void visitAlternation(Alternation element) {
        text("(");
        boolean first = true;
        for (Element item : element.items) {
            if (!first) {
                text("|");
                tokens.add(Token.BREAKPOINT);
            }
            visit(item);
            first = false;
        }
        text(")");
    }

    @Override
    protected void visitRepetition(Repetition element) {
        boolean grouped = PatternRenderer.needsGroup(element.inner);
        if (grouped) text("(");
        visit(element.inner);
        String suffix = PatternRenderer.quantifier(element);
        text(grouped ? ")" + suffix : suffix);
    }

    @Override
    protected void visitCaseInsensitivity(CaseInsensitivity element) {
        text("(?i:");
        visit(element.inner);
        text(")");
    }

    @Override
    protected void visitLiteral(Literal element) {
        text(Escaping.literal(element.value));
    }

    @Override
    protected void visitRange(Range element) {
        StringBuilder buf = new StringBuilder("[");
        PatternRenderer.appendMember(buf, element, Escaping.CLASS_START);
        text(buf.append(']').toString());
    }

    @Override
    protected void visitCharacterClass(CharacterClass element) {
        text("[");
        int previous = Escaping.CLASS_START;
        for (ClassMember member : element.items) {
            if (previous != Escaping.CLASS_START)
                tokens.add(Token.BREAKPOINT);
            StringBuilder buf = new StringBuilder();
            previous = PatternRenderer.appendMember(buf, member, previous);
            text(buf.toString());
        }
        text("]");
    }

    @Override
    protected void visitReference(Reference element) {
        tokens.add(Token.reference(element.name));
    }
}
