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

/**
 * Walks expression trees without changing them, depth-first and left
 * to right. By default, containers visit their children, and leaves do
 * nothing.
 * 
 * @author simpsons
 */
public class Visitor {
    private final Element.Cases<Void> dispatch = new Element.Cases<Void>() {
        @Override
        public Void literal(Literal element) {
            visitLiteral(element);
            return null;
        }

        @Override
        public Void range(Range element) {
            visitRange(element);
            return null;
        }

        @Override
        public Void concatenation(Concatenation element) {
            visitConcatenation(element);
            return null;
        }

        @Override
        public Void alternation(Alternation element) {
            visitAlternation(element);
            return null;
        }

        @Override
        public Void repetition(Repetition element) {
            visitRepetition(element);
            return null;
        }

        @Override
        public Void caseInsensitivity(CaseInsensitivity element) {
            visitCaseInsensitivity(element);
            return null;
        }

        @Override
        public Void characterClass(CharacterClass element) {
            visitCharacterClass(element);
            return null;
        }

        @Override
        public Void reference(Reference element) {
            visitReference(element);
            return null;
        }
    };

    /**
     * Visit an expression.
     * 
     * @param element the expression to visit
     */
    public final void visit(Element element) {
        element.match(dispatch);
    }

    protected void visitConcatenation(Concatenation element) {
        for (Element item : element.items)
            visit(item);
    }

    protected void visitAlternation(Alternation element) {
        for (Element item : element.items)
            visit(item);
    }

    protected void visitRepetition(Repetition element) {
        visit(element.inner);
    }

    protected void visitCaseInsensitivity(CaseInsensitivity element) {
        visit(element.inner);
    }

    protected void visitLiteral(Literal element) {}

    protected void visitRange(Range element) {}

    protected void visitCharacterClass(CharacterClass element) {}

    protected void visitReference(Reference element) {}
}
