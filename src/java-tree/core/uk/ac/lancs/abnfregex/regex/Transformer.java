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

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites expression trees. By default, each container is rebuilt
 * from its independently rewritten children, and leaves are returned
 * unchanged, so the default transformation yields an equal tree.
 * Override the handlers of specific kinds to implement a rewrite.
 * 
 * @author simpsons
 */
public class Transformer {
    private final Element.Cases<Element> dispatch =
        new Element.Cases<Element>() {
            @Override
            public Element literal(Literal element) {
                return transformLiteral(element);
            }

            @Override
            public Element range(Range element) {
                return transformRange(element);
            }

            @Override
            public Element concatenation(Concatenation element) {
                return transformConcatenation(element);
            }

            @Override
            public Element alternation(Alternation element) {
                return transformAlternation(element);
            }

            @Override
            public Element repetition(Repetition element) {
                return transformRepetition(element);
            }

            @Override
            public Element caseInsensitivity(CaseInsensitivity element) {
                return transformCaseInsensitivity(element);
            }

            @Override
            public Element characterClass(CharacterClass element) {
                return transformCharacterClass(element);
            }

            @Override
            public Element reference(Reference element) {
                return transformReference(element);
            }
        };

    /**
     * Rewrite an expression.
     * 
     * @param element the expression to rewrite
     * 
     * @return the rewritten expression
     */
    public final Element transform(Element element) {
        return element.match(dispatch);
    }

    /**
     * Rewrite each of a list of expressions, in order.
     * 
     * @param elements the expressions to rewrite
     * 
     * @return the rewritten expressions
     */
    protected final List<Element> transformAll(List<Element> elements) {
        List<Element> result = new ArrayList<>(elements.size());
        for (Element element : elements)
            result.add(transform(element));
        return result;
    }

    protected Element transformConcatenation(Concatenation element) {
        return Concatenation.of(transformAll(element.items));
    }

    protected Element transformAlternation(Alternation element) {
        return Alternation.of(transformAll(element.items));
    }

    protected Element transformRepetition(Repetition element) {
        return element.withInner(transform(element.inner));
    }

    protected Element transformCaseInsensitivity(CaseInsensitivity element) {
        return CaseInsensitivity.of(transform(element.inner));
    }

    protected Element transformLiteral(Literal element) {
        return element;
    }

    protected Element transformRange(Range element) {
        return element;
    }

    protected Element transformCharacterClass(CharacterClass element) {
        return element;
    }

    protected Element transformReference(Reference element) {
        return element;
    }
}
