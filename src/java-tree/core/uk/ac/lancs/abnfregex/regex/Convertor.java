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
 * Folds expression trees into values. Each kind has its own handler,
 * which usually converts its children by calling
 * {@link #convert(Element)}. References cannot be converted unless
 * {@link #convertReference(Reference)} is overridden.
 * 
 * @param <T> the type of value an expression is converted to
 * 
 * @author simpsons
 */
public abstract class Convertor<T> {
    private final Element.Cases<T> dispatch = new Element.Cases<T>() {
        @Override
        public T literal(Literal element) {
            return convertLiteral(element);
        }

        @Override
        public T range(Range element) {
            return convertRange(element);
        }

        @Override
        public T concatenation(Concatenation element) {
            return convertConcatenation(element);
        }

        @Override
        public T alternation(Alternation element) {
            return convertAlternation(element);
        }

        @Override
        public T repetition(Repetition element) {
            return convertRepetition(element);
        }

        @Override
        public T caseInsensitivity(CaseInsensitivity element) {
            return convertCaseInsensitivity(element);
        }

        @Override
        public T characterClass(CharacterClass element) {
            return convertCharacterClass(element);
        }

        @Override
        public T reference(Reference element) {
            return convertReference(element);
        }
    };

    /**
     * Convert an expression.
     * 
     * @param element the expression to convert
     * 
     * @return the converted value
     */
    public final T convert(Element element) {
        return element.match(dispatch);
    }

    protected abstract T convertConcatenation(Concatenation element);

    protected abstract T convertAlternation(Alternation element);

    protected abstract T convertRepetition(Repetition element);

    protected abstract T convertCaseInsensitivity(CaseInsensitivity element);

    protected abstract T convertLiteral(Literal element);

    protected abstract T convertRange(Range element);

    protected abstract T convertCharacterClass(CharacterClass element);

    /**
     * Convert a reference. This implementation always fails, as most
     * conversions require self-contained expressions.
     * 
     * @param element the reference
     * 
     * @return never
     * 
     * @throws IllegalStateException always
     */
    protected T convertReference(Reference element) {
        throw new IllegalStateException("unexpected reference to "
            + element.name + "; references must be resolved first");
    }
}
