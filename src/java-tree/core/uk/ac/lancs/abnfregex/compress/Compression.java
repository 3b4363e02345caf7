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

package uk.ac.lancs.abnfregex.compress;

import java.util.ArrayList;
import java.util.List;

import uk.ac.lancs.abnfregex.regex.Alternation;
import uk.ac.lancs.abnfregex.regex.CaseInsensitivity;
import uk.ac.lancs.abnfregex.regex.CharacterClass;
import uk.ac.lancs.abnfregex.regex.ClassMember;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.LetterRanges;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Transformer;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Rewrites expressions into equivalent but shorter forms.
 * 
 * @author simpsons
 */
public final class Compression {
    private Compression() {}

    @Detail(ShadowLevel.FINER)
    private interface Logger extends FormattedLogger {
        @Format("compression round %d changed %s")
        void changed(int round, Element result);
    }

    private static final Logger logger =
        FormattedLogger.get(Compression.class.getName(), Logger.class);

    private static final Transformer NESTED_ALTERNATIONS = new Transformer() {
        @Override
        protected Element transformAlternation(Alternation element) {
            List<Element> items = transformAll(element.items);
            List<Element> merged = new ArrayList<>();
            for (Element item : items) {
                if (!(item instanceof Alternation))
                    return Alternation.of(items);
                merged.addAll(((Alternation) item).items);
            }
            return Alternation.of(merged);
        }
    };

    private static final Transformer CHARACTER_CLASSES = new Transformer() {
        @Override
        protected Element transformAlternation(Alternation element) {
            List<Element> result = new ArrayList<>();
            List<ClassMember> group = new ArrayList<>();
            for (Element item : transformAll(element.items)) {
                if (item instanceof Literal && ((Literal) item).isSingle()) {
                    group.add((Literal) item);
                } else if (item instanceof Range) {
                    group.add((Range) item);
                } else if (item instanceof CharacterClass) {
                    group.addAll(((CharacterClass) item).items);
                } else {
                    flush(group, result);
                    result.add(item);
                }
            }
            flush(group, result);
            if (result.size() == 1) return result.get(0);
            return Alternation.of(result);
        }

        private void flush(List<ClassMember> group, List<Element> result) {
            switch (group.size()) {
            case 0:
                return;
            case 1:
                result.add(group.get(0).element());
                break;
            default:
                result.add(CharacterClass.of(group));
                break;
            }
            group.clear();
        }
    };

    private static final Transformer SINGLE_LETTERS = new Transformer() {
        @Override
        protected Element
            transformCaseInsensitivity(CaseInsensitivity element) {
            Element inner = transform(element.inner);
            if (inner instanceof Literal) {
                Literal lit = (Literal) inner;
                if (lit.isSingle() && LetterRanges.isLetter(lit.codePoint())) {
                    int lower = Character.toLowerCase(lit.codePoint());
                    int upper = Character.toUpperCase(lit.codePoint());
                    if (lower == upper) return lit;
                    return Element.chars(Literal.of(lower),
                                         Literal.of(upper));
                }
            }
            return CaseInsensitivity.of(inner);
        }
    };

    /**
     * Flatten alternations of alternations. An alternation is flattened
     * by one level only if all of its options are alternations.
     * 
     * @param element the expression to rewrite
     * 
     * @return the rewritten expression
     */
    public static Element mergeNestedAlternations(Element element) {
        return NESTED_ALTERNATIONS.transform(element);
    }

    /**
     * Merge adjacent single-code-point options of alternations into
     * character classes.
     * 
     * @param element the expression to rewrite
     * 
     * @return the rewritten expression
     */
    public static Element mergeCharacterClasses(Element element) {
        return CHARACTER_CLASSES.transform(element);
    }

    /**
     * Replace case-insensitive single letters with character classes
     * of their lower- and upper-case forms.
     * 
     * @param element the expression to rewrite
     * 
     * @return the rewritten expression
     */
    public static Element expandSingleLetters(Element element) {
        return SINGLE_LETTERS.transform(element);
    }

    /**
     * Apply all compressions until the expression no longer changes.
     * 
     * @param element the expression to compress
     * 
     * @return the compressed expression
     */
    public static Element compress(Element element) {
        for (int round = 1;; round++) {
            Element result = mergeNestedAlternations(element);
            result = mergeCharacterClasses(result);
            result = expandSingleLetters(result);
            if (result.equals(element)) return result;
            logger.changed(round, result);
            element = result;
        }
    }
}
