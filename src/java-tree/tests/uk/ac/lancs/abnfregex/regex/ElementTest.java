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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class ElementTest {
    @Test
    void testInvariantsEnforced() {
        assertThatThrownBy(() -> Range.of('b', 'a'))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Range.of(-1, 'a'))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Range.of(0, 0x110000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Repetition.of(Literal.of("a"), 3, 2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Repetition.of(Literal.of("a"), -1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Element.chars(Literal.of("ab")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Reference.of(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testValueEquality() {
        Element a = Element.sequence(Literal.of("x"),
                                     Element.choice(Range.of('0', '9'),
                                                    Reference.of("r")));
        Element b = Element.sequence(Literal.of("x"),
                                     Element.choice(Range.of('0', '9'),
                                                    Reference.of("r")));
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(Element.sequence(Literal.of("x")))
            .isNotEqualTo(Element.choice(Literal.of("x")));
        assertThat(Repetition.of(Literal.of("x"), null, 1))
            .isNotEqualTo(Repetition.of(Literal.of("x"), 0, 1));
    }

    @Test
    void testItemsAreCopied() {
        List<Element> items = new ArrayList<>();
        items.add(Literal.of("a"));
        Concatenation seq = Concatenation.of(items);
        items.add(Literal.of("b"));
        assertThat(seq.items).hasSize(1);
        assertThatThrownBy(() -> seq.items.add(Literal.of("c")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testSupplementaryLiteralIsSingle() {
        Literal lit = Literal.of(0x1F600);
        assertThat(lit.isSingle()).isTrue();
        assertThat(lit.codePoint()).isEqualTo(0x1F600);
        assertThat(Element.chars(lit, Range.of('a', 'b')).items).hasSize(2);
    }

    @Test
    void testDefaultTransformerRebuildsEqualTree() {
        Element tree = Element
            .sequence(CaseInsensitivity.of(Literal.of("abc")),
                      Repetition.of(Element.choice(Literal.of("x"),
                                                   Reference.of("y")),
                                    2, null),
                      Element.chars(Literal.of('-'), Range.of('a', 'f')));
        assertThat(new Transformer().transform(tree)).isEqualTo(tree);
    }

    @Test
    void testTransformerRewritesLeaves() {
        Transformer upper = new Transformer() {
            @Override
            protected Element transformLiteral(Literal element) {
                return Literal.of(element.value.toUpperCase());
            }
        };
        Element tree = Element.choice(Literal.of("a"), Element
            .sequence(Literal.of("b"), Repetition.optional(Literal.of("c"))));
        assertThat(upper.transform(tree))
            .isEqualTo(Element.choice(Literal.of("A"), Element
                .sequence(Literal.of("B"),
                          Repetition.optional(Literal.of("C")))));
    }

    @Test
    void testVisitorWalksDepthFirstLeftToRight() {
        List<String> seen = new ArrayList<>();
        new Visitor() {
            @Override
            protected void visitLiteral(Literal element) {
                seen.add(element.value);
            }

            @Override
            protected void visitReference(Reference element) {
                seen.add("@" + element.name);
            }
        }.visit(Element.sequence(Literal.of("a"), Element
            .choice(Reference.of("b"), CaseInsensitivity.of(Literal.of("c"))),
                                 Repetition.of(Literal.of("d"), 1, 2)));
        assertThat(seen).isEqualTo(Arrays.asList("a", "@b", "c", "d"));
    }

    @Test
    void testConvertorRejectsReferences() {
        Convertor<Integer> counter = new Convertor<Integer>() {
            @Override
            protected Integer convertConcatenation(Concatenation element) {
                return element.items.size();
            }

            @Override
            protected Integer convertAlternation(Alternation element) {
                return element.items.size();
            }

            @Override
            protected Integer convertRepetition(Repetition element) {
                return convert(element.inner);
            }

            @Override
            protected Integer
                convertCaseInsensitivity(CaseInsensitivity element) {
                return convert(element.inner);
            }

            @Override
            protected Integer convertLiteral(Literal element) {
                return element.length();
            }

            @Override
            protected Integer convertRange(Range element) {
                return 1;
            }

            @Override
            protected Integer convertCharacterClass(CharacterClass element) {
                return 1;
            }
        };
        assertThat(counter.convert(Literal.of("abc"))).isEqualTo(3);
        assertThatThrownBy(() -> counter.convert(Reference.of("x")))
            .isInstanceOf(IllegalStateException.class);
    }
}
