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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.regex.CaseInsensitivity;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.regex.Repetition;

class CompressionTest {
    private static Element ci(String text) {
        return CaseInsensitivity.of(Literal.of(text));
    }

    @Test
    void testNestedAlternationsFlattened() {
        Element nested =
            Element.choice(Element.choice(Literal.of("ab"), Literal.of("cd")),
                           Element.choice(Literal.of("ef")));
        assertThat(Compression.mergeNestedAlternations(nested))
            .isEqualTo(Element.choice(Literal.of("ab"), Literal.of("cd"),
                                      Literal.of("ef")));
    }

    @Test
    @DisplayName("Mixed alternations are not flattened")
    void testMixedAlternationsKept() {
        Element mixed =
            Element.choice(Element.choice(Literal.of("ab"), Literal.of("cd")),
                           Literal.of("ef"));
        assertThat(Compression.mergeNestedAlternations(mixed))
            .isEqualTo(mixed);
    }

    @Test
    @DisplayName("Nested alternations deep inside are flattened too")
    void testDeepNestedAlternations() {
        Element deep = Element.sequence(Literal.of("x"), Element
            .choice(Element.choice(Literal.of("ab")),
                    Element.choice(Literal.of("cd"))));
        assertThat(Compression.mergeNestedAlternations(deep))
            .isEqualTo(Element.sequence(Literal.of("x"), Element
                .choice(Literal.of("ab"), Literal.of("cd"))));
    }

    @Test
    void testSingleCodePointsMergedIntoClass() {
        Element choice = Element.choice(Literal.of("A"), Literal.of("B"),
                                        Range.of('0', '9'));
        assertThat(Compression.mergeCharacterClasses(choice))
            .isEqualTo(Element.chars(Literal.of('A'), Literal.of('B'),
                                     Range.of('0', '9')));
    }

    @Test
    @DisplayName("Only adjacent single code points are merged")
    void testClassMergingRespectsOrder() {
        Element choice =
            Element.choice(Literal.of("a"), Literal.of("b"), Literal.of("cd"),
                           Literal.of("e"), Element.chars(Literal.of('f'),
                                                          Literal.of('g')));
        assertThat(Compression.mergeCharacterClasses(choice))
            .isEqualTo(Element.choice(Element.chars(Literal.of('a'),
                                                    Literal.of('b')),
                                      Literal.of("cd"),
                                      Element.chars(Literal.of('e'),
                                                    Literal.of('f'),
                                                    Literal.of('g'))));
    }

    @Test
    void testLoneCodePointNotWrapped() {
        Element choice = Element.choice(Literal.of("a"), Literal.of("bc"));
        assertThat(Compression.mergeCharacterClasses(choice))
            .isEqualTo(choice);
    }

    @Test
    void testSingleLetterExpanded() {
        assertThat(Compression.expandSingleLetters(ci("a")))
            .isEqualTo(Element.chars(Literal.of('a'), Literal.of('A')));
        assertThat(Compression.expandSingleLetters(ci("Q")))
            .isEqualTo(Element.chars(Literal.of('q'), Literal.of('Q')));
    }

    @Test
    @DisplayName("A letter without case forms loses its wrapper")
    void testCaselessLetter() {
        assertThat(Compression.expandSingleLetters(ci("一")))
            .isEqualTo(Literal.of("一"));
    }

    @Test
    void testMultiLetterCaseInsensitivityKept() {
        assertThat(Compression.expandSingleLetters(ci("ab")))
            .isEqualTo(ci("ab"));
        Element range = CaseInsensitivity.of(Range.of('a', 'c'));
        assertThat(Compression.expandSingleLetters(range)).isEqualTo(range);
    }

    @Test
    @DisplayName("Case-insensitive letter choices become one class")
    void testCompressLetterChoice() {
        Element choice = Element.choice(ci("A"), ci("B"), ci("C"));
        assertThat(Compression.compress(choice))
            .isEqualTo(Element.chars(Literal.of('a'), Literal.of('A'),
                                     Literal.of('b'), Literal.of('B'),
                                     Literal.of('c'), Literal.of('C')));
    }

    @Test
    void testCompressCaseSensitiveChoice() {
        Element choice =
            Element.choice(Literal.of("A"), Literal.of("B"), Literal.of("C"));
        assertThat(Compression.compress(choice))
            .isEqualTo(Element.chars(Literal.of('A'), Literal.of('B'),
                                     Literal.of('C')));
    }

    @Test
    void testCompressIsIdempotent() {
        Element input = Repetition.of(Element
            .choice(Element.choice(ci("x"), Literal.of("-")),
                    Element.choice(Reference.of("digit"), ci("yz"))), 1,
                                      null);
        Element once = Compression.compress(input);
        assertThat(Compression.compress(once)).isEqualTo(once);
        assertThat(once).isEqualTo(Repetition.of(Element
            .choice(Element.chars(Literal.of('x'), Literal.of('X'),
                                  Literal.of('-')),
                    Reference.of("digit"), ci("yz")), 1, null));
    }

    @Test
    void testReferencesUntouched() {
        Element ref = Reference.of("rule");
        assertThat(Compression.compress(ref)).isSameAs(ref);
    }
}
