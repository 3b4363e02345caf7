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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.grammar.AbnfParser;
import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Range;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.regex.Repetition;

class ReferencingTranslatorTest {
    private static Map<String, Element> translate(String abnf)
        throws Exception {
        return new ReferencingTranslator(AbnfParser.parse(abnf))
            .translateRules();
    }

    @Test
    @DisplayName("Each rule is translated once, references left in place")
    void testReferencesKept() throws Exception {
        Map<String, Element> rules =
            translate("a = b \"!\"\nb = %s\"x\" / a\n");
        assertThat(rules.keySet()).containsExactly("a", "b");
        assertThat(rules.get("a"))
            .isEqualTo(Element.sequence(Reference.of("b"), Literal.of("!")));
        assertThat(rules.get("b"))
            .isEqualTo(Element.choice(Literal.of("x"), Reference.of("a")));
    }

    @Test
    void testReferenceUsesDeclaredName() throws Exception {
        Map<String, Element> rules = translate("a = PART\nPart = %s\"x\"\n");
        assertThat(rules.get("a")).isEqualTo(Reference.of("Part"));
    }

    @Test
    void testShortCircuits() throws Exception {
        Map<String, Element> rules =
            translate("a = CRLF SP wsp VCHAR DIGIT\n");
        assertThat(rules).hasSize(1);
        assertThat(rules.get("a"))
            .isEqualTo(Element
                .sequence(Literal.of("\r\n"), Literal.of(" "),
                          Element.chars(Literal.of(' '), Literal.of('\t')),
                          Range.of(0x21, 0x7e), Range.of('0', '9')));
        assertThat(ReferencingTranslator.isShortCircuited("crlf")).isTrue();
        assertThat(ReferencingTranslator.isShortCircuited("CHAR")).isFalse();
    }

    @Test
    @DisplayName("Core rules without a short form are pulled in once")
    void testCoreRulesPulledIn() throws Exception {
        Map<String, Element> rules = translate("a = CHAR OCTET CHAR\n");
        assertThat(rules.keySet()).containsExactly("a", "CHAR", "OCTET");
        assertThat(rules.get("a"))
            .isEqualTo(Element.sequence(Reference.of("CHAR"),
                                        Reference.of("OCTET"),
                                        Reference.of("CHAR")));
        assertThat(rules.get("CHAR")).isEqualTo(Range.of(0x01, 0x7f));
    }

    @Test
    void testCoreRuleDependenciesPulledIn() throws Exception {
        Map<String, Element> rules = translate("a = LWSP\n");
        assertThat(rules.keySet()).containsExactly("a", "LWSP");
        assertThat(rules.get("LWSP")).isEqualTo(Repetition
            .of(Element.choice(Element.chars(Literal.of(' '),
                                             Literal.of('\t')),
                               Element.sequence(Literal.of("\r\n"),
                                                Element.chars(Literal.of(' '),
                                                              Literal
                                                                  .of('\t')))),
                0, null));
    }

    @Test
    @DisplayName("Recursive grammars are accepted")
    void testRecursionAllowed() throws Exception {
        Map<String, Element> rules = translate("a = \"(\" [a] \")\"\n");
        assertThat(rules.get("a"))
            .isEqualTo(Element.sequence(Literal.of("("),
                                        Repetition
                                            .optional(Reference.of("a")),
                                        Literal.of(")")));
    }
}
