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

package uk.ac.lancs.abnfregex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.regex.Pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.grammar.AbnfParser;
import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.render.JavaTableFormatter;
import uk.ac.lancs.abnfregex.render.TableLayout;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;
import uk.ac.lancs.abnfregex.table.RuleTable;

class TranslationTest {
    private static final String GREETING =
        "greeting = \"hello\" SP name\r\nname = 1*ALPHA\r\n";

    @Test
    void testFlatten() throws Exception {
        Grammar grammar = AbnfParser.parse(GREETING);
        String regex = Translation.flatten(grammar);
        assertThat(regex).isEqualTo("(?i:hello) [a-zA-Z]+");
        Pattern pattern = Pattern.compile(regex);
        assertThat(pattern.matcher("HeLLo World").matches()).isTrue();
        assertThat(pattern.matcher("hello  world").matches()).isFalse();
    }

    @Test
    @DisplayName("Letter choices compress into a character class")
    void testFlattenCompresses() throws Exception {
        Grammar grammar =
            AbnfParser.parse("a = \"x\" / \"y\" / \"1\" / DIGIT\n");
        assertThat(Translation.flatten(grammar)).isEqualTo("[xXyY10-9]");
    }

    @Test
    @DisplayName("Merged classes with overlapping ampersands still match")
    void testFlattenAmpersands() throws Exception {
        String regex =
            Translation.flatten(AbnfParser.parse("r = \"&\" / %x26-27\n"));
        assertThat(regex).doesNotContain("&&");
        Pattern pattern = Pattern.compile(regex);
        assertThat(pattern.matcher("&").matches()).isTrue();
        assertThat(pattern.matcher("'").matches()).isTrue();

        regex = Translation
            .flatten(AbnfParser.parse("r = %x21-26 / %x26-28\n"));
        assertThat(regex).doesNotContain("&&");
        pattern = Pattern.compile(regex);
        assertThat(pattern.matcher("&").matches()).isTrue();
        assertThat(pattern.matcher("(").matches()).isTrue();
        assertThat(pattern.matcher(")").matches()).isFalse();
    }

    @Test
    void testFlattenRejectsRecursion() throws Exception {
        Grammar grammar = AbnfParser.parse("list = \"x\" [\",\" list]\n");
        assertThatThrownBy(() -> Translation.flatten(grammar))
            .isInstanceOf(DependencyCycleException.class)
            .hasMessageContaining("list -> list");
    }

    @Test
    void testTable() throws Exception {
        RuleTable table = Translation.table(AbnfParser.parse(GREETING));
        assertThat(table.rules.keySet()).containsExactly("name", "greeting");
        assertThat(table.identifiers).containsEntry("greeting", "greeting");
    }

    @Test
    @DisplayName("Nested Java output defines rules before their users")
    void testRenderNested() throws Exception {
        String text =
            Translation.render(AbnfParser.parse(GREETING), Mode.NESTED,
                               new JavaTableFormatter(TableLayout.DEFAULT));
        assertThat(text)
            .isEqualTo("static final String name = \"[a-zA-Z]+\";\n"
                + "static final String greeting = \"(?i:hello) \" + name;");
    }

    @Test
    @DisplayName("The formatter is ignored for a single expression")
    void testRenderSingle() throws Exception {
        assertThat(Translation.render(AbnfParser.parse(GREETING),
                                      Mode.SINGLE_REGEXP, null))
                                          .isEqualTo("(?i:hello) [a-zA-Z]+");
    }

    @Test
    void testTableRejectsRecursion() throws Exception {
        Grammar grammar = AbnfParser.parse("list = \"x\" [\",\" list]\n");
        assertThatThrownBy(() -> Translation.table(grammar))
            .isInstanceOf(DependencyCycleException.class);
    }

    @Test
    void testModeLabels() {
        assertThat(Mode.forLabel("nested")).isEqualTo(Mode.NESTED);
        assertThat(Mode.forLabel("single-regexp"))
            .isEqualTo(Mode.SINGLE_REGEXP);
        assertThatThrownBy(() -> Mode.forLabel("tree"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
