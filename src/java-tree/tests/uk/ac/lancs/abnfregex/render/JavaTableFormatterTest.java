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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.table.RuleTable;
import uk.ac.lancs.abnfregex.table.RuleTableAssembler;

class JavaTableFormatterTest {
    @Test
    @DisplayName("Short rules fit on one line, in dependency order")
    void testShortForm() throws Exception {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("greeting",
                  Element.sequence(Literal.of("hi "), Reference.of("name"),
                                   Literal.of("!")));
        rules.put("name", Literal.of("bob"));
        RuleTable table = RuleTableAssembler.assemble(rules);
        String text = new JavaTableFormatter(TableLayout.DEFAULT)
            .format(table);
        assertThat(text).isEqualTo("static final String name = \"bob\";\n"
            + "static final String greeting = \"hi \" + name + \"!\";");
    }

    @Test
    @DisplayName("Long rules are wrapped at breakpoints and concatenated")
    void testLongForm() throws Exception {
        RuleTable table = RuleTableAssembler.assemble(Collections
            .singletonMap("r", Element.sequence(Literal.of("abcdefgh"),
                                                Literal.of("ijklmnop"),
                                                Literal.of("qrstuvwx"))));
        String text = new JavaTableFormatter(new TableLayout(27, 2, "String"))
            .format(table);
        assertThat(text).isEqualTo("String r = (\n" + "  \"abcdefgh\"\n"
            + "  + \"ijklmnop\"\n" + "  + \"qrstuvwx\"\n" + ");");
    }

    @Test
    @DisplayName("The declaration counts towards the width of a one-line rule")
    void testDeclarationCountsTowardsWidth() throws Exception {
        String half = "abcdefghijklmnopqrstuvwx";
        RuleTable table = RuleTableAssembler.assemble(Collections
            .singletonMap("r", Element.sequence(Literal.of(half),
                                                Literal.of(half))));
        String text = new JavaTableFormatter(TableLayout.DEFAULT)
            .format(table);
        assertThat(text).isEqualTo("static final String r = (\n"
            + "    \"" + half + "\"\n" + "    + \"" + half + "\"\n" + ");");
        for (String line : text.split("\n"))
            assertThat(line.length()).isLessThanOrEqualTo(70);
    }

    @Test
    void testQuote() {
        assertThat(JavaTableFormatter.quote("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
    }

    @Test
    void testEmptyExpression() {
        assertThat(JavaTableFormatter.expression(Collections.emptyList()))
            .isEqualTo("\"\"");
    }

    @Test
    @DisplayName("Regex escapes survive as Java string content")
    void testEscapedPatternQuoted() {
        assertThat(JavaTableFormatter
            .expression(TokenWriter.tokenize(Literal.of("a.b"))))
                .isEqualTo("\"a\\\\.b\"");
    }
}
