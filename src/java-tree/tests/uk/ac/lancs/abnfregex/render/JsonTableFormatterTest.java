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

import java.util.LinkedHashMap;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.table.RuleTable;
import uk.ac.lancs.abnfregex.table.RuleTableAssembler;

class JsonTableFormatterTest {
    @Test
    void testDocument() throws Exception {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("greeting", Element.sequence(Literal.of("hi"),
                                               Reference.of("user-name")));
        rules.put("user-name", Literal.of("bob"));
        RuleTable table = RuleTableAssembler.assemble(rules);

        String text = new JsonTableFormatter().format(table);
        JSONObject doc = (JSONObject) new JSONParser().parse(text);

        JSONArray list = (JSONArray) doc.get("rules");
        assertThat(list).hasSize(2);
        JSONObject first = (JSONObject) list.get(0);
        assertThat(first.get("identifier")).isEqualTo("user_name");
        assertThat(first.get("name")).isEqualTo("user-name");
        assertThat(first.get("pattern")).isEqualTo("bob");
        JSONObject second = (JSONObject) list.get(1);
        assertThat(second.get("identifier")).isEqualTo("greeting");
        assertThat(second.get("pattern")).isEqualTo("hi{user_name}");

        JSONObject names = (JSONObject) doc.get("names");
        assertThat(names).hasSize(2).containsEntry("user-name", "user_name")
            .containsEntry("greeting", "greeting");
    }

    @Test
    void testBracesDoubled() {
        assertThat(JsonTableFormatter.template(TokenWriter.tokenize(Element
            .sequence(Literal.of("{"), Reference.of("x"),
                      Element.chars(Literal.of('}'))))))
                .isEqualTo("\\{{{x}[}}]");
    }
}
