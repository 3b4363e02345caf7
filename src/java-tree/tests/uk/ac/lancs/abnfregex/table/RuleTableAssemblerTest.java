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

package uk.ac.lancs.abnfregex.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Literal;
import uk.ac.lancs.abnfregex.regex.Reference;

class RuleTableAssemblerTest {
    @Test
    @DisplayName("Identifiers are lower-case, safe and distinct")
    void testIdentify() {
        Map<String, String> ids = RuleTableAssembler
            .identify(Arrays.asList("rule-name", "a", "A", "class", "a1",
                                    "_"));
        assertThat(ids).containsEntry("rule-name", "rule_name")
            .containsEntry("a", "a").containsEntry("A", "a1")
            .containsEntry("class", "class1").containsEntry("a1", "a11")
            .containsEntry("_", "_1");
        assertThat(ids.keySet()).containsExactly("rule-name", "a", "A",
                                                 "class", "a1", "_");
    }

    @Test
    void testReferencesInOrderOfFirstUse() {
        Element expr = Element.sequence(Reference.of("b"), Element
            .choice(Reference.of("a"), Reference.of("b")), Literal.of("x"));
        assertThat(RuleTableAssembler.references(expr))
            .containsExactly("b", "a");
    }

    @Test
    @DisplayName("Rules follow the rules they reference")
    void testDependencyOrder() throws Exception {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("z", Reference.of("b"));
        rules.put("b", Element.sequence(Reference.of("c-d"), Literal.of("!")));
        rules.put("c-d", Literal.of("x"));
        rules.put("y", Literal.of("y"));
        RuleTable table = RuleTableAssembler.assemble(rules);
        assertThat(table.rules.keySet()).containsExactly("c_d", "b", "y",
                                                         "z");
        assertThat(table.rules.get("b"))
            .isEqualTo(Element.sequence(Reference.of("c_d"),
                                        Literal.of("!")));
        assertThat(table.identifiers.keySet()).containsExactly("z", "b",
                                                               "c-d", "y");
        assertThat(table.nameOf("c_d")).isEqualTo("c-d");
        assertThat(table.nameOf("nope")).isNull();
    }

    @Test
    void testCycleReported() {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("a", Reference.of("b"));
        rules.put("b", Element.choice(Literal.of("x"), Reference.of("a")));
        DependencyCycleException ex =
            catchThrowableOfType(() -> RuleTableAssembler.assemble(rules),
                                 DependencyCycleException.class);
        assertThat(ex).isNotNull();
        assertThat(ex.getRuleName()).isEqualTo("a");
        assertThat(ex.getCycle()).containsExactly("a", "b", "a");
    }

    @Test
    @DisplayName("Cycles are reported with original rule names")
    void testCycleUsesOriginalNames() {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("Self-Ref", Element.sequence(Literal.of("("),
                                               Reference.of("Self-Ref")));
        DependencyCycleException ex =
            catchThrowableOfType(() -> RuleTableAssembler.assemble(rules),
                                 DependencyCycleException.class);
        assertThat(ex).isNotNull();
        assertThat(ex.getCycle()).containsExactly("Self-Ref", "Self-Ref");
    }

    @Test
    void testUnmappedReferenceRejected() {
        Map<String, Element> rules = new LinkedHashMap<>();
        rules.put("a", Reference.of("missing"));
        assertThatThrownBy(() -> RuleTableAssembler.assemble(rules))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing");
    }
}
