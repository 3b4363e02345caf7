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

import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.table.RuleTable;

/**
 * Formats rule tables as JSON documents. The document has a
 * <samp>rules</samp> array, holding an object for each rule in
 * dependency order, and a <samp>names</samp> object, mapping each
 * rule's original name to its identifier. Each rule object has the
 * rule's <samp>identifier</samp>, its original <samp>name</samp>, and
 * its <samp>pattern</samp>, in which each reference to another rule
 * appears as the rule's identifier in braces, and literal braces are
 * doubled.
 * 
 * @author simpsons
 */
public final class JsonTableFormatter implements TableFormatter {
    @Override
    public String format(RuleTable table) {
        return toJSON(table).toJSONString();
    }

    /**
     * Convert a rule table to JSON.
     * 
     * @param table the table to convert
     * 
     * @return the JSON representation of the table
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON(RuleTable table) {
        JSONArray rules = new JSONArray();
        for (Map.Entry<String, Element> entry : table.rules.entrySet()) {
            JSONObject rule = new JSONObject();
            rule.put("identifier", entry.getKey());
            rule.put("name", table.nameOf(entry.getKey()));
            rule.put("pattern",
                     template(TokenWriter.tokenize(entry.getValue())));
            rules.add(rule);
        }

        JSONObject names = new JSONObject();
        names.putAll(table.identifiers);

        JSONObject result = new JSONObject();
        result.put("rules", rules);
        result.put("names", names);
        return result;
    }

    /**
     * Express tokens as a template, with references as identifiers in
     * braces.
     * 
     * @param tokens the tokens to express
     * 
     * @return the template
     */
    public static String template(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            switch (token.kind) {
            case TEXT:
                out.append(token.value.replace("{", "{{").replace("}", "}}"));
                break;

            case REFERENCE:
                out.append('{').append(token.value).append('}');
                break;

            default:
                break;
            }
        }
        return out.toString();
    }
}
