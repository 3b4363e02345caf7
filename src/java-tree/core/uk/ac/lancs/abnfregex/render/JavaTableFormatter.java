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

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.table.RuleTable;

/**
 * Formats rule tables as Java declarations of string constants. Each
 * rule's constant concatenates its own text with the constants of the
 * rules it references.
 * 
 * @author simpsons
 */
public final class JavaTableFormatter implements TableFormatter {
    private final TableLayout layout;

    /**
     * Create a formatter.
     * 
     * @param layout the layout of the declarations
     */
    public JavaTableFormatter(TableLayout layout) {
        this.layout = layout;
    }

    @Override
    public String format(RuleTable table) {
        StringBuilder out = new StringBuilder();
        String sep = "";
        for (Map.Entry<String, Element> entry : table.rules.entrySet()) {
            out.append(sep);
            sep = "\n";
            String id = entry.getKey();
            List<Token> tokens = TokenWriter.tokenize(entry.getValue());
            out.append(layout.declaration).append(' ').append(id)
                .append(" = ");
            if (layout.fits(id, LineWrapper.length(tokens))) {
                out.append(expression(tokens)).append(';');
                continue;
            }
            out.append("(\n");
            String indentation = layout.indentation();
            String prefix = "";
            for (List<Token> line : LineWrapper
                .wrap(tokens, layout.wrapWidth(id))) {
                out.append(indentation).append(prefix)
                    .append(expression(line)).append('\n');
                prefix = "+ ";
            }
            out.append(");");
        }
        return out.toString();
    }

    /**
     * Express tokens as a Java string expression. Adjacent text is
     * merged into a single literal, and references become the names of
     * the referenced constants.
     * 
     * @param tokens the tokens to express
     * 
     * @return the Java expression
     */
    public static String expression(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        StringBuilder text = null;
        String sep = "";
        for (Token token : tokens) {
            switch (token.kind) {
            case TEXT:
                if (text == null) text = new StringBuilder();
                text.append(token.value);
                break;

            case REFERENCE:
                if (text != null) {
                    out.append(sep).append(quote(text));
                    sep = " + ";
                    text = null;
                }
                out.append(sep).append(token.value);
                sep = " + ";
                break;

            default:
                break;
            }
        }
        if (text != null) out.append(sep).append(quote(text));
        if (out.length() == 0) return "\"\"";
        return out.toString();
    }

    /**
     * Quote text as a Java string literal. Only backslashes and double
     * quotes are escaped, as rendered patterns are printable ASCII.
     * 
     * @param text the text to quote
     * 
     * @return the string literal
     */
    public static String quote(CharSequence text) {
        StringBuilder out = new StringBuilder(text.length() + 2);
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '\\':
            case '"':
                out.append('\\').append(c);
                break;
            default:
                out.append(c);
                break;
            }
        }
        return out.append('"').toString();
    }
}
