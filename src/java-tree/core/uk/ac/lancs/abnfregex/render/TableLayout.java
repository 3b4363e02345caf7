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

import uk.ac.lancs.config.Configuration;

/**
 * Specifies how rule tables are laid out as source text.
 * 
 * @author simpsons
 */
public final class TableLayout {
    /**
     * The line width aimed for
     */
    public final int width;

    /**
     * The indentation of continuation lines
     */
    public final int indent;

    /**
     * The modifiers and type preceding each identifier in generated
     * Java declarations
     */
    public final String declaration;

    /**
     * The default layout, with a width of 70, an indentation of 4, and
     * {@code static final String} declarations
     */
    public static final TableLayout DEFAULT =
        new TableLayout(70, 4, "static final String");

    /**
     * Create a layout.
     * 
     * @param width the line width aimed for
     * 
     * @param indent the indentation of continuation lines
     * 
     * @param declaration the modifiers and type preceding each
     * identifier
     * 
     * @throws IllegalArgumentException if the width is not positive, or
     * the indentation is negative
     */
    public TableLayout(int width, int indent, String declaration) {
        if (width <= 0)
            throw new IllegalArgumentException("width must be positive: "
                + width);
        if (indent < 0)
            throw new IllegalArgumentException("indent must not be negative: "
                + indent);
        if (declaration == null)
            throw new NullPointerException("declaration");
        this.width = width;
        this.indent = indent;
        this.declaration = declaration.trim();
    }

    /**
     * Get a layout from configuration. The keys <samp>width</samp>,
     * <samp>indent</samp> and <samp>declaration</samp> are recognized,
     * and default to those of {@link #DEFAULT}.
     * 
     * @param config the configuration
     * 
     * @return the configured layout
     */
    public static TableLayout from(Configuration config) {
        return new TableLayout(config.getInt("width", DEFAULT.width),
                               config.getInt("indent", DEFAULT.indent),
                               config.get("declaration",
                                          DEFAULT.declaration));
    }

    /**
     * Get the length of the text preceding a rule's expression on its
     * first line, namely the declaration, the identifier and the
     * assignment operator.
     * 
     * @param identifier the rule's identifier
     * 
     * @return the length of the rule's heading
     */
    public int headingLength(String identifier) {
        return declaration.length() + 1 + identifier.length() + 3;
    }

    /**
     * Get the width available to the continuation lines of a rule. The
     * rule's heading is deducted as well as the indentation, so that
     * the wrapped text lines up with a rule that fits. Lengths are
     * those of the pattern text, not of its quoted form.
     * 
     * @param identifier the rule's identifier
     * 
     * @return the available width, at least 1
     */
    public int wrapWidth(String identifier) {
        return Math.max(1, width - indent - headingLength(identifier));
    }

    /**
     * Determine whether a rule fits on one line after its heading.
     * 
     * @param identifier the rule's identifier
     * 
     * @param length the total length of the rule's tokens
     * 
     * @return {@code true} if the rule fits on one line
     */
    public boolean fits(String identifier, int length) {
        return headingLength(identifier) + length <= width;
    }

    /**
     * Get the indentation string.
     * 
     * @return a string of spaces
     */
    public String indentation() {
        StringBuilder result = new StringBuilder(indent);
        for (int i = 0; i < indent; i++)
            result.append(' ');
        return result.toString();
    }

    @Override
    public String toString() {
        return "width=" + width + ", indent=" + indent + ", declaration="
            + declaration;
    }
}
