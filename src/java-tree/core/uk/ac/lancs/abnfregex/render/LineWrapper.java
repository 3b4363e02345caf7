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

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks token sequences into lines. Lines are broken only at
 * breakpoints, and each line takes as many unbreakable segments as fit.
 * 
 * @author simpsons
 */
public final class LineWrapper {
    private LineWrapper() {}

    /**
     * Split tokens at breakpoints. Breakpoints are discarded, and no
     * segment is empty.
     * 
     * @param tokens the tokens to split
     * 
     * @return the unbreakable segments
     */
    public static List<List<Token>> segments(List<Token> tokens) {
        List<List<Token>> result = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind == Token.Kind.BREAKPOINT) {
                if (!current.isEmpty()) {
                    result.add(current);
                    current = new ArrayList<>();
                }
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty()) result.add(current);
        return result;
    }

    /**
     * Get the total length of some tokens.
     * 
     * @param tokens the tokens
     * 
     * @return the sum of the tokens' lengths
     */
    public static int length(List<Token> tokens) {
        int total = 0;
        for (Token token : tokens)
            total += token.length();
        return total;
    }

    /**
     * Wrap tokens into lines. A segment longer than the width occupies
     * a line of its own.
     * 
     * @param tokens the tokens to wrap
     * 
     * @param width the line width to aim for
     * 
     * @return the tokens of each line, without breakpoints
     * 
     * @throws IllegalArgumentException if the width is not positive
     */
    public static List<List<Token>> wrap(List<Token> tokens, int width) {
        if (width <= 0)
            throw new IllegalArgumentException("width must be positive: "
                + width);
        List<List<Token>> lines = new ArrayList<>();
        List<Token> line = new ArrayList<>();
        int lineLength = 0;
        for (List<Token> segment : segments(tokens)) {
            int segLength = length(segment);
            if (lineLength + segLength > width && !line.isEmpty()) {
                lines.add(line);
                line = new ArrayList<>();
                lineLength = 0;
            }
            line.addAll(segment);
            lineLength += segLength;
        }
        if (!line.isEmpty()) lines.add(line);
        return lines;
    }
}
