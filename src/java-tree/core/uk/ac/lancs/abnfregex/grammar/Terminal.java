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

package uk.ac.lancs.abnfregex.grammar;

/**
 * Matches literal text or a single code point from a range. A terminal
 * carries exactly one of these payloads.
 * 
 * @author simpsons
 */
public final class Terminal extends Node {
    /**
     * The literal text, or {@code null} if this is a range
     */
    public final String text;

    /**
     * The first code point of the range, or {@code -1} if this is
     * literal text
     */
    public final int start;

    /**
     * The last code point of the range, or {@code -1} if this is
     * literal text
     */
    public final int end;

    /**
     * Whether the payload is to be matched with regard to case
     */
    public final boolean caseSensitive;

    Terminal(String text, int start, int end, boolean caseSensitive) {
        this.text = text;
        this.start = start;
        this.end = end;
        this.caseSensitive = caseSensitive;
    }

    /**
     * Create a terminal matching literal text.
     * 
     * @param text the text to match
     * 
     * @param caseSensitive {@code true} if case is significant
     * 
     * @return the requested terminal
     */
    public static Terminal text(String text, boolean caseSensitive) {
        if (text == null) throw new NullPointerException("text");
        return new Terminal(text, -1, -1, caseSensitive);
    }

    /**
     * Create a terminal matching a code point from a range. Numeric
     * ranges are always case-sensitive.
     * 
     * @param start the first code point
     * 
     * @param end the last code point
     * 
     * @return the requested terminal
     */
    public static Terminal range(int start, int end) {
        return new Terminal(null, start, end, true);
    }

    /**
     * Determine whether this terminal is a range.
     * 
     * @return {@code true} if this terminal is a range
     */
    public boolean isRange() {
        return text == null && start >= 0 && end >= 0;
    }

    @Override
    public Kind kind() {
        return Kind.TERMINAL;
    }

    @Override
    public String toString() {
        if (text != null) return (caseSensitive ? "%s" : "") + '"' + text
            + '"';
        return String.format("%%x%X-%X", start, end);
    }
}
