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

package uk.ac.lancs.abnfregex.regex;

/**
 * Matches a single code point from an inclusive range.
 * 
 * @author simpsons
 */
public final class Range extends Element implements ClassMember {
    /**
     * The first code point of the range
     */
    public final int start;

    /**
     * The last code point of the range
     */
    public final int end;

    private Range(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Create an expression matching a code point from a range.
     * 
     * @param start the first code point
     * 
     * @param end the last code point
     * 
     * @return the requested range
     * 
     * @throws IllegalArgumentException if either code point is invalid,
     * or the start exceeds the end
     */
    public static Range of(int start, int end) {
        if (!Character.isValidCodePoint(start))
            throw new IllegalArgumentException("bad start: " + start);
        if (!Character.isValidCodePoint(end))
            throw new IllegalArgumentException("bad end: " + end);
        if (start > end)
            throw new IllegalArgumentException("inverted range: " + start
                + ".." + end);
        return new Range(start, end);
    }

    @Override
    public int first() {
        return start;
    }

    @Override
    public int last() {
        return end;
    }

    @Override
    public Element element() {
        return this;
    }

    @Override
    public <R> R match(Cases<R> cases) {
        return cases.range(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Range)) return false;
        Range other = (Range) obj;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return start * 31 + end;
    }

    @Override
    public String toString() {
        return "Range(" + Ranges.hex(start) + ", " + Ranges.hex(end) + ")";
    }
}
