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
 * Matches exact text.
 * 
 * @author simpsons
 */
public final class Literal extends Element implements ClassMember {
    /**
     * The text to be matched
     */
    public final String value;

    private final int codePoints;

    private Literal(String value) {
        this.value = value;
        this.codePoints = value.codePointCount(0, value.length());
    }

    /**
     * Create an expression matching literal text.
     * 
     * @param text the text to match
     * 
     * @return an expression matching the text
     * 
     * @throws NullPointerException if the text is {@code null}
     */
    public static Literal of(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        return new Literal(text.toString());
    }

    /**
     * Create an expression matching a single code point.
     * 
     * @param codePoint the code point to match
     * 
     * @return an expression matching the code point
     * 
     * @throws IllegalArgumentException if the code point is invalid
     */
    public static Literal of(int codePoint) {
        if (!Character.isValidCodePoint(codePoint))
            throw new IllegalArgumentException("bad code point: "
                + codePoint);
        return new Literal(new String(Character.toChars(codePoint)));
    }

    /**
     * Get the number of code points in the text.
     * 
     * @return the text length in code points
     */
    public int length() {
        return codePoints;
    }

    /**
     * Determine whether the text is exactly one code point.
     * 
     * @return {@code true} if the text is one code point
     */
    public boolean isSingle() {
        return codePoints == 1;
    }

    /**
     * Get the sole code point of the text.
     * 
     * @return the code point
     * 
     * @throws IllegalStateException if the text is not exactly one
     * code point
     */
    public int codePoint() {
        if (codePoints != 1)
            throw new IllegalStateException("not a single code point: "
                + this);
        return value.codePointAt(0);
    }

    @Override
    public int first() {
        return codePoint();
    }

    @Override
    public int last() {
        return codePoint();
    }

    @Override
    public Element element() {
        return this;
    }

    @Override
    public <R> R match(Cases<R> cases) {
        return cases.literal(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        return value.equals(((Literal) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + Ranges.quote(value) + ")";
    }
}
