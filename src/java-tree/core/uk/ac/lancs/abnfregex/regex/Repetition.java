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

import java.util.Objects;

/**
 * Matches an expression repeatedly. An absent minimum means zero, and
 * an absent maximum means no upper bound.
 * 
 * @author simpsons
 */
public final class Repetition extends Element {
    /**
     * The repeated expression
     */
    public final Element inner;

    /**
     * The minimum number of occurrences, or {@code null} if not
     * specified
     */
    public final Integer min;

    /**
     * The maximum number of occurrences, or {@code null} if unbounded
     */
    public final Integer max;

    private Repetition(Element inner, Integer min, Integer max) {
        this.inner = inner;
        this.min = min;
        this.max = max;
    }

    /**
     * Create a repetition.
     * 
     * @param inner the expression to repeat
     * 
     * @param min the minimum number of occurrences, or {@code null}
     * for zero
     * 
     * @param max the maximum number of occurrences, or {@code null}
     * for no limit
     * 
     * @return the requested repetition
     * 
     * @throws IllegalArgumentException if a bound is negative, or the
     * minimum exceeds the maximum
     */
    public static Repetition of(Element inner, Integer min, Integer max) {
        if (inner == null) throw new NullPointerException("inner");
        if (min != null && min < 0)
            throw new IllegalArgumentException("-ve min: " + min);
        if (max != null && max < 0)
            throw new IllegalArgumentException("-ve max: " + max);
        if (min != null && max != null && min > max)
            throw new IllegalArgumentException("min " + min + " > max "
                + max);
        return new Repetition(inner, min, max);
    }

    /**
     * Create an optional expression.
     * 
     * @param inner the expression that may appear once
     * 
     * @return a repetition of zero or one occurrences
     */
    public static Repetition optional(Element inner) {
        return of(inner, 0, 1);
    }

    /**
     * Get the effective minimum.
     * 
     * @return the minimum, or zero if not specified
     */
    public int minimum() {
        return min == null ? 0 : min;
    }

    /**
     * Create a repetition of the same bounds around another
     * expression.
     * 
     * @param inner the replacement expression
     * 
     * @return a repetition with the same bounds
     */
    public Repetition withInner(Element inner) {
        return of(inner, min, max);
    }

    @Override
    public <R> R match(Cases<R> cases) {
        return cases.repetition(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Repetition)) return false;
        Repetition other = (Repetition) obj;
        return inner.equals(other.inner) && Objects.equals(min, other.min)
            && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inner, min, max);
    }

    @Override
    public String toString() {
        return "Repetition(" + inner + ", " + min + ", " + max + ")";
    }
}
