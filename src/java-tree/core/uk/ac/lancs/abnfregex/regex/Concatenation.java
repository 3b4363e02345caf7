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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Matches each of several expressions in turn.
 * 
 * @author simpsons
 */
public final class Concatenation extends Element {
    /**
     * The expressions in matching order
     */
    public final List<Element> items;

    private Concatenation(List<Element> items) {
        this.items = items;
    }

    /**
     * Create a sequence of expressions.
     * 
     * @param items the expressions in matching order
     * 
     * @return the requested sequence
     */
    public static Concatenation of(List<? extends Element> items) {
        List<Element> copy = new ArrayList<>(items.size());
        for (Element item : items) {
            if (item == null) throw new NullPointerException("item");
            copy.add(item);
        }
        return new Concatenation(Collections.unmodifiableList(copy));
    }

    @Override
    public <R> R match(Cases<R> cases) {
        return cases.concatenation(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Concatenation)) return false;
        return items.equals(((Concatenation) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode() * 3 + 1;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        appendAll(buf, "Concatenation", items);
        return buf.toString();
    }
}
