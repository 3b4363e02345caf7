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
 * Matches a single code point from a union of ranges and individual
 * code points.
 * 
 * @author simpsons
 */
public final class CharacterClass extends Element {
    /**
     * The members of the class in rendering order
     */
    public final List<ClassMember> items;

    private CharacterClass(List<ClassMember> items) {
        this.items = items;
    }

    /**
     * Create a character class.
     * 
     * @param items the ranges and single-code-point literals
     * 
     * @return the requested class
     * 
     * @throws IllegalArgumentException if a literal member is not
     * exactly one code point
     */
    public static CharacterClass of(List<? extends ClassMember> items) {
        List<ClassMember> copy = new ArrayList<>(items.size());
        for (ClassMember item : items) {
            if (item instanceof Literal && !((Literal) item).isSingle())
                throw new IllegalArgumentException("multi-code-point member: "
                    + item);
            if (!(item instanceof Literal) && !(item instanceof Range))
                throw new IllegalArgumentException("not a class member: "
                    + item);
            copy.add(item);
        }
        return new CharacterClass(Collections.unmodifiableList(copy));
    }

    /**
     * Get the class's members as elements.
     * 
     * @return the members
     */
    public List<Element> elements() {
        List<Element> result = new ArrayList<>(items.size());
        for (ClassMember item : items)
            result.add(item.element());
        return result;
    }

    @Override
    public <R> R match(Cases<R> cases) {
        return cases.characterClass(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CharacterClass)) return false;
        return items.equals(((CharacterClass) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode() * 3 + 3;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        appendAll(buf, "CharacterClass", elements());
        return buf.toString();
    }
}
