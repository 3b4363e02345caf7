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

/**
 * Holds part of the textual form of an expression.
 * 
 * @author simpsons
 */
public final class Token {
    /**
     * Identifies the kind of a token.
     */
    public enum Kind {
        /**
         * Regular-expression text
         */
        TEXT,

        /**
         * The identifier of a referenced rule
         */
        REFERENCE,

        /**
         * A position where a line may be broken, carrying no text
         */
        BREAKPOINT;
    }

    /**
     * The token's kind
     */
    public final Kind kind;

    /**
     * The token's text, or the referenced identifier
     */
    public final String value;

    private Token(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    static final Token BREAKPOINT = new Token(Kind.BREAKPOINT, "");

    static Token text(String value) {
        return new Token(Kind.TEXT, value);
    }

    static Token reference(String identifier) {
        return new Token(Kind.REFERENCE, identifier);
    }

    /**
     * Get the length of the token's value.
     * 
     * @return the number of characters in the value
     */
    public int length() {
        return value.length();
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
