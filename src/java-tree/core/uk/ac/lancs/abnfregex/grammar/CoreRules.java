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
 * Provides the core rules of RFC 5234, Appendix B.1. These are
 * available to every parsed grammar without being defined by it.
 * 
 * @author simpsons
 */
public final class CoreRules {
    private CoreRules() {}

    private static final String TEXT = String
        .join("\n", "ALPHA  = %x41-5A / %x61-7A   ; A-Z / a-z",
              "BIT    = \"0\" / \"1\"", "CHAR   = %x01-7F",
              "CR     = %x0D", "CRLF   = CR LF",
              "CTL    = %x00-1F / %x7F", "DIGIT  = %x30-39   ; 0-9",
              "DQUOTE = %x22", "HEXDIG = DIGIT / \"A\" / \"B\" / \"C\" / "
                  + "\"D\" / \"E\" / \"F\"",
              "HTAB   = %x09", "LF     = %x0A",
              "LWSP   = *(WSP / CRLF WSP)", "OCTET  = %x00-FF",
              "SP     = %x20", "VCHAR  = %x21-7E", "WSP    = SP / HTAB",
              "");

    private static final Grammar GRAMMAR;

    static {
        try {
            GRAMMAR = AbnfParser.parse(TEXT, null);
        } catch (GrammarParseException ex) {
            throw new AssertionError("core rules", ex);
        }
    }

    /**
     * Get the core rules as a grammar.
     * 
     * @return the core rules
     */
    public static Grammar grammar() {
        return GRAMMAR;
    }

    /**
     * Determine whether a name identifies a core rule.
     * 
     * @param name the name, in any case
     * 
     * @return {@code true} if the name identifies a core rule
     */
    public static boolean isCore(String name) {
        return GRAMMAR.defines(name);
    }
}
