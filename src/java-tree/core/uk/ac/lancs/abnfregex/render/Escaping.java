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

import java.util.Locale;

/**
 * Escapes code points for inclusion in regular expressions. The output
 * is printable ASCII, and is understood by most regular-expression
 * dialects.
 * 
 * @author simpsons
 */
public final class Escaping {
    private Escaping() {}

    private static final String PLAIN_PUNCTUATION = "_- #:,;=@~`'\"!%&<>/";

    private static final String METACHARACTERS = "\\.^$*+?()[]{}|";

    private static final String CLASS_METACHARACTERS = "-\\[]";

    /**
     * Determine whether a code point may appear unescaped outside a
     * character class.
     * 
     * @param cp the code point
     * 
     * @return {@code true} if the code point needs no escaping
     */
    public static boolean isPlain(int cp) {
        return (cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z')
            || (cp >= '0' && cp <= '9') || PLAIN_PUNCTUATION.indexOf(cp) >= 0;
    }

    /**
     * Escape text to be matched literally outside a character class.
     * 
     * @param text the text to escape
     * 
     * @return the escaped text
     */
    public static String literal(CharSequence text) {
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> appendLiteral(result, cp));
        return result.toString();
    }

    /**
     * Escape a code point to be matched literally outside a character
     * class.
     * 
     * @param out the destination of the escaped code point
     * 
     * @param cp the code point
     */
    public static void appendLiteral(StringBuilder out, int cp) {
        if (isPlain(cp)) {
            out.appendCodePoint(cp);
        } else if (METACHARACTERS.indexOf(cp) >= 0) {
            out.append('\\').appendCodePoint(cp);
        } else {
            switch (cp) {
            case 0x07:
                out.append("\\a");
                break;
            case '\t':
                out.append("\\t");
                break;
            case '\n':
                out.append("\\n");
                break;
            case '\f':
                out.append("\\f");
                break;
            case '\r':
                out.append("\\r");
                break;
            default:
                appendNumeric(out, cp);
                break;
            }
        }
    }

    /**
     * The previous code point of a class member at the start of a class
     */
    public static final int CLASS_START = -1;

    /**
     * Escape a code point to appear inside a character class.
     * 
     * @param cp the code point
     * 
     * @param previous the code point rendered immediately before within
     * the same class, or {@link #CLASS_START} if there is none
     * 
     * @return the escaped code point
     */
    public static String classMember(int cp, int previous) {
        StringBuilder result = new StringBuilder();
        appendClassMember(result, cp, previous);
        return result.toString();
    }

    /**
     * Escape a code point to appear inside a character class. A leading
     * caret is escaped, as it would negate the class. An ampersand
     * following another is written numerically, as <samp>&amp;&amp;</samp>
     * denotes intersection in some dialects.
     * 
     * @param out the destination of the escaped code point
     * 
     * @param cp the code point
     * 
     * @param previous the code point rendered immediately before within
     * the same class, or {@link #CLASS_START} if there is none
     */
    public static void appendClassMember(StringBuilder out, int cp,
                                         int previous) {
        if (CLASS_METACHARACTERS.indexOf(cp) >= 0
            || (previous == CLASS_START && cp == '^'))
            out.append('\\').appendCodePoint(cp);
        else if (cp == '&' && previous == '&')
            appendNumeric(out, cp);
        else if (cp >= 0x20 && cp <= 0x7e)
            out.appendCodePoint(cp);
        else
            appendNumeric(out, cp);
    }

    private static void appendNumeric(StringBuilder out, int cp) {
        if (cp <= 0xff)
            out.append(String.format(Locale.ROOT, "\\x%02x", cp));
        else if (cp <= 0xffff)
            out.append(String.format(Locale.ROOT, "\\u%04x", cp));
        else
            out.append(String.format(Locale.ROOT, "\\U%08x", cp));
    }
}
