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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EscapingTest {
    private static boolean isSurrogate(int cp) {
        return cp >= 0xd800 && cp <= 0xdfff;
    }

    @Test
    @DisplayName("Every BMP code point escaped as a literal matches itself")
    void testLiteralRoundTrip() {
        for (int cp = 0; cp <= 0xffff; cp++) {
            if (isSurrogate(cp)) continue;
            String text = new String(Character.toChars(cp));
            String escaped = Escaping.literal(text);
            assertThat(Pattern.compile(escaped).matcher(text).matches())
                .as("U+%04X as %s", cp, escaped).isTrue();
        }
    }

    @Test
    @DisplayName("Every BMP code point escaped in a class matches itself")
    void testClassRoundTrip() {
        for (int cp = 0; cp <= 0xffff; cp++) {
            if (isSurrogate(cp)) continue;
            String text = new String(Character.toChars(cp));
            for (int previous : new int[] { Escaping.CLASS_START, '0', '&' }) {
                String pattern = "["
                    + (previous == Escaping.CLASS_START ? ""
                        : Character.toString(previous))
                    + Escaping.classMember(cp, previous) + "]";
                assertThat(Pattern.compile(pattern).matcher(text).matches())
                    .as("U+%04X as %s", cp, pattern).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Escaped ASCII text matches exactly")
    void testAsciiTextRoundTrip() {
        StringBuilder buf = new StringBuilder();
        for (int cp = 0; cp < 0x80; cp++)
            buf.appendCodePoint(cp);
        String text = buf.toString();
        Pattern pattern = Pattern.compile(Escaping.literal(text));
        assertThat(pattern.matcher(text).matches()).isTrue();
        assertThat(pattern.matcher(text.substring(1)).matches()).isFalse();
    }

    @Test
    void testPlainCharactersPassThrough() {
        assertThat(Escaping.literal("abc-XYZ_09 #:,;=@~`'\"!%&<>/"))
            .isEqualTo("abc-XYZ_09 #:,;=@~`'\"!%&<>/");
    }

    @Test
    void testMetacharactersEscaped() {
        assertThat(Escaping.literal("a.b")).isEqualTo("a\\.b");
        assertThat(Escaping.literal("\\^$*+?()[]{}|"))
            .isEqualTo("\\\\\\^\\$\\*\\+\\?\\(\\)\\[\\]\\{\\}\\|");
    }

    @Test
    void testControlCharacters() {
        assertThat(Escaping.literal("\t\n\r\f\u0007"))
            .isEqualTo("\\t\\n\\r\\f\\a");
        assertThat(Escaping.literal("\u0000\u0008\u000b"))
            .isEqualTo("\\x00\\x08\\x0b");
        assertThat(Escaping.literal("\u007f")).isEqualTo("\\x7f");
    }

    @Test
    void testNumericEscapesAreLowerCaseAndFixedWidth() {
        assertThat(Escaping.literal("é")).isEqualTo("\\xe9");
        assertThat(Escaping.literal("Δ")).isEqualTo("\\u0394");
        assertThat(Escaping.literal("�")).isEqualTo("\\ufffd");
        assertThat(Escaping.literal(new String(Character.toChars(0x1F600))))
            .isEqualTo("\\U0001f600");
        assertThat(Escaping.classMember(0x10FFFF, 'a'))
            .isEqualTo("\\U0010ffff");
    }

    @Test
    void testClassEscaping() {
        assertThat(Escaping.classMember('-', 'a')).isEqualTo("\\-");
        assertThat(Escaping.classMember('\\', 'a')).isEqualTo("\\\\");
        assertThat(Escaping.classMember('[', 'a')).isEqualTo("\\[");
        assertThat(Escaping.classMember(']', 'a')).isEqualTo("\\]");
        assertThat(Escaping.classMember('.', 'a')).isEqualTo(".");
        assertThat(Escaping.classMember(' ', 'a')).isEqualTo(" ");
        assertThat(Escaping.classMember('\n', 'a')).isEqualTo("\\x0a");
        assertThat(Escaping.classMember('^', 'a')).isEqualTo("^");
        assertThat(Escaping.classMember('^', Escaping.CLASS_START))
            .isEqualTo("\\^");
    }

    @Test
    @DisplayName("A doubled ampersand in a class is not an intersection")
    void testClassAmpersands() {
        assertThat(Escaping.classMember('&', Escaping.CLASS_START))
            .isEqualTo("&");
        assertThat(Escaping.classMember('&', 'a')).isEqualTo("&");
        assertThat(Escaping.classMember('&', '&')).isEqualTo("\\x26");
        String pattern = "[&" + Escaping.classMember('&', '&') + "]";
        assertThat(Pattern.compile(pattern).matcher("&").matches()).isTrue();
    }
}
