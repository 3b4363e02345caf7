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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LetterRangesTest {
    private static boolean linearOverlaps(int start, int end) {
        for (int i = 0; i < LetterRanges.size(); i++)
            if (LetterRanges.start(i) <= end && LetterRanges.end(i) >= start)
                return true;
        return false;
    }

    @Test
    @DisplayName("Table is sorted and disjoint")
    void testTableShape() {
        assertThat(LetterRanges.size()).isGreaterThan(0);
        for (int i = 0; i < LetterRanges.size(); i++) {
            assertThat(LetterRanges.start(i)).isLessThanOrEqualTo(LetterRanges
                .end(i));
            if (i > 0)
                assertThat(LetterRanges.end(i - 1))
                    .isLessThan(LetterRanges.start(i));
        }
    }

    @Test
    @DisplayName("Single code points agree with a linear scan")
    void testPointsAgreeWithLinearScan() {
        for (int cp = 0; cp < 0x3400; cp++)
            assertThat(LetterRanges.isLetter(cp)).as("U+%04X", cp)
                .isEqualTo(linearOverlaps(cp, cp));
    }

    @Test
    @DisplayName("Interval boundaries agree with a linear scan")
    void testBoundariesAgreeWithLinearScan() {
        for (int i = 0; i < LetterRanges.size(); i++) {
            int s = LetterRanges.start(i), e = LetterRanges.end(i);
            for (int q : new int[] { s - 1, s, e, e + 1 }) {
                if (q < 0) continue;
                assertThat(LetterRanges.overlaps(q, q)).as("U+%04X", q)
                    .isEqualTo(linearOverlaps(q, q));
            }
            if (s > 0)
                assertThat(LetterRanges.overlaps(s - 1, s)).isTrue();
            assertThat(LetterRanges.overlaps(e, e + 1)).isTrue();
        }
    }

    @Test
    @DisplayName("Random ranges agree with a linear scan")
    void testRandomRangesAgreeWithLinearScan() {
        Random rng = new Random(42);
        for (int n = 0; n < 20000; n++) {
            int a = rng.nextInt(0x110000);
            int len = rng.nextInt(n % 2 == 0 ? 16 : 4096);
            int b = Math.min(0x10FFFF, a + len);
            assertThat(LetterRanges.overlaps(a, b))
                .as("U+%04X..U+%04X", a, b).isEqualTo(linearOverlaps(a, b));
        }
    }

    @Test
    void testKnownCodePoints() {
        assertThat(LetterRanges.isLetter('A')).isTrue();
        assertThat(LetterRanges.isLetter('z')).isTrue();
        assertThat(LetterRanges.isLetter('0')).isFalse();
        assertThat(LetterRanges.isLetter(' ')).isFalse();
        assertThat(LetterRanges.isLetter(0xe9)).isTrue();
        assertThat(LetterRanges.overlaps(0x30, 0x39)).isFalse();
        assertThat(LetterRanges.overlaps(0x30, 0x41)).isTrue();
        assertThat(LetterRanges.overlaps(0x10FFF0, 0x10FFFF)).isFalse();
        assertThat(LetterRanges.overlaps(0, 0x10FFFF)).isTrue();
    }

    @Test
    void testContainsLetter() {
        assertThat(LetterRanges.containsLetter("123-456")).isFalse();
        assertThat(LetterRanges.containsLetter("12a")).isTrue();
        assertThat(LetterRanges.containsLetter("")).isFalse();
    }

    @Test
    void testInvertedRangeRejected() {
        assertThatThrownBy(() -> LetterRanges.overlaps(10, 9))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
