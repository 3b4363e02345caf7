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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;

class TableLayoutTest {
    @Test
    void testFromConfiguration() {
        Properties props = new Properties();
        props.setProperty("table.width", "40");
        props.setProperty("table.declaration", "  public static String ");
        Configuration config =
            new ConfigurationContext(props).defaults().subview("table");
        TableLayout layout = TableLayout.from(config);
        assertThat(layout.width).isEqualTo(40);
        assertThat(layout.indent).isEqualTo(TableLayout.DEFAULT.indent);
        assertThat(layout.declaration).isEqualTo("public static String");
    }

    @Test
    void testBadConfiguration() {
        Properties props = new Properties();
        props.setProperty("width", "wide");
        Configuration config = new ConfigurationContext(props).defaults();
        assertThatThrownBy(() -> TableLayout.from(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("width=wide");
        props.setProperty("width", "0");
        Configuration zero = new ConfigurationContext(props).defaults();
        assertThatThrownBy(() -> TableLayout.from(zero))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testWidths() {
        TableLayout layout = new TableLayout(30, 4, "String");
        assertThat(layout.headingLength("abc")).isEqualTo(13);
        assertThat(layout.wrapWidth("abc")).isEqualTo(13);
        assertThat(layout.wrapWidth("a_very_long_identifier_indeed"))
            .isEqualTo(1);
        assertThat(layout.fits("abc", 17)).isTrue();
        assertThat(layout.fits("abc", 18)).isFalse();
        assertThat(layout.indentation()).isEqualTo("    ");
    }
}
