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

package uk.ac.lancs.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationTest {
    @TempDir
    Path dir;

    private Path file;

    @BeforeEach
    void writeFile() throws Exception {
        file = dir.resolve("settings.properties");
        Files.write(file, ("abnf2regex.mode=nested\n"
            + "abnf2regex.table.width=50\n"
            + "abnf2regex.table.indent=2\n" + "other=x\n")
                .getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void testLoadAndSubview() throws Exception {
        Configuration config = new ConfigurationContext().get(file);
        assertThat(config.get("abnf2regex.mode")).isEqualTo("nested");
        assertThat(config.prefix()).isEmpty();

        Configuration table = config.subview("abnf2regex").subview("table");
        assertThat(table.prefix()).isEqualTo("abnf2regex.table.");
        assertThat(table.getInt("width", 70)).isEqualTo(50);
        assertThat(table.get("declaration", "String")).isEqualTo("String");
        assertThat(table.get("indent")).isEqualTo("2");
        assertThat(table.get("other")).isNull();
    }

    @Test
    @DisplayName("Loaded values override the context's defaults")
    void testDefaults() throws Exception {
        Properties defaults = new Properties();
        defaults.setProperty("abnf2regex.mode", "single-regexp");
        defaults.setProperty("abnf2regex.format", "json");
        ConfigurationContext ctxt = new ConfigurationContext(defaults);

        Configuration loaded = ctxt.get(file).subview("abnf2regex");
        assertThat(loaded.get("mode")).isEqualTo("nested");
        assertThat(loaded.get("format")).isEqualTo("json");

        Configuration plain = ctxt.defaults().subview("abnf2regex");
        assertThat(plain.get("mode")).isEqualTo("single-regexp");
        assertThat(plain.get("table.width")).isNull();
    }

    @Test
    @DisplayName("A fragment selects a subview of a cached configuration")
    void testFragment() throws Exception {
        ConfigurationContext ctxt = new ConfigurationContext();
        URI location = file.toUri();
        Configuration table =
            ctxt.get(URI.create(location + "#abnf2regex.table"));
        assertThat(table.get("width")).isEqualTo("50");
        assertThat(ctxt.get(file)).isSameAs(ctxt.get(location));
    }

    @Test
    void testBadInteger() throws Exception {
        Configuration config = new ConfigurationContext().get(file);
        assertThatThrownBy(() -> config.getInt("other", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("other=x");
    }

    @Test
    void testNormalization() {
        assertThat(Configuration.normalizeKey("..a...b.")).isEqualTo("a.b");
        assertThat(Configuration.normalizePrefix("a..b")).isEqualTo("a.b.");
        assertThat(Configuration.normalizePrefix("..")).isEmpty();
        assertThat(Configuration.normalizeKey(null)).isNull();
    }

    @Test
    void testEmptySubviewIsSelf() throws Exception {
        Configuration config = new ConfigurationContext().get(file);
        assertThat(config.subview("")).isSameAs(config);
        Configuration sub = config.subview("abnf2regex");
        assertThat(sub.subview("table").subview("")).isNotSameAs(sub);
    }
}
