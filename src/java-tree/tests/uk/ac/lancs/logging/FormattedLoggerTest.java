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

package uk.ac.lancs.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FormattedLoggerTest {
    interface Sample extends FormattedLogger {
        @Format("translated %s in %d pass(es)")
        void translated(String rule, int passes);

        @Detail(ShadowLevel.FINE)
        @Format("visiting %s")
        void visiting(String rule);

        @Format("done")
        void done();
    }

    @Detail(ShadowLevel.WARNING)
    interface Warnings extends FormattedLogger {
        @Format("cycle through %s")
        void cycle(String rule);

        @Detail(ShadowLevel.SEVERE)
        @Format("gave up")
        void gaveUp();
    }

    interface NotVoid extends FormattedLogger {
        @Format("x")
        int count();
    }

    interface Unformatted extends FormattedLogger {
        void missing();
    }

    private final List<LogRecord> records = new ArrayList<>();

    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
    };

    private Logger base;

    @BeforeEach
    void attach() {
        base = Logger.getLogger(FormattedLoggerTest.class.getName());
        base.setUseParentHandlers(false);
        base.setLevel(Level.ALL);
        base.addHandler(handler);
    }

    @AfterEach
    void detach() {
        base.removeHandler(handler);
    }

    @Test
    void testMessagesFormatted() {
        Sample logger = FormattedLogger.get(base, Sample.class);
        logger.translated("greeting", 2);
        logger.done();
        assertThat(records).extracting(LogRecord::getMessage)
            .containsExactly("translated greeting in 2 pass(es)", "done");
        assertThat(records).extracting(LogRecord::getLevel)
            .containsOnly(Level.INFO);
    }

    @Test
    @DisplayName("Method detail overrides type detail, which overrides INFO")
    void testLevels() {
        Sample sample =
            FormattedLogger.get(FormattedLoggerTest.class.getName(),
                                Sample.class);
        Warnings warnings = FormattedLogger.get(base, Warnings.class);
        sample.visiting("a");
        warnings.cycle("b");
        warnings.gaveUp();
        assertThat(records).extracting(LogRecord::getLevel)
            .containsExactly(Level.FINE, Level.WARNING, Level.SEVERE);
    }

    @Test
    void testFilteredByLevel() {
        base.setLevel(Level.INFO);
        Sample logger = FormattedLogger.get(base, Sample.class);
        logger.visiting("hidden");
        logger.done();
        assertThat(records).extracting(LogRecord::getMessage)
            .containsExactly("done");
    }

    @Test
    void testObjectMethods() {
        Sample logger = FormattedLogger.get(base, Sample.class);
        assertThat(logger.base()).isSameAs(base);
        assertThat(logger.toString()).contains(base.getName());
        assertThat(logger).isEqualTo(logger);
        assertThat(logger.hashCode()).isEqualTo(logger.hashCode());
    }

    @Test
    void testBadInterfaces() {
        assertThatThrownBy(() -> FormattedLogger.get(base, NotVoid.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not return void");
        assertThatThrownBy(() -> FormattedLogger.get(base, Unformatted.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a log message");
    }
}
