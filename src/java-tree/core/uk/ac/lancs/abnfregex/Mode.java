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

package uk.ac.lancs.abnfregex;

import java.util.Locale;

/**
 * Selects the shape of a translated grammar.
 * 
 * @author simpsons
 */
public enum Mode {
    /**
     * Every rule is inlined into one expression for the grammar's
     * first rule.
     */
    SINGLE_REGEXP("single-regexp"),

    /**
     * Every rule becomes a named expression, referring to others by
     * name.
     */
    NESTED("nested");

    /**
     * The name of the mode on the command line and in configuration
     */
    public final String label;

    Mode(String label) {
        this.label = label;
    }

    /**
     * Find a mode by its label.
     * 
     * @param label the label, in any case
     * 
     * @return the matching mode
     * 
     * @throws IllegalArgumentException if no mode has the label
     */
    public static Mode forLabel(String label) {
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (Mode mode : values())
            if (mode.label.equals(key)) return mode;
        throw new IllegalArgumentException("unknown mode: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
