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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Provides access to a set of string properties, with keys structured
 * as dot-separated components.
 * 
 * @author simpsons
 */
public interface Configuration {
    /**
     * Get a property.
     * 
     * @param key the property key
     * 
     * @return the property's value, or {@code null} if not set
     */
    String get(String key);

    /**
     * Get a property, or a default if not set.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to return if the property is not
     * set
     * 
     * @return the property's value, or the default if not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a property as an integer, or a default if not set.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to return if the property is not
     * set
     * 
     * @return the property's value, or the default if not set
     * 
     * @throws IllegalArgumentException if the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not an integer: " + prefix()
                + key + "=" + value, ex);
        }
    }

    /**
     * Create a subview.
     * 
     * @param prefix the additional prefix to limit the subview to
     * 
     * @return the requested subview
     */
    Configuration subview(String prefix);

    /**
     * Get the prefix of this view relative to its base.
     * 
     * @return the prefix, ending with a dot, or empty if this is a
     * base configuration
     */
    String prefix();

    /**
     * Normalize a key by removing empty components.
     * 
     * @param key the key to normalize
     * 
     * @return the normalized key
     */
    public static String normalizeKey(String key) {
        if (key == null) return null;
        return Arrays.stream(key.split("\\.+")).filter(s -> !s.isEmpty())
            .collect(Collectors.joining("."));
    }

    /**
     * Normalize a prefix, so that it ends with a single dot, unless it
     * is empty.
     * 
     * @param prefix the prefix to normalize
     * 
     * @return the normalized prefix
     */
    public static String normalizePrefix(String prefix) {
        if (prefix == null) return null;
        String key = normalizeKey(prefix);
        return key.isEmpty() ? "" : key + '.';
    }
}
