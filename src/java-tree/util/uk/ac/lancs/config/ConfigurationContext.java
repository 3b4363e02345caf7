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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Loads configurations, caching them by location. Each loaded
 * configuration falls back on a common set of defaults.
 * 
 * @author simpsons
 */
public final class ConfigurationContext {
    private final Map<URI, BaseConfiguration> cache = new HashMap<>();
    private final Properties defaults;

    /**
     * Create a context with defaults.
     * 
     * @param defaults properties used when a loaded configuration
     * leaves them unset
     */
    public ConfigurationContext(Properties defaults) {
        this.defaults = defaults;
    }

    /**
     * Create a context with no defaults.
     */
    public ConfigurationContext() {
        this(new Properties());
    }

    /**
     * Get a configuration consisting only of the defaults.
     * 
     * @return the default configuration
     */
    public Configuration defaults() {
        return new BaseConfiguration(null, new Properties(defaults));
    }

    /**
     * Get the configuration at a location. A fragment identifier
     * selects a subview.
     * 
     * @param location the configuration's location
     * 
     * @return the configuration
     * 
     * @throws IOException if the configuration could not be loaded
     */
    public Configuration get(URI location) throws IOException {
        location = location.normalize();
        String fragment = location.getFragment();
        if (fragment != null) location = defragment(location);
        Configuration root = cache.get(location);
        if (root == null) {
            BaseConfiguration loaded =
                new BaseConfiguration(location, load(location, defaults));
            cache.put(location, loaded);
            root = loaded;
        }
        if (fragment != null) root = root.subview(fragment);
        return root;
    }

    /**
     * Get the configuration in a file.
     * 
     * @param file the file
     * 
     * @return the configuration
     * 
     * @throws IOException if the configuration could not be loaded
     */
    public Configuration get(File file) throws IOException {
        return get(file.toURI());
    }

    /**
     * Get the configuration in a file.
     * 
     * @param path the file
     * 
     * @return the configuration
     * 
     * @throws IOException if the configuration could not be loaded
     */
    public Configuration get(Path path) throws IOException {
        return get(path.toUri());
    }

    /**
     * Get the configuration in a named file.
     * 
     * @param name the file name
     * 
     * @return the configuration
     * 
     * @throws IOException if the configuration could not be loaded
     */
    public Configuration get(String name) throws IOException {
        return get(new File(name));
    }

    private static URI defragment(URI location) {
        try {
            return new URI(location.getScheme(),
                           location.getSchemeSpecificPart(), null);
        } catch (URISyntaxException ex) {
            throw new AssertionError("unreachable", ex);
        }
    }

    static Properties load(URI location, Properties defaults)
        throws IOException {
        URL url = location.toURL();
        URLConnection conn = url.openConnection();
        try (InputStream in = conn.getInputStream()) {
            Properties result = new Properties(defaults);
            result.load(in);
            return result;
        }
    }
}
