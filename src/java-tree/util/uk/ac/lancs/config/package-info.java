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

/**
 * Presents Java properties as hierarchical configurations. Keys have
 * the form <samp>foo.bar.baz</samp>. Subviews of a configuration can be
 * obtained by specifying a prefix. With a prefix of <samp>foo.</samp>,
 * all properties whose names don't begin with this prefix are hidden,
 * and the names of remaining ones have the prefix removed.
 * 
 * <p>
 * The starting point is to create a {@link ConfigurationContext} with a
 * set of defaults, and use it to load a root configuration from a file.
 * Properties absent from the file take their values from the defaults.
 * For example:
 * 
 * <pre>
 * ConfigurationContext ctxt = new ConfigurationContext(defaults);
 * Configuration root = ctxt.get("config.properties");
 * Configuration table = root.subview("abnf2regex.table");
 * assert table.get("width").equals(root.get("abnf2regex.table.width"));
 * </pre>
 * 
 * <p>
 * Configurations loaded using the same context are cached, so that
 * repeated requests do not result in multiple loads of the same file.
 * 
 * @author simpsons
 */
package uk.ac.lancs.config;
