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

package uk.ac.lancs.abnfregex.grammar;

/**
 * Represents a node of a parsed ABNF rule definition. The kinds of
 * node are fixed; consumers dispatch on {@link #kind()}.
 * 
 * @author simpsons
 */
public abstract class Node {
    /**
     * Identifies the kind of a grammar node.
     */
    public enum Kind {
        /**
         * A quoted string, numeric value or value range, represented
         * by {@link Terminal}
         */
        TERMINAL,

        /**
         * A concatenation of elements, represented by
         * {@link Sequence}
         */
        SEQUENCE,

        /**
         * A choice of alternatives, represented by {@link Choice}
         */
        CHOICE,

        /**
         * An optional group, represented by {@link Option}
         */
        OPTION,

        /**
         * A repeated element, represented by {@link Repeat}
         */
        REPEAT,

        /**
         * A reference to a named rule, represented by {@link RuleRef}
         */
        RULE;
    }

    /**
     * Create a node. Only the kinds enumerated by {@link Kind} are
     * understood by consumers.
     */
    protected Node() {}

    /**
     * Get the kind of this node.
     * 
     * @return the node's kind
     */
    public abstract Kind kind();
}
