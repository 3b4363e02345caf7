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

package uk.ac.lancs.abnfregex.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Indicates that rules depend on each other cyclically, so they cannot
 * be ordered or inlined.
 * 
 * @author simpsons
 */
public class DependencyCycleException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String ruleName;

    private final List<String> cycle;

    /**
     * Create an exception.
     * 
     * @param ruleName the original name of the rule found to be visited
     * more than once
     * 
     * @param cycle the original names of the rules along the cycle,
     * starting and ending with the repeated rule
     */
    public DependencyCycleException(String ruleName, List<String> cycle) {
        super("cycle in grammar: rule " + ruleName
            + " is visited more than once (" + String.join(" -> ", cycle)
            + ")");
        this.ruleName = ruleName;
        this.cycle = Collections.unmodifiableList(new ArrayList<>(cycle));
    }

    /**
     * Get the original name of the repeated rule.
     * 
     * @return the rule's name
     */
    public String getRuleName() {
        return ruleName;
    }

    /**
     * Get the path of the cycle.
     * 
     * @return the original names of the rules along the cycle
     */
    public List<String> getCycle() {
        return cycle;
    }
}
