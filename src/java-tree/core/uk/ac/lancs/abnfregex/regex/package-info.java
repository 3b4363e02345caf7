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
 * Represents regular expressions structurally, as immutable trees of
 * {@link uk.ac.lancs.abnfregex.regex.Element}s.
 * 
 * <p>
 * Build trees with the static factories, such as
 * {@link uk.ac.lancs.abnfregex.regex.Element#literal(CharSequence)} and
 * {@link uk.ac.lancs.abnfregex.regex.Element#choice(Element...)}. Then
 * process them with one of three disciplines:
 * 
 * <ul>
 * 
 * <li>{@link uk.ac.lancs.abnfregex.regex.Transformer} rewrites a tree
 * into a new one;
 * 
 * <li>{@link uk.ac.lancs.abnfregex.regex.Visitor} walks a tree to
 * gather information;
 * 
 * <li>{@link uk.ac.lancs.abnfregex.regex.Convertor} folds a tree into
 * some other value, such as its textual form.
 * 
 * </ul>
 * 
 * <p>
 * All three walk depth-first, and visit ordered children from first to
 * last.
 * 
 * <p>
 * {@link uk.ac.lancs.abnfregex.regex.LetterRanges} classifies code
 * points as letters, which determines where case-insensitivity is
 * worth expressing.
 * 
 * @resume Classes for structural representation of regular expressions
 * 
 * @author simpsons
 */
package uk.ac.lancs.abnfregex.regex;
