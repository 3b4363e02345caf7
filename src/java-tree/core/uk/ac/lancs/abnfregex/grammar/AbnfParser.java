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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Parses ABNF rule lists, as defined by RFC 5234 and extended by RFC
 * 7405 with case-sensitive string literals. Lines may end with CRLF or
 * a bare LF. Prose values cannot be expressed, and are rejected.
 *
 * @author simpsons
 */
public final class AbnfParser {
    @Detail(ShadowLevel.FINE)
    private interface Logger extends FormattedLogger {
        @Format("parsed %d rule(s)")
        void parsed(int count);

        @Format("rule %s extended with =/")
        void extended(String name);
    }

    private static final Logger logger =
        FormattedLogger.get(AbnfParser.class.getName(), Logger.class);

    private final String text;
    private final Grammar fallback;
    private int pos = 0;

    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, Node> definitions = new LinkedHashMap<>();
    private final List<Object[]> references = new ArrayList<>();

    private AbnfParser(String text, Grammar fallback) {
        this.text = text;
        this.fallback = fallback;
    }

    /**
     * Parse a rule list, resolving undefined names against the RFC 5234
     * core rules.
     *
     * @param text the ABNF text
     *
     * @return the parsed grammar
     *
     * @throws GrammarParseException if the text is not a valid rule
     * list, or refers to an undefined rule
     */
    public static Grammar parse(String text) throws GrammarParseException {
        return parse(text, CoreRules.grammar());
    }

    /**
     * Parse a rule list.
     *
     * @param text the ABNF text
     *
     * @param fallback the grammar used to resolve names not defined by
     * the text, or {@code null} if all names must be defined
     *
     * @return the parsed grammar
     *
     * @throws GrammarParseException if the text is not a valid rule
     * list, or refers to an undefined rule
     */
    public static Grammar parse(String text, Grammar fallback)
        throws GrammarParseException {
        AbnfParser parser = new AbnfParser(text, fallback);
        parser.ruleList();
        return parser.build();
    }

    private Grammar build() throws GrammarParseException {
        for (Object[] ref : references) {
            String name = (String) ref[0];
            if (names.containsKey(key(name))) continue;
            if (fallback != null && fallback.rule(name) != null) continue;
            throw error((Integer) ref[1], "undefined rule: " + name);
        }
        List<Rule> rules = new ArrayList<>(definitions.size());
        for (Map.Entry<String, Node> entry : definitions.entrySet())
            rules.add(new Rule(names.get(entry.getKey()), entry.getValue()));
        logger.parsed(rules.size());
        return new Grammar(rules, fallback);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /* rulelist = 1*( rule / (*c-wsp c-nl) ) */
    private void ruleList() throws GrammarParseException {
        while (!atEnd()) {
            skipWhite();
            if (atEnd()) break;
            if (atNewline() || peek() == ';') {
                skipToNextLine();
                continue;
            }
            rule();
        }
        if (definitions.isEmpty()) throw error(pos, "no rules defined");
    }

    /* rule = rulename defined-as elements c-nl */
    private void rule() throws GrammarParseException {
        final int start = pos;
        String name = ruleName();
        skipCwsp();
        boolean incremental;
        if (!consume('=')) throw error(pos, "expected '=' after " + name);
        incremental = consume('/');
        skipCwsp();
        Node definition = alternation();
        skipCwsp();
        if (!atEnd() && !atNewline() && peek() != ';')
            throw error(pos, "unexpected '" + (char) peek() + "'");
        skipToNextLine();

        String key = key(name);
        Node old = definitions.get(key);
        if (incremental) {
            if (old == null)
                throw error(start, "=/ used on undefined rule " + name);
            definitions.put(key, extend(old, definition));
            logger.extended(name);
        } else {
            if (old != null) throw error(start, "rule redefined: " + name);
            names.put(key, name);
            definitions.put(key, definition);
        }
    }

    private static Node extend(Node old, Node extra) {
        List<Node> options = new ArrayList<>();
        if (old instanceof Choice)
            options.addAll(((Choice) old).options);
        else
            options.add(old);
        if (extra instanceof Choice)
            options.addAll(((Choice) extra).options);
        else
            options.add(extra);
        return new Choice(options);
    }

    /* rulename = ALPHA *(ALPHA / DIGIT / "-") */
    private String ruleName() throws GrammarParseException {
        final int start = pos;
        if (atEnd() || !isAlpha(peek()))
            throw error(pos, "expected rule name");
        pos++;
        while (!atEnd() && (isAlpha(peek()) || isDigit(peek())
            || peek() == '-'))
            pos++;
        return text.substring(start, pos);
    }

    /* alternation = concatenation *(*c-wsp "/" *c-wsp concatenation) */
    private Node alternation() throws GrammarParseException {
        List<Node> options = new ArrayList<>();
        options.add(concatenation());
        for (;;) {
            final int mark = pos;
            skipCwsp();
            if (!consume('/')) {
                pos = mark;
                break;
            }
            skipCwsp();
            options.add(concatenation());
        }
        if (options.size() == 1) return options.get(0);
        return new Choice(options);
    }

    /* concatenation = repetition *(1*c-wsp repetition) */
    private Node concatenation() throws GrammarParseException {
        List<Node> parts = new ArrayList<>();
        parts.add(repetition());
        for (;;) {
            final int mark = pos;
            if (!skipCwsp() || atEnd() || !startsElement(peek())) {
                pos = mark;
                break;
            }
            parts.add(repetition());
        }
        if (parts.size() == 1) return parts.get(0);
        return new Sequence(parts);
    }

    private static boolean startsElement(int c) {
        return isAlpha(c) || isDigit(c) || c == '*' || c == '(' || c == '['
            || c == '"' || c == '%' || c == '<';
    }

    /* repetition = [repeat] element; repeat = 1*DIGIT / (*DIGIT "*"
     * *DIGIT) */
    private Node repetition() throws GrammarParseException {
        final int start = pos;
        Integer min = digits(10);
        if (consume('*')) {
            Integer max = digits(10);
            int lo = min == null ? 0 : min;
            if (max != null && lo > max)
                throw error(start, "repetition minimum " + lo
                    + " exceeds maximum " + max);
            return new Repeat(element(), lo, max);
        }
        if (min != null) return new Repeat(element(), min, min);
        return element();
    }

    /* element = rulename / group / option / char-val / num-val /
     * prose-val */
    private Node element() throws GrammarParseException {
        if (atEnd()) throw error(pos, "unexpected end of grammar");
        final int c = peek();
        if (isAlpha(c)) {
            final int start = pos;
            String name = ruleName();
            references.add(new Object[] { name, start });
            return new RuleRef(name);
        }
        switch (c) {
        case '(': {
            pos++;
            skipCwsp();
            Node body = alternation();
            skipCwsp();
            expect(')');
            return body;
        }
        case '[': {
            pos++;
            skipCwsp();
            Node body = alternation();
            skipCwsp();
            expect(']');
            return new Option(body);
        }
        case '"':
            return quoted(false);
        case '%':
            return percent();
        case '<':
            throw error(pos, "prose values cannot be translated");
        default:
            throw error(pos, "unexpected '" + (char) c + "'");
        }
    }

    private Node percent() throws GrammarParseException {
        final int start = pos;
        pos++;
        if (atEnd()) throw error(start, "incomplete % value");
        final int c = Character.toLowerCase(peek());
        switch (c) {
        case 's':
            pos++;
            return quoted(true);
        case 'i':
            pos++;
            return quoted(false);
        case 'b':
            pos++;
            return numeric(2, start);
        case 'd':
            pos++;
            return numeric(10, start);
        case 'x':
            pos++;
            return numeric(16, start);
        default:
            throw error(start, "unknown % value type '" + (char) peek()
                + "'");
        }
    }

    /* char-val = DQUOTE *(%x20-21 / %x23-7E) DQUOTE */
    private Node quoted(boolean caseSensitive) throws GrammarParseException {
        final int start = pos;
        expect('"');
        StringBuilder value = new StringBuilder();
        for (;;) {
            if (atEnd() || atNewline())
                throw error(start, "unterminated string");
            char c = text.charAt(pos++);
            if (c == '"') break;
            value.append(c);
        }
        return Terminal.text(value.toString(), caseSensitive);
    }

    /* num-val body: 1*DIGIT [ 1*("." 1*DIGIT) / ("-" 1*DIGIT) ] */
    private Node numeric(int radix, int start) throws GrammarParseException {
        int first = codePoint(radix, start);
        if (consume('-')) {
            int last = codePoint(radix, start);
            if (first > last)
                throw error(start, "inverted range");
            return Terminal.range(first, last);
        }
        StringBuilder value = new StringBuilder();
        value.appendCodePoint(first);
        while (consume('.'))
            value.appendCodePoint(codePoint(radix, start));
        return Terminal.text(value.toString(), true);
    }

    private int codePoint(int radix, int start) throws GrammarParseException {
        final int here = pos;
        Integer value = digits(radix);
        if (value == null) throw error(here, "expected base-" + radix
            + " digits");
        if (!Character.isValidCodePoint(value))
            throw error(start, "code point out of range: " + value);
        return value;
    }

    private Integer digits(int radix) throws GrammarParseException {
        final int start = pos;
        while (!atEnd() && Character.digit(peek(), radix) >= 0)
            pos++;
        if (pos == start) return null;
        try {
            return Integer.valueOf(text.substring(start, pos), radix);
        } catch (NumberFormatException ex) {
            throw error(start, "number too large");
        }
    }

    /**
     * Skip comments, whitespace and line breaks followed by whitespace.
     *
     * @return {@code true} if anything was skipped
     */
    private boolean skipCwsp() {
        final int start = pos;
        for (;;) {
            skipWhite();
            int mark = pos;
            if (!atEnd() && peek() == ';') {
                while (!atEnd() && !atNewline())
                    pos++;
            }
            if (atNewline()) {
                int afterNewline = pos + newlineLength();
                if (afterNewline < text.length()
                    && isWhite(text.charAt(afterNewline))) {
                    pos = afterNewline;
                    continue;
                }
                if (pos != mark) {
                    /* Keep the comment consumed, but leave the line
                     * break for the rule to end on. */
                    break;
                }
            }
            break;
        }
        return pos != start;
    }

    private void skipWhite() {
        while (!atEnd() && isWhite(peek()))
            pos++;
    }

    private void skipToNextLine() {
        while (!atEnd() && !atNewline())
            pos++;
        if (!atEnd()) pos += newlineLength();
    }

    private boolean atNewline() {
        if (atEnd()) return false;
        char c = text.charAt(pos);
        return c == '\n' || c == '\r';
    }

    private int newlineLength() {
        if (text.charAt(pos) == '\r' && pos + 1 < text.length()
            && text.charAt(pos + 1) == '\n') return 2;
        return 1;
    }

    private static boolean isWhite(int c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private int peek() {
        return text.charAt(pos);
    }

    private boolean consume(char c) {
        if (atEnd() || text.charAt(pos) != c) return false;
        pos++;
        return true;
    }

    private void expect(char c) throws GrammarParseException {
        if (!consume(c)) throw error(pos, "expected '" + c + "'");
    }

    private GrammarParseException error(int at, String message) {
        int line = 1, column = 1;
        for (int i = 0; i < at && i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
        }
        return new GrammarParseException(line, column, message);
    }
}
