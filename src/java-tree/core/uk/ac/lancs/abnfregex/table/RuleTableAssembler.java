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
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import uk.ac.lancs.abnfregex.regex.Element;
import uk.ac.lancs.abnfregex.regex.Reference;
import uk.ac.lancs.abnfregex.regex.Transformer;
import uk.ac.lancs.abnfregex.regex.Visitor;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Assembles translated rules into a table. Rules are renamed to valid
 * identifiers, and ordered so that each follows the rules it
 * references.
 * 
 * @author simpsons
 */
public final class RuleTableAssembler {
    private RuleTableAssembler() {}

    @Detail(ShadowLevel.FINE)
    private interface Logger extends FormattedLogger {
        @Format("rule %s renamed to %s")
        void renamed(String name, String identifier);

        @Format("rule order: %s")
        void ordered(Collection<String> identifiers);

        @Detail(ShadowLevel.WARNING)
        @Format("cycle through rule %s")
        void cycle(String name);
    }

    private static final Logger logger = FormattedLogger
        .get(RuleTableAssembler.class.getName(), Logger.class);

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");

    private static final Set<String> RESERVED =
        new HashSet<>(Arrays.asList("_", "abstract", "assert", "boolean",
                                    "break", "byte", "case", "catch",
                                    "char", "class", "const", "continue",
                                    "default", "do", "double", "else",
                                    "enum", "extends", "false", "final",
                                    "finally", "float", "for", "goto", "if",
                                    "implements", "import", "instanceof",
                                    "int", "interface", "long", "native",
                                    "new", "null", "package", "private",
                                    "protected", "public", "return",
                                    "short", "static", "strictfp", "super",
                                    "switch", "synchronized", "this",
                                    "throw", "throws", "transient", "true",
                                    "try", "void", "volatile", "while"));

    /**
     * Assemble rules into a table.
     * 
     * @param rules the rules' expressions indexed by original name, in
     * definition order
     * 
     * @return the assembled table
     * 
     * @throws DependencyCycleException if the rules refer to each other
     * cyclically
     * 
     * @throws IllegalStateException if a rule refers to a name not in
     * the map
     */
    public static RuleTable assemble(Map<String, Element> rules)
        throws DependencyCycleException {
        Map<String, String> identifiers = identify(rules.keySet());
        Map<String, Element> renamed = rename(rules, identifiers);
        List<String> order = sort(graph(renamed), identifiers);
        logger.ordered(order);

        Map<String, Element> ordered = new LinkedHashMap<>();
        for (String id : order)
            ordered.put(id, renamed.get(id));
        return new RuleTable(ordered, identifiers);
    }

    /**
     * Choose a distinct identifier for each name. An identifier is the
     * lower-case name, with characters other than ASCII letters, digits
     * and underscores replaced by underscores. Numeric suffixes resolve
     * collisions, including with Java's reserved words.
     * 
     * @param names the names to identify
     * 
     * @return a map from each name to its identifier
     */
    public static Map<String, String> identify(Collection<String> names) {
        Map<String, String> result = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>(RESERVED);
        for (String name : names) {
            String base = UNSAFE.matcher(name.toLowerCase(Locale.ROOT))
                .replaceAll("_");
            String cand = base;
            for (int i = 1; taken.contains(cand); i++)
                cand = base + i;
            taken.add(cand);
            result.put(name, cand);
            logger.renamed(name, cand);
        }
        return result;
    }

    private static Map<String, Element>
        rename(Map<String, Element> rules, Map<String, String> identifiers) {
        Transformer renamer = new Transformer() {
            @Override
            protected Element transformReference(Reference element) {
                String id = identifiers.get(element.name);
                if (id == null)
                    throw new IllegalStateException("unmapped reference: "
                        + element.name);
                return Reference.of(id);
            }
        };
        Map<String, Element> result = new LinkedHashMap<>();
        for (Map.Entry<String, Element> entry : rules.entrySet())
            result.put(identifiers.get(entry.getKey()),
                       renamer.transform(entry.getValue()));
        return result;
    }

    /**
     * List the names referenced by an expression.
     * 
     * @param element the expression to search
     * 
     * @return the referenced names in order of first occurrence
     */
    public static List<String> references(Element element) {
        Set<String> result = new LinkedHashSet<>();
        new Visitor() {
            @Override
            protected void visitReference(Reference element) {
                result.add(element.name);
            }
        }.visit(element);
        return new ArrayList<>(result);
    }

    private static Map<String, List<String>>
        graph(Map<String, Element> rules) {
        Map<String, List<String>> result = new TreeMap<>();
        for (Map.Entry<String, Element> entry : rules.entrySet())
            result.put(entry.getKey(), references(entry.getValue()));
        return result;
    }

    private enum Mark {
        IN_PROGRESS, DONE;
    }

    private static List<String> sort(Map<String, List<String>> graph,
                                     Map<String, String> identifiers)
        throws DependencyCycleException {
        Map<String, String> names = new TreeMap<>();
        for (Map.Entry<String, String> entry : identifiers.entrySet())
            names.put(entry.getValue(), entry.getKey());

        List<String> trace = new ArrayList<>(graph.size());
        Map<String, Mark> marks = new TreeMap<>();
        List<String> path = new ArrayList<>();
        for (String id : graph.keySet())
            visit(id, graph, marks, path, trace, names);
        return trace;
    }

    private static void visit(String id, Map<String, List<String>> graph,
                              Map<String, Mark> marks, List<String> path,
                              List<String> trace, Map<String, String> names)
        throws DependencyCycleException {
        Mark mark = marks.get(id);
        if (mark == Mark.DONE) return;
        if (mark == Mark.IN_PROGRESS) {
            List<String> cycle = new ArrayList<>();
            for (String step : path.subList(path.indexOf(id), path.size()))
                cycle.add(names.get(step));
            cycle.add(names.get(id));
            logger.cycle(names.get(id));
            throw new DependencyCycleException(names.get(id), cycle);
        }

        marks.put(id, Mark.IN_PROGRESS);
        path.add(id);
        for (String dep : graph.get(id))
            visit(dep, graph, marks, path, trace, names);
        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);

        /* Each rule finishes after everything it references. */
        trace.add(id);
    }
}
