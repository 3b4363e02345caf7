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

package uk.ac.lancs.abnfregex.apps;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.logging.LogManager;

import uk.ac.lancs.abnfregex.Mode;
import uk.ac.lancs.abnfregex.Translation;
import uk.ac.lancs.abnfregex.grammar.AbnfParser;
import uk.ac.lancs.abnfregex.grammar.Grammar;
import uk.ac.lancs.abnfregex.grammar.GrammarParseException;
import uk.ac.lancs.abnfregex.render.JavaTableFormatter;
import uk.ac.lancs.abnfregex.render.JsonTableFormatter;
import uk.ac.lancs.abnfregex.render.TableFormatter;
import uk.ac.lancs.abnfregex.render.TableLayout;
import uk.ac.lancs.abnfregex.table.DependencyCycleException;
import uk.ac.lancs.abnfregex.translate.UnsupportedGrammarException;
import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Translates an ABNF grammar file into a regular expression, or into a
 * table of regular expressions.
 * 
 * @author simpsons
 */
public final class AbnfToRegex {
    @Detail(ShadowLevel.INFO)
    private interface Logger extends FormattedLogger {
        @Format("reading grammar from %s")
        void reading(Path path);

        @Format("writing %s output to %s")
        void writing(Mode mode, Object dest);

        @Detail(ShadowLevel.CONFIG)
        @Format("mode %s, format %s, layout %s")
        void settings(Mode mode, String format, TableLayout layout);
    }

    private static final Logger logger =
        FormattedLogger.get(AbnfToRegex.class.getName(), Logger.class);

    /**
     * The prefix of all configuration keys
     */
    public static final String CONFIG_PREFIX = "abnf2regex";

    /**
     * The class-path resource holding default settings
     */
    public static final String DEFAULTS_RESOURCE = "abnf2regex.properties";

    /**
     * The class-path resource holding the logging configuration, used
     * unless one is specified by system property
     */
    public static final String LOGGING_RESOURCE =
        "abnf2regex-logging.properties";

    /**
     * Exit status on success
     */
    public static final int EXIT_OK = 0;

    /**
     * Exit status when the grammar could not be read or translated
     */
    public static final int EXIT_FAILURE = 1;

    /**
     * Exit status when the command line is invalid
     */
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "abnf-to-regex -i <grammar>"
        + " [-o <output>] [-f single-regexp|nested] [--format java|json]"
        + " [-c <config.properties>]";

    private final PrintStream out;
    private final PrintStream err;

    private Path input = null;
    private Path output = null;
    private Path configFile = null;
    private String modeText = null;
    private String formatText = null;
    private boolean help = false;
    private String usage = null;

    AbnfToRegex(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    private boolean process(Iterator<? extends String> iter) {
        usage = null;
        final String arg = iter.next();

        if ("-i".equals(arg) || "--input".equals(arg)) {
            usage = arg + " <grammar>";
            input = Paths.get(iter.next());
            return true;
        }

        if ("-o".equals(arg) || "--output".equals(arg)) {
            usage = arg + " <output>";
            output = Paths.get(iter.next());
            return true;
        }

        if ("-f".equals(arg) || "--mode".equals(arg)) {
            usage = arg + " single-regexp|nested";
            modeText = iter.next();
            return true;
        }

        if ("--format".equals(arg)) {
            usage = arg + " java|json";
            formatText = iter.next();
            return true;
        }

        if ("-c".equals(arg) || "--config".equals(arg)) {
            usage = arg + " <config.properties>";
            configFile = Paths.get(iter.next());
            return true;
        }

        if ("-h".equals(arg) || "--help".equals(arg)) {
            help = true;
            return true;
        }

        err.printf("Unknown argument: %s%n", arg);
        return false;
    }

    /**
     * Run the translator.
     * 
     * @param args the command-line arguments
     * 
     * @return the exit status
     */
    int run(String[] args) {
        try {
            for (Iterator<String> iter = Arrays.asList(args).iterator(); iter
                .hasNext();) {
                if (!process(iter)) {
                    err.printf("Usage: %s%n", USAGE);
                    return EXIT_USAGE;
                }
            }
        } catch (NoSuchElementException ex) {
            err.printf("Usage: %s%n", usage);
            return EXIT_USAGE;
        }
        if (help) {
            out.printf("Usage: %s%n", USAGE);
            return EXIT_OK;
        }
        if (input == null) {
            err.printf("No grammar specified%nUsage: %s%n", USAGE);
            return EXIT_USAGE;
        }

        final Configuration config;
        try {
            config = loadConfiguration(configFile).subview(CONFIG_PREFIX);
        } catch (IOException ex) {
            err.printf("Cannot read configuration %s: %s%n", configFile,
                       ex.getMessage());
            return EXIT_FAILURE;
        }

        final Mode mode;
        final TableFormatter formatter;
        try {
            mode = Mode.forLabel(modeText != null ? modeText
                : config.get("mode", Mode.SINGLE_REGEXP.label));
            String format =
                formatText != null ? formatText : config.get("format", "java");
            TableLayout layout = TableLayout.from(config.subview("table"));
            formatter = formatter(format, layout);
            logger.settings(mode, format, layout);
        } catch (IllegalArgumentException ex) {
            err.printf("%s%nUsage: %s%n", ex.getMessage(), USAGE);
            return EXIT_USAGE;
        }

        try {
            logger.reading(input);
            String text =
                new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            Grammar grammar = AbnfParser.parse(text);
            String result = Translation.render(grammar, mode, formatter);
            if (!result.endsWith("\n")) result += "\n";
            if (output == null) {
                logger.writing(mode, "standard output");
                out.print(result);
                out.flush();
            } else {
                logger.writing(mode, output);
                Files.write(output, result.getBytes(StandardCharsets.UTF_8));
            }
            return EXIT_OK;
        } catch (GrammarParseException | DependencyCycleException
            | UnsupportedGrammarException ex) {
            err.printf("%s: %s%n", input, ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            err.printf("I/O error: %s%n", ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static TableFormatter formatter(String name,
                                            TableLayout layout) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "java":
            return new JavaTableFormatter(layout);
        case "json":
            return new JsonTableFormatter();
        default:
            throw new IllegalArgumentException("unknown format: " + name);
        }
    }

    /**
     * Load configuration. Bundled defaults are overridden by system
     * properties with the configuration prefix, which are in turn
     * overridden by the configuration file, if specified.
     * 
     * @param file the configuration file, or {@code null} if none is
     * specified
     * 
     * @return the loaded configuration
     * 
     * @throws IOException if the defaults or file could not be read
     */
    static Configuration loadConfiguration(Path file) throws IOException {
        Properties defaults = new Properties();
        try (InputStream in = AbnfToRegex.class.getClassLoader()
            .getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) defaults.load(in);
        }

        Properties layered = new Properties(defaults);
        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames())
            if (key.startsWith(CONFIG_PREFIX + "."))
                layered.setProperty(key, system.getProperty(key));

        ConfigurationContext ctxt = new ConfigurationContext(layered);
        if (file == null) return ctxt.defaults();
        return ctxt.get(file);
    }

    /**
     * Translate an ABNF grammar file.
     * 
     * @param args The following switches are recognized:
     * 
     * <dl>
     * 
     * <dt><samp>-i <var>grammar</var></samp>
     * 
     * <dd>Read the grammar from the specified file. This is required.
     * 
     * <dt><samp>-o <var>output</var></samp>
     * 
     * <dd>Write the result to the specified file, rather than to
     * standard output.
     * 
     * <dt><samp>-f single-regexp|nested</samp>
     * 
     * <dd>Inline all rules into one expression for the first rule, or
     * produce a table of expressions, one per rule.
     * 
     * <dt><samp>--format java|json</samp>
     * 
     * <dd>Write tables as Java string constants, or as a JSON document.
     * 
     * <dt><samp>-c <var>config.properties</var></samp>
     * 
     * <dd>Read settings from the specified file. Keys are prefixed with
     * <samp>abnf2regex.</samp>, and include <samp>mode</samp>,
     * <samp>format</samp>, <samp>table.width</samp>,
     * <samp>table.indent</samp> and <samp>table.declaration</samp>.
     * 
     * </dl>
     * 
     * @throws IOException if the bundled logging configuration could
     * not be read
     */
    public static void main(String[] args) throws IOException {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = AbnfToRegex.class.getClassLoader()
                .getResourceAsStream(LOGGING_RESOURCE)) {
                if (in != null)
                    LogManager.getLogManager().readConfiguration(in);
            }
        }
        System.exit(new AbnfToRegex(System.out, System.err).run(args));
    }
}
