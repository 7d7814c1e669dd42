package com.tdtl;

import com.tdtl.json.JsonPatcher;
import com.tdtl.json.JsonValueParser;
import com.tdtl.json.JsonWriter;
import com.tdtl.value.Node;
import com.tdtl.value.Nodes;
import com.tdtl.value.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "tdtl", mixinStandardHelpOptions = true, version = "1.0",
         description = "Inspect value coercions and JSON partial updates",
         subcommands = {Tdtl.Convert.class, Tdtl.Update.class})
public class Tdtl implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(Tdtl.class);

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    // @file arguments are read by the update command itself
    static CommandLine commandLine() {
        return new CommandLine(new Tdtl())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExpandAtFiles(false);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Reads {@code text} as a JSON value, or as a plain string when {@code asString} is set.
     * Objects and arrays keep their text as written.
     */
    static Node readNode(String text, boolean asString) throws IOException {
        if (asString) {
            return new Node.StringNode(text);
        }
        Object decoded = new JsonValueParser().parse(text);
        if (decoded instanceof Map || decoded instanceof List) {
            return new Node.JsonNode(text.strip());
        }
        return Nodes.of(decoded);
    }

    @Command(name = "convert", mixinStandardHelpOptions = true,
             description = "Convert a value to another type and print its canonical text")
    static class Convert implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "The value, as JSON unless --string is given")
        private String value;

        @Option(names = {"-t", "--to"}, required = true,
                description = "Target type: ${COMPLETION-CANDIDATES}")
        private Type target;

        @Option(names = {"-s", "--string"}, description = "Take the value as a plain string")
        private boolean asString = false;

        @Option(names = {"--type"}, description = "Print the resulting type before the value")
        private boolean printType = false;

        @Option(names = {"-d", "--decoded"}, description = "Print the decoded value as indented JSON")
        private boolean decoded = false;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            try {
                Node result = readNode(value, asString).to(target);
                if (result.type() == Type.UNDEFINED) {
                    err.println("undefined");
                    return 2;
                }
                String text = decoded ? new JsonWriter(true).write(result.value()) : result.toString();
                out.println(printType ? result.type() + " " + text : text);
                return 0;
            } catch (Exception e) {
                LOG.debug("convert failed", e);
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "update", mixinStandardHelpOptions = true,
             description = "Replace the value of a top-level key in a JSON object")
    static class Update implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "The JSON object, or @file to read it from a file")
        private String document;

        @Parameters(index = "1", description = "Top-level key; empty to replace the whole document")
        private String key;

        @Parameters(index = "2", description = "The new value, as JSON unless --string is given")
        private String value;

        @Option(names = {"-s", "--string"}, description = "Take the new value as a plain string")
        private boolean asString = false;

        @Option(names = {"-u", "--upsert"}, description = "Append the key when it is missing")
        private boolean upsert = false;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            try {
                String source = document.startsWith("@")
                    ? Files.readString(Path.of(document.substring(1)), StandardCharsets.UTF_8)
                    : document;
                Node replacement = readNode(value, asString);
                String updated = upsert
                    ? JsonPatcher.upsert(source, key, replacement)
                    : JsonPatcher.update(source, key, replacement);
                out.println(updated);
                return 0;
            } catch (Exception e) {
                LOG.debug("update failed", e);
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }
}
