package com.jcss;

import com.jcss.json.NodeJsonReader;
import com.jcss.json.NodeJsonWriter;
import com.jcss.node.Node;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "jcss", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse CSS and print it back or dump its syntax tree")
public class JCSS implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Input file (default: stdin)")
    private File inputFile;

    @Option(names = "--from", description = "Source label for error messages (default: input file name)")
    private String from;

    @Option(names = {"-a", "--ast"}, description = "Print the syntax tree as JSON")
    private boolean ast = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-j", "--json-input"}, description = "Read a JSON syntax tree instead of CSS")
    private boolean jsonInput = false;

    private final InputStream stdin;

    public JCSS() {
        this(System.in);
    }

    JCSS(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JCSS()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            Node tree;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : stdin) {
                if (jsonInput) {
                    tree = new NodeJsonReader().read(input);
                } else {
                    String label = from != null ? from : inputFile != null ? inputFile.getName() : null;
                    tree = Css.parse(new String(input.readAllBytes(), StandardCharsets.UTF_8), label);
                }
            }

            if (ast) {
                spec.commandLine().getOut().println(new NodeJsonWriter(!compactOutput).write(tree));
            } else {
                spec.commandLine().getOut().print(Css.stringify(tree));
            }
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException | RuntimeException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
