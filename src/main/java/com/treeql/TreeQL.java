package com.treeql;

import com.treeql.json.JsonNode;
import com.treeql.json.JsonTreeParser;
import com.treeql.output.OutputFormatter;
import com.treeql.statement.StatementCodec;
import com.treeql.update.ChangeRecord;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;

@Command(name = "treeql", mixinStandardHelpOptions = true, version = "1.0",
         description = "Select from, update and test JSON documents with declarative statements")
public class TreeQL implements Callable<Integer> {

    enum Mode { SELECT, UPDATE, PROJECT, MATCH }

    @Parameters(index = "0", description = "One of: ${COMPLETION-CANDIDATES}")
    private Mode mode;

    @Parameters(index = "1", description = "The statement as JSON, or a projection path for 'project'")
    private String statement;

    @Parameters(index = "2", arity = "0..1", description = "Input JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-r", "--raw-output"}, description = "Output raw strings, not JSON texts")
    private boolean rawOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = "--changes", description = "For 'update', print the change record instead of the document")
    private boolean printChanges = false;

    private final InputStream in;
    private final PrintStream out;

    public TreeQL() {
        this(System.in, System.out);
    }

    TreeQL(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new TreeQL()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(TreeQL app) {
        return new CommandLine(app).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws Exception {
        try {
            JsonTreeParser jsonParser = new JsonTreeParser();
            StatementCodec codec = new StatementCodec();

            JsonNode data;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : in) {
                data = jsonParser.parse(input);
            }

            JsonNode result = switch (mode) {
                case SELECT -> TreeQuery.select(data, codec.decodeSelect(jsonParser.parse(statement)));
                case PROJECT -> TreeQuery.selectByPath(data, statement);
                case MATCH -> JsonNode.of(TreeQuery.evaluatePredicate(data, codec.decodePredicate(jsonParser.parse(statement))));
                case UPDATE -> {
                    var changes = TreeQuery.update(data, codec.decodeUpdate(jsonParser.parse(statement)));
                    yield printChanges ? changes.map(ChangeRecord::toJson).orElse(JsonNode.JsonObject.empty()) : data;
                }
            };

            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);
            if (rawOutput && result instanceof JsonNode.JsonString s) {
                out.println(s.value());
            } else {
                out.println(formatter.format(result));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
