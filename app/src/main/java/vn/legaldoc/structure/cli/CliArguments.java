package vn.legaldoc.structure.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import vn.legaldoc.structure.config.LogFormat;
import vn.legaldoc.structure.parse.Dialect;

@CommandLine.Command(name = "legal-structure-parser", mixinStandardHelpOptions = true,
        description = "Extracts the Part/Chapter/Section/Article/Clause/Point tree from Vietnamese legal HTML")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "INPUT", description = "HTML files or directories to parse")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--output-dir", description = "Directory for the JSON results", paramLabel = "DIR")
    private String outputDirectory;

    @CommandLine.Option(names = "--doc-type", description = "Declared document type, e.g. \"Nghị định\" or \"Chỉ thị\"", paramLabel = "TYPE")
    private String documentType;

    @CommandLine.Option(names = "--dialect", description = "Force a dialect: hierarchical, decision, directive or plan", converter = DialectConverter.class)
    private Dialect dialect;

    @CommandLine.Option(names = "--title", description = "Document title used for every input", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--threads", description = "Number of documents parsed in parallel", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print the JSON output")
    private boolean prettyPrint;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-document parse details")
    private boolean verbose;

    public List<Path> inputs() {
        return inputs == null ? List.of() : List.copyOf(inputs);
    }

    public String outputDirectory() {
        return outputDirectory;
    }

    public String documentType() {
        return documentType;
    }

    public Dialect dialect() {
        return dialect;
    }

    public String title() {
        return title;
    }

    public Integer threads() {
        return threads;
    }

    public boolean prettyPrint() {
        return prettyPrint;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
