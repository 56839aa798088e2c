package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Control/test comparison of labelled rows, written as a single CSV table with the averages of
 * both images and their difference.
 */
@CommandLine.Command(name = "rows",
    mixinStandardHelpOptions = true,
    header = "Compare control and test photographs row by row",
    description = "Each --row is LABEL=CONTROL,TEST. Either image may be left empty; such a row is "
                  + "reported without a difference.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: report written",
        "1: an image could not be analyzed or the report could not be written"
    })
public class RowReportCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(RowReportCommand.class);

    @CommandLine.Option(names = {"--row", "-r"}, required = true,
        description = "LABEL=CONTROL,TEST (repeatable, in report order)")
    private List<String> rows = new ArrayList<>();

    @CommandLine.Option(names = {"--output", "-o"}, required = true,
        description = "Report file; .csv is appended when missing")
    private Path output;

    @CommandLine.Option(names = {"--skip-failed"},
        description = "Report an image that fails to decode as missing instead of aborting")
    private boolean skipFailed;

    @CommandLine.Mixin
    private ConversionOptions conversion = new ConversionOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        List<RowSpec> specs = new ArrayList<>(rows.size());
        for (String row : rows) {
            specs.add(parseRow(row));
        }
        Path destination = withCsvExtension(output);
        FailurePolicy policy = skipFailed ? FailurePolicy.SKIP : FailurePolicy.ABORT;
        try {
            LabReportPipeline pipeline = new LabReportPipeline(conversion.toSettings());
            pipeline.generateRowReport(specs, destination, policy);
            System.out.printf("Wrote %s%n", destination);
            return 0;
        } catch (IOException | ColorProfileException | EmptyHistogramException e) {
            logger.error("Row report failed: {}", e.getMessage());
            logger.debug("Failure detail", e);
            return 1;
        }
    }

    RowSpec parseRow(String value) {
        int eq = value.indexOf('=');
        int comma = value.lastIndexOf(',');
        if (eq < 0 || comma < eq) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Invalid --row '" + value + "', expected LABEL=CONTROL,TEST");
        }
        String label = value.substring(0, eq).trim();
        return new RowSpec(label, pathOrNull(value.substring(eq + 1, comma)), pathOrNull(value.substring(comma + 1)));
    }

    private static Path pathOrNull(String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : Path.of(trimmed);
    }

    static Path withCsvExtension(Path output) {
        String name = output.getFileName().toString();
        return name.toLowerCase(Locale.ROOT).endsWith(".csv") ? output : output.resolveSibling(name + ".csv");
    }
}
