package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Generate CIELAB histograms and average values for pre-op and post-op photographs.
 * <p>
 * Writes {@code <output>.csv} with the raw per-bin histogram counts of every image and
 * {@code <output>_summary.csv} with the average L*, a*, b* of each image and the difference
 * between each post-op image and the pre-op image of the same side.
 */
@CommandLine.Command(name = "lab-report",
    mixinStandardHelpOptions = true,
    header = "Generate CIELAB histograms and average values for a set of photographs",
    description = "Intended for pre-op and post-op photographs of the same subject; the averages may be "
                  + "compared to quantify color change such as bilateral bruising. Works with a single "
                  + "photograph or a complete set of pre and post-op photographs.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: report written",
        "1: an image could not be analyzed or a report file could not be written"
    },
    subcommands = {RowReportCommand.class})
public class LabReportCli implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(LabReportCli.class);

    @CommandLine.Option(names = {"--preop-left", "-p"}, description = "Left-side pre-op photograph")
    private Path preopLeft;

    @CommandLine.Option(names = {"--output", "-o"},
        description = "Name to use for the output files. Should not include a file extension")
    private Path output;

    @CommandLine.Option(names = {"--preop-right"}, description = "Right-side pre-op photograph")
    private Path preopRight;

    @CommandLine.Option(names = {"--postop-left"}, arity = "1..*",
        description = "Left-side post-op photographs. Keep the order consistent with --postop-right")
    private List<Path> postopLeft = new ArrayList<>();

    @CommandLine.Option(names = {"--postop-right"}, arity = "1..*",
        description = "Right-side post-op photographs. Keep the order consistent with --postop-left")
    private List<Path> postopRight = new ArrayList<>();

    @CommandLine.Mixin
    private ConversionOptions conversion = new ConversionOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new LabReportCli())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        // required here rather than on the options so the rows subcommand can run without them
        if (preopLeft == null || output == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Missing required options: --preop-left and --output");
        }
        try {
            LabReportPipeline pipeline = new LabReportPipeline(conversion.toSettings());
            BilateralDataset dataset = new BilateralDataset(preopLeft, preopRight, postopLeft, postopRight);
            List<Path> written = pipeline.generateReport(dataset, output);
            for (Path p : written) {
                System.out.printf("Wrote %s%n", p);
            }
            return 0;
        } catch (IOException | ColorProfileException | EmptyHistogramException e) {
            logger.error("Report generation failed: {}", e.getMessage());
            logger.debug("Failure detail", e);
            return 1;
        }
    }
}
