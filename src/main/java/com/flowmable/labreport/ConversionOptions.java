package com.flowmable.labreport;

import picocli.CommandLine;

/**
 * Conversion and rounding options shared by the report commands.
 */
public class ConversionOptions {

    @CommandLine.Option(names = {"--illuminant"},
        description = "Reference white of the Lab conversion: A, D50, D55, D65, D75 or E (default: ${DEFAULT-VALUE})",
        defaultValue = "D65")
    String illuminant;

    @CommandLine.Option(names = {"--threads"},
        description = "Images analyzed in parallel (default: number of processors)")
    Integer threads;

    @CommandLine.Option(names = {"--rounding"},
        description = "FINAL_VALUES rounds averages and deltas independently; AVERAGES_FIRST rounds averages "
                      + "before differencing (default: ${DEFAULT-VALUE})",
        defaultValue = "FINAL_VALUES")
    RoundingPolicy rounding;

    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    CommandLine.Model.CommandSpec mixee;

    /**
     * @throws ColorProfileException for an unknown illuminant
     * @throws CommandLine.ParameterException for a thread count below one
     */
    ReportSettings toSettings() {
        if (threads != null && threads < 1) {
            throw new CommandLine.ParameterException(mixee.commandLine(),
                "--threads must be at least 1, got " + threads);
        }
        ReportSettings settings = ReportSettings.DEFAULT
            .withWhitePoint(WhitePoint.named(illuminant))
            .withRoundingPolicy(rounding);
        if (threads != null) {
            settings = settings.withWorkerThreads(threads);
        }
        return settings;
    }
}
