package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns per-image averages into deltas and ordered summary rows.
 * <p>
 * Summary order: the left side entirely before the right. Per side, the pre-op average, then
 * for each post-op image its average immediately followed by its difference from the pre-op
 * average. A side without a pre-op image lists its post-op averages only.
 */
public class RowAggregator {

    private static final Logger logger = LogManager.getLogger(RowAggregator.class);

    private final ReportSettings settings;

    public RowAggregator() {
        this(ReportSettings.DEFAULT);
    }

    public RowAggregator(ReportSettings settings) {
        this.settings = settings;
    }

    /**
     * test − control per channel, rounded to the delta precision.
     *
     * @return empty if either side is null
     */
    public Optional<DeltaTriple> delta(ChannelAverages control, ChannelAverages test) {
        if (control == null || test == null) {
            return Optional.empty();
        }
        ChannelAverages c = control;
        ChannelAverages t = test;
        if (settings.roundingPolicy() == RoundingPolicy.AVERAGES_FIRST) {
            c = control.rounded(settings.averageDigits());
            t = test.rounded(settings.averageDigits());
        }
        int digits = settings.deltaDigits();
        return Optional.of(new DeltaTriple(
                HistogramStatistics.round(t.l() - c.l(), digits),
                HistogramStatistics.round(t.a() - c.a(), digits),
                HistogramStatistics.round(t.b() - c.b(), digits)));
    }

    public Optional<DeltaTriple> delta(Row row) {
        return delta(row.control(), row.test());
    }

    /**
     * Delta of a row that must have both sides.
     *
     * @throws IncompleteRowException if the row lacks a side
     */
    public DeltaTriple requireDelta(Row row) {
        return delta(row).orElseThrow(() -> new IncompleteRowException(row.label()));
    }

    /**
     * Build the summary table rows for a bilateral snapshot.
     */
    public List<SummaryRow> summarize(BilateralImages images) {
        List<SummaryRow> rows = new ArrayList<>();
        int id = 1;
        for (Side side : Side.values()) {
            String word = side.word();
            AnalyzedImage pre = images.pre(side);
            ChannelAverages preAvg = pre == null ? null : pre.averages();

            if (preAvg != null) {
                rows.add(averageRow(id++, "Pre-op " + word + "-side", preAvg));
            } else if (!images.post(side).isEmpty()) {
                logger.warn("No pre-op {} image; {} post-op {} image(s) reported without differences",
                        word, images.post(side).size(), word);
            }

            List<AnalyzedImage> posts = images.post(side);
            for (int i = 0; i < posts.size(); i++) {
                int n = i + 1;
                ChannelAverages postAvg = posts.get(i).averages();
                rows.add(averageRow(id++, "Post-op " + n + " " + word + "-side", postAvg));

                Optional<DeltaTriple> d = delta(preAvg, postAvg);
                if (d.isPresent()) {
                    DeltaTriple delta = d.get();
                    rows.add(new SummaryRow(id++,
                            "Difference Post-op " + n + " " + word + "-side vs Pre-op " + word + " side",
                            delta.l(), delta.a(), delta.b()));
                }
            }
        }
        return rows;
    }

    private SummaryRow averageRow(int id, String description, ChannelAverages averages) {
        ChannelAverages r = averages.rounded(settings.averageDigits());
        return new SummaryRow(id, description, r.l(), r.a(), r.b());
    }
}
