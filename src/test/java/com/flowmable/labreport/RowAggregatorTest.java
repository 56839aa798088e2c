package com.flowmable.labreport;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RowAggregatorTest {

    private final RowAggregator aggregator = new RowAggregator();

    static AnalyzedImage image(String name, double l, double a, double b) {
        LabHistogram h = LabHistogram.builder()
                .add(ColorSpaceUtils.encodeLightness(l), ColorSpaceUtils.encodeChroma(a), ColorSpaceUtils.encodeChroma(b))
                .build();
        return new AnalyzedImage(Path.of(name), name, h, new ChannelAverages(l, a, b));
    }

    @Test
    void delta_ofIdenticalAverages_isZero() {
        ChannelAverages x = new ChannelAverages(61.234567, -3.5, 17.25);
        DeltaTriple d = aggregator.delta(x, x).orElseThrow();
        assertEquals(0.0, d.l());
        assertEquals(0.0, d.a());
        assertEquals(0.0, d.b());
    }

    @Test
    void delta_isTestMinusControl_roundedToThreeDigits() {
        ChannelAverages control = new ChannelAverages(50.0, 10.0, -5.0);
        ChannelAverages test = new ChannelAverages(52.12345, 8.0004, -4.9996);
        DeltaTriple d = aggregator.delta(control, test).orElseThrow();
        assertEquals(2.123, d.l(), 0.0);
        assertEquals(-2.0, d.a(), 0.0);
        assertEquals(0.0, d.b());
    }

    @Test
    void delta_missingSide_isAbsent() {
        ChannelAverages x = new ChannelAverages(1, 2, 3);
        assertEquals(Optional.empty(), aggregator.delta(null, x));
        assertEquals(Optional.empty(), aggregator.delta(x, null));
        assertEquals(Optional.empty(), aggregator.delta(new Row("only control", x, null)));
    }

    @Test
    void requireDelta_onIncompleteRow_throws() {
        Row row = new Row("Day 3", new ChannelAverages(1, 2, 3), null);
        IncompleteRowException e = assertThrows(IncompleteRowException.class, () -> aggregator.requireDelta(row));
        assertTrue(e.getMessage().contains("Day 3"));
    }

    @Test
    void roundingPolicy_changesDeltaOfUnroundedAverages() {
        ChannelAverages control = new ChannelAverages(10.004, 0, 0);
        ChannelAverages test = new ChannelAverages(10.016, 0, 0);

        RowAggregator finalValues = new RowAggregator(ReportSettings.DEFAULT);
        RowAggregator averagesFirst = new RowAggregator(
                ReportSettings.DEFAULT.withRoundingPolicy(RoundingPolicy.AVERAGES_FIRST));

        assertEquals(0.012, finalValues.delta(control, test).orElseThrow().l(), 0.0);
        assertEquals(0.02, averagesFirst.delta(control, test).orElseThrow().l(), 0.0);
    }

    @Test
    void summarize_preLeftOnly_singleRow() {
        BilateralImages images = new BilateralImages(image("pl", 55.556, 1.0, 2.0), null, List.of(), List.of());
        List<SummaryRow> rows = aggregator.summarize(images);

        assertEquals(1, rows.size());
        assertEquals(new SummaryRow(1, "Pre-op left-side", 55.56, 1.0, 2.0), rows.get(0));
    }

    @Test
    void summarize_fullBilateral_orderAndIds() {
        BilateralImages images = new BilateralImages(
                image("pl", 50, 10, 10),
                image("pr", 60, 20, 20),
                List.of(image("pl1", 51, 11, 9), image("pl2", 52, 12, 8)),
                List.of(image("pr1", 61, 19, 21), image("pr2", 62, 18, 22)));

        List<SummaryRow> rows = aggregator.summarize(images);

        assertEquals(1 + 2 * 2 + 1 + 2 * 2, rows.size());
        List<String> descriptions = rows.stream().map(SummaryRow::description).toList();
        assertEquals(List.of(
                "Pre-op left-side",
                "Post-op 1 left-side",
                "Difference Post-op 1 left-side vs Pre-op left side",
                "Post-op 2 left-side",
                "Difference Post-op 2 left-side vs Pre-op left side",
                "Pre-op right-side",
                "Post-op 1 right-side",
                "Difference Post-op 1 right-side vs Pre-op right side",
                "Post-op 2 right-side",
                "Difference Post-op 2 right-side vs Pre-op right side"
        ), descriptions);
        for (int i = 0; i < rows.size(); i++) {
            assertEquals(i + 1, rows.get(i).id());
        }
    }

    @Test
    void summarize_eachSideDiffersAgainstItsOwnPreImage() {
        BilateralImages images = new BilateralImages(
                image("pl", 50, 10, 10),
                image("pr", 70, -10, 30),
                List.of(image("pl1", 53, 12, 7)),
                List.of(image("pr1", 71, -12, 33)));

        List<SummaryRow> rows = aggregator.summarize(images);

        SummaryRow leftDelta = rows.get(2);
        assertEquals(3.0, leftDelta.avgL(), 0.0);
        assertEquals(2.0, leftDelta.avgA(), 0.0);
        assertEquals(-3.0, leftDelta.avgB(), 0.0);

        SummaryRow rightDelta = rows.get(5);
        assertEquals(1.0, rightDelta.avgL(), 0.0);
        assertEquals(-2.0, rightDelta.avgA(), 0.0);
        assertEquals(3.0, rightDelta.avgB(), 0.0);
    }

    @Test
    void summarize_rightPostWithoutRightPre_averagesOnly() {
        BilateralImages images = new BilateralImages(
                image("pl", 50, 10, 10),
                null,
                List.of(image("pl1", 51, 11, 9)),
                List.of(image("pr1", 61, 19, 21), image("pr2", 62, 18, 22)));

        List<SummaryRow> rows = aggregator.summarize(images);

        assertEquals(1 + 2 + 2, rows.size());
        assertEquals("Post-op 1 right-side", rows.get(3).description());
        assertEquals("Post-op 2 right-side", rows.get(4).description());
        assertEquals(5, rows.get(4).id());
    }

    @Test
    void summarize_identicalPrePost_zeroDelta() {
        AnalyzedImage same = image("same", 42.4242, -7.77, 3.3333);
        BilateralImages images = new BilateralImages(same, null, List.of(same), List.of());
        SummaryRow delta = aggregator.summarize(images).get(2);
        assertEquals(new SummaryRow(3, "Difference Post-op 1 left-side vs Pre-op left side", 0.0, 0.0, 0.0), delta);
    }
}
