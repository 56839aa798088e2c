package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes the CSV report artifacts.
 * <ul>
 *   <li>{@code <base>.csv}: raw histogram table, one line per bin 0–255, three columns per image</li>
 *   <li>{@code <base>_summary.csv}: {@code id,desc,avgL,avgA,avgB}</li>
 *   <li>row table for simple control/test mode</li>
 * </ul>
 * Each file is rendered in memory, written to a temporary sibling and moved over the target,
 * so a failed write never leaves a half-written target behind. Temporary files are created with
 * the default permissions of a new file, which the target keeps after the move.
 */
public class ReportWriter {

    private static final Logger logger = LogManager.getLogger(ReportWriter.class);

    static final String SUMMARY_SUFFIX = "_summary";
    static final String CSV = ".csv";
    static final List<String> SUMMARY_HEADER = List.of("id", "desc", "avgL", "avgA", "avgB");
    static final List<String> ROW_HEADER = List.of(
            "row_label",
            "control_L", "control_a", "control_b",
            "test_L", "test_a", "test_b",
            "delta_L", "delta_a", "delta_b");

    private final ReportSettings settings;
    private final RowAggregator aggregator;

    public ReportWriter() {
        this(ReportSettings.DEFAULT);
    }

    public ReportWriter(ReportSettings settings) {
        this.settings = settings;
        this.aggregator = new RowAggregator(settings);
    }

    /**
     * Write {@code <outputBase>.csv} and {@code <outputBase>_summary.csv}.
     * <p>
     * Both tables are staged before either target is replaced, so a failure while rendering or
     * staging leaves both targets untouched. Only a failure of the second rename can leave a
     * new raw table beside the previous summary.
     *
     * @param outputBase Destination without extension
     * @return the two files, raw table first
     * @throws ReportWriteException naming the file that failed
     */
    public List<Path> writeReport(BilateralImages images, Path outputBase) throws ReportWriteException {
        Path rawFile = sibling(outputBase, CSV);
        Path summaryFile = sibling(outputBase, SUMMARY_SUFFIX + CSV);
        List<Path> files = List.of(rawFile, summaryFile);
        writeAll(files, List.of(renderHistogramTable(images), renderSummaryTable(aggregator.summarize(images))));
        return files;
    }

    public void writeHistogramTable(BilateralImages images, Path file) throws ReportWriteException {
        write(file, renderHistogramTable(images));
    }

    String renderHistogramTable(BilateralImages images) {
        List<String> header = new ArrayList<>();
        List<LabHistogram> columns = new ArrayList<>();

        addSlot(header, columns, "pre_left", images.preLeft());
        if (images.preRight() != null) {
            addSlot(header, columns, "pre_right", images.preRight());
        }
        for (int i = 0; i < images.postLeft().size(); i++) {
            addSlot(header, columns, "post_left_" + i, images.postLeft().get(i));
        }
        for (int i = 0; i < images.postRight().size(); i++) {
            addSlot(header, columns, "post_right_" + i, images.postRight().get(i));
        }

        StringBuilder out = new StringBuilder();
        appendLine(out, header);
        List<String> line = new ArrayList<>(header.size());
        for (int bin = 0; bin < LabHistogram.BINS; bin++) {
            line.clear();
            for (LabHistogram h : columns) {
                for (Channel c : Channel.values()) {
                    line.add(Long.toString(h.count(c, bin)));
                }
            }
            appendLine(out, line);
        }
        return out.toString();
    }

    private static void addSlot(List<String> header, List<LabHistogram> columns, String slot, AnalyzedImage image) {
        for (Channel c : Channel.values()) {
            header.add(slot + "_" + c.suffix());
        }
        columns.add(image.histogram());
    }

    public void writeSummaryTable(List<SummaryRow> rows, Path file) throws ReportWriteException {
        write(file, renderSummaryTable(rows));
    }

    String renderSummaryTable(List<SummaryRow> rows) {
        StringBuilder out = new StringBuilder();
        appendLine(out, SUMMARY_HEADER);
        for (SummaryRow row : rows) {
            appendLine(out, List.of(
                    Integer.toString(row.id()),
                    row.description(),
                    formatNumber(row.avgL()),
                    formatNumber(row.avgA()),
                    formatNumber(row.avgB())));
        }
        return out.toString();
    }

    /**
     * Write the simple-mode table. A blank label becomes {@code Row n} (1-based position);
     * absent sides and deltas are empty fields.
     */
    public void writeRowTable(List<Row> rows, Path file) throws ReportWriteException {
        StringBuilder out = new StringBuilder();
        appendLine(out, ROW_HEADER);
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            String label = row.label().isBlank() ? "Row " + (i + 1) : row.label();
            List<String> line = new ArrayList<>(ROW_HEADER.size());
            line.add(label);
            addAverages(line, row.control());
            addAverages(line, row.test());

            Optional<DeltaTriple> delta = aggregator.delta(row);
            if (delta.isPresent()) {
                line.add(formatNumber(delta.get().l()));
                line.add(formatNumber(delta.get().a()));
                line.add(formatNumber(delta.get().b()));
            } else {
                logger.debug("Row '{}' is incomplete, delta left blank", label);
                line.add("");
                line.add("");
                line.add("");
            }
            appendLine(out, line);
        }
        write(file, out.toString());
    }

    private void addAverages(List<String> line, ChannelAverages averages) {
        if (averages == null) {
            line.add("");
            line.add("");
            line.add("");
            return;
        }
        ChannelAverages r = averages.rounded(settings.averageDigits());
        line.add(formatNumber(r.l()));
        line.add(formatNumber(r.a()));
        line.add(formatNumber(r.b()));
    }

    /**
     * Shortest plain decimal of a value: 100.0, 52.34, -0.5. Never scientific notation.
     */
    static String formatNumber(double value) {
        BigDecimal d = BigDecimal.valueOf(value).stripTrailingZeros();
        if (d.scale() < 1) {
            d = d.setScale(1);
        }
        return d.toPlainString();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    private static void appendLine(StringBuilder out, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) out.append(',');
            out.append(escape(fields.get(i)));
        }
        out.append('\n');
    }

    static Path sibling(Path base, String suffix) {
        return base.resolveSibling(base.getFileName() + suffix);
    }

    private static void write(Path file, String content) throws ReportWriteException {
        writeAll(List.of(file), List.of(content));
    }

    /**
     * Stage every file as a temporary sibling, then rename each over its target in order.
     * Nothing is renamed unless all files were staged.
     */
    private static void writeAll(List<Path> files, List<String> contents) throws ReportWriteException {
        Path[] staged = new Path[files.size()];
        int i = 0;
        try {
            for (; i < files.size(); i++) {
                Path file = files.get(i);
                if (Files.isDirectory(file)) {
                    throw new FileSystemException(file.toString(), null, "Target is a directory");
                }
                staged[i] = tempSibling(file);
                // new-file permissions; Files.createTempFile would make the report owner-only
                Files.writeString(staged[i], contents.get(i), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
            for (i = 0; i < files.size(); i++) {
                move(staged[i], files.get(i));
                staged[i] = null;
                logger.info("Wrote {}", files.get(i));
            }
        } catch (IOException e) {
            ReportWriteException failure = new ReportWriteException(files.get(i), e);
            for (Path tmp : staged) {
                if (tmp == null) continue;
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static Path tempSibling(Path file) {
        return file.resolveSibling("." + file.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private static void move(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
