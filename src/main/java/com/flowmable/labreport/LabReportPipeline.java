package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level entry point for histogram reports.
 * <p>
 * 1. Analyze: decode, convert and average every image (in parallel, results kept in input order).
 * 2. Aggregate: pair post/test averages with their pre/control average.
 * 3. Write: the CSV tables.
 * <p>
 * Analysis results are cached by content hash for the lifetime of the pipeline.
 */
public class LabReportPipeline {

    private static final Logger logger = LogManager.getLogger(LabReportPipeline.class);

    private final ReportSettings settings;
    private final ColorSpaceConverter converter;
    private final RowAggregator aggregator;
    private final ReportWriter writer;
    private final ImageCache cache = new ImageCache();

    public LabReportPipeline() {
        this(ReportSettings.DEFAULT);
    }

    /**
     * @throws ColorProfileException if the configured white point has no valid transform
     */
    public LabReportPipeline(ReportSettings settings) {
        this(settings, new ColorSpaceConverter(settings.whitePoint()));
    }

    LabReportPipeline(ReportSettings settings, ColorSpaceConverter converter) {
        this.settings = settings;
        this.converter = converter;
        this.aggregator = new RowAggregator(settings);
        this.writer = new ReportWriter(settings);
    }

    public ReportSettings settings() {
        return settings;
    }

    public ImageCache cache() {
        return cache;
    }

    /**
     * Averages of a single image, rounded to the display precision.
     */
    public ChannelAverages convert(Path imageFile) throws ImageDecodeException {
        return analyzeImage(imageFile).averages().rounded(settings.averageDigits());
    }

    public AnalyzedImage analyzeImage(Path imageFile) throws ImageDecodeException {
        byte[] data = ColorSpaceConverter.readBytes(imageFile);
        String hash = ImageCache.contentHash(data);

        ImageCache.Entry entry = cache.getOrLoad(hash, imageFile.toString(), () -> {
            LabHistogram histogram = converter.histogram(data, imageFile.toString());
            ChannelAverages averages;
            try {
                averages = HistogramStatistics.averages(histogram);
            } catch (EmptyHistogramException e) {
                throw new EmptyHistogramException("Image has no pixels: " + imageFile, e);
            }
            logger.debug("Analyzed {}: L={} a={} b={}", imageFile, averages.l(), averages.a(), averages.b());
            return new ImageCache.Entry(histogram, averages);
        });
        return new AnalyzedImage(imageFile, hash, entry.histogram(), entry.averages());
    }

    /**
     * Analyze images concurrently. The result list matches the input order.
     *
     * @throws ImageDecodeException for the first image, in input order, that failed to decode
     */
    public List<AnalyzedImage> analyze(List<Path> imageFiles) throws ImageDecodeException {
        List<Outcome> outcomes = analyzeAll(imageFiles);
        List<AnalyzedImage> images = new ArrayList<>(outcomes.size());
        for (Outcome outcome : outcomes) {
            images.add(outcome.getOrThrow());
        }
        return images;
    }

    public BilateralImages analyze(BilateralDataset dataset) throws ImageDecodeException {
        // one batch so every image of the report shares the pool
        List<Path> all = new ArrayList<>();
        all.add(dataset.preLeft());
        if (dataset.preRight() != null) {
            all.add(dataset.preRight());
        }
        all.addAll(dataset.postLeft());
        all.addAll(dataset.postRight());

        List<AnalyzedImage> images = analyze(all);
        int i = 0;
        AnalyzedImage preLeft = images.get(i++);
        AnalyzedImage preRight = dataset.preRight() != null ? images.get(i++) : null;
        List<AnalyzedImage> postLeft = images.subList(i, i + dataset.postLeft().size());
        i += dataset.postLeft().size();
        List<AnalyzedImage> postRight = images.subList(i, i + dataset.postRight().size());
        return new BilateralImages(preLeft, preRight, postLeft, postRight);
    }

    /**
     * Analyze a bilateral dataset and write {@code <outputBase>.csv} and {@code <outputBase>_summary.csv}.
     *
     * @return the written files
     * @throws ImageDecodeException if any image fails; nothing is written
     * @throws ReportWriteException if a file cannot be written
     */
    public List<Path> generateReport(BilateralDataset dataset, Path outputBase) throws IOException {
        BilateralImages images = analyze(dataset);
        return writer.writeReport(images, outputBase);
    }

    public List<SummaryRow> summarize(BilateralDataset dataset) throws ImageDecodeException {
        return aggregator.summarize(analyze(dataset));
    }

    /**
     * Analyze simple-mode rows. Sides without a path stay absent.
     *
     * @param policy ABORT rethrows the first failure; SKIP logs it and leaves that side absent
     */
    public List<Row> analyzeRows(List<RowSpec> specs, FailurePolicy policy) throws ImageDecodeException {
        List<Path> paths = new ArrayList<>();
        for (RowSpec spec : specs) {
            if (spec.control() != null) paths.add(spec.control());
            if (spec.test() != null) paths.add(spec.test());
        }
        List<Outcome> outcomes = analyzeAll(paths);

        List<Row> rows = new ArrayList<>(specs.size());
        int i = 0;
        for (RowSpec spec : specs) {
            ChannelAverages control = spec.control() != null ? averagesOf(outcomes.get(i++), policy) : null;
            ChannelAverages test = spec.test() != null ? averagesOf(outcomes.get(i++), policy) : null;
            Row row = new Row(spec.label(), control, test);
            if (!row.isComplete()) {
                logger.warn("Row '{}' is incomplete; no delta will be reported", spec.label());
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Analyze rows and write the control/test table to {@code destination}.
     * The caller picks the destination, including its extension.
     */
    public Path generateRowReport(List<RowSpec> specs, Path destination, FailurePolicy policy) throws IOException {
        List<Row> rows = analyzeRows(specs, policy);
        writer.writeRowTable(rows, destination);
        return destination;
    }

    private static ChannelAverages averagesOf(Outcome outcome, FailurePolicy policy) throws ImageDecodeException {
        if (outcome.failure() != null && policy == FailurePolicy.SKIP) {
            logger.warn("Skipping {}: {}", outcome.path(), outcome.failure().getMessage());
            return null;
        }
        return outcome.getOrThrow().averages();
    }

    private List<Outcome> analyzeAll(List<Path> imageFiles) throws ImageDecodeException {
        List<Outcome> outcomes = new ArrayList<>(imageFiles.size());
        int threads = Math.min(settings.workerThreads(), imageFiles.size());
        if (threads <= 1) {
            for (Path p : imageFiles) {
                outcomes.add(analyzeCapturing(p));
            }
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        try {
            List<Future<Outcome>> futures = new ArrayList<>(imageFiles.size());
            for (Path p : imageFiles) {
                futures.add(pool.submit(() -> analyzeCapturing(p)));
            }
            // collect by submission index, not completion order
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    outcomes.add(new Outcome(imageFiles.get(i), null, e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ImageDecodeException(imageFiles.get(i).toString(), "Interrupted while analyzing image", e);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return outcomes;
    }

    private Outcome analyzeCapturing(Path p) {
        try {
            return new Outcome(p, analyzeImage(p), null);
        } catch (ImageDecodeException | RuntimeException e) {
            return new Outcome(p, null, e);
        }
    }

    private record Outcome(Path path, AnalyzedImage image, Throwable failure) {

        AnalyzedImage getOrThrow() throws ImageDecodeException {
            if (failure == null) {
                return image;
            }
            if (failure instanceof ImageDecodeException decode) {
                throw decode;
            }
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (failure instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure analyzing " + path, failure);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "lab-analyzer-" + pool + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
