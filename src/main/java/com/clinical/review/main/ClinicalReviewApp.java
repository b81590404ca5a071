package com.clinical.review.main;

import com.clinical.review.analyzer.ReviewItemAnalyzer;
import com.clinical.review.fhir.BundleReadException;
import com.clinical.review.fhir.BundleReader;
import com.clinical.review.model.ReviewItem;
import com.clinical.review.model.SelectionResult;
import com.clinical.review.report.ReviewItemWriter;
import com.clinical.review.selector.MissingSubjectException;
import com.clinical.review.selector.ResourceSelector;
import com.clinical.review.tables.CodeTables;
import org.hl7.fhir.r4.model.Bundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Command-line runner: reads FHIR bundle files, selects relevant resources, computes review items
 * and prints one JSON document per bundle.
 * <p>
 * Usage: {@code ClinicalReviewApp [--now=2024-06-01T00:00:00Z] bundle.json [bundle2.json ...]}
 */
public class ClinicalReviewApp {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalReviewApp.class);
    private static final String NOW_OPTION = "--now=";
    private static final int THREAD_POOL_SIZE = 4; // Bundles are independent, so they run concurrently

    private final BundleReader bundleReader;
    private final ResourceSelector selector;
    private final ReviewItemAnalyzer analyzer;
    private final ReviewItemWriter writer;

    public ClinicalReviewApp(Clock clock) {
        CodeTables codeTables = CodeTables.defaults();
        this.bundleReader = new BundleReader();
        this.selector = new ResourceSelector(codeTables, clock);
        this.analyzer = new ReviewItemAnalyzer(codeTables, clock);
        this.writer = new ReviewItemWriter();
    }

    public static void main(String[] args) {
        logger.info("Starting clinical review engine");

        Clock clock;
        List<Path> bundlePaths;
        try {
            clock = parseClock(args);
            bundlePaths = parseBundlePaths(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: ClinicalReviewApp [--now=<ISO instant>] <bundle.json> [...]");
            System.exit(2);
            return;
        }

        List<BundleOutcome> outcomes = new ClinicalReviewApp(clock).reviewAll(bundlePaths);
        outcomes.forEach(outcome -> System.out.println(outcome.getJson()));

        long failures = outcomes.stream().filter(BundleOutcome::isFailed).count();
        logger.info("Reviewed {} bundles, {} failed", outcomes.size(), failures);
        if (failures > 0) {
            System.exit(1);
        }
    }

    /**
     * Review one bundle file
     * @param path The bundle file
     * @return The JSON report, or an error document when the bundle cannot be reviewed
     */
    public BundleOutcome review(Path path) {
        String source = path.toString();
        try {
            Bundle bundle = bundleReader.read(path);
            SelectionResult selection = selector.selectRelevantResources(bundle);
            List<ReviewItem> items = analyzer.computeReviewItems(selection);
            return new BundleOutcome(writer.writeReport(source, selection, items), false);
        } catch (BundleReadException | MissingSubjectException e) {
            logger.error("Unable to review bundle {}: {}", source, e.getMessage());
            return new BundleOutcome(writer.writeError(source, e.getMessage()), true);
        }
    }

    /**
     * Review bundles in parallel. Output order follows the input order.
     */
    public List<BundleOutcome> reviewAll(List<Path> paths) {
        ExecutorService executorService = Executors.newFixedThreadPool(THREAD_POOL_SIZE);
        AtomicInteger processedCount = new AtomicInteger(0);
        int totalBundles = paths.size();

        try {
            List<CompletableFuture<BundleOutcome>> futures = paths.stream()
                .map(path -> CompletableFuture.supplyAsync(() -> {
                    logger.info("Reviewing bundle {}/{}: {}", processedCount.incrementAndGet(), totalBundles, path);
                    return review(path);
                }, executorService))
                .collect(Collectors.toList());

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        } finally {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Executor service did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.error("Interrupted while waiting for executor service to terminate");
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Use a fixed clock when --now is given, otherwise the system UTC clock
     */
    static Clock parseClock(String[] args) {
        for (String arg : args) {
            if (arg.startsWith(NOW_OPTION)) {
                String value = arg.substring(NOW_OPTION.length());
                try {
                    Instant now = Instant.parse(value);
                    logger.info("Using fixed reference time {}", now);
                    return Clock.fixed(now, ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid --now value: " + value, e);
                }
            }
        }
        return Clock.systemUTC();
    }

    static List<Path> parseBundlePaths(String[] args) {
        List<Path> paths = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                paths.add(Path.of(arg));
            }
        }
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No bundle files given");
        }
        return paths;
    }

    /**
     * JSON output for one bundle and whether reviewing it failed
     */
    public static final class BundleOutcome {
        private final String json;
        private final boolean failed;

        BundleOutcome(String json, boolean failed) {
            this.json = json;
            this.failed = failed;
        }

        public String getJson() {
            return json;
        }

        public boolean isFailed() {
            return failed;
        }
    }
}
