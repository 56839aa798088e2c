package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Memoizes histograms and averages by image content, so the same bytes are analyzed once
 * however many rows or paths refer to them. Entries depend on the conversion settings, so a
 * cache belongs to a single {@link LabReportPipeline}.
 */
public class ImageCache {

    private static final Logger logger = LogManager.getLogger(ImageCache.class);

    public record Entry(LabHistogram histogram, ChannelAverages averages) {}

    /**
     * Analysis of one image's bytes; only ever run by the first caller for a hash.
     */
    @FunctionalInterface
    public interface Loader {
        Entry load() throws ImageDecodeException;
    }

    private final Map<String, CompletableFuture<Entry>> entries = new ConcurrentHashMap<>();

    /**
     * Completed entry for a hash, or {@code null} if none is cached or it is still being analyzed.
     */
    public Entry get(String contentHash) {
        CompletableFuture<Entry> f = entries.get(contentHash);
        return f != null && f.isDone() && !f.isCompletedExceptionally() ? f.join() : null;
    }

    /**
     * Return the cached entry for {@code contentHash}, running {@code loader} if no other caller
     * has claimed the hash. Concurrent callers for the same hash wait for the first one.
     * A failed load is not cached.
     *
     * @param source Image the caller is analyzing, named in failures seen while waiting
     */
    public Entry getOrLoad(String contentHash, String source, Loader loader) throws ImageDecodeException {
        CompletableFuture<Entry> created = new CompletableFuture<>();
        CompletableFuture<Entry> existing = entries.putIfAbsent(contentHash, created);
        if (existing == null) {
            try {
                Entry entry = loader.load();
                created.complete(entry);
                return entry;
            } catch (ImageDecodeException | RuntimeException | Error e) {
                entries.remove(contentHash, created);
                created.completeExceptionally(e);
                throw e;
            }
        }
        logger.debug("Cache hit for {} ({})", source, contentHash);
        return await(existing, source);
    }

    private static Entry await(CompletableFuture<Entry> pending, String source) throws ImageDecodeException {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageDecodeException(source, "Interrupted while waiting for analysis", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ImageDecodeException decode) {
                throw new ImageDecodeException(source, decode.getMessage(), decode);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure analyzing " + source, cause);
        }
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Hex SHA-256 of the given bytes.
     */
    public static String contentHash(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
