/*
 * Copyright (c) 2024  Tommy Ettinger
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */

package com.github.tommyettinger.mosaic;

import com.badlogic.gdx.graphics.Pixmap;
import com.badlogic.gdx.utils.Disposable;
import com.badlogic.gdx.utils.IntArray;
import com.badlogic.gdx.utils.IntSet;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the palette of sample anchors and lazily loads the tile for each anchor the first time it is needed.
 * <br>
 * The anchors are fixed when the library is created; their tiles are not. {@link #resolve(int)} returns a future
 * that is already complete when the tile is resident, and otherwise starts one fetch through the
 * {@link SampleSource}. Every caller that asks for the same missing anchor while that fetch is outstanding gets the
 * same future, so a tile is never fetched twice. Tiles are never evicted; they stay until {@link #dispose()}.
 * <br>
 * If a fetch fails, the anchor is remembered as failed. It won't be fetched again, {@link #isUsable(int)} reports
 * false for it, and {@link #match(int, double)} skips it.
 * <br>
 * One library can be shared by several synthesis runs at once, on any threads.
 */
public class SampleLibrary implements Disposable {
    private static final Logger LOGGER = Logger.getLogger(SampleLibrary.class.getName());

    private final SampleSource source;
    private final SampleMatcher matcher;
    private final IntSet known;
    private final AsyncCache<Integer, ColorSample> cache;
    private final Set<Integer> failed = ConcurrentHashMap.newKeySet();
    private final AtomicInteger acquisitions = new AtomicInteger();

    /**
     * @param source where missing tiles are fetched from
     * @param anchors RGB888 anchors in matching order; repeated anchors after the first are ignored
     */
    public SampleLibrary(SampleSource source, IntArray anchors) {
        this(source, anchors.toArray());
    }

    /**
     * @param source where missing tiles are fetched from
     * @param anchors RGB888 anchors in matching order; repeated anchors after the first are ignored
     */
    public SampleLibrary(SampleSource source, int... anchors) {
        if (source == null)
            throw new IllegalArgumentException("source cannot be null");
        this.source = source;
        this.known = new IntSet(anchors.length);
        IntArray unique = new IntArray(anchors.length);
        for (int anchor : anchors) {
            if (known.add(anchor & 0xFFFFFF))
                unique.add(anchor & 0xFFFFFF);
        }
        this.matcher = new SampleMatcher(unique);
        this.cache = Caffeine.newBuilder().buildAsync();
    }

    /**
     * Makes a library where every tile is already resident. Nothing is ever fetched; the anchors are the samples'
     * anchors, in the given order. When several samples share an anchor, the first one is kept and the rest are
     * disposed here.
     * @param samples the samples to hold; the library takes ownership of them
     * @return a new SampleLibrary holding {@code samples}
     */
    public static SampleLibrary of(ColorSample... samples) {
        int[] anchors = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            anchors[i] = samples[i].getAnchor();
        }
        SampleLibrary library = new SampleLibrary(
                id -> CompletableFuture.failedFuture(new IllegalStateException("no source for " + id)),
                anchors);
        for (ColorSample sample : samples) {
            if (!library.add(sample))
                sample.dispose();
        }
        return library;
    }

    /**
     * Gets the tile for an anchor, fetching it if it isn't resident yet. The returned future completes exceptionally
     * with a {@link SampleAcquisitionException} (possibly wrapped in a {@link CompletionException}) if the fetch
     * fails, or if it failed before.
     * @param anchor an RGB888 anchor known to this library
     * @return a future for the sample; already complete if the sample is resident
     */
    public CompletableFuture<ColorSample> resolve(int anchor) {
        final int key = anchor & 0xFFFFFF;
        if (!known.contains(key))
            return CompletableFuture.failedFuture(new SampleAcquisitionException(key, "not an anchor in this library"));
        if (failed.contains(key))
            return CompletableFuture.failedFuture(new SampleAcquisitionException(key, "failed earlier"));
        return cache.get(key, (k, executor) -> acquire(k));
    }

    private CompletableFuture<ColorSample> acquire(final int anchor) {
        acquisitions.incrementAndGet();
        final String identifier = ColorSample.toIdentifier(anchor);
        LOGGER.log(Level.FINE, "Fetching sample " + identifier);
        CompletableFuture<Pixmap> fetching;
        try {
            fetching = source.fetch(identifier);
        } catch (RuntimeException e) {
            fetching = CompletableFuture.failedFuture(e);
        }
        if (fetching == null)
            fetching = CompletableFuture.failedFuture(new IllegalStateException("source returned no future"));
        return fetching.handle((pixmap, error) -> {
            if (error == null && pixmap == null)
                error = new IllegalStateException("source produced no image");
            if (error == null) {
                try {
                    return new ColorSample(anchor, pixmap);
                } catch (RuntimeException e) {
                    pixmap.dispose();
                    error = e;
                }
            }
            failed.add(anchor);
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            LOGGER.log(Level.WARNING, "Sample " + identifier + " is unusable", cause);
            throw new SampleAcquisitionException(anchor, cause);
        });
    }

    /**
     * Adds a sample whose tile is already decoded, unless its anchor already has a tile or a fetch in progress.
     * @param sample a sample whose anchor is one of this library's anchors; if it is added, the library owns it
     * @return true if the sample was added, false if the anchor was already present
     */
    public boolean add(ColorSample sample) {
        if (!known.contains(sample.getAnchor()))
            throw new IllegalArgumentException("Anchor " + sample.getIdentifier() + " is not in this library");
        return cache.asMap().putIfAbsent(sample.getAnchor(), CompletableFuture.completedFuture(sample)) == null;
    }

    /**
     * @param anchor an RGB888 anchor
     * @return the resident sample for that anchor, or null if it is missing, still loading, or failed
     */
    public ColorSample getIfResident(int anchor) {
        CompletableFuture<ColorSample> future = cache.getIfPresent(anchor & 0xFFFFFF);
        if (future == null || !future.isDone() || future.isCompletedExceptionally())
            return null;
        return future.join();
    }

    /**
     * @param anchor an RGB888 anchor
     * @return true if the anchor belongs to this library and its tile has not failed to load
     */
    public boolean isUsable(int anchor) {
        return known.contains(anchor & 0xFFFFFF) && !failed.contains(anchor & 0xFFFFFF);
    }

    /**
     * Finds the nearest usable anchor to a color.
     * @param rgba an RGBA8888 color
     * @param maxDistance the largest Euclidean RGB distance that still counts as a match
     * @return an RGB888 anchor, or {@link SampleMatcher#NO_MATCH}
     */
    public int match(int rgba, double maxDistance) {
        return matcher.closest(rgba, this::isUsable, maxDistance);
    }

    public SampleMatcher getMatcher() {
        return matcher;
    }

    /**
     * @return how many times this library has asked its {@link SampleSource} for a tile
     */
    public int getAcquisitionCount() {
        return acquisitions.get();
    }

    /**
     * @return how many anchors have failed to load so far
     */
    public int getFailedCount() {
        return failed.size();
    }

    /**
     * Disposes every resident tile, and any tile still loading once it arrives. The library should not be used
     * afterwards.
     */
    @Override
    public void dispose() {
        for (CompletableFuture<ColorSample> future : cache.asMap().values()) {
            future.thenAccept(ColorSample::dispose);
        }
        cache.synchronous().invalidateAll();
    }
}
