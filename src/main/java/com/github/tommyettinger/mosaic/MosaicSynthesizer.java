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
import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.IntArray;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.tommyettinger.mosaic.MosaicResult.FailureKind.NO_MATCHING_SAMPLE;
import static com.github.tommyettinger.mosaic.MosaicResult.FailureKind.SAMPLE_ACQUISITION_FAILED;

/**
 * Turns a palette-reduced image into a mosaic by replacing each connected region of one color with a tile from a
 * {@link SampleLibrary}.
 * <br>
 * The quantized image is scanned in row-major order. The first pixel of each region not yet handled becomes that
 * region's seed; the seed's color is matched to the nearest usable anchor in the library, and a flood fill spreads
 * from the seed over 4-connected pixels whose colors are within the configured tolerance of the seed's color.
 * Every pixel the fill reaches gets the matching tile's pixel at the same position, with the tile repeating as
 * often as needed, and is marked consumed so no later region can take it. The flood fill keeps its own stack in an
 * {@link IntArray}, so region size is limited only by image size.
 * <br>
 * Looking up a tile is the only step that can wait. When a tile isn't resident, the run stops where it is and
 * picks up from the next scan position once the library's future completes, on whatever thread completes it.
 * Nothing ever blocks waiting for a tile. A region whose tile fails to load, or whose color has no usable anchor,
 * is consumed without being drawn and shows up in {@link MosaicResult#getFailures()}.
 * <br>
 * A MosaicSynthesizer can start any number of runs; each run owns its own buffers and only shares the library.
 */
public class MosaicSynthesizer {
    private static final Logger LOGGER = Logger.getLogger(MosaicSynthesizer.class.getName());

    private final SampleLibrary library;
    private final MosaicConfig config;

    public MosaicSynthesizer(SampleLibrary library) {
        this(library, new MosaicConfig());
    }

    public MosaicSynthesizer(SampleLibrary library, MosaicConfig config) {
        if (library == null)
            throw new IllegalArgumentException("library cannot be null");
        this.library = library;
        this.config = config == null ? new MosaicConfig() : config;
    }

    public SampleLibrary getLibrary() {
        return library;
    }

    public MosaicConfig getConfig() {
        return config;
    }

    /**
     * Starts building a mosaic from {@code quantized}. The quantized Pixmap is only read, once, before this returns,
     * so the caller may dispose or reuse it right away. The config is also read once, at the start.
     * <br>
     * Cancelling the returned future disposes the partial image, right away if the run is waiting on a tile and
     * otherwise at the run's next step. A tile the run was waiting on still arrives in the library.
     * @param quantized a palette-reduced image with non-zero width and height
     * @return a future for the result; already complete if every tile needed was resident
     * @throws InvalidImageDimensionsException if {@code quantized} has no area; nothing is started in that case
     */
    public CompletableFuture<MosaicResult> synthesize(Pixmap quantized) {
        checkDimensions(quantized.getWidth(), quantized.getHeight());
        return synthesize(quantized, new Pixmap(quantized.getWidth(), quantized.getHeight(), Pixmap.Format.RGBA8888));
    }

    /**
     * Runs a synthesis that draws into {@code destination}, which must be an RGBA8888 Pixmap the same size as
     * {@code quantized}. The run owns it from here on.
     */
    CompletableFuture<MosaicResult> synthesize(Pixmap quantized, Pixmap destination) {
        final Run run = new Run(quantized, destination);
        run.result.whenComplete((done, error) -> run.releaseIfWaiting());
        run.resume(0);
        return run.result;
    }

    static void checkDimensions(int width, int height) {
        if (width <= 0 || height <= 0)
            throw new InvalidImageDimensionsException(width, height);
    }

    private static Throwable unwrap(Throwable error) {
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    /**
     * The state of one synthesis. Only one thread works on a Run at a time: either the caller of
     * {@link #synthesize(Pixmap)}, or the thread that completed the tile future the run was waiting on. The
     * {@code waiting} and {@code discarded} flags are also touched by whoever completes {@link #result}, so they
     * are guarded by {@code lock}.
     */
    private final class Run {
        final CompletableFuture<MosaicResult> result = new CompletableFuture<>();
        final int width, height, area;
        final int tolerance;
        final double maxMatchDistance;
        final MosaicConfig.TileOrigin tileOrigin;
        /**
         * Left and upper neighbors are only pushed when x or y is greater than this.
         */
        final int reachLimit;
        final int[] source;
        final boolean[] consumed;
        final boolean[] written;
        final Pixmap destination;
        final IntArray stack = new IntArray();
        final Array<MosaicResult.FilledRegion> regions = new Array<>();
        final Array<MosaicResult.SynthesisFailure> failures = new Array<>();
        final Object lock = new Object();
        int filledCount;
        boolean waiting;
        boolean discarded;

        Run(Pixmap quantized, Pixmap destination) {
            width = quantized.getWidth();
            height = quantized.getHeight();
            area = width * height;
            tolerance = config.getTolerance();
            maxMatchDistance = config.getMaxMatchDistance();
            tileOrigin = config.getTileOrigin();
            reachLimit = config.getNeighborReach() == MosaicConfig.NeighborReach.ALL_EDGES ? 0 : 1;
            source = Pixels.read(quantized);
            consumed = new boolean[area];
            written = new boolean[area];
            this.destination = destination;
            destination.setBlending(Pixmap.Blending.None);
        }

        void resume(int start) {
            try {
                scan(start);
            } catch (RuntimeException e) {
                discard();
                result.completeExceptionally(e);
            }
        }

        void scan(int start) {
            for (int i = start; i < area; i++) {
                if (result.isDone()) {
                    discard();
                    return;
                }
                if (written[i] || consumed[i])
                    continue;
                final int color = source[i];
                final int anchor = library.match(color, maxMatchDistance);
                if (anchor == SampleMatcher.NO_MATCH) {
                    int count = flood(i, color, null);
                    failures.add(new MosaicResult.SynthesisFailure(NO_MATCHING_SAMPLE,
                            i % width, i / width, color, anchor, count, null));
                    continue;
                }
                CompletableFuture<ColorSample> pending = library.resolve(anchor);
                if (!pending.isDone()) {
                    final int seed = i;
                    LOGGER.log(Level.FINE, "Waiting for sample " + ColorSample.toIdentifier(anchor));
                    synchronized (lock) {
                        if (result.isDone()) {
                            discard();
                            return;
                        }
                        waiting = true;
                    }
                    pending.whenComplete((resolved, failure) -> {
                        synchronized (lock) {
                            waiting = false;
                            if (discarded || result.isDone()) {
                                discard();
                                return;
                            }
                        }
                        try {
                            place(seed, color, anchor, resolved, failure);
                        } catch (RuntimeException e) {
                            discard();
                            result.completeExceptionally(e);
                            return;
                        }
                        resume(seed + 1);
                    });
                    return;
                }
                ColorSample sample = null;
                Throwable error = null;
                try {
                    sample = pending.join();
                } catch (CompletionException | CancellationException e) {
                    error = e;
                }
                place(i, color, anchor, sample, error);
            }
            finish();
        }

        void place(int seed, int color, int anchor, ColorSample sample, Throwable error) {
            if (error != null || sample == null) {
                int count = flood(seed, color, null);
                failures.add(new MosaicResult.SynthesisFailure(SAMPLE_ACQUISITION_FAILED,
                        seed % width, seed / width, color, anchor, count, error == null ? null : unwrap(error)));
                return;
            }
            int count = flood(seed, color, sample);
            regions.add(new MosaicResult.FilledRegion(seed % width, seed / width, color, anchor, count));
        }

        /**
         * Consumes the region connected to {@code seed}, drawing {@code sample}'s tile over it unless sample is
         * null.
         * @return how many pixels the region had
         */
        int flood(int seed, int seedColor, ColorSample sample) {
            final int seedX = seed % width, seedY = seed / width;
            final int offsetX = tileOrigin == MosaicConfig.TileOrigin.SEED ? seedX : 0;
            final int offsetY = tileOrigin == MosaicConfig.TileOrigin.SEED ? seedY : 0;
            int count = 0;
            stack.clear();
            stack.add(seed);
            while (stack.notEmpty()) {
                final int p = stack.pop();
                if (consumed[p] || !ColorTolerance.isSimilar(source[p], seedColor, tolerance))
                    continue;
                final int x = p % width, y = p / width;
                if (sample != null) {
                    destination.drawPixel(x, y, sample.getWrappedPixel(x - offsetX, y - offsetY) | 0xFF);
                    written[p] = true;
                    filledCount++;
                }
                consumed[p] = true;
                count++;
                if (x > reachLimit)
                    stack.add(p - 1);
                if (y > reachLimit)
                    stack.add(p - width);
                if (x < width - 1)
                    stack.add(p + 1);
                if (y < height - 1)
                    stack.add(p + width);
            }
            return count;
        }

        void finish() {
            MosaicResult done = new MosaicResult(destination, written, filledCount, regions, failures);
            if (!result.complete(done)) {
                discard();
                return;
            }
            LOGGER.log(failures.isEmpty() ? Level.FINE : Level.INFO, "Mosaic " + width + "x" + height + " filled "
                    + regions.size + " regions; " + failures.size + " regions with "
                    + done.getUnfilledCount() + " pixels left unfilled");
        }

        /**
         * Called once {@link #result} completes. If that happened while the run was waiting on a tile, the run isn't
         * going to look at the result again until the tile arrives, which may be never, so the image goes now.
         */
        void releaseIfWaiting() {
            synchronized (lock) {
                if (waiting)
                    discard();
            }
        }

        void discard() {
            synchronized (lock) {
                if (!discarded) {
                    discarded = true;
                    destination.dispose();
                }
            }
        }
    }
}
