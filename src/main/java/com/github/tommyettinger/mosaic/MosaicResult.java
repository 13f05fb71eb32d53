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
import com.badlogic.gdx.utils.Disposable;

/**
 * The output of one synthesis run: the composited image plus a record of what was filled and what wasn't.
 * <br>
 * Pixels that were never filled are fully transparent in {@link #getPixmap()}, and every filled pixel is fully
 * opaque, so an unfilled pixel can't be mistaken for black or any other color. A result with unfilled pixels is
 * still a valid result; {@link #getFailures()} says why each unfilled region was left alone.
 */
public class MosaicResult implements Disposable {

    /**
     * Why a region was left unfilled.
     */
    public enum FailureKind {
        /**
         * No usable anchor was close enough to the region's color, or there were no usable anchors at all.
         */
        NO_MATCHING_SAMPLE,
        /**
         * The nearest anchor's tile could not be fetched or decoded.
         */
        SAMPLE_ACQUISITION_FAILED
    }

    /**
     * One connected region that was filled with a tile.
     */
    public static class FilledRegion {
        public final int seedX, seedY;
        /**
         * The RGBA8888 color of the seed pixel in the quantized image.
         */
        public final int color;
        /**
         * The RGB888 anchor of the sample used.
         */
        public final int anchor;
        public final int pixelCount;

        public FilledRegion(int seedX, int seedY, int color, int anchor, int pixelCount) {
            this.seedX = seedX;
            this.seedY = seedY;
            this.color = color;
            this.anchor = anchor;
            this.pixelCount = pixelCount;
        }

        @Override
        public String toString() {
            return "FilledRegion{" +
                    "seed=" + seedX + "," + seedY +
                    ", anchor=" + ColorSample.toIdentifier(anchor) +
                    ", pixelCount=" + pixelCount +
                    '}';
        }
    }

    /**
     * One connected region that was left unfilled.
     */
    public static class SynthesisFailure {
        public final FailureKind kind;
        public final int seedX, seedY;
        /**
         * The RGBA8888 color of the seed pixel in the quantized image.
         */
        public final int color;
        /**
         * The RGB888 anchor that could not be acquired, or {@link SampleMatcher#NO_MATCH}.
         */
        public final int anchor;
        public final int pixelCount;
        /**
         * What went wrong while acquiring the sample; null for {@link FailureKind#NO_MATCHING_SAMPLE}.
         */
        public final Throwable cause;

        public SynthesisFailure(FailureKind kind, int seedX, int seedY, int color, int anchor, int pixelCount,
                                Throwable cause) {
            this.kind = kind;
            this.seedX = seedX;
            this.seedY = seedY;
            this.color = color;
            this.anchor = anchor;
            this.pixelCount = pixelCount;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return "SynthesisFailure{" +
                    "kind=" + kind +
                    ", seed=" + seedX + "," + seedY +
                    ", color=" + Integer.toHexString(color) +
                    ", pixelCount=" + pixelCount +
                    '}';
        }
    }

    private final Pixmap pixmap;
    private final boolean[] filled;
    private final int filledCount;
    private final Array<FilledRegion> regions;
    private final Array<SynthesisFailure> failures;

    MosaicResult(Pixmap pixmap, boolean[] filled, int filledCount,
                 Array<FilledRegion> regions, Array<SynthesisFailure> failures) {
        this.pixmap = pixmap;
        this.filled = filled;
        this.filledCount = filledCount;
        this.regions = regions;
        this.failures = failures;
    }

    /**
     * @return the composited RGBA8888 image, owned by this result
     */
    public Pixmap getPixmap() {
        return pixmap;
    }

    public int getWidth() {
        return pixmap.getWidth();
    }

    public int getHeight() {
        return pixmap.getHeight();
    }

    /**
     * @param x between 0 inclusive and {@link #getWidth()} exclusive
     * @param y between 0 inclusive and {@link #getHeight()} exclusive
     * @return true if a tile pixel was written at x,y
     */
    public boolean isFilled(int x, int y) {
        return filled[y * pixmap.getWidth() + x];
    }

    public int getFilledCount() {
        return filledCount;
    }

    public int getUnfilledCount() {
        return filled.length - filledCount;
    }

    /**
     * @return true if every pixel was filled
     */
    public boolean isComplete() {
        return filledCount == filled.length;
    }

    /**
     * @return a new Array with every filled region, in the order the scan found their seeds; changing it doesn't
     * change this result
     */
    public Array<FilledRegion> getRegions() {
        return new Array<>(regions);
    }

    /**
     * @return a new Array with every region left unfilled, in the order the scan found their seeds; changing it
     * doesn't change this result
     */
    public Array<SynthesisFailure> getFailures() {
        return new Array<>(failures);
    }

    @Override
    public void dispose() {
        pixmap.dispose();
    }
}
