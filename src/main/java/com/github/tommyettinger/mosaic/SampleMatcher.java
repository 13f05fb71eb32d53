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

import com.badlogic.gdx.utils.IntArray;

import java.util.function.IntPredicate;

/**
 * Finds the sample anchor nearest to a color, by Euclidean distance in RGB space. The anchors are a small, fixed
 * palette, so this is a linear search; there is no spatial index.
 * <br>
 * Ties go to the anchor that was enumerated first: a later anchor only replaces the current best if it is strictly
 * closer. This keeps the result stable for a given anchor order.
 */
public class SampleMatcher {
    /**
     * Returned by the matching methods when no anchor is usable.
     */
    public static final int NO_MATCH = -1;

    private final int[] anchors;

    /**
     * @param anchors RGB888 anchor colors, in the order ties should be broken; copied
     */
    public SampleMatcher(IntArray anchors) {
        this(anchors.toArray());
    }

    /**
     * @param anchors RGB888 anchor colors, in the order ties should be broken; copied
     */
    public SampleMatcher(int... anchors) {
        this.anchors = new int[anchors.length];
        for (int i = 0; i < anchors.length; i++) {
            this.anchors[i] = anchors[i] & 0xFFFFFF;
        }
    }

    public int size() {
        return anchors.length;
    }

    /**
     * @param index which anchor, in enumeration order
     * @return the RGB888 anchor at that index
     */
    public int getAnchor(int index) {
        return anchors[index];
    }

    /**
     * Gets the closest anchor to an RGBA8888 color, considering every anchor.
     * @param rgba an RGBA8888 color; alpha is ignored
     * @return the nearest RGB888 anchor, or {@link #NO_MATCH} if there are no anchors
     */
    public int closest(int rgba) {
        return closest(rgba, a -> true, Double.POSITIVE_INFINITY);
    }

    /**
     * Gets the closest usable anchor to an RGBA8888 color.
     * @param rgba an RGBA8888 color; alpha is ignored
     * @param usable anchors this rejects are skipped entirely
     * @param maxDistance anchors farther than this Euclidean distance are never returned;
     *                    {@link Double#POSITIVE_INFINITY} disables the limit
     * @return the nearest acceptable RGB888 anchor, or {@link #NO_MATCH} if none qualifies
     */
    public int closest(int rgba, IntPredicate usable, double maxDistance) {
        final int rgb = ColorTolerance.toRGB888(rgba);
        final int r = rgb >>> 16, g = rgb >>> 8 & 0xFF, b = rgb & 0xFF;
        int best = NO_MATCH;
        long bestDist = Long.MAX_VALUE;
        for (int anchor : anchors) {
            if (!usable.test(anchor))
                continue;
            int dr = (anchor >>> 16) - r, dg = (anchor >>> 8 & 0xFF) - g, db = (anchor & 0xFF) - b;
            long dist = dr * dr + dg * dg + db * db;
            if (dist < bestDist) {
                best = anchor;
                bestDist = dist;
            }
        }
        if (best != NO_MATCH && bestDist > maxDistance * maxDistance)
            return NO_MATCH;
        return best;
    }

    /**
     * Euclidean distance between an RGBA8888 color and an RGB888 anchor.
     * @param rgba an RGBA8888 color; alpha is ignored
     * @param anchor an RGB888 color
     * @return the square root of the summed squared channel differences
     */
    public static double distance(int rgba, int anchor) {
        final int rgb = ColorTolerance.toRGB888(rgba);
        int dr = (anchor >>> 16) - (rgb >>> 16),
                dg = (anchor >>> 8 & 0xFF) - (rgb >>> 8 & 0xFF),
                db = (anchor & 0xFF) - (rgb & 0xFF);
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
