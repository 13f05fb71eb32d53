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

/**
 * Settings for a {@link MosaicSynthesizer}. Every setter returns this object for chaining. The defaults are the
 * ones {@link #MosaicConfig()} documents.
 */
public class MosaicConfig {

    /**
     * Where the repeating tile pattern is anchored.
     */
    public enum TileOrigin {
        /**
         * Tiles repeat from the top-left corner of the whole image, so tile x is {@code x % tileWidth}. Two separate
         * regions that use the same sample line up as if cut from one big sheet of tiles, and a region's edge may
         * fall partway through a tile.
         */
        IMAGE,
        /**
         * Tiles repeat from each region's seed pixel, the first pixel of that region in row-major order. Each
         * region starts with the tile's top-left corner at its seed.
         */
        SEED
    }

    /**
     * Which neighbors a flood fill may push when it reaches the first row or column.
     */
    public enum NeighborReach {
        /**
         * Every in-bounds neighbor is pushed, including ones in row 0 and column 0.
         */
        ALL_EDGES,
        /**
         * The left neighbor is only pushed when x is greater than 1, and the upper neighbor only when y is greater
         * than 1. Row 0 and column 0 can still be filled, but only as seeds of their own regions during the scan,
         * never by spreading into them. This reproduces older mosaic output.
         */
        SKIP_ZERO_EDGE
    }

    private int tolerance = ColorTolerance.DEFAULT_TOLERANCE;
    private double maxMatchDistance = Double.POSITIVE_INFINITY;
    private TileOrigin tileOrigin = TileOrigin.IMAGE;
    private NeighborReach neighborReach = NeighborReach.ALL_EDGES;

    /**
     * Creates a config with a tolerance of {@link ColorTolerance#DEFAULT_TOLERANCE}, no limit on match distance,
     * {@link TileOrigin#IMAGE}, and {@link NeighborReach#ALL_EDGES}.
     */
    public MosaicConfig() {
    }

    public int getTolerance() {
        return tolerance;
    }

    /**
     * @param tolerance each RGB channel must differ by less than this for a pixel to join its seed's region; must be
     *                  at least 1
     * @return this, for chaining
     */
    public MosaicConfig setTolerance(int tolerance) {
        if (tolerance < 1)
            throw new IllegalArgumentException("tolerance must be at least 1, but was " + tolerance);
        this.tolerance = tolerance;
        return this;
    }

    public double getMaxMatchDistance() {
        return maxMatchDistance;
    }

    /**
     * Limits how far (by Euclidean RGB distance) a region's color may be from the anchor it gets matched to. Regions
     * with no anchor close enough are left unfilled.
     * @param maxMatchDistance a non-negative distance, or {@link Double#POSITIVE_INFINITY} for no limit
     * @return this, for chaining
     */
    public MosaicConfig setMaxMatchDistance(double maxMatchDistance) {
        if (!(maxMatchDistance >= 0.0))
            throw new IllegalArgumentException("maxMatchDistance must be non-negative, but was " + maxMatchDistance);
        this.maxMatchDistance = maxMatchDistance;
        return this;
    }

    public TileOrigin getTileOrigin() {
        return tileOrigin;
    }

    public MosaicConfig setTileOrigin(TileOrigin tileOrigin) {
        if (tileOrigin != null)
            this.tileOrigin = tileOrigin;
        return this;
    }

    public NeighborReach getNeighborReach() {
        return neighborReach;
    }

    public MosaicConfig setNeighborReach(NeighborReach neighborReach) {
        if (neighborReach != null)
            this.neighborReach = neighborReach;
        return this;
    }

    @Override
    public String toString() {
        return "MosaicConfig{" +
                "tolerance=" + tolerance +
                ", maxMatchDistance=" + maxMatchDistance +
                ", tileOrigin=" + tileOrigin +
                ", neighborReach=" + neighborReach +
                '}';
    }
}
