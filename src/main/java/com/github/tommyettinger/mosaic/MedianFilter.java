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

import java.util.Arrays;

/**
 * Replaces each pixel with the per-channel median of the rectangle around it, which removes speckles while keeping
 * edges sharp. The rectangle spans {@code 2 * radiusX + 1} by {@code 2 * radiusY + 1} pixels, with pixels past the
 * edges treated as copies of the nearest edge pixel, so every window holds the same number of samples.
 */
public class MedianFilter implements PixmapFilter {
    private final int radiusX, radiusY;

    /**
     * A filter with radius 2 on both axes, a 5x5 window.
     */
    public MedianFilter() {
        this(2, 2);
    }

    /**
     * @param radiusX how far the window reaches left and right; non-negative
     * @param radiusY how far the window reaches up and down; non-negative
     */
    public MedianFilter(int radiusX, int radiusY) {
        if (radiusX < 0 || radiusY < 0)
            throw new IllegalArgumentException("radii must be non-negative, but were " + radiusX + ", " + radiusY);
        this.radiusX = radiusX;
        this.radiusY = radiusY;
    }

    @Override
    public Pixmap apply(Pixmap pixmap) {
        final int w = pixmap.getWidth(), h = pixmap.getHeight();
        final int[] pixels = Pixels.read(pixmap);
        final int[] out = new int[pixels.length];
        final int windowSize = (radiusX * 2 + 1) * (radiusY * 2 + 1), middle = windowSize >>> 1;
        // one histogram per channel, in RGBA order
        final int[][] histograms = new int[4][256];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                for (int[] histogram : histograms) {
                    Arrays.fill(histogram, 0);
                }
                for (int dy = -radiusY; dy <= radiusY; dy++) {
                    final int row = Math.min(Math.max(y + dy, 0), h - 1) * w;
                    for (int dx = -radiusX; dx <= radiusX; dx++) {
                        final int c = pixels[row + Math.min(Math.max(x + dx, 0), w - 1)];
                        histograms[0][c >>> 24]++;
                        histograms[1][c >>> 16 & 0xFF]++;
                        histograms[2][c >>> 8 & 0xFF]++;
                        histograms[3][c & 0xFF]++;
                    }
                }
                out[y * w + x] = median(histograms[0], middle) << 24
                        | median(histograms[1], middle) << 16
                        | median(histograms[2], middle) << 8
                        | median(histograms[3], middle);
            }
        }
        return Pixels.write(out, w, h);
    }

    private static int median(int[] histogram, int middle) {
        int seen = 0;
        for (int v = 0; v < 256; v++) {
            seen += histogram[v];
            if (seen > middle)
                return v;
        }
        return 255;
    }
}
