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

/**
 * A Gaussian blur on all four RGBA channels, done as a horizontal pass and then a vertical pass. Pixels past the
 * edges are treated as copies of the nearest edge pixel. The kernel reaches out {@code ceil(3 * sigma)} pixels in
 * each direction.
 */
public class GaussianBlur implements PixmapFilter {
    private final float sigma;
    private final float[] kernel;

    /**
     * A blur with sigma 2, which is what the mosaic pipeline uses by default.
     */
    public GaussianBlur() {
        this(2f);
    }

    /**
     * @param sigma the standard deviation of the blur, in pixels; must be positive
     */
    public GaussianBlur(float sigma) {
        if (!(sigma > 0f))
            throw new IllegalArgumentException("sigma must be positive, but was " + sigma);
        this.sigma = sigma;
        final int radius = (int) Math.ceil(sigma * 3f);
        kernel = new float[radius * 2 + 1];
        float sum = 0f;
        for (int i = -radius; i <= radius; i++) {
            sum += kernel[i + radius] = (float) Math.exp(-(i * i) / (2.0 * sigma * sigma));
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
    }

    public float getSigma() {
        return sigma;
    }

    @Override
    public Pixmap apply(Pixmap pixmap) {
        final int w = pixmap.getWidth(), h = pixmap.getHeight();
        final int[] pixels = Pixels.read(pixmap);
        final int[] horizontal = new int[pixels.length];
        final int radius = kernel.length >>> 1;
        for (int y = 0; y < h; y++) {
            final int row = y * w;
            for (int x = 0; x < w; x++) {
                float r = 0f, g = 0f, b = 0f, a = 0f;
                for (int k = -radius; k <= radius; k++) {
                    final int c = pixels[row + Math.min(Math.max(x + k, 0), w - 1)];
                    final float weight = kernel[k + radius];
                    r += (c >>> 24) * weight;
                    g += (c >>> 16 & 0xFF) * weight;
                    b += (c >>> 8 & 0xFF) * weight;
                    a += (c & 0xFF) * weight;
                }
                horizontal[row + x] = pack(r, g, b, a);
            }
        }
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                float r = 0f, g = 0f, b = 0f, a = 0f;
                for (int k = -radius; k <= radius; k++) {
                    final int c = horizontal[Math.min(Math.max(y + k, 0), h - 1) * w + x];
                    final float weight = kernel[k + radius];
                    r += (c >>> 24) * weight;
                    g += (c >>> 16 & 0xFF) * weight;
                    b += (c >>> 8 & 0xFF) * weight;
                    a += (c & 0xFF) * weight;
                }
                pixels[y * w + x] = pack(r, g, b, a);
            }
        }
        return Pixels.write(pixels, w, h);
    }

    private static int pack(float r, float g, float b, float a) {
        return Math.min(Math.round(r), 255) << 24
                | Math.min(Math.round(g), 255) << 16
                | Math.min(Math.round(b), 255) << 8
                | Math.min(Math.round(a), 255);
    }
}
