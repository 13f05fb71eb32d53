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
 * Loose color equality used to decide whether two pixels belong to the same flat region of a quantized image.
 * Each of the red, green, and blue channels is compared on its own; two colors are similar when every channel
 * differs by strictly less than the tolerance. Alpha is ignored.
 * <br>
 * All colors here are RGBA8888 ints, as returned by {@link com.badlogic.gdx.graphics.Pixmap#getPixel(int, int)}.
 */
public final class ColorTolerance {
    /**
     * The per-channel tolerance used when nothing else is requested. Quantization can leave neighboring pixels a
     * step or two apart in a channel, and 4 keeps those in one region.
     */
    public static final int DEFAULT_TOLERANCE = 4;

    private ColorTolerance() {
    }

    /**
     * Compares two RGBA8888 colors using {@link #DEFAULT_TOLERANCE}.
     * @param rgba1 an RGBA8888 color
     * @param rgba2 another RGBA8888 color
     * @return true if each RGB channel differs by less than {@link #DEFAULT_TOLERANCE}
     */
    public static boolean isSimilar(int rgba1, int rgba2) {
        return isSimilar(rgba1, rgba2, DEFAULT_TOLERANCE);
    }

    /**
     * Compares two RGBA8888 colors channel-by-channel. A tolerance of 1 only accepts exact RGB matches; a tolerance
     * of 0 or less accepts nothing.
     * @param rgba1 an RGBA8888 color
     * @param rgba2 another RGBA8888 color
     * @param tolerance each channel must differ by strictly less than this
     * @return true if each RGB channel differs by less than {@code tolerance}
     */
    public static boolean isSimilar(int rgba1, int rgba2, int tolerance) {
        return Math.abs((rgba1 >>> 24) - (rgba2 >>> 24)) < tolerance
                && Math.abs((rgba1 >>> 16 & 0xFF) - (rgba2 >>> 16 & 0xFF)) < tolerance
                && Math.abs((rgba1 >>> 8 & 0xFF) - (rgba2 >>> 8 & 0xFF)) < tolerance;
    }

    /**
     * Converts an RGBA8888 color to RGB888, dropping alpha.
     * @param rgba an RGBA8888 int
     * @return the same color as {@code 0xRRGGBB}
     */
    public static int toRGB888(int rgba) {
        return rgba >>> 8;
    }
}
