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
 * Moves pixels between Pixmaps and plain int arrays of RGBA8888 colors, in row-major order.
 */
final class Pixels {
    private Pixels() {
    }

    static int[] read(Pixmap pixmap) {
        final int w = pixmap.getWidth(), h = pixmap.getHeight();
        final int[] rgba = new int[w * h];
        for (int y = 0, i = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                rgba[i++] = pixmap.getPixel(x, y);
            }
        }
        return rgba;
    }

    static Pixmap write(int[] rgba, int width, int height) {
        Pixmap pixmap = new Pixmap(width, height, Pixmap.Format.RGBA8888);
        pixmap.setBlending(Pixmap.Blending.None);
        for (int y = 0, i = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixmap.drawPixel(x, y, rgba[i++]);
            }
        }
        return pixmap;
    }
}
