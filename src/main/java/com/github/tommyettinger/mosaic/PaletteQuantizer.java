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
import com.github.tommyettinger.anim8.PaletteReducer;

/**
 * Reduces an image to a palette computed from that same image, using anim8's {@link PaletteReducer} with no
 * dithering. Dithering would break flat areas into speckles, and flat areas are what a mosaic fills, so this always
 * uses {@link PaletteReducer#reduceSolid(Pixmap)}.
 */
public class PaletteQuantizer implements PixmapFilter {
    /**
     * How different two colors must be for {@link PaletteReducer#analyze(Pixmap, double, int)} to keep both.
     */
    public static final int DEFAULT_THRESHOLD = 100;

    private final PaletteReducer reducer;
    private final int limit;
    private final int threshold;

    /**
     * Reduces to at most 256 colors.
     */
    public PaletteQuantizer() {
        this(256);
    }

    /**
     * @param limit the most colors the result may use, between 2 and 256
     */
    public PaletteQuantizer(int limit) {
        this(limit, DEFAULT_THRESHOLD);
    }

    /**
     * @param limit the most colors the result may use, between 2 and 256
     * @param threshold higher values make the palette more varied; anim8 suggests 100 to 300
     */
    public PaletteQuantizer(int limit, int threshold) {
        if (limit < 2 || limit > 256)
            throw new IllegalArgumentException("limit must be between 2 and 256, but was " + limit);
        this.limit = limit;
        this.threshold = threshold;
        reducer = new PaletteReducer();
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Analyzes {@code pixmap} and returns a palette-reduced copy of it. A PaletteQuantizer keeps state between calls,
     * so one instance should only be used by one thread at a time.
     * @param pixmap the image to reduce; not modified
     * @return a new RGBA8888 Pixmap using at most {@link #getLimit()} colors
     */
    @Override
    public Pixmap apply(Pixmap pixmap) {
        reducer.analyze(pixmap, threshold, limit);
        Pixmap copy = new Pixmap(pixmap.getWidth(), pixmap.getHeight(), Pixmap.Format.RGBA8888);
        copy.setBlending(Pixmap.Blending.None);
        copy.drawPixmap(pixmap, 0, 0);
        return reducer.reduceSolid(copy);
    }
}
