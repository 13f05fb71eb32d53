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

import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a photo through a series of {@link PixmapFilter}s and then through a {@link MosaicSynthesizer}. The usual
 * setup, from {@link #standard(SampleLibrary, int)}, blurs, removes speckles, and reduces the palette before
 * synthesis, so the photo ends up as a few large flat regions.
 */
public class MosaicPipeline {
    private static final Logger LOGGER = Logger.getLogger(MosaicPipeline.class.getName());

    private final Array<PixmapFilter> filters;
    private final MosaicSynthesizer synthesizer;

    /**
     * @param synthesizer builds the mosaic from the last filter's output
     * @param filters applied in order before synthesis; may be empty
     */
    public MosaicPipeline(MosaicSynthesizer synthesizer, PixmapFilter... filters) {
        this.synthesizer = synthesizer;
        this.filters = Array.with(filters);
    }

    /**
     * A {@link GaussianBlur} with sigma 2, then a 5x5 {@link MedianFilter}, then a {@link PaletteQuantizer}, then
     * synthesis with the default {@link MosaicConfig}.
     * @param library where tiles come from
     * @param colors the most colors the quantized image may have, between 2 and 256
     * @return a new MosaicPipeline
     */
    public static MosaicPipeline standard(SampleLibrary library, int colors) {
        return new MosaicPipeline(new MosaicSynthesizer(library),
                new GaussianBlur(2f), new MedianFilter(2, 2), new PaletteQuantizer(colors));
    }

    public Array<PixmapFilter> getFilters() {
        return filters;
    }

    public MosaicSynthesizer getSynthesizer() {
        return synthesizer;
    }

    /**
     * Applies every filter, then starts synthesis. The filters run on the calling thread; synthesis may finish on
     * another thread if tiles need to be fetched.
     * @param photo the source image; not modified, and still owned by the caller
     * @return a future for the mosaic
     */
    public CompletableFuture<MosaicResult> process(Pixmap photo) {
        MosaicSynthesizer.checkDimensions(photo.getWidth(), photo.getHeight());
        Pixmap current = photo;
        for (PixmapFilter filter : filters) {
            LOGGER.log(Level.INFO, "Applying " + filter.getClass().getSimpleName());
            Pixmap next = filter.apply(current);
            if (current != photo)
                current.dispose();
            current = next;
        }
        LOGGER.log(Level.INFO, "Applying samples");
        try {
            return synthesizer.synthesize(current);
        } finally {
            if (current != photo)
                current.dispose();
        }
    }
}
