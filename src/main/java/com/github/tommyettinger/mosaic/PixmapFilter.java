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
 * One image-to-image step that runs before synthesis, such as smoothing or palette reduction. The output has the
 * same width and height as the input. {@link MosaicPipeline} runs a list of these.
 */
public interface PixmapFilter {
    /**
     * Filters {@code pixmap} into a new Pixmap; the input is not changed and still belongs to the caller.
     * @param pixmap a non-null Pixmap
     * @return a newly-allocated Pixmap of the same size, owned by the caller
     */
    Pixmap apply(Pixmap pixmap);
}
