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

import com.badlogic.gdx.utils.GdxRuntimeException;

/**
 * Thrown when an image that must have some area has none. Synthesis throws this before it allocates or fills
 * anything.
 */
public class InvalidImageDimensionsException extends GdxRuntimeException {
    private final int width;
    private final int height;

    public InvalidImageDimensionsException(int width, int height) {
        super("Image must have positive width and height, but was " + width + "x" + height);
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
