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
 * Reports that the tile for one anchor could not be fetched or decoded. Once this happens, the anchor is unusable
 * for as long as its {@link SampleLibrary} lives.
 */
public class SampleAcquisitionException extends GdxRuntimeException {
    private final int anchor;

    public SampleAcquisitionException(int anchor, String message) {
        super("Could not acquire sample " + ColorSample.toIdentifier(anchor) + ": " + message);
        this.anchor = anchor;
    }

    public SampleAcquisitionException(int anchor, Throwable cause) {
        super("Could not acquire sample " + ColorSample.toIdentifier(anchor), cause);
        this.anchor = anchor;
    }

    /**
     * @return the RGB888 anchor whose tile could not be acquired
     */
    public int getAnchor() {
        return anchor;
    }
}
