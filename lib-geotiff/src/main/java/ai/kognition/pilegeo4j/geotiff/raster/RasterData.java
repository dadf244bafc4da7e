/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilegeo4j.geotiff.raster;

import mil.nga.tiff.Rasters;

/**
 * Decoded samples of one image addressed by the linear index {@code (y * width + x) * samplesPerPixel + sample}.
 */
public class RasterData {
    private final Rasters rasters;
    private final int width;
    private final int height;
    private final int samplesPerPixel;

    public RasterData(final Rasters rasters) {
        this.rasters = rasters;
        this.width = rasters.getWidth();
        this.height = rasters.getHeight();
        this.samplesPerPixel = rasters.getSamplesPerPixel();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getSamplesPerPixel() {
        return samplesPerPixel;
    }

    public long size() {
        return (long)width * height * samplesPerPixel;
    }

    public static long index(final int x, final int y, final int sample, final int width, final int samplesPerPixel) {
        return ((long)y * width + x) * samplesPerPixel + sample;
    }

    /**
     * @throws IndexOutOfBoundsException if the index is negative or not less than {@link #size()}
     */
    public Number get(final long index) {
        if(index < 0 || index >= size())
            throw new IndexOutOfBoundsException("Sample index " + index + " is outside of the raster's " + size() + " samples");

        final int sample = (int)(index % samplesPerPixel);
        final long pixel = index / samplesPerPixel;
        return rasters.getPixelSample(sample, (int)(pixel % width), (int)(pixel / width));
    }

    public Number get(final int x, final int y, final int sample) {
        return get(index(x, y, sample, width, samplesPerPixel));
    }
}
