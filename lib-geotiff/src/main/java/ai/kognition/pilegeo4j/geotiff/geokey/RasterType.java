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

package ai.kognition.pilegeo4j.geotiff.geokey;

/**
 * Whether a pixel value describes the whole pixel area or the point at the pixel's center.
 */
public enum RasterType {
    PixelIsArea(1), PixelIsPoint(2);

    public final int code;

    private RasterType(final int code) {
        this.code = code;
    }

    /**
     * @return the type or {@code null} for an unknown code.
     */
    public static RasterType byCode(final int code) {
        for(final RasterType rt: values()) {
            if(rt.code == code)
                return rt;
        }
        return null;
    }

    /**
     * Raster space offset that puts pixel centers on integral coordinates for {@link #PixelIsPoint}.
     */
    public double offset() {
        return this == PixelIsPoint ? -0.5 : 0.0;
    }
}
