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

package ai.kognition.pilegeo4j.geotiff;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.geokey.GeoKeyDirectory;
import ai.kognition.pilegeo4j.geotiff.transform.CoordinateTransform;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

/**
 * The raw georeferencing tag payloads of one TIFF directory. Any of them may be {@code null}
 * when the tag is absent.
 */
public class GeoTiffTags {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiffTags.class);

    public static final int MODEL_PIXEL_SCALE = 33550;
    public static final int MODEL_TIE_POINT = 33922;
    public static final int MODEL_TRANSFORMATION = 34264;
    public static final int GEO_KEY_DIRECTORY = 34735;
    public static final int GEO_DOUBLE_PARAMS = 34736;
    public static final int GEO_ASCII_PARAMS = 34737;

    private final double[] pixelScale;
    private final double[] tiePoints;
    private final double[] transformationMatrix;
    private final int[] geoKeyDirectory;
    private final double[] geoDoubleParams;
    private final String geoAsciiParams;

    public GeoTiffTags(final double[] pixelScale, final double[] tiePoints, final double[] transformationMatrix, final int[] geoKeyDirectory,
        final double[] geoDoubleParams, final String geoAsciiParams) {
        this.pixelScale = pixelScale;
        this.tiePoints = tiePoints;
        this.transformationMatrix = transformationMatrix;
        this.geoKeyDirectory = geoKeyDirectory;
        this.geoDoubleParams = geoDoubleParams;
        this.geoAsciiParams = geoAsciiParams;
    }

    public static GeoTiffTags from(final FileDirectory directory) {
        double[] pixelScale = null;
        double[] tiePoints = null;
        double[] transformation = null;
        int[] keys = null;
        double[] doubles = null;
        String ascii = null;

        for(final FileDirectoryEntry entry: directory.getEntries()) {
            if(entry.getFieldTag() == null)
                continue;
            switch(entry.getFieldTag().getId()) {
                case MODEL_PIXEL_SCALE:
                    pixelScale = toDoubles(entry.getValues());
                    break;
                case MODEL_TIE_POINT:
                    tiePoints = toDoubles(entry.getValues());
                    break;
                case MODEL_TRANSFORMATION:
                    transformation = toDoubles(entry.getValues());
                    break;
                case GEO_KEY_DIRECTORY:
                    keys = toInts(entry.getValues());
                    break;
                case GEO_DOUBLE_PARAMS:
                    doubles = toDoubles(entry.getValues());
                    break;
                case GEO_ASCII_PARAMS:
                    ascii = toAscii(entry.getValues());
                    break;
                default:
                    LOGGER.trace("Ignoring the non-georeferencing tag {}", entry.getFieldTag());
                    break;
            }
        }
        return new GeoTiffTags(pixelScale, tiePoints, transformation, keys, doubles, ascii);
    }

    static double[] toDoubles(final Object values) {
        if(values instanceof double[])
            return ((double[])values).clone();
        if(values instanceof Number)
            return new double[] {((Number)values).doubleValue()};
        if(values instanceof List) {
            final List<?> list = (List<?>)values;
            final double[] ret = new double[list.size()];
            for(int i = 0; i < ret.length; i++)
                ret[i] = ((Number)list.get(i)).doubleValue();
            return ret;
        }
        throw new GeoTiffFormatException("Expected numeric tag values but got " + (values == null ? "nothing" : values.getClass().getName()));
    }

    static int[] toInts(final Object values) {
        final double[] asDoubles = toDoubles(values);
        final int[] ret = new int[asDoubles.length];
        for(int i = 0; i < ret.length; i++)
            ret[i] = (int)asDoubles[i];
        return ret;
    }

    // the TIFF reader splits ASCII values at each NUL so put them back to keep the offsets right
    static String toAscii(final Object values) {
        if(values instanceof String)
            return (String)values;
        if(values instanceof List) {
            final StringBuilder sb = new StringBuilder();
            for(final Object o: (List<?>)values) {
                if(sb.length() > 0)
                    sb.append('\0');
                sb.append(o);
            }
            return sb.toString();
        }
        throw new GeoTiffFormatException("Expected an ASCII tag value but got " + (values == null ? "nothing" : values.getClass().getName()));
    }

    /**
     * Whether any of ModelPixelScaleTag, ModelTiePointTag or ModelTransformationTag is present.
     */
    public boolean hasTransformTags() {
        return pixelScale != null || tiePoints != null || transformationMatrix != null;
    }

    /**
     * The transform described by the tags, or empty when none of the three transform tags is present,
     * which means raster space and model space are the same.
     *
     * @throws GeoTiffFormatException if the tags are present but invalid.
     */
    public Optional<CoordinateTransform> coordinateTransform(final GeoTiffConfig config) {
        if(!hasTransformTags()) {
            LOGGER.debug("No transform tags present");
            return Optional.empty();
        }
        return Optional.of(CoordinateTransform.fromTagData(pixelScale, tiePoints, transformationMatrix, config));
    }

    public GeoKeyDirectory geoKeyDirectory() {
        return GeoKeyDirectory.fromTagData(geoKeyDirectory, geoDoubleParams, geoAsciiParams);
    }

    public double[] getPixelScale() {
        return pixelScale;
    }

    public double[] getTiePoints() {
        return tiePoints;
    }

    public double[] getTransformationMatrix() {
        return transformationMatrix;
    }
}
