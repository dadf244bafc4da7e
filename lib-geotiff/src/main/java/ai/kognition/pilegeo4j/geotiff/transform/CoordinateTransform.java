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

package ai.kognition.pilegeo4j.geotiff.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.GeoTiffConfig;
import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;

/**
 * The mapping between raster space and model space described by a GeoTIFF's
 * ModelPixelScaleTag, ModelTiePointTag and ModelTransformationTag. There are exactly three
 * kinds: {@link AffineTransform}, {@link TiePointAndPixelScale} and {@link TiePointTransform}.
 * <p>
 * Instances are immutable once constructed. {@link #toModel(Point)} and {@link #toRaster(Point)}
 * never fail and can be called concurrently.
 * </p>
 */
public abstract class CoordinateTransform {
    private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateTransform.class);

    public static final int PIXEL_SCALE_LENGTH = 3;
    public static final int TRANSFORMATION_MATRIX_LENGTH = 16;

    CoordinateTransform() {}

    public abstract Point toModel(Point raster);

    public abstract Point toRaster(Point model);

    public Transform2D modelTransform() {
        return this::toModel;
    }

    public Transform2D rasterTransform() {
        return this::toRaster;
    }

    /**
     * Same as {@link #fromTagData(double[], double[], double[], GeoTiffConfig)} with the configuration
     * from {@link GeoTiffConfig#getDefault()}.
     */
    public static CoordinateTransform fromTagData(final double[] pixelScale, final double[] tiePoints, final double[] transformationMatrix) {
        return fromTagData(pixelScale, tiePoints, transformationMatrix, GeoTiffConfig.getDefault());
    }

    /**
     * Validate the raw tag payloads and build the one transform they describe. Any of the
     * arrays may be {@code null} when the tag is absent but at least one of {@code tiePoints} or
     * {@code transformationMatrix} must be present. Deciding that a file with none of the three tags
     * simply has no transform is up to the caller.
     *
     * @throws GeoTiffFormatException if the tags are malformed or inconsistent, the matrix is
     *             singular, or several tie points are given while {@link GeoTiffConfig#isTiePointsEnabled()}
     *             is off.
     */
    public static CoordinateTransform fromTagData(final double[] pixelScale, final double[] tiePoints, final double[] transformationMatrix,
        final GeoTiffConfig config) {
        if(pixelScale != null && pixelScale.length != PIXEL_SCALE_LENGTH)
            throw new GeoTiffFormatException("Number values in ModelPixelScaleTag must be equal to " + PIXEL_SCALE_LENGTH + " but was "
                + pixelScale.length);

        if(tiePoints != null) {
            if(tiePoints.length == 0)
                throw new GeoTiffFormatException("Number of values in ModelTiePointTag must be greater than 0");
            if(tiePoints.length % ControlPoints.VALUES_PER_TIE_POINT != 0)
                throw new GeoTiffFormatException("Number of values in ModelTiePointTag must be divisible by " + ControlPoints.VALUES_PER_TIE_POINT
                    + " but was " + tiePoints.length);
        }

        if(transformationMatrix != null && transformationMatrix.length != TRANSFORMATION_MATRIX_LENGTH)
            throw new GeoTiffFormatException("Number of values in ModelTransformationTag must be equal to " + TRANSFORMATION_MATRIX_LENGTH
                + " but was " + transformationMatrix.length);

        if(transformationMatrix != null) {
            if(pixelScale != null)
                throw new GeoTiffFormatException("ModelPixelScaleTag must not be specified when ModelTransformationTag is present");
            if(tiePoints != null)
                throw new GeoTiffFormatException("ModelTiePointTag must not be specified when ModelTransformationTag is present");

            LOGGER.debug("Building an affine transform from the ModelTransformationTag");
            return new AffineTransform(transformationMatrix);
        }

        if(tiePoints == null)
            throw new GeoTiffFormatException("ModelTiePointTag must be present when ModelTransformationTag is missing");

        if(tiePoints.length == ControlPoints.VALUES_PER_TIE_POINT) {
            if(pixelScale == null)
                throw new GeoTiffFormatException("ModelPixelScaleTag must be specified when ModelTiePointTag contains "
                    + ControlPoints.VALUES_PER_TIE_POINT + " values");

            LOGGER.debug("Building a tie point and pixel scale transform");
            return TiePointAndPixelScale.fromTagData(tiePoints, pixelScale);
        }

        if(!config.isTiePointsEnabled())
            throw new GeoTiffFormatException("Transformation by tie points is not supported");

        if(pixelScale != null)
            LOGGER.debug("Ignoring the ModelPixelScaleTag since the ModelTiePointTag has {} tie points", tiePoints.length
                / ControlPoints.VALUES_PER_TIE_POINT);

        return new TiePointTransform(ControlPoints.fromTiePoints(tiePoints));
    }
}
