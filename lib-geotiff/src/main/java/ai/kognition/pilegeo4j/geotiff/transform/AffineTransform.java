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

import java.util.Arrays;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;

/**
 * A 2D affine map taken from a 4x4 ModelTransformationTag. The coefficients are
 * {@code [a, b, c, d, e, f]} with {@code x' = a*x + b*y + c} and {@code y' = d*x + e*y + f}.
 */
public final class AffineTransform extends CoordinateTransform {
    public static final double DETERMINANT_EPSILON = 1.0E-15;

    private final double[] forward;
    private final double[] inverse;

    /**
     * @param transformationMatrix the row major 4x4 matrix. Only the entries that act on x and y
     *            (indices 0, 1, 3, 4, 5, 7) are used.
     */
    public AffineTransform(final double[] transformationMatrix) {
        if(transformationMatrix.length != TRANSFORMATION_MATRIX_LENGTH)
            throw new GeoTiffFormatException("Number of values in ModelTransformationTag must be equal to " + TRANSFORMATION_MATRIX_LENGTH
                + " but was " + transformationMatrix.length);

        final double[] m = transformationMatrix;
        forward = new double[] {m[0],m[1],m[3],m[4],m[5],m[7]};
        inverse = invert(forward);
    }

    private static double[] invert(final double[] t) {
        final double det = t[0] * t[4] - t[1] * t[3];
        if(Math.abs(det) < DETERMINANT_EPSILON)
            throw new GeoTiffFormatException("Provided transformation matrix is not invertible");

        return new double[] {
            t[4] / det,
            -t[1] / det,
            (t[1] * t[5] - t[2] * t[4]) / det,
            -t[3] / det,
            t[0] / det,
            (-t[0] * t[5] + t[2] * t[3]) / det
        };
    }

    private static Point apply(final double[] t, final Point p) {
        final double x = p.x();
        final double y = p.y();
        return new SimplePoint(t[0] * x + t[1] * y + t[2], t[3] * x + t[4] * y + t[5]);
    }

    @Override
    public Point toModel(final Point raster) {
        return apply(forward, raster);
    }

    @Override
    public Point toRaster(final Point model) {
        return apply(inverse, model);
    }

    public double[] getForward() {
        return forward.clone();
    }

    public double[] getInverse() {
        return inverse.clone();
    }

    @Override
    public String toString() {
        return "AffineTransform [forward=" + Arrays.toString(forward) + ", inverse=" + Arrays.toString(inverse) + "]";
    }
}
