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

package ai.kognition.pilegeo4j.geotiff.geometry;

/**
 * A 2D coordinate in either raster space (x is the column, y is the row) or model space.
 * Implementations are immutable. The vector operations all return new instances.
 */
public interface Point {

    public static String toString(final Point p) {
        return p.getClass().getSimpleName() + "[ x=" + p.x() + ", y=" + p.y() + " ]";
    }

    public double x();

    public double y();

    /**
     * This will return a point that's translated such that if the point passed in
     * is the same as {@code this} then the result will be the [0, 0].
     *
     * It basically results in [ this - toOrigin ];
     */
    default public Point subtract(final Point toOrigin) {
        return new SimplePoint(x() - toOrigin.x(), y() - toOrigin.y());
    }

    default public Point add(final Point other) {
        return new SimplePoint(x() + other.x(), y() + other.y());
    }

    default public double magnitudeSquared() {
        final double y = y();
        final double x = x();
        return (y * y) + (x * x);
    }

    default public double magnitude() {
        return Math.sqrt(magnitudeSquared());
    }

    default public double dot(final Point other) {
        return (x() * other.x()) + (y() * other.y());
    }

    default public Point multiply(final double scalar) {
        return new SimplePoint(x() * scalar, y() * scalar);
    }

    /**
     * A zero length vector normalizes to NaN components.
     */
    default public Point normalize() {
        return multiply(1.0 / magnitude());
    }

    /**
     * The vector rotated a quarter turn clockwise (in a y-up frame).
     */
    default public Point rightPerpendicular() {
        return new SimplePoint(y(), -x());
    }

    default public boolean isFinite() {
        return Double.isFinite(x()) && Double.isFinite(y());
    }
}
