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

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

/**
 * Predicates and constructions shared by the mesh code.
 */
public class Vectors {
    /**
     * Below this length the sum of two unit vectors is considered to have cancelled out.
     */
    public static final double CANCELLATION_EPSILON = 1.0E-10;

    private Vectors() {}

    public static Coordinate toCoordinate(final Point p) {
        return new Coordinate(p.x(), p.y());
    }

    public static Point toPoint(final Coordinate c) {
        return new SimplePoint(c.x, c.y);
    }

    /**
     * Robust orientation of {@code r} relative to the directed line {@code p -> q}.
     *
     * @return 1 when {@code r} is to the left (counter-clockwise), -1 when it's to the right and 0 when
     *         the three points are collinear.
     */
    public static int orientation(final Point p, final Point q, final Point r) {
        return Orientation.index(toCoordinate(p), toCoordinate(q), toCoordinate(r));
    }

    /**
     * The outward bisector of the polygon corner at {@code vertex}, that is, the normalized sum of the
     * unit vectors from each neighbor to the vertex. The sum points away from the polygon at a convex
     * corner and into it at a reflex one, so it's reversed for reflex corners. When the neighbors are
     * collinear with the vertex the sum cancels out and the outward normal of the straight boundary is
     * used instead. {@code counterClockwise} is the orientation of the polygon, which tells the outside
     * from the inside.
     */
    public static Point bisector(final Point prev, final Point vertex, final Point next, final boolean counterClockwise) {
        final Point sum = vertex.subtract(prev).normalize().add(vertex.subtract(next).normalize());
        if(sum.magnitude() < CANCELLATION_EPSILON || !sum.isFinite()) {
            final Point along = next.subtract(prev).normalize();
            return counterClockwise ? along.rightPerpendicular() : along.rightPerpendicular().multiply(-1.0);
        }
        final int turn = orientation(prev, vertex, next) * (counterClockwise ? 1 : -1);
        return turn < 0 ? sum.normalize().multiply(-1.0) : sum.normalize();
    }
}
