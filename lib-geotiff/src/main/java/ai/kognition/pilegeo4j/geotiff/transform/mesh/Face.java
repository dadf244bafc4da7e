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

package ai.kognition.pilegeo4j.geotiff.transform.mesh;

import org.locationtech.jts.algorithm.Distance;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;
import ai.kognition.pilegeo4j.geotiff.geometry.Vectors;

/**
 * One triangle of a {@link Mesh} together with the region of the plane it's responsible for.
 * The support points keep the vertex order of the triangulation so that the same
 * barycentric parameters mean the same thing in the corresponding face of the other mesh.
 */
public final class Face {
    private final Point a;
    private final Point b;
    private final Point c;
    private final Boundary boundary;

    // +1 when a, b, c are counter-clockwise in this face's own space, else -1
    private final int winding;
    private final boolean degenerate;

    public Face(final Point a, final Point b, final Point c, final Boundary boundary) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.boundary = boundary;
        final int orientation = Vectors.orientation(a, b, c);
        this.winding = orientation < 0 ? -1 : 1;
        this.degenerate = orientation == 0;
    }

    public Point getVertex(final int i) {
        switch(i) {
            case 0:
                return a;
            case 1:
                return b;
            case 2:
                return c;
            default:
                throw new IndexOutOfBoundsException("A face has 3 vertices. There's no vertex " + i);
        }
    }

    public Boundary getBoundary() {
        return boundary;
    }

    public boolean contains(final Point p) {
        return boundary.contains(this, p);
    }

    public Envelope getEnvelope() {
        return boundary.envelope(this);
    }

    /**
     * Orientation of {@code r} relative to {@code p -> q} as seen in this face's winding, so 1 always
     * means "the same side as the triangle's interior is of its own edges".
     */
    int orientation(final Point p, final Point q, final Point r) {
        return Vectors.orientation(p, q, r) * winding;
    }

    boolean inTriangle(final Point p) {
        return orientation(a, b, p) >= 0 && orientation(b, c, p) >= 0 && orientation(c, a, p) >= 0;
    }

    Envelope triangleEnvelope() {
        final Envelope ret = new Envelope(Vectors.toCoordinate(a));
        ret.expandToInclude(Vectors.toCoordinate(b));
        ret.expandToInclude(Vectors.toCoordinate(c));
        return ret;
    }

    /**
     * The triangle has no area, so it has no barycentric parameters.
     */
    public boolean isDegenerate() {
        return degenerate;
    }

    /**
     * Euclidean distance from {@code p} to the triangle, 0 inside it.
     */
    public double distance(final Point p) {
        if(inTriangle(p))
            return 0.0;
        final Coordinate pc = Vectors.toCoordinate(p);
        final Coordinate ac = Vectors.toCoordinate(a);
        final Coordinate bc = Vectors.toCoordinate(b);
        final Coordinate cc = Vectors.toCoordinate(c);
        return Math.min(Distance.pointToSegment(pc, ac, bc), Math.min(Distance.pointToSegment(pc, bc, cc), Distance.pointToSegment(pc, cc, ac)));
    }

    /**
     * The barycentric parameters {@code (u, v)} of {@code p} so that
     * {@code p = (1 - u - v) * a + u * b + v * c}. Points outside the triangle give parameters
     * outside [0, 1], which is what extrapolation through a wedge relies on.
     */
    public double[] barycentric(final Point p) {
        final double d = c.x() * (a.y() - b.y()) - b.x() * (a.y() - c.y()) + a.x() * (b.y() - c.y());
        final double u = -(p.x() * (a.y() - c.y()) - c.x() * (a.y() - p.y()) + a.x() * (c.y() - p.y())) / d;
        final double v = (p.x() * (a.y() - b.y()) - b.x() * (a.y() - p.y()) + a.x() * (b.y() - p.y())) / d;
        return new double[] {u,v};
    }

    public Point interpolate(final double u, final double v) {
        final double w = 1.0 - u - v;
        return new SimplePoint(w * a.x() + u * b.x() + v * c.x(), w * a.y() + u * b.y() + v * c.y());
    }

    @Override
    public String toString() {
        return "Face [a=" + a + ", b=" + b + ", c=" + c + ", boundary=" + boundary + "]";
    }
}
