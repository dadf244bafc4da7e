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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Envelope;

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.Vectors;

/**
 * How much of the plane a {@link Face} covers beyond its own triangle. There are exactly three
 * kinds: {@link Interior}, {@link Wedge} and {@link ClosedTriangle}.
 */
public abstract class Boundary {
    /**
     * Stands in for infinity in index envelopes. Real infinities would give the spatial index
     * NaN node centers.
     */
    public static final double UNBOUNDED = Double.MAX_VALUE;

    Boundary() {}

    abstract boolean contains(Face face, Point p);

    abstract Envelope envelope(Face face);

    static boolean inClosedTriangle(final Point a, final Point b, final Point c, final Point p) {
        final int sign = Vectors.orientation(a, b, c);
        return Vectors.orientation(a, b, p) * sign >= 0 && Vectors.orientation(b, c, p) * sign >= 0
            && Vectors.orientation(c, a, p) * sign >= 0;
    }

    /**
     * The face is the only one in the mesh and covers the whole plane.
     */
    public static final class Interior extends Boundary {
        @Override
        boolean contains(final Face face, final Point p) {
            return true;
        }

        @Override
        Envelope envelope(final Face face) {
            return new Envelope(-UNBOUNDED, UNBOUNDED, -UNBOUNDED, UNBOUNDED);
        }

        @Override
        public String toString() {
            return "Interior";
        }
    }

    /**
     * The face touches no hull edge so it covers exactly its triangle.
     */
    public static final class ClosedTriangle extends Boundary {
        private final Point[] coords;

        public ClosedTriangle(final Point a, final Point b, final Point c) {
            coords = new Point[] {a,b,c,a};
        }

        public Point[] getCoords() {
            return coords.clone();
        }

        @Override
        boolean contains(final Face face, final Point p) {
            for(int i = 0; i < coords.length - 1; i++) {
                if(face.orientation(coords[i], coords[i + 1], p) < 0)
                    return false;
            }
            return true;
        }

        @Override
        Envelope envelope(final Face face) {
            return face.triangleEnvelope();
        }

        @Override
        public String toString() {
            return "ClosedTriangle " + Arrays.toString(coords);
        }
    }

    /**
     * One edge of a convex boundary together with the outward rays at its ends. The region it
     * stands for is everything outside the edge between the two rays.
     */
    public static final class HullEdge {
        private final Point from;
        private final Point to;
        private final Point fromRay;
        private final Point toRay;
        private final Point fromTip;
        private final Point toTip;

        public HullEdge(final Point from, final Point to, final Point fromRay, final Point toRay) {
            this.from = from;
            this.to = to;
            this.fromRay = fromRay;
            this.toRay = toRay;
            fromTip = from.add(fromRay);
            toTip = to.add(toRay);
        }

        public Point getFrom() {
            return from;
        }

        public Point getTo() {
            return to;
        }

        public Point getFromRay() {
            return fromRay;
        }

        public Point getToRay() {
            return toRay;
        }

        // winding is +1 when the boundary runs counter-clockwise, so the outside is on the right
        boolean beyond(final int winding, final Point p) {
            return Vectors.orientation(to, from, p) * winding >= 0 && Vectors.orientation(from, fromTip, p) * winding >= 0
                && Vectors.orientation(toTip, to, p) * winding >= 0;
        }

        void expand(final Envelope env) {
            env.expandToInclude(Vectors.toCoordinate(from));
            env.expandToInclude(Vectors.toCoordinate(to));
            double minX = env.getMinX();
            double maxX = env.getMaxX();
            double minY = env.getMinY();
            double maxY = env.getMaxY();
            for(final Point ray: new Point[] {fromRay,toRay}) {
                if(ray.x() > 0.0)
                    maxX = UNBOUNDED;
                else if(ray.x() < 0.0)
                    minX = -UNBOUNDED;
                if(ray.y() > 0.0)
                    maxY = UNBOUNDED;
                else if(ray.y() < 0.0)
                    minY = -UNBOUNDED;
            }
            env.init(minX, maxX, minY, maxY);
        }

        @Override
        public String toString() {
            return "HullEdge [" + from + " -> " + to + ", rays=" + fromRay + ", " + toRay + "]";
        }
    }

    /**
     * The face lies on the hull. Besides its triangle it covers the region beyond each of its
     * {@link HullEdge}s and, where the hull had to be filled in to make it convex, the pocket
     * triangles assigned to it.
     * <p>
     * In raster space the hull edges are the 1 or 2 edges of the triangle itself, in hull order,
     * and there are no pockets.
     * </p>
     */
    public static final class Wedge extends Boundary {
        private final int winding;
        private final List<HullEdge> edges;
        private final List<Point[]> pockets;

        /**
         * @param winding +1 when the hull runs counter-clockwise, -1 when it runs clockwise
         * @param pockets triangles, each given as 3 points
         */
        public Wedge(final int winding, final List<HullEdge> edges, final List<Point[]> pockets) {
            if(edges.size() > 2)
                throw new IllegalArgumentException("A face can own at most 2 hull edges but was given " + edges.size());
            this.winding = winding < 0 ? -1 : 1;
            this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
            final List<Point[]> copy = new ArrayList<>(pockets.size());
            for(final Point[] pocket: pockets) {
                if(pocket.length != 3)
                    throw new IllegalArgumentException("A pocket is a triangle but was given " + pocket.length + " points");
                copy.add(pocket.clone());
            }
            this.pockets = Collections.unmodifiableList(copy);
        }

        public List<HullEdge> getEdges() {
            return edges;
        }

        public List<Point[]> getPockets() {
            return pockets;
        }

        /**
         * The end points of the hull edges in order, with end points shared by consecutive edges
         * listed once.
         */
        public Point[] getEdgeCoords() {
            final List<Point> ret = new ArrayList<>();
            for(final HullEdge e: edges) {
                if(ret.isEmpty() || !ret.get(ret.size() - 1).equals(e.getFrom()))
                    ret.add(e.getFrom());
                ret.add(e.getTo());
            }
            return ret.toArray(new Point[ret.size()]);
        }

        public Point getFromRay() {
            return edges.isEmpty() ? null : edges.get(0).getFromRay();
        }

        public Point getToRay() {
            return edges.isEmpty() ? null : edges.get(edges.size() - 1).getToRay();
        }

        @Override
        boolean contains(final Face face, final Point p) {
            if(face.inTriangle(p))
                return true;
            for(final HullEdge e: edges) {
                if(e.beyond(winding, p))
                    return true;
            }
            for(final Point[] pocket: pockets) {
                if(inClosedTriangle(pocket[0], pocket[1], pocket[2], p))
                    return true;
            }
            return false;
        }

        @Override
        Envelope envelope(final Face face) {
            final Envelope env = face.triangleEnvelope();
            for(final Point[] pocket: pockets) {
                for(final Point p: pocket)
                    env.expandToInclude(Vectors.toCoordinate(p));
            }
            for(final HullEdge e: edges)
                e.expand(env);
            return env;
        }

        @Override
        public String toString() {
            return "Wedge [edges=" + edges + ", pockets=" + pockets.size() + "]";
        }
    }
}
