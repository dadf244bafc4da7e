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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.Vectors;

/**
 * Triangulates a set of raster points once and then builds meshes with that topology for any
 * index aligned set of points (the raster points themselves and their model counterparts).
 * <p>
 * Triangles are stored counter-clockwise in raster space. The hull is the cycle of directed
 * edges that belong to a single triangle. The Delaunay triangulation can leave reflex corners on
 * that cycle, so those are filled with extra triangles until the hull is convex.
 * </p>
 * <p>
 * The hull of the model points generally isn't convex. When building a mesh for them the reflex
 * corners are clipped off into pocket triangles instead, each handed to the face on one of the
 * edges it covers, and the wedges are built on the convex cycle that's left.
 * </p>
 */
public class MeshBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(MeshBuilder.class);

    // relative tolerance when comparing the area of the faces with the area of the hull
    private static final double AREA_TOLERANCE = 1.0E-9;

    @FunctionalInterface
    private static interface CornerClipper {
        void clip(int prev, int corner, int next);
    }

    private final int pointCount;
    private final List<int[]> triangles = new ArrayList<>();
    private final Set<Long> hullEdges = new HashSet<>();
    // directed hull edge to the index of the triangle it belongs to
    private final Map<Long, Integer> edgeOwners = new HashMap<>();
    private final int[] next;
    private final int[] prev;

    /**
     * @throws GeoTiffFormatException if a point isn't finite or the points don't span an area,
     *             i.e. there are fewer than 3 distinct points or they're all collinear.
     */
    public MeshBuilder(final List<Point> rasterPoints) {
        pointCount = rasterPoints.size();

        final Map<Coordinate, Integer> indexOf = new HashMap<>();
        final List<Coordinate> sites = new ArrayList<>();
        for(int i = 0; i < pointCount; i++) {
            final Point p = rasterPoints.get(i);
            if(!p.isFinite())
                throw new GeoTiffFormatException("Tie point " + i + " has a non-finite raster coordinate " + p);
            final Coordinate c = Vectors.toCoordinate(p);
            final Integer existing = indexOf.putIfAbsent(c, i);
            if(existing == null)
                sites.add(c);
            else
                LOGGER.warn("Tie point {} has the same raster coordinate as tie point {} ({}). Only the first one is used.", i, existing, p);
        }

        if(spansArea(sites))
            triangulate(sites, indexOf, rasterPoints);

        if(triangles.isEmpty())
            throw new GeoTiffFormatException("The " + pointCount + " tie points can't be triangulated. There must be at least 3 distinct "
                + "raster points that aren't all on one line.");

        warnAboutUnusedSites(sites, indexOf);

        next = new int[pointCount];
        prev = new int[pointCount];
        findHull();

        final int filled = clipReflexCorners(rasterPoints, next, prev, 1, (p, v, q) -> triangles.add(new int[] {p,q,v}));
        if(filled > 0) {
            LOGGER.debug("Filled {} reflex corners of the triangulation's hull", filled);
            findHull();
        }
        if(!isConvex(rasterPoints, next, prev, 1))
            throw new IllegalStateException("The hull of the triangulated tie points isn't convex after filling it in");

        LOGGER.debug("Triangulated {} tie points into {} triangles with {} hull edges", pointCount, triangles.size(), hullEdges.size());
    }

    private static boolean spansArea(final List<Coordinate> sites) {
        for(int i = 2; i < sites.size(); i++) {
            if(Orientation.index(sites.get(0), sites.get(1), sites.get(i)) != Orientation.COLLINEAR)
                return true;
        }
        return false;
    }

    private void triangulate(final List<Coordinate> sites, final Map<Coordinate, Integer> indexOf, final List<Point> points) {
        final DelaunayTriangulationBuilder dtb = new DelaunayTriangulationBuilder();
        dtb.setSites(sites);
        final Geometry tris = dtb.getTriangles(new GeometryFactory());

        for(int g = 0; g < tris.getNumGeometries(); g++) {
            final Coordinate[] cs = tris.getGeometryN(g).getCoordinates();
            final Integer i0 = indexOf.get(cs[0]);
            final Integer i1 = indexOf.get(cs[1]);
            final Integer i2 = indexOf.get(cs[2]);
            if(i0 == null || i1 == null || i2 == null) {
                LOGGER.debug("Skipping a triangle with a vertex that isn't a tie point: {}", Arrays.toString(cs));
                continue;
            }

            final int orientation = Vectors.orientation(points.get(i0), points.get(i1), points.get(i2));
            if(orientation == 0) {
                LOGGER.debug("Skipping the degenerate triangle ({}, {}, {})", i0, i1, i2);
                continue;
            }

            triangles.add(orientation > 0 ? new int[] {i0,i1,i2} : new int[] {i0,i2,i1});
        }
    }

    private void warnAboutUnusedSites(final List<Coordinate> sites, final Map<Coordinate, Integer> indexOf) {
        final boolean[] used = new boolean[pointCount];
        for(final int[] t: triangles) {
            for(final int v: t)
                used[v] = true;
        }
        for(final Coordinate c: sites) {
            final int i = indexOf.get(c);
            if(!used[i])
                LOGGER.warn("Tie point {} at {} isn't a vertex of any triangle and is ignored", i, c);
        }
    }

    private static long undirected(final int p, final int q) {
        return directed(Math.min(p, q), Math.max(p, q));
    }

    private static long directed(final int p, final int q) {
        return ((long)p << 32) | (q & 0xffffffffL);
    }

    private void findHull() {
        hullEdges.clear();
        edgeOwners.clear();
        Arrays.fill(next, -1);
        Arrays.fill(prev, -1);

        final Map<Long, Integer> uses = new HashMap<>();
        for(final int[] t: triangles) {
            for(int i = 0; i < 3; i++)
                uses.merge(undirected(t[i], t[(i + 1) % 3]), 1, Integer::sum);
        }

        for(int k = 0; k < triangles.size(); k++) {
            final int[] t = triangles.get(k);
            for(int i = 0; i < 3; i++) {
                final int p = t[i];
                final int q = t[(i + 1) % 3];
                if(uses.get(undirected(p, q)) == 1) {
                    if(next[p] >= 0)
                        throw new IllegalStateException("The triangulation's boundary passes through tie point " + p + " more than once");
                    hullEdges.add(directed(p, q));
                    edgeOwners.put(directed(p, q), k);
                    next[p] = q;
                    prev[q] = p;
                }
            }
        }
    }

    /**
     * Repeatedly clips reflex corners off the boundary cycle given by {@code next} and {@code prev}
     * (updating both) until none can be clipped. A corner can be clipped when no other boundary
     * vertex lies in the triangle it forms with its neighbors.
     *
     * @param winding +1 when the cycle runs counter-clockwise, -1 when it runs clockwise
     * @return the number of corners clipped
     */
    private static int clipReflexCorners(final List<Point> points, final int[] next, final int[] prev, final int winding,
        final CornerClipper clipper) {
        int ret = 0;
        boolean clipped = true;
        while(clipped) {
            clipped = false;
            for(int v = 0; v < next.length; v++) {
                if(next[v] < 0)
                    continue;
                final int p = prev[v];
                final int q = next[v];
                if(Vectors.orientation(points.get(p), points.get(v), points.get(q)) * winding >= 0 || !isEar(points, next, p, v, q))
                    continue;

                clipper.clip(p, v, q);
                next[p] = q;
                prev[q] = p;
                next[v] = -1;
                prev[v] = -1;
                clipped = true;
                ret++;
            }
        }
        return ret;
    }

    private static boolean isEar(final List<Point> points, final int[] next, final int p, final int v, final int q) {
        final Point a = points.get(p);
        final Point b = points.get(v);
        final Point c = points.get(q);
        for(int w = 0; w < next.length; w++) {
            if(next[w] >= 0 && w != p && w != v && w != q && Boundary.inClosedTriangle(a, b, c, points.get(w)))
                return false;
        }
        return true;
    }

    private static boolean isConvex(final List<Point> points, final int[] next, final int[] prev, final int winding) {
        for(int v = 0; v < next.length; v++) {
            if(next[v] >= 0 && Vectors.orientation(points.get(prev[v]), points.get(v), points.get(next[v])) * winding < 0)
                return false;
        }
        return true;
    }

    public int getTriangleCount() {
        return triangles.size();
    }

    /**
     * The triangles as index triples, counter-clockwise in raster space.
     */
    public List<int[]> getTriangles() {
        final List<int[]> ret = new ArrayList<>(triangles.size());
        for(final int[] t: triangles)
            ret.add(t.clone());
        return ret;
    }

    public boolean isHullEdge(final int p, final int q) {
        return hullEdges.contains(directed(p, q));
    }

    /**
     * The tie point indices of the hull, counter-clockwise in raster space.
     */
    public int[] getHull() {
        int start = 0;
        while(next[start] < 0)
            start++;
        final int[] ret = new int[hullEdges.size()];
        int v = start;
        for(int i = 0; i < ret.length; i++) {
            ret[i] = v;
            v = next[v];
        }
        return ret;
    }

    /**
     * Build the mesh for {@code points}, which must be index aligned with the raster points this
     * builder triangulated.
     *
     * @throws GeoTiffFormatException if none of the triangles has an area with these points.
     */
    public Mesh build(final List<Point> points) {
        if(points.size() != pointCount)
            throw new IllegalArgumentException("Expected " + pointCount + " points to build a mesh but got " + points.size());

        final double area = hullArea(points, next);
        final int winding = area >= 0.0 ? 1 : -1;
        final boolean folded = folds(points, winding);

        final int[] cycleNext = next.clone();
        final int[] cyclePrev = prev.clone();
        final Map<Long, Integer> owners = new HashMap<>(edgeOwners);
        final Map<Integer, List<Point[]>> pockets = new HashMap<>();
        final int clipped = clipReflexCorners(points, cycleNext, cyclePrev, winding, (p, v, q) -> {
            final Integer owner = owners.remove(directed(p, v));
            owners.put(directed(p, q), owners.remove(directed(v, q)));
            pockets.computeIfAbsent(owner, k -> new ArrayList<>()).add(new Point[] {points.get(p),points.get(q),points.get(v)});
        });
        if(clipped > 0)
            LOGGER.debug("Clipped {} reflex corners off the hull into pockets", clipped);

        final boolean covering = !folded && isConvex(points, cycleNext, cyclePrev, winding) && fills(points, cycleNext, pockets);
        if(!covering)
            LOGGER.warn("The mesh of {} tie points folds over itself so its faces don't cover the plane exactly once. "
                + "Points outside of every face resolve to the nearest one.", pointCount);

        final Point[] rays = new Point[pointCount];
        final Map<Integer, List<int[]>> owned = new HashMap<>();
        for(int v = 0; v < pointCount; v++) {
            if(cycleNext[v] >= 0) {
                rays[v] = Vectors.bisector(points.get(cyclePrev[v]), points.get(v), points.get(cycleNext[v]), winding > 0);
                owned.computeIfAbsent(owners.get(directed(v, cycleNext[v])), k -> new ArrayList<>()).add(new int[] {v,cycleNext[v]});
            }
        }

        final List<Face> faces = new ArrayList<>(triangles.size());
        for(int k = 0; k < triangles.size(); k++) {
            final int[] t = triangles.get(k);
            final Boundary boundary = boundary(t, points, winding, edges(owned.get(k), points, rays),
                pockets.getOrDefault(k, Collections.emptyList()));
            faces.add(new Face(points.get(t[0]), points.get(t[1]), points.get(t[2]), boundary));
        }
        return new Mesh(faces, covering);
    }

    // twice the signed area enclosed by a boundary cycle
    private static double hullArea(final List<Point> points, final int[] next) {
        double ret = 0.0;
        for(int v = 0; v < next.length; v++) {
            if(next[v] >= 0) {
                final Point p = points.get(v);
                final Point q = points.get(next[v]);
                ret += p.x() * q.y() - q.x() * p.y();
            }
        }
        return ret;
    }

    private static double triangleArea(final Point a, final Point b, final Point c) {
        return Math.abs((b.x() - a.x()) * (c.y() - a.y()) - (c.x() - a.x()) * (b.y() - a.y()));
    }

    private boolean folds(final List<Point> points, final int winding) {
        boolean anyArea = false;
        boolean ret = false;
        for(final int[] t: triangles) {
            final int orientation = Vectors.orientation(points.get(t[0]), points.get(t[1]), points.get(t[2]));
            if(orientation != 0)
                anyArea = true;
            if(orientation * winding <= 0)
                ret = true;
        }
        if(!anyArea)
            throw new GeoTiffFormatException("None of the " + triangles.size() + " triangles of the tie points has an area. "
                + "The tie points' model coordinates must not all be on one line.");
        return ret;
    }

    // the triangles and the pockets add up to the area of the convex cycle, so nothing overlaps
    private boolean fills(final List<Point> points, final int[] cycleNext, final Map<Integer, List<Point[]>> pockets) {
        double covered = 0.0;
        for(final int[] t: triangles)
            covered += triangleArea(points.get(t[0]), points.get(t[1]), points.get(t[2]));
        for(final List<Point[]> ps: pockets.values()) {
            for(final Point[] p: ps)
                covered += triangleArea(p[0], p[1], p[2]);
        }
        final double hull = Math.abs(hullArea(points, cycleNext));
        return Math.abs(covered - hull) <= AREA_TOLERANCE * hull;
    }

    // the hull edges a face owns, chained in hull order
    private static List<Boundary.HullEdge> edges(final List<int[]> owned, final List<Point> points, final Point[] rays) {
        if(owned == null)
            return Collections.emptyList();
        if(owned.size() == 2 && owned.get(1)[1] == owned.get(0)[0])
            Collections.swap(owned, 0, 1);
        final List<Boundary.HullEdge> ret = new ArrayList<>(owned.size());
        for(final int[] e: owned)
            ret.add(new Boundary.HullEdge(points.get(e[0]), points.get(e[1]), rays[e[0]], rays[e[1]]));
        return ret;
    }

    private Boundary boundary(final int[] t, final List<Point> points, final int winding, final List<Boundary.HullEdge> edges,
        final List<Point[]> pockets) {
        int count = 0;
        for(int i = 0; i < 3; i++) {
            if(isHullEdge(t[i], t[(i + 1) % 3]))
                count++;
        }

        switch(count) {
            case 3:
                return new Boundary.Interior();
            case 0:
                return new Boundary.ClosedTriangle(points.get(t[0]), points.get(t[1]), points.get(t[2]));
            default:
                return new Boundary.Wedge(winding, edges, pockets);
        }
    }
}
