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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Test;
import org.locationtech.jts.geom.Envelope;

import ai.kognition.pilegeo4j.geotiff.GeoTiffFormatException;
import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.SimplePoint;
import ai.kognition.pilegeo4j.geotiff.geometry.Vectors;

public class MeshBuilderTest {

    private static List<Point> points(final double... xy) {
        final List<Point> ret = new ArrayList<>();
        for(int i = 0; i < xy.length; i += 2)
            ret.add(new SimplePoint(xy[i], xy[i + 1]));
        return ret;
    }

    private static List<Point> random(final Random rand, final int count, final double range) {
        final List<Point> ret = new ArrayList<>();
        for(int i = 0; i < count; i++)
            ret.add(new SimplePoint(rand.nextDouble() * range, rand.nextDouble() * range));
        return ret;
    }

    // a 5 x 5 grid, 25 apart
    private static List<Point> grid() {
        final List<Point> ret = new ArrayList<>();
        for(int y = 0; y < 5; y++) {
            for(int x = 0; x < 5; x++)
                ret.add(new SimplePoint(x * 25.0, y * 25.0));
        }
        return ret;
    }

    // bends every side of the grid into a curve, some of them concave, without folding it
    private static List<Point> warp(final List<Point> pts) {
        final List<Point> ret = new ArrayList<>();
        for(final Point p: pts)
            ret.add(new SimplePoint(p.x() + 0.02 * p.y() * p.y(), -p.y() + 0.02 * p.x() * p.x()));
        return ret;
    }

    private static double area(final Point a, final Point b, final Point c) {
        return Math.abs((b.x() - a.x()) * (c.y() - a.y()) - (c.x() - a.x()) * (b.y() - a.y())) / 2.0;
    }

    private static int containing(final Mesh mesh, final Point p) {
        int ret = 0;
        for(final Face f: mesh.getFaces()) {
            if(f.contains(p))
                ret++;
        }
        return ret;
    }

    @Test
    public void testTrianglesAreCounterClockwise() {
        final List<Point> pts = random(new Random(3L), 40, 100.0);
        final MeshBuilder builder = new MeshBuilder(pts);
        for(final int[] t: builder.getTriangles())
            assertEquals(1, Vectors.orientation(pts.get(t[0]), pts.get(t[1]), pts.get(t[2])));
    }

    @Test
    public void testSquareWithCenter() {
        final List<Point> pts = points(0, 0, 10, 0, 10, 10, 0, 10, 5, 5);
        final MeshBuilder builder = new MeshBuilder(pts);
        assertEquals(4, builder.getTriangleCount());
        assertTrue(builder.isHullEdge(0, 1));
        assertFalse(builder.isHullEdge(1, 0));
        assertFalse(builder.isHullEdge(0, 4));

        final Mesh mesh = builder.build(pts);
        for(final Face f: mesh.getFaces()) {
            assertTrue(f.getBoundary() instanceof Boundary.Wedge);
            assertEquals(2, ((Boundary.Wedge)f.getBoundary()).getEdgeCoords().length);
        }

        // below the bottom edge only the bottom face applies
        final Point below = new SimplePoint(5, -100);
        final Face bottom = mesh.getFace(mesh.locate(below));
        assertEquals(1, containing(mesh, below));
        assertEquals(0.0, ((Boundary.Wedge)bottom.getBoundary()).getEdgeCoords()[0].y(), 0.0);
        assertEquals(0.0, ((Boundary.Wedge)bottom.getBoundary()).getEdgeCoords()[1].y(), 0.0);
    }

    @Test
    public void testTwoHullEdges() {
        final List<Point> pts = points(0, 0, 10, 0, 10, 10, 0, 10);
        final Mesh mesh = new MeshBuilder(pts).build(pts);
        assertEquals(2, mesh.size());
        for(final Face f: mesh.getFaces()) {
            final Boundary.Wedge wedge = (Boundary.Wedge)f.getBoundary();
            assertEquals(3, wedge.getEdgeCoords().length);
            assertEquals(1.0, wedge.getFromRay().magnitude(), 0.00000000001);
            assertEquals(1.0, wedge.getToRay().magnitude(), 0.00000000001);
        }

        // beyond every corner
        for(final Point p: points(-5, -2, 15, -3, 12, 16, -2, 13))
            assertEquals(p.toString(), 1, containing(mesh, p));
    }

    @Test
    public void testInteriorTrianglesAreClosed() {
        final List<Point> pts = random(new Random(11L), 50, 100.0);
        final Mesh mesh = new MeshBuilder(pts).build(pts);

        int closed = 0;
        for(final Face f: mesh.getFaces()) {
            if(f.getBoundary() instanceof Boundary.ClosedTriangle) {
                closed++;
                final Point[] coords = ((Boundary.ClosedTriangle)f.getBoundary()).getCoords();
                assertEquals(4, coords.length);
                assertEquals(coords[0], coords[3]);

                final Envelope env = f.getEnvelope();
                assertTrue(env.getMaxX() < Boundary.UNBOUNDED && env.getMinY() > -Boundary.UNBOUNDED);
            }
        }
        assertTrue(closed > 0);
    }

    @Test
    public void testWedgeEnvelopesOpenTowardTheRays() {
        final List<Point> pts = points(0, 0, 10, 0, 10, 10, 0, 10, 5, 5);
        final Mesh mesh = new MeshBuilder(pts).build(pts);
        final Face bottom = mesh.getFace(mesh.locate(new SimplePoint(5, -1)));
        final Envelope env = bottom.getEnvelope();
        // rays point down-left and down-right
        assertEquals(-Boundary.UNBOUNDED, env.getMinX(), 0.0);
        assertEquals(Boundary.UNBOUNDED, env.getMaxX(), 0.0);
        assertEquals(-Boundary.UNBOUNDED, env.getMinY(), 0.0);
        assertEquals(5.0, env.getMaxY(), 0.0);
    }

    @Test
    public void testCoverageIsTotal() {
        final Random rand = new Random(99L);
        final List<Point> raster = random(rand, 40, 1000.0);
        final MeshBuilder builder = new MeshBuilder(raster);
        final Mesh mesh = builder.build(raster);
        // beyond a corner where the triangulation's own boundary bends inward
        assertEquals(1, containing(mesh, new SimplePoint(1585.88, 1032.35)));

        for(int k = 0; k < 3000; k++) {
            final double range = k % 3 == 0 ? 1.0e6 : 3000.0;
            final Point p = new SimplePoint(rand.nextDouble() * range - range / 2 + 500, rand.nextDouble() * range - range / 2 + 500);
            assertEquals(p.toString(), 1, containing(mesh, p));
            assertTrue(mesh.getFace(mesh.locate(p)).contains(p));
        }
    }

    @Test
    public void testHullIsConvexAndFilled() {
        for(final long seed: new long[] {3L,11L,99L,2024L}) {
            final List<Point> pts = random(new Random(seed), 40, 1000.0);
            final MeshBuilder builder = new MeshBuilder(pts);
            final int[] hull = builder.getHull();

            double hullArea = 0.0;
            for(int i = 0; i < hull.length; i++) {
                final Point prev = pts.get(hull[(i + hull.length - 1) % hull.length]);
                final Point v = pts.get(hull[i]);
                final Point next = pts.get(hull[(i + 1) % hull.length]);
                assertTrue("seed " + seed + " has a reflex hull corner at " + hull[i], Vectors.orientation(prev, v, next) >= 0);
                assertTrue(builder.isHullEdge(hull[i], hull[(i + 1) % hull.length]));
                hullArea += (v.x() * next.y() - next.x() * v.y()) / 2.0;
            }

            double trianglesArea = 0.0;
            for(final int[] t: builder.getTriangles())
                trianglesArea += area(pts.get(t[0]), pts.get(t[1]), pts.get(t[2]));
            assertEquals("seed " + seed, hullArea, trianglesArea, hullArea * 1.0E-9);
        }
    }

    @Test
    public void testCurvedModelMeshCoverage() {
        final List<Point> raster = grid();
        final Mesh mesh = new MeshBuilder(raster).build(warp(raster));
        assertTrue(mesh.isCovering());

        int pockets = 0;
        for(final Face f: mesh.getFaces()) {
            if(f.getBoundary() instanceof Boundary.Wedge)
                pockets += ((Boundary.Wedge)f.getBoundary()).getPockets().size();
        }
        assertTrue(pockets > 0);

        final Random rand = new Random(17L);
        for(int k = 0; k < 3000; k++) {
            final Point p = new SimplePoint(rand.nextDouble() * 400 - 150, rand.nextDouble() * 400 - 150);
            assertEquals(p.toString(), 1, containing(mesh, p));
        }
        for(int k = 0; k < 500; k++) {
            final Point p = new SimplePoint(rand.nextDouble() * 2.0e6 - 1.0e6, rand.nextDouble() * 2.0e6 - 1.0e6);
            assertEquals(p.toString(), 1, containing(mesh, p));
        }
    }

    @Test
    public void testFoldedMeshResolvesToNearestFace() {
        final List<Point> raster = points(0, 0, 10, 0, 10, 10, 0, 10, 5, 5);
        // the center is dragged past the right side
        final List<Point> model = points(0, 0, 10, 0, 10, 10, 0, 10, 20, 5);
        final Mesh mesh = new MeshBuilder(raster).build(model);
        assertFalse(mesh.isCovering());

        final Random rand = new Random(23L);
        for(int k = 0; k < 1000; k++) {
            final Point p = new SimplePoint(rand.nextDouble() * 200 - 100, rand.nextDouble() * 200 - 100);
            final Face face = mesh.getFace(mesh.locate(p));
            assertNotNull(face);
            assertFalse(face.isDegenerate());
        }
    }

    @Test
    public void testCollinearModelPoints() {
        final List<Point> raster = points(0, 0, 10, 0, 10, 10, 0, 10);
        final MeshBuilder builder = new MeshBuilder(raster);
        assertThrows(GeoTiffFormatException.class, () -> builder.build(points(0, 0, 1, 1, 2, 2, 3, 3)));
    }

    @Test
    public void testMirroredMeshCoverage() {
        final Random rand = new Random(5L);
        final List<Point> raster = random(rand, 25, 100.0);
        final List<Point> mirrored = new ArrayList<>();
        for(final Point p: raster)
            mirrored.add(new SimplePoint(p.x() * 3 + 7, -p.y() * 3 + 1000));

        final Mesh mesh = new MeshBuilder(raster).build(mirrored);
        for(int k = 0; k < 2000; k++) {
            final Point p = new SimplePoint(rand.nextDouble() * 4000 - 2000, rand.nextDouble() * 4000 - 1000);
            assertEquals(p.toString(), 1, containing(mesh, p));
        }
    }

    @Test
    public void testCollinearHullPoints() {
        // 3 points along the bottom edge
        final List<Point> pts = points(0, 0, 5, 0, 10, 0, 10, 10, 0, 10, 4, 6);
        final Mesh mesh = new MeshBuilder(pts).build(pts);
        for(final Point p: points(5.5, -3, 2.5, -100, 7.5, -0.001, -3, -2, 13, -2.5))
            assertEquals(p.toString(), 1, containing(mesh, p));
    }

    @Test
    public void testBarycentric() {
        final Face face = new Face(new SimplePoint(0, 0), new SimplePoint(4, 0), new SimplePoint(0, 2), new Boundary.Interior());
        final double[] uv = face.barycentric(new SimplePoint(1, 1));
        assertEquals(0.25, uv[0], 0.00000000001);
        assertEquals(0.5, uv[1], 0.00000000001);

        final Point back = face.interpolate(uv[0], uv[1]);
        assertEquals(1.0, back.x(), 0.00000000001);
        assertEquals(1.0, back.y(), 0.00000000001);
    }

    @Test
    public void testMismatchedPointCount() {
        final List<Point> pts = points(0, 0, 10, 0, 10, 10);
        final MeshBuilder builder = new MeshBuilder(pts);
        assertThrows(IllegalArgumentException.class, () -> builder.build(points(0, 0, 1, 1)));
    }

    @Test
    public void testNonFinitePoint() {
        assertThrows(GeoTiffFormatException.class, () -> new MeshBuilder(points(0, 0, 10, 0, Double.NaN, 10)));
    }
}
