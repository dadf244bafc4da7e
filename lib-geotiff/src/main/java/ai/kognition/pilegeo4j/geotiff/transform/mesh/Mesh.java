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

import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.geotiff.geometry.Point;
import ai.kognition.pilegeo4j.geotiff.geometry.Vectors;

/**
 * An ordered list of faces plus an R-tree over their envelopes. The tree holds face indices
 * rather than the faces themselves; a position in the list is the key shared with the
 * corresponding mesh in the other space.
 * <p>
 * A mesh whose faces cover the plane exactly once is {@link #isCovering() covering}. Model space
 * meshes whose tie points fold over themselves aren't. Points none of their faces contain resolve
 * to the nearest face instead.
 * </p>
 */
public final class Mesh {
    private static final Logger LOGGER = LoggerFactory.getLogger(Mesh.class);

    private final List<Face> faces;
    private final boolean covering;
    private final STRtree index = new STRtree();

    public Mesh(final List<Face> faces) {
        this(faces, true);
    }

    public Mesh(final List<Face> faces, final boolean covering) {
        if(faces.isEmpty())
            throw new IllegalArgumentException("A mesh needs at least one face");

        this.faces = Collections.unmodifiableList(faces);
        this.covering = covering;
        for(int i = 0; i < faces.size(); i++)
            index.insert(faces.get(i).getEnvelope(), Integer.valueOf(i));

        // built up front so that queries never modify the tree
        index.build();
    }

    public int size() {
        return faces.size();
    }

    public Face getFace(final int i) {
        return faces.get(i);
    }

    public List<Face> getFaces() {
        return faces;
    }

    public boolean isCovering() {
        return covering;
    }

    /**
     * Indices of the faces whose envelope contains {@code p}.
     */
    @SuppressWarnings("unchecked")
    public List<Integer> candidates(final Point p) {
        return index.query(new Envelope(Vectors.toCoordinate(p)));
    }

    /**
     * The index of the face containing {@code p}. On the shared boundary of several faces it's the
     * lowest index.
     *
     * @throws IllegalStateException if the mesh is covering and still no face contains the point,
     *             which means the mesh itself is broken.
     */
    public int locate(final Point p) {
        int ret = -1;
        for(final Integer i: candidates(p)) {
            if((ret < 0 || i < ret) && usable(i) && faces.get(i).contains(p))
                ret = i;
        }
        if(ret >= 0)
            return ret;
        if(covering)
            throw new IllegalStateException("No face of the mesh contains " + p + ". The mesh doesn't cover the plane.");
        return nearest(p);
    }

    private boolean usable(final int i) {
        return covering || !faces.get(i).isDegenerate();
    }

    private int nearest(final Point p) {
        int ret = -1;
        double best = Double.POSITIVE_INFINITY;
        for(int i = 0; i < faces.size(); i++) {
            if(!usable(i))
                continue;
            final double d = faces.get(i).distance(p);
            if(ret < 0 || d < best) {
                ret = i;
                best = d;
            }
        }
        if(ret < 0)
            throw new IllegalStateException("Every face of the mesh is degenerate so nothing can be located in it");
        LOGGER.trace("No face contains {}. Using the nearest one, {}, at a distance of {}", p, ret, best);
        return ret;
    }
}
