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

package ai.kognition.pilegeo4j.geotiff.geokey;

import java.util.HashMap;
import java.util.Map;

/**
 * The georeferencing keys this reader understands, with the type of value each one carries.
 */
public enum GeoKey {
    ModelType(1024, ValueType.SHORT),
    RasterType(1025, ValueType.SHORT),
    Citation(1026, ValueType.ASCII),

    GeographicType(2048, ValueType.SHORT),
    GeogCitation(2049, ValueType.ASCII),
    GeogGeodeticDatum(2050, ValueType.SHORT),
    GeogPrimeMeridian(2051, ValueType.SHORT),
    GeogLinearUnits(2052, ValueType.SHORT),
    GeogLinearUnitSize(2053, ValueType.DOUBLE),
    GeogAngularUnits(2054, ValueType.SHORT),
    GeogAngularUnitSize(2055, ValueType.DOUBLE),
    GeogEllipsoid(2056, ValueType.SHORT),
    GeogSemiMajorAxis(2057, ValueType.DOUBLE),
    GeogSemiMinorAxis(2058, ValueType.DOUBLE),
    GeogInvFlattening(2059, ValueType.DOUBLE),
    GeogAzimuthUnits(2060, ValueType.SHORT),
    GeogPrimeMeridianLong(2061, ValueType.DOUBLE),

    ProjectedType(3072, ValueType.SHORT),
    ProjCitation(3073, ValueType.ASCII),
    Projection(3074, ValueType.SHORT),
    ProjCoordTrans(3075, ValueType.SHORT),
    ProjLinearUnits(3076, ValueType.SHORT),
    ProjLinearUnitSize(3077, ValueType.DOUBLE),
    ProjStdParallel1(3078, ValueType.DOUBLE),
    ProjStdParallel2(3079, ValueType.DOUBLE),
    ProjNatOriginLong(3080, ValueType.DOUBLE),
    ProjNatOriginLat(3081, ValueType.DOUBLE),
    ProjFalseEasting(3082, ValueType.DOUBLE),
    ProjFalseNorthing(3083, ValueType.DOUBLE),
    ProjFalseOriginLong(3084, ValueType.DOUBLE),
    ProjFalseOriginLat(3085, ValueType.DOUBLE),
    ProjFalseOriginEasting(3086, ValueType.DOUBLE),
    ProjFalseOriginNorthing(3087, ValueType.DOUBLE),
    ProjCenterLong(3088, ValueType.DOUBLE),
    ProjCenterLat(3089, ValueType.DOUBLE),
    ProjCenterEasting(3090, ValueType.DOUBLE),
    ProjCenterNorthing(3091, ValueType.DOUBLE),
    ProjScaleAtNatOrigin(3092, ValueType.DOUBLE),
    ProjScaleAtCenter(3093, ValueType.DOUBLE),
    ProjAzimuthAngle(3094, ValueType.DOUBLE),
    ProjStraightVertPoleLong(3095, ValueType.DOUBLE),

    Vertical(4096, ValueType.SHORT),
    VerticalCitation(4097, ValueType.ASCII),
    VerticalDatum(4098, ValueType.SHORT),
    VerticalUnits(4099, ValueType.SHORT);

    public static enum ValueType {
        SHORT, DOUBLE, ASCII
    }

    private static final Map<Integer, GeoKey> BY_ID = new HashMap<>();

    static {
        for(final GeoKey k: values())
            BY_ID.put(k.id, k);
    }

    public final int id;
    public final ValueType valueType;

    private GeoKey(final int id, final ValueType valueType) {
        this.id = id;
        this.valueType = valueType;
    }

    /**
     * @return the key or {@code null} if the id isn't one this reader knows.
     */
    public static GeoKey byId(final int id) {
        return BY_ID.get(id);
    }
}
