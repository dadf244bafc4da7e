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

package ai.kognition.pilegeo4j.geotiff;

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilegeo4j.util.PropertiesUtils;

/**
 * Reader settings. {@link #load()} reads {@value #RESOURCE} from the classpath and lets
 * JVM system properties with the same keys override it.
 */
public class GeoTiffConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiffConfig.class);

    public static final String RESOURCE = "pilegeo4j.properties";
    public static final String SECTION = "pilegeo4j";

    public static final String TIE_POINTS_ENABLED = SECTION + ".transform.tie-points.enabled";
    public static final String IMAGE_INDEX = SECTION + ".image.index";

    private final boolean tiePointsEnabled;
    private final int imageIndex;

    public GeoTiffConfig(final boolean tiePointsEnabled, final int imageIndex) {
        if(imageIndex < 0)
            throw new IllegalArgumentException("The image index must not be negative but was " + imageIndex);
        this.tiePointsEnabled = tiePointsEnabled;
        this.imageIndex = imageIndex;
    }

    public GeoTiffConfig(final Properties props) {
        this(PropertiesUtils.getBoolean(props, TIE_POINTS_ENABLED, true), PropertiesUtils.getInt(props, IMAGE_INDEX, 0));
    }

    private static class DefaultHolder {
        private static final GeoTiffConfig DEFAULT = load();
    }

    /**
     * The configuration from {@link #load()}, read the first time it's asked for and shared after that.
     */
    public static GeoTiffConfig getDefault() {
        return DefaultHolder.DEFAULT;
    }

    public static GeoTiffConfig load() {
        final Properties props = PropertiesUtils.overlaySystemProperties(PropertiesUtils.loadResource(RESOURCE), SECTION);
        final GeoTiffConfig ret = new GeoTiffConfig(props);
        LOGGER.debug("Loaded {}", ret);
        return ret;
    }

    /**
     * Whether a transform may be built from more than one tie point. When it's {@code false}
     * such files fail with a {@link GeoTiffFormatException}.
     */
    public boolean isTiePointsEnabled() {
        return tiePointsEnabled;
    }

    /**
     * The TIFF directory (image) that's decoded.
     */
    public int getImageIndex() {
        return imageIndex;
    }

    public GeoTiffConfig withTiePointsEnabled(final boolean enabled) {
        return new GeoTiffConfig(enabled, imageIndex);
    }

    public GeoTiffConfig withImageIndex(final int index) {
        return new GeoTiffConfig(tiePointsEnabled, index);
    }

    @Override
    public String toString() {
        return "GeoTiffConfig [tiePointsEnabled=" + tiePointsEnabled + ", imageIndex=" + imageIndex + "]";
    }
}
