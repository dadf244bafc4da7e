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

package ai.kognition.pilegeo4j.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Enumeration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Select the properties that start with {@code sectionName + "."}.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(sectionName + separator)) {
                final String newkey = removeSectionName ? key.substring(sectionName.length() + 1) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Load a properties resource from the classpath. A missing resource results in an
     * empty {@link Properties}.
     *
     * @throws UncheckedIOException if the resource exists but can't be read.
     */
    public static Properties loadResource(final String resource) {
        final Properties ret = new Properties();
        final ClassLoader cl = Thread.currentThread().getContextClassLoader() == null ? PropertiesUtils.class.getClassLoader()
            : Thread.currentThread().getContextClassLoader();

        try(InputStream is = cl.getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.debug("No properties resource \"{}\" on the classpath.", resource);
                return ret;
            }
            ret.load(is);
        } catch(final IOException ioe) {
            throw new UncheckedIOException("Couldn't load properties from the classpath resource " + resource, ioe);
        }

        LOGGER.debug("Loaded {} properties from \"{}\"", ret.size(), resource);
        return ret;
    }

    /**
     * Any key in {@code props} that's also set as a system property takes the system property's value.
     * The passed {@link Properties} isn't modified.
     */
    public static Properties overlaySystemProperties(final Properties props, final String sectionName) {
        final Properties ret = new Properties();
        ret.putAll(props);

        final Properties system = getSection(System.getProperties(), sectionName, false);
        for(final String key: system.stringPropertyNames()) {
            LOGGER.trace("System property {} overrides {}", key, props.getProperty(key));
            ret.setProperty(key, system.getProperty(key));
        }
        return ret;
    }

    public static boolean getBoolean(final Properties props, final String key, final boolean defaultValue) {
        final String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public static int getInt(final Properties props, final String key, final int defaultValue) {
        final String val = props.getProperty(key);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be an integer but was \"" + val + "\"", nfe);
        }
    }
}
