/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.soltrack;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of {@link Option} switches for one computation.
 *
 * <p>{@link #defaults()} reads the classpath resource
 * <code>soltrack.properties</code> once; each option is a boolean key, for
 * example <code>soltrack.useDegrees=true</code>.</p>
 */
public final class Options {
    private static final Logger log = LoggerFactory.getLogger(Options.class);
    private static final String RESOURCE = "soltrack.properties";
    private static final String KEY_PREFIX = "soltrack.";
    private static final Options NONE = new Options(EnumSet.noneOf(Option.class));

    private static volatile Options defaults;

    private final Set<Option> enabled;

    private Options(EnumSet<Option> enabled) {
        this.enabled = Collections.unmodifiableSet(enabled);
    }

    /** Radians, south = 0, no back-conversion, no distance. */
    public static Options none() {
        return NONE;
    }

    public static Options of(Option... options) {
        EnumSet<Option> set = EnumSet.noneOf(Option.class);
        set.addAll(Arrays.asList(options));
        return new Options(set);
    }

    /**
     * Options declared in the bundled <code>soltrack.properties</code>.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static Options defaults() {
        Options d = defaults;
        if (d == null) {
            d = ensureLoaded();
        }
        return d;
    }

    private static synchronized Options ensureLoaded() {
        if (defaults != null) return defaults;
        defaults = loadFromResource();
        log.debug("Loaded default options {} from {}", defaults, RESOURCE);
        return defaults;
    }

    private static Options loadFromResource() {
        InputStream in = Options.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Options file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Options file '" + RESOURCE + "' not found on classpath");
        }
        try (InputStream stream = in) {
            Properties props = new Properties();
            props.load(stream);
            return fromProperties(props);
        } catch (IOException e) {
            log.error("Failed to read options file '{}'", RESOURCE, e);
            throw new IllegalStateException("Failed to read options file '" + RESOURCE + "'", e);
        }
    }

    /**
     * Build options from <code>soltrack.*</code> boolean properties. Keys that
     * are absent leave the option off; unknown <code>soltrack.*</code> keys are
     * ignored with a warning.
     *
     * @throws IllegalStateException if a value is not <code>true</code> or <code>false</code>
     */
    public static Options fromProperties(Properties props) {
        EnumSet<Option> set = EnumSet.noneOf(Option.class);
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(KEY_PREFIX)) continue;
            Option option = forKey(key);
            if (option == null) {
                log.warn("Ignoring unknown option '{}'", key);
                continue;
            }
            String value = props.getProperty(key).trim();
            if (value.equalsIgnoreCase("true")) {
                set.add(option);
            } else if (!value.equalsIgnoreCase("false")) {
                throw new IllegalStateException(
                        "Option '" + key + "' must be true or false, got '" + value + "'");
            }
        }
        return new Options(set);
    }

    private static Option forKey(String key) {
        for (Option option : Option.values()) {
            if (option.propertyKey().equals(key)) return option;
        }
        return null;
    }

    public boolean contains(Option option) {
        return enabled.contains(option);
    }

    public Options with(Option option) {
        EnumSet<Option> set = copy();
        set.add(option);
        return new Options(set);
    }

    public Options without(Option option) {
        EnumSet<Option> set = copy();
        set.remove(option);
        return new Options(set);
    }

    private EnumSet<Option> copy() {
        return enabled.isEmpty() ? EnumSet.noneOf(Option.class) : EnumSet.copyOf(enabled);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Options && ((Options) o).enabled.equals(enabled);
    }

    @Override
    public int hashCode() {
        return enabled.hashCode();
    }

    @Override
    public String toString() {
        return enabled.toString();
    }
}
