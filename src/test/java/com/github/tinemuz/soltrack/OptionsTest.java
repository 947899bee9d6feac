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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OptionsTest {

    @Test
    @DisplayName("Bundled defaults: radians, south = 0, nothing optional")
    void bundledDefaults() {
        Options defaults = Options.defaults();
        for (Option option : Option.values()) {
            assertFalse(defaults.contains(option), option.name());
        }
        assertEquals(Options.none(), defaults);
        assertSame(defaults, Options.defaults(), "loaded once");
    }

    @Test
    @DisplayName("Properties switch options on")
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty("soltrack.useDegrees", "true");
        props.setProperty("soltrack.useNorthEqualsZero", " TRUE ");
        props.setProperty("soltrack.computeDistance", "false");
        props.setProperty("unrelated.key", "whatever");

        Options options = Options.fromProperties(props);
        assertEquals(Options.of(Option.USE_DEGREES, Option.USE_NORTH_EQUALS_ZERO), options);
        assertFalse(options.contains(Option.COMPUTE_DISTANCE));
        assertFalse(options.contains(Option.COMPUTE_REFR_EQUATORIAL));
    }

    @Test
    @DisplayName("Unknown soltrack keys are ignored")
    void unknownKey() {
        Properties props = new Properties();
        props.setProperty("soltrack.useRadians", "true");
        assertEquals(Options.none(), Options.fromProperties(props));
    }

    @Test
    @DisplayName("Non-boolean values are rejected")
    void invalidValue() {
        Properties props = new Properties();
        props.setProperty("soltrack.computeDistance", "yes");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Options.fromProperties(props));
        assertTrue(e.getMessage().contains("soltrack.computeDistance"));
    }

    @Test
    @DisplayName("with and without return new instances")
    void withWithout() {
        Options base = Options.of(Option.USE_DEGREES);
        Options more = base.with(Option.COMPUTE_DISTANCE);
        assertTrue(more.contains(Option.COMPUTE_DISTANCE));
        assertFalse(base.contains(Option.COMPUTE_DISTANCE));

        Options less = more.without(Option.USE_DEGREES);
        assertEquals(Options.of(Option.COMPUTE_DISTANCE), less);
        assertEquals(Options.none(), Options.none().without(Option.USE_DEGREES));
        assertEquals(base.hashCode(), Options.of(Option.USE_DEGREES).hashCode());
    }

    @Test
    @DisplayName("Every option has a distinct property key")
    void propertyKeys() {
        assertEquals("soltrack.useDegrees", Option.USE_DEGREES.propertyKey());
        assertEquals("soltrack.useNorthEqualsZero", Option.USE_NORTH_EQUALS_ZERO.propertyKey());
        assertEquals("soltrack.computeRefrEquatorial", Option.COMPUTE_REFR_EQUATORIAL.propertyKey());
        assertEquals("soltrack.computeDistance", Option.COMPUTE_DISTANCE.propertyKey());
    }
}
