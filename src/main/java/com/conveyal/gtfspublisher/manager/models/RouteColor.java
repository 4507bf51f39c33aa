package com.conveyal.gtfspublisher.manager.models;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * The RGBA color of a route, decoded from the six hex digit route_color field of routes.txt.
 */
public class RouteColor {
    /** Mid-grey, used whenever the source color is empty or malformed. */
    private static final int[] DEFAULT_RGBA = {136, 136, 136, 255};
    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-Fa-f]{6}");

    public final String routeId;
    private final int[] rgba;

    public RouteColor(String routeId, int[] rgba) {
        this.routeId = routeId;
        this.rgba = rgba.clone();
    }

    /**
     * Decode a route color. Anything other than exactly six hex digits falls back to the default grey.
     */
    public static RouteColor fromHex(String routeId, String hex) {
        return new RouteColor(routeId, decode(hex));
    }

    public static int[] decode(String hex) {
        if (hex == null || !HEX_COLOR.matcher(hex).matches()) {
            return defaultRgba();
        }
        return new int[] {
            Integer.parseInt(hex.substring(0, 2), 16),
            Integer.parseInt(hex.substring(2, 4), 16),
            Integer.parseInt(hex.substring(4, 6), 16),
            255
        };
    }

    public static int[] defaultRgba() {
        return DEFAULT_RGBA.clone();
    }

    public int[] getRgba() {
        return rgba.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouteColor that = (RouteColor) o;
        return routeId.equals(that.routeId) && Arrays.equals(rgba, that.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * routeId.hashCode() + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return String.format("RouteColor{%s %s}", routeId, Arrays.toString(rgba));
    }
}
