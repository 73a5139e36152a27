package fmap.domain.feed;

import fmap.common.MappingConstants;

import java.util.Locale;

/**
 * Color and material comparison helpers.
 * Printers report "RRGGBBAA", slicers write "#RRGGBB"; both compare on the first six hex digits.
 * @since 14/10/2026
 */
public final class FeedColors {
    private FeedColors() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    /**
     * Strip '#' and alpha, lowercase. Returns an empty string for a missing color.
     */
    public static String normalizeForCompare(String color) {
        if (color == null) {
            return "";
        }
        String hex = color.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        }
        if (hex.length() > 6) {
            hex = hex.substring(0, 6);
        }
        return hex.toLowerCase(Locale.ROOT);
    }

    public static String normalizeForDisplay(String color) {
        String hex = normalizeForCompare(color);
        if (hex.isEmpty()) {
            return MappingConstants.UNKNOWN_DISPLAY_COLOR;
        }
        return "#" + hex.toUpperCase(Locale.ROOT);
    }

    /**
     * Two colors are similar when every RGB channel differs by at most {@code tolerance}.
     * Missing or malformed colors are never similar to anything.
     */
    public static boolean areSimilar(String color1, String color2, int tolerance) {
        if (tolerance <= 0) {
            return false;
        }
        int[] rgb1 = toRgb(normalizeForCompare(color1));
        int[] rgb2 = toRgb(normalizeForCompare(color2));
        if (rgb1 == null || rgb2 == null) {
            return false;
        }
        for (int i = 0; i < 3; i++) {
            if (Math.abs(rgb1[i] - rgb2[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * Case-insensitive material comparison; a blank material never matches.
     */
    public static boolean sameMaterial(String type1, String type2) {
        if (type1 == null || type2 == null) {
            return false;
        }
        String a = type1.trim();
        return !a.isEmpty() && a.equalsIgnoreCase(type2.trim());
    }

    private static int[] toRgb(String hex) {
        if (hex.length() != 6) {
            return null;
        }
        try {
            return new int[]{
                    Integer.parseInt(hex.substring(0, 2), 16),
                    Integer.parseInt(hex.substring(2, 4), 16),
                    Integer.parseInt(hex.substring(4, 6), 16)
            };
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
