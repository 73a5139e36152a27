package fmap.domain.mapping;

/**
 * Which rule selected a slot, strongest first
 * @since 14/10/2026
 */
public enum EMatchTier {
    FINGERPRINT,    // Same spool as at slice time
    COLOR,          // Same material and color
    SIMILAR_COLOR,  // Same material, color within tolerance
    TYPE_ONLY,      // Same material, different color
    NONE;           // Nothing usable

    public boolean isMatched() {
        return this != NONE;
    }

    public boolean isColorMatch() {
        return this == FINGERPRINT || this == COLOR || this == SIMILAR_COLOR;
    }
}
