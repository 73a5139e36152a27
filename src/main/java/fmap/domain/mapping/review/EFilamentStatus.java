package fmap.domain.mapping.review;

/**
 * @since 15/10/2026
 */
public enum EFilamentStatus {
    MATCH,       // Material and color agree (or same spool)
    TYPE_ONLY,   // Material agrees, color differs
    MISMATCH     // Material not available
}
