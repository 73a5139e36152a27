package fmap.domain.mapping.review;

/**
 * Overall verdict for one printer
 * @since 15/10/2026
 */
public enum EPrinterMatchStatus {
    FULL,       // Every filament matched on material and color
    PARTIAL,    // Some filament only matched on material
    MISSING     // Some material is not loaded at all
}
