package fmap.domain.mapping.review;

import java.util.List;

/**
 * Counts used to rank printers when one job can go to several of them
 * @since 15/10/2026
 */
public record PrinterMatchSummary(int exactMatches, int typeOnlyMatches, int missingTypes, int totalSlots) {

    public static PrinterMatchSummary of(List<FilamentComparison> comparisons) {
        int exact = 0;
        int typeOnly = 0;
        int missing = 0;
        for (FilamentComparison comparison : comparisons) {
            switch (comparison.status()) {
                case MATCH -> exact++;
                case TYPE_ONLY -> typeOnly++;
                case MISMATCH -> missing++;
            }
        }
        return new PrinterMatchSummary(exact, typeOnly, missing, comparisons.size());
    }

    public EPrinterMatchStatus status() {
        if (missingTypes > 0) {
            return EPrinterMatchStatus.MISSING;
        }
        if (typeOnlyMatches > 0) {
            return EPrinterMatchStatus.PARTIAL;
        }
        return EPrinterMatchStatus.FULL;
    }
}
