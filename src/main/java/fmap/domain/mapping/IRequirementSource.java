package fmap.domain.mapping;

import java.util.List;

/**
 * Extracts the ordered filament requirements from a submitted print job (slicer metadata parser)
 * @since 14/10/2026
 */
public interface IRequirementSource {
    List<FilamentRequirement> getRequirements(String jobId);
}
