package fmap.domain.mapping;

import java.util.List;

/**
 * Used when no job parser is wired in; requirements then only arrive through events.
 * @since 14/10/2026
 */
public class NoOpRequirementSource implements IRequirementSource {
    @Override
    public List<FilamentRequirement> getRequirements(String jobId) {
        return List.of();
    }
}
