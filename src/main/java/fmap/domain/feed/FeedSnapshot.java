package fmap.domain.feed;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of a printer's material-feed hardware at one point in time
 * @since 14/10/2026
 */
public record FeedSnapshot(List<FeedUnit> units, List<ExternalFeed> externals, Optional<ExtruderTopology> topology) {

    public FeedSnapshot {
        units = units == null ? List.of() : List.copyOf(units);
        externals = externals == null ? List.of() : List.copyOf(externals);
        // An empty wiring map carries no information
        topology = topology == null ? Optional.empty() : topology.filter(t -> !t.isEmpty());
    }

    public static FeedSnapshot of(List<FeedUnit> units) {
        return new FeedSnapshot(units, List.of(), Optional.empty());
    }

    public FeedSnapshot withExternals(ExternalFeed... feeds) {
        return new FeedSnapshot(units, List.of(feeds), topology);
    }

    public FeedSnapshot withTopology(ExtruderTopology value) {
        return new FeedSnapshot(units, externals, Optional.ofNullable(value));
    }
}
