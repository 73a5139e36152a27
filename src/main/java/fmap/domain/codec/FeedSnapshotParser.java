package fmap.domain.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fmap.common.MappingConstants;
import fmap.domain.feed.ExternalFeed;
import fmap.domain.feed.ExtruderTopology;
import fmap.domain.feed.FeedSlot;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.FeedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads printer status JSON into a {@link FeedSnapshot}.
 * <pre>
 * {
 *   "ams": [ { "id": 0, "tray": [ { "id": 0, "tray_type": "PLA", "tray_color": "FF0000FF",
 *                                   "tray_info_idx": "GFA00", "tray_sub_brands": "PLA Basic" } ] } ],
 *   "vt_tray": { "id": 254, "tray_type": "TPU", "tray_color": "0000FF" },
 *   "ams_extruder_map": { "0": 1, "1": 0 }
 * }
 * </pre>
 * {@code vt_tray} may also be an array of holders. Unexpected shapes are skipped, never rejected.
 *
 * @since 15/10/2026
 */
public class FeedSnapshotParser {
    private static final Logger logger = LoggerFactory.getLogger(FeedSnapshotParser.class);

    public FeedSnapshot parse(String json) throws FeedParseException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json == null ? "" : json);
        } catch (JsonParseException e) {
            throw new FeedParseException("Invalid printer status JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new FeedParseException("Printer status must be a JSON object");
        }
        return fromJson(root.getAsJsonObject());
    }

    public FeedSnapshot fromJson(JsonObject status) {
        List<FeedUnit> units = readUnits(JsonFields.array(status, "ams"));
        List<ExternalFeed> externals = readExternals(status.get("vt_tray"));
        Optional<ExtruderTopology> topology = readTopology(status.get("ams_extruder_map"));
        return new FeedSnapshot(units, externals, topology);
    }

    private List<FeedUnit> readUnits(JsonArray ams) {
        List<FeedUnit> units = new ArrayList<>();
        for (JsonElement element : ams) {
            Optional<JsonObject> unit = JsonFields.object(element);
            if (unit.isEmpty()) {
                continue;
            }
            OptionalInt id = JsonFields.integer(unit.get(), "id");
            if (id.isEmpty()) {
                logger.debug("Skipping feed unit without id: {}", element);
                continue;
            }
            List<FeedSlot> slots = new ArrayList<>();
            for (JsonElement trayElement : JsonFields.array(unit.get(), "tray")) {
                JsonFields.object(trayElement).ifPresent(tray -> slots.add(readSlot(tray)));
            }
            units.add(new FeedUnit(id.getAsInt(), slots));
        }
        return units;
    }

    private List<ExternalFeed> readExternals(JsonElement vtTray) {
        List<ExternalFeed> externals = new ArrayList<>();
        if (vtTray == null) {
            return externals;
        }
        if (vtTray.isJsonObject()) {
            JsonObject tray = vtTray.getAsJsonObject();
            int position = JsonFields.integer(tray, "id").orElse(MappingConstants.EXTERNAL_PRIMARY_ID);
            externals.add(new ExternalFeed(position, readSlot(tray)));
        } else if (vtTray.isJsonArray()) {
            JsonArray trays = vtTray.getAsJsonArray();
            for (int i = 0; i < trays.size(); i++) {
                int defaultPosition = MappingConstants.EXTERNAL_PRIMARY_ID + i;
                JsonFields.object(trays.get(i)).ifPresent(tray -> {
                    int position = JsonFields.integer(tray, "id").orElse(defaultPosition);
                    externals.add(new ExternalFeed(position, readSlot(tray)));
                });
            }
        }
        return externals;
    }

    private Optional<ExtruderTopology> readTopology(JsonElement map) {
        Optional<JsonObject> obj = JsonFields.object(map);
        if (obj.isEmpty()) {
            return Optional.empty();
        }
        Map<Integer, Integer> wiring = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : obj.get().entrySet()) {
            if (!entry.getValue().isJsonPrimitive()) {
                continue;
            }
            try {
                int unitId = Integer.parseInt(entry.getKey().trim());
                JsonFields.parseInt(entry.getValue().getAsJsonPrimitive())
                        .ifPresent(extruder -> wiring.put(unitId, extruder));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring extruder map key '{}'", entry.getKey());
            }
        }
        return wiring.isEmpty() ? Optional.empty() : Optional.of(new ExtruderTopology(wiring));
    }

    private static FeedSlot readSlot(JsonObject tray) {
        return new FeedSlot(
                JsonFields.integer(tray, "id"),
                JsonFields.string(tray, "tray_type"),
                JsonFields.string(tray, "tray_color"),
                JsonFields.string(tray, "tray_info_idx"),
                JsonFields.string(tray, "tray_sub_brands"));
    }
}
