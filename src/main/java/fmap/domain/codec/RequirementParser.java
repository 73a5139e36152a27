package fmap.domain.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fmap.common.MappingConstants;
import fmap.domain.mapping.FilamentRequirement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads job filament requirements, either {@code {"filaments": [...]}} or a bare array of
 * {@code {slot_id, type, color, used_grams, tray_info_idx, nozzle_id}}.
 * Entries that are not objects are skipped; list order is preserved.
 *
 * @since 15/10/2026
 */
public class RequirementParser {

    public List<FilamentRequirement> parse(String json) throws FeedParseException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json == null ? "" : json);
        } catch (JsonParseException e) {
            throw new FeedParseException("Invalid filament requirements JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject() && !root.isJsonArray()) {
            throw new FeedParseException("Filament requirements must be a JSON object or array");
        }
        return fromJson(root);
    }

    /**
     * @throws FeedParseException when a {@code slot_id} lies outside 0..{@value MappingConstants#MAX_JOB_SLOT_ID}
     */
    public List<FilamentRequirement> fromJson(JsonElement element) throws FeedParseException {
        JsonArray filaments;
        if (element == null) {
            return List.of();
        } else if (element.isJsonArray()) {
            filaments = element.getAsJsonArray();
        } else if (element.isJsonObject()) {
            filaments = JsonFields.array(element.getAsJsonObject(), "filaments");
        } else {
            return List.of();
        }

        List<FilamentRequirement> requirements = new ArrayList<>();
        for (JsonElement entry : filaments) {
            Optional<JsonObject> filament = JsonFields.object(entry);
            if (filament.isPresent()) {
                requirements.add(readRequirement(filament.get()));
            }
        }
        return requirements;
    }

    private static FilamentRequirement readRequirement(JsonObject filament) throws FeedParseException {
        int slotId = JsonFields.integer(filament, "slot_id").orElse(0);
        if (slotId < 0 || slotId > MappingConstants.MAX_JOB_SLOT_ID) {
            throw new FeedParseException("Filament slot_id " + slotId + " out of range 0.." + MappingConstants.MAX_JOB_SLOT_ID);
        }
        return new FilamentRequirement(
                slotId,
                JsonFields.string(filament, "type").orElse(""),
                JsonFields.string(filament, "color").orElse(""),
                JsonFields.decimal(filament, "used_grams").orElse(0.0),
                JsonFields.string(filament, "tray_info_idx"),
                JsonFields.integer(filament, "nozzle_id"));
    }
}
