package com.trustgate.steering.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustgate.common.exception.TrustGateException;
import com.trustgate.common.model.ActionRequirement;
import com.trustgate.common.model.TrustCategory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads requirement overrides from a JSON array:
 * <pre>
 * [{"action": "deploy", "minSovereignty": 0.9, "description": "...",
 *   "requiredScores": {"testing": 0.8, "code_quality": 0.8}}]
 * </pre>
 * An unknown category name is a configuration error and stops startup.
 */
final class RequirementOverrides {

    private RequirementOverrides() {}

    static List<ActionRequirement> load(Path file, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file));
        } catch (IOException e) {
            throw new TrustGateException("RequirementTable", "Cannot read overrides file " + file, e);
        }
        if (!root.isArray()) {
            throw new TrustGateException("RequirementTable", "Overrides file must hold a JSON array: " + file);
        }

        List<ActionRequirement> out = new ArrayList<>();
        for (JsonNode entry : root) {
            Map<TrustCategory, Double> scores = new EnumMap<>(TrustCategory.class);
            Iterator<Map.Entry<String, JsonNode>> fields = entry.path("requiredScores").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                TrustCategory category = TrustCategory.fromKey(f.getKey()).orElseThrow(() ->
                    new TrustGateException("RequirementTable", "Unknown category '" + f.getKey() + "' in " + file));
                scores.put(category, f.getValue().asDouble());
            }
            out.add(new ActionRequirement(
                entry.path("action").asText(null),
                scores,
                entry.path("minSovereignty").asDouble(0.0),
                entry.path("description").asText("")));
        }
        return out;
    }
}
