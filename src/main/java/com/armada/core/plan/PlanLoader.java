package com.armada.core.plan;

import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.Wave;
import com.armada.core.model.WorkItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and validates plan documents into {@link ExecutionPlan}s.
 *
 * <p>Validation covers structure only: a non-empty wave list, non-empty item lists, unique
 * item identifiers, and strictly increasing wave numbers. Dependency placement is trusted.
 */
public class PlanLoader {

    private static final Logger log = LoggerFactory.getLogger(PlanLoader.class);

    private final ObjectMapper mapper;

    public PlanLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws InvalidPlanException if the file is missing, unparsable, or malformed
     */
    public ExecutionPlan load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidPlanException(file.toString(), List.of("file not found"));
        }
        PlanDocument doc;
        try {
            doc = mapper.readValue(file.toFile(), PlanDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidPlanException(file.toString(), "unparsable JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidPlanException(file.toString(), "unreadable: " + e.getMessage(), e);
        }
        return toPlan(doc, file.toString());
    }

    public ExecutionPlan parse(String json, String source) {
        PlanDocument doc;
        try {
            doc = mapper.readValue(json, PlanDocument.class);
        } catch (IOException e) {
            throw new InvalidPlanException(source, "unparsable JSON: " + e.getMessage(), e);
        }
        return toPlan(doc, source);
    }

    public ExecutionPlan toPlan(PlanDocument doc, String source) {
        var problems = new ArrayList<String>();
        if (doc == null || doc.waves() == null || doc.waves().isEmpty()) {
            throw new InvalidPlanException(source, List.of("plan has no waves"));
        }

        var waves = new ArrayList<Wave>();
        var seenIn = new HashMap<String, Integer>();
        int previous = 0;
        for (int i = 0; i < doc.waves().size(); i++) {
            PlanDocument.WaveEntry entry = doc.waves().get(i);
            if (entry == null) {
                problems.add("wave entry " + (i + 1) + " is null");
                continue;
            }
            int number = entry.wave() != null ? entry.wave() : i + 1;
            if (number <= previous) {
                problems.add("wave " + number + " does not follow wave " + previous);
            }
            previous = Math.max(previous, number);

            List<String> ids = new ArrayList<>();
            if (entry.items() != null) {
                for (JsonNode node : entry.items()) {
                    String id = idOf(node);
                    if (id == null) {
                        problems.add("wave " + number + " has a blank item identifier");
                        continue;
                    }
                    Integer other = seenIn.putIfAbsent(id, number);
                    if (other != null) {
                        problems.add("item " + id + " appears in wave " + other + " and wave " + number);
                        continue;
                    }
                    ids.add(id);
                }
            }
            if (entry.items() == null || entry.items().isEmpty()) {
                problems.add("wave " + number + " has no items");
            }
            if (!ids.isEmpty()) {
                waves.add(new Wave(number, ids, entry.description()));
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidPlanException(source, problems);
        }

        Map<String, WorkItem> items = new LinkedHashMap<>();
        for (Wave wave : waves) {
            for (String id : wave.itemIds()) {
                PlanDocument.ItemDetail detail = doc.details() != null ? doc.details().get(id) : null;
                if (detail == null) {
                    items.put(id, WorkItem.of(id));
                } else {
                    List<String> deps = detail.dependsOn() == null ? List.of()
                            : detail.dependsOn().stream().map(PlanLoader::idOf).filter(d -> d != null).toList();
                    items.put(id, new WorkItem(id, detail.title() != null ? detail.title() : id, deps));
                }
            }
        }

        var plan = new ExecutionPlan(waves, items, doc.successCriteria(), doc.estimatedTime());
        log.debug("Accepted plan {}: {} waves, {} items", source, plan.waves().size(), plan.totalItems());
        return plan;
    }

    /** Converts an accepted plan back to its wire shape, used when persisting it per run. */
    public static PlanDocument toDocument(ExecutionPlan plan, ObjectMapper mapper) {
        var waves = plan.waves().stream()
                .map(w -> new PlanDocument.WaveEntry(w.number(),
                        w.itemIds().stream().map(id -> (JsonNode) mapper.getNodeFactory().textNode(id)).toList(),
                        w.description(), null))
                .toList();
        Map<String, PlanDocument.ItemDetail> details = new LinkedHashMap<>();
        plan.items().forEach((id, item) -> details.put(id, new PlanDocument.ItemDetail(item.title(),
                item.dependsOn().stream().map(d -> (JsonNode) mapper.getNodeFactory().textNode(d)).toList())));
        return new PlanDocument(waves, details, plan.successCriteria(), plan.estimatedTime());
    }

    private static String idOf(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
