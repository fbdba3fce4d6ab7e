package br.edu.ifba.federated.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entities and relationships extracted from one piece of text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedGraph(
    List<ExtractedEntity> entities,
    List<ExtractedRelationship> relationships
) {

    public ExtractedGraph {
        entities = entities != null ? List.copyOf(entities.stream().filter(e -> e != null).toList()) : List.of();
        relationships = relationships != null
            ? List.copyOf(relationships.stream().filter(r -> r != null).toList()) : List.of();
    }

    public static ExtractedGraph empty() {
        return new ExtractedGraph(List.of(), List.of());
    }

    /**
     * Relationships with a usable source, target and relation.
     */
    public List<ExtractedRelationship> completeRelationships() {
        return relationships.stream()
            .filter(ExtractedRelationship::isComplete)
            .toList();
    }

    /**
     * Endpoints of every complete relationship, in first-seen order.
     */
    public Set<String> touchedEntities() {
        final Set<String> touched = new LinkedHashSet<>();
        for (ExtractedRelationship relationship : completeRelationships()) {
            touched.add(relationship.source().trim());
            touched.add(relationship.target().trim());
        }
        return touched;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractedEntity(String name, String type) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractedRelationship(
        String source,
        String target,
        @JsonAlias({"type", "relationship"}) String relation
    ) {

        boolean isComplete() {
            return source != null && !source.isBlank()
                && target != null && !target.isBlank()
                && relation != null && !relation.isBlank();
        }
    }
}
