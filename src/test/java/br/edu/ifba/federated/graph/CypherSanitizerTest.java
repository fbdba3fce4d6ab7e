package br.edu.ifba.federated.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CypherSanitizerTest {

    @Nested
    @DisplayName("relationType")
    class RelationType {

        @Test
        @DisplayName("should uppercase and join words with underscores")
        void uppercases() {
            assertEquals("WORKS_FOR", CypherSanitizer.relationType("works for"));
            assertEquals("LOCATED_IN", CypherSanitizer.relationType("located-in"));
        }

        @Test
        @DisplayName("should strip query syntax from the label")
        void stripsInjection() {
            assertEquals("OWNS_B_MATCH_N_DETACH_DELETE_N",
                CypherSanitizer.relationType("OWNS]->(b) MATCH (n) DETACH DELETE n //"));
        }

        @Test
        @DisplayName("should fall back to RELATED_TO for blank labels")
        void blank() {
            assertEquals(CypherSanitizer.DEFAULT_RELATION, CypherSanitizer.relationType(null));
            assertEquals(CypherSanitizer.DEFAULT_RELATION, CypherSanitizer.relationType("   "));
            assertEquals(CypherSanitizer.DEFAULT_RELATION, CypherSanitizer.relationType("-->"));
        }

        @Test
        @DisplayName("should prefix labels that start with a digit")
        void leadingDigit() {
            assertEquals("R_2ND_OWNER", CypherSanitizer.relationType("2nd owner"));
        }
    }

    @Nested
    @DisplayName("parameter")
    class Parameter {

        @Test
        @DisplayName("should double backslashes and fold line breaks")
        void escapes() {
            assertEquals("a\\\\b c", CypherSanitizer.parameter("a\\b\nc"));
        }

        @Test
        @DisplayName("should map null to empty")
        void nullValue() {
            assertEquals("", CypherSanitizer.parameter(null));
        }
    }
}
