package br.edu.ifba.federated.graph;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.graph.Record;
import redis.clients.jedis.graph.ResultSet;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FalkorGraphStoreTest {

    private JedisPooled jedis;
    private FalkorGraphStore store;

    @BeforeEach
    void setUp() {
        jedis = mock(JedisPooled.class);
        store = new FalkorGraphStore();
        store.jedis = jedis;
        store.graphName = "test_graph";
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("should place only the sanitized relation in the query text")
        @SuppressWarnings("unchecked")
        void sanitizedRelation() {
            store.upsertTriple("Alice", "works for]->(x) DELETE x", "Acme").join();

            final ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
            final ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
            verify(jedis).graphQuery(eq("test_graph"), query.capture(), params.capture());

            assertTrue(query.getValue().contains("[:WORKS_FOR_X_DELETE_X]"));
            assertFalse(query.getValue().contains("Alice"));
            assertEquals("Alice", params.getValue().get("subject"));
            assertEquals("Acme", params.getValue().get("object"));
        }

        @Test
        @DisplayName("should surface write failures to the caller")
        void writeFailure() {
            when(jedis.graphQuery(anyString(), anyString(), anyMap()))
                .thenThrow(new JedisConnectionException("down"));

            assertTrue(store.upsertTriple("a", "b", "c").handle((v, e) -> e != null).join());
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("should map result rows to triples")
        void mapsRows() {
            final Record record = mock(Record.class);
            when(record.<Object>getValue(0)).thenReturn("Acme Corp");
            when(record.<Object>getValue(1)).thenReturn("LOCATED_IN");
            when(record.<Object>getValue(2)).thenReturn("Paris");
            final ResultSet resultSet = mock(ResultSet.class);
            when(resultSet.iterator()).thenReturn(List.of(record).iterator());
            when(jedis.graphQuery(anyString(), anyString(), anyMap())).thenReturn(resultSet);

            final List<GraphTriple> triples = store.queryNeighbors(List.of("acme")).join();

            assertEquals(List.of(new GraphTriple("Acme Corp", "LOCATED_IN", "Paris")), triples);
        }

        @Test
        @DisplayName("should degrade a failed read to an empty list")
        void readFailure() {
            when(jedis.graphQuery(anyString(), anyString(), anyMap()))
                .thenThrow(new JedisConnectionException("down"));

            assertTrue(store.queryNeighbors(List.of("acme")).join().isEmpty());
            assertTrue(store.findPaths(List.of("acme", "paris")).join().isEmpty());
            assertTrue(store.chunksForEntity("acme", null).join().isEmpty());
        }

        @Test
        @DisplayName("should not query for paths with fewer than two names")
        void pathsNeedTwoNames() {
            assertTrue(store.findPaths(List.of("acme", " ", "acme")).join().isEmpty());

            verify(jedis, never()).graphQuery(anyString(), anyString(), anyMap());
        }
    }

    @Test
    @DisplayName("reset should tolerate a missing graph")
    void resetMissingGraph() {
        when(jedis.graphDelete(anyString())).thenThrow(new JedisDataException("ERR Invalid graph operation on empty key"));

        store.reset().join();

        verify(jedis).graphDelete("test_graph");
    }

    @Test
    @DisplayName("nameMatch should register one parameter per name")
    void nameMatch() {
        final Map<String, Object> params = new HashMap<>();

        final String condition = FalkorGraphStore.nameMatch("n", List.of("Acme", "Paris"), params);

        assertEquals("(toLower(n.name) CONTAINS toLower($e0) OR toLower(n.name) CONTAINS toLower($e1))", condition);
        assertEquals(Map.of("e0", "Acme", "e1", "Paris"), params);
    }
}
