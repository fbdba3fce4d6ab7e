package br.edu.ifba.federated.vector.qdrant;

import br.edu.ifba.federated.vector.ChunkPayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * REST client for the Qdrant collections and points API.
 *
 * <p>This client is registered with the key "qdrant" and configured via:
 * <pre>
 * quarkus.rest-client.qdrant.url=http://localhost:6333
 * quarkus.rest-client.qdrant.read-timeout=30000
 * </pre>
 */
@RegisterRestClient(configKey = "qdrant")
@Path("/collections")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface QdrantClient {

    @GET
    @Path("/{collection}/exists")
    QdrantResponse<ExistsResult> exists(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection
    );

    @PUT
    @Path("/{collection}")
    QdrantResponse<Boolean> createCollection(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection,
        CreateCollectionRequest request
    );

    @DELETE
    @Path("/{collection}")
    QdrantResponse<Boolean> deleteCollection(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection
    );

    @PUT
    @Path("/{collection}/points")
    QdrantResponse<UpdateResult> upsertPoints(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection,
        @QueryParam("wait") boolean wait,
        UpsertRequest request
    );

    @POST
    @Path("/{collection}/points/search")
    QdrantResponse<List<ScoredPointDto>> search(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection,
        SearchRequest request
    );

    @POST
    @Path("/{collection}/points")
    QdrantResponse<List<RecordDto>> retrieve(
        @HeaderParam("api-key") String apiKey,
        @PathParam("collection") String collection,
        RetrieveRequest request
    );

    /**
     * Envelope shared by every Qdrant answer.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record QdrantResponse<T>(T result, String status, Double time) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExistsResult(boolean exists) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpdateResult(@JsonProperty("operation_id") Long operationId, String status) {
    }

    record CreateCollectionRequest(VectorParams vectors) {

        public static CreateCollectionRequest cosine(final int size) {
            return new CreateCollectionRequest(new VectorParams(size, "Cosine"));
        }
    }

    record VectorParams(int size, String distance) {
    }

    record UpsertRequest(List<PointStruct> points) {
    }

    record PointStruct(String id, float[] vector, ChunkPayload payload) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchRequest(
        float[] vector,
        int limit,
        Filter filter,
        @JsonProperty("with_payload") boolean withPayload
    ) {
    }

    record RetrieveRequest(
        List<String> ids,
        @JsonProperty("with_payload") boolean withPayload,
        @JsonProperty("with_vector") boolean withVector
    ) {
    }

    /**
     * {@code {"must": [{"key": ..., "match": {"value": ...}}]}}
     */
    record Filter(List<FieldCondition> must) {

        public static Filter matching(final String key, final String value) {
            return new Filter(List.of(new FieldCondition(key, new MatchValue(value))));
        }
    }

    record FieldCondition(String key, MatchValue match) {
    }

    record MatchValue(String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScoredPointDto(Object id, double score, ChunkPayload payload) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RecordDto(Object id, ChunkPayload payload) {
    }
}
