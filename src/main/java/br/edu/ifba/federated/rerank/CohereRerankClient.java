package br.edu.ifba.federated.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * REST client for the Cohere Rerank API.
 *
 * <pre>
 * quarkus.rest-client."cohere-rerank".url=https://api.cohere.ai
 * quarkus.rest-client."cohere-rerank".read-timeout=3000
 * </pre>
 */
@RegisterRestClient(configKey = "cohere-rerank")
@Path("/v1")
public interface CohereRerankClient {

    @POST
    @Path("/rerank")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    CohereRerankResponse rerank(@HeaderParam("Authorization") String authorization, CohereRerankRequest request);

    record CohereRerankRequest(
        String model,
        String query,
        List<String> documents,
        @JsonProperty("top_n") int topN,
        @JsonProperty("return_documents") boolean returnDocuments
    ) {

        public static CohereRerankRequest of(String model, String query, List<String> documents, int topN) {
            return new CohereRerankRequest(model, query, documents, topN, false);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CohereRerankResponse(String id, List<CohereRerankResult> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CohereRerankResult(int index, @JsonProperty("relevance_score") double relevanceScore) {
    }
}
