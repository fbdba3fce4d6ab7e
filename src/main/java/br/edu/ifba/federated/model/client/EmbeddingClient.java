package br.edu.ifba.federated.model.client;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;

@RegisterProvider(ModelClientExceptionMapper.class)
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface EmbeddingClient {

    @POST
    @Path("/embeddings")
    EmbeddingResponse embed(
        @HeaderParam("Authorization") String authorization,
        @HeaderParam("api-key") String apiKey,
        @QueryParam("api-version") String apiVersion,
        EmbeddingRequest request
    );
}
