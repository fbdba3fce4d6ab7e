package br.edu.ifba.federated.model.client;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;

/**
 * OpenAI-compatible chat completions endpoint.
 *
 * <p>Instances are built at runtime with {@code RestClientBuilder} so a provider switch
 * can point them at a different base URI. Null header and query values are omitted,
 * which lets one interface serve OpenAI ({@code Authorization}), Azure ({@code api-key}
 * plus {@code api-version}), Gemini and Ollama.</p>
 */
@RegisterProvider(ModelClientExceptionMapper.class)
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface ChatCompletionClient {

    @POST
    @Path("/chat/completions")
    ChatCompletionResponse complete(
        @HeaderParam("Authorization") String authorization,
        @HeaderParam("api-key") String apiKey,
        @QueryParam("api-version") String apiVersion,
        ChatCompletionRequest request
    );
}
