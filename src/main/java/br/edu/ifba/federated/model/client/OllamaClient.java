package br.edu.ifba.federated.model.client;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;

/**
 * Native Ollama API used by the local channel.
 *
 * @see <a href="https://github.com/ollama/ollama/blob/main/docs/api.md">Ollama API</a>
 */
@RegisterProvider(ModelClientExceptionMapper.class)
@Path("/api")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface OllamaClient {

    @GET
    @Path("/tags")
    OllamaTagsResponse tags();

    @POST
    @Path("/show")
    OllamaShowResponse show(OllamaShowRequest request);

    @POST
    @Path("/generate")
    OllamaGenerateResponse generate(OllamaGenerateRequest request);
}
