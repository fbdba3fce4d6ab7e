package br.edu.ifba.federated.model.client;

import br.edu.ifba.federated.shared.ModelCallException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses from any model backend into {@link ModelCallException}s that
 * keep the status code, so retry classification can tell 429/5xx from 4xx.
 */
public class ModelClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(ModelClientExceptionMapper.class);

    private static final int MAX_BODY_LENGTH = 500;

    @Override
    public RuntimeException toThrowable(final Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read error response body", e);
        }

        final int status = response.getStatus();
        final String statusInfo = response.getStatusInfo().getReasonPhrase();
        if (responseBody != null && responseBody.length() > MAX_BODY_LENGTH) {
            responseBody = responseBody.substring(0, MAX_BODY_LENGTH) + "...";
        }

        LOG.errorf("Model API returned %d %s: %s", status, statusInfo,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty)");

        return new ModelCallException(String.format(
            "Model API returned %d %s%s",
            status,
            statusInfo,
            responseBody != null ? " - " + responseBody : ""
        ), status);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
