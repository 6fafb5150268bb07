package io.murt;

import io.muserver.MuRequest;
import io.muserver.MuResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * A listener that logs each invocation to slf4j which can be added with {@link MurtServerBuilder#addInvocationCompleteListener(InvocationCompleteListener)}
 */
public class Slf4jInvocationLogger implements InvocationCompleteListener {
    private static final Logger log = LoggerFactory.getLogger(TemplateProxyHandler.class);

    /**
     * Default constructor
     */
    public Slf4jInvocationLogger() {
    }

    /** {@inheritDoc} */
    @Override
    public void onComplete(MuRequest clientRequest, MuResponse clientResponse, String templateName, URI targetUri, long durationMillis) {
        log.info("Invoked template {} for {} against {} and returned {} in {}ms",
            templateName, clientRequest.remoteAddress(), targetUri, clientResponse.status(), durationMillis);
    }
}
