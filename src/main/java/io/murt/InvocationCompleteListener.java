package io.murt;

import io.muserver.MuRequest;
import io.muserver.MuResponse;

import java.net.URI;

/**
 * A listener for when template invocations complete
 */
public interface InvocationCompleteListener {

    /**
     * Called after the response has been written to the caller, whether successful or not
     *
     * @param clientRequest  The request to <code>/send-request</code>
     * @param clientResponse The response sent to the caller
     * @param templateName   The name of the template that was invoked, or null if no template was found
     * @param targetUri      The URI the request was sent to, or null if no upstream request was made
     * @param durationMillis The time in millis from receiving the invocation until the response was written
     * @throws java.lang.Exception Any exceptions will be logged and ignored
     */
    void onComplete(MuRequest clientRequest, MuResponse clientResponse, String templateName, URI targetUri, long durationMillis) throws Exception;

}
