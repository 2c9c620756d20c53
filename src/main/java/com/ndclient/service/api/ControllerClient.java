package com.ndclient.service.api;

import com.ndclient.dto.request.CredentialArgs;
import com.ndclient.model.NormalizedResult;
import com.ndclient.model.RequestDescriptor;
import com.ndclient.model.Session;

/**
 * Entry point for automation code: logs in once, then executes controller operations with the
 * resulting session. The client never writes to the console or terminates the process; every
 * failure surfaces as a subtype of {@link com.ndclient.exception.NdClientException}.
 */
public interface ControllerClient {

    /**
     * Resolves credentials and logs in to the controller.
     *
     * @param explicitArgs Credential values supplied by the caller.
     * @return The authenticated session to pass to {@link #execute(Session, RequestDescriptor)}.
     */
    Session login(CredentialArgs explicitArgs);

    /**
     * Sends a request and normalizes its response.
     *
     * @param session The session returned by {@link #login(CredentialArgs)}.
     * @param request The operation to perform.
     * @return The normalized outcome of the operation.
     */
    NormalizedResult execute(Session session, RequestDescriptor request);
}
