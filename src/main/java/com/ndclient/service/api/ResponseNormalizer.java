package com.ndclient.service.api;

import com.ndclient.model.NormalizedResult;
import com.ndclient.model.RawResponse;

public interface ResponseNormalizer {

    /**
     * Maps a raw HTTP result into the uniform {@link NormalizedResult} structure. Failed
     * operations are returned as data, never thrown.
     *
     * @param rawResponse The raw response of a request.
     * @return The normalized result.
     * @throws com.ndclient.exception.ResponseFormatException if a 2xx response carries a body that
     *                                                        cannot be parsed.
     */
    NormalizedResult normalize(RawResponse rawResponse);
}
