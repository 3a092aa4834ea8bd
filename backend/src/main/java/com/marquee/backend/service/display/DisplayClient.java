package com.marquee.backend.service.display;

/**
 * The physical board. Failures surface as {@link com.marquee.backend.exception.DisplayClientException}.
 */
public interface DisplayClient {

    void sendLayout(int[][] layout);
}
