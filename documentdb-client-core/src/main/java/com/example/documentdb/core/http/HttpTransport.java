package com.example.documentdb.core.http;

import java.io.IOException;

/**
 * Sends a single HTTP request and returns the complete response. The client issues one request
 * at a time per operation; implementations must be safe to share between operations running on
 * different threads.
 */
@FunctionalInterface
public interface HttpTransport {

  /**
   * Sends the request.
   *
   * @param request request to send
   * @return response with status, headers and body
   * @throws IOException on transport failure; propagated to the caller unmodified
   */
  TransportResponse send(final TransportRequest request) throws IOException;
}
