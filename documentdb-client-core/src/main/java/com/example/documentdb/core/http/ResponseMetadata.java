package com.example.documentdb.core.http;

import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;

/**
 * Cost and session information every DocumentDB response carries in its headers.
 *
 * @param requestCharge request units charged for the request, 0 when not reported
 * @param sessionToken session token of the response, or null when not reported
 */
public record ResponseMetadata(double requestCharge, String sessionToken) {

  private static final Logger logger = System.getLogger(ResponseMetadata.class.getName());

  public static ResponseMetadata from(final TransportResponse response) {
    return new ResponseMetadata(
        requestCharge(response),
        response.header(DocumentDbHeaders.SESSION_TOKEN).filter(s -> !s.isEmpty()).orElse(null));
  }

  private static double requestCharge(final TransportResponse response) {
    return response
        .header(DocumentDbHeaders.REQUEST_CHARGE)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(
            value -> {
              final double charge;
              try {
                charge = Double.parseDouble(value);
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring unparseable request charge: {0}", value);
                return 0.0;
              }
              if (!Double.isFinite(charge)) {
                logger.log(WARNING, "Ignoring non-finite request charge: {0}", value);
                return 0.0;
              }
              return Math.max(0.0, charge);
            })
        .orElse(0.0);
  }
}
