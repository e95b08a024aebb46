package net.kili.client.graphql;

import java.io.IOException;

/** Wire access to a GraphQL endpoint. */
public interface GraphQLTransport {
  /**
   * Sends one operation. GraphQL and HTTP errors are returned in the response, not thrown.
   *
   * @param request operation to send
   * @return status and decoded body
   * @throws IOException if the call did not complete
   */
  GraphQLResponse execute(GraphQLRequest request) throws IOException;

  /**
   * Reads the backend build version from the version endpoint.
   *
   * @return version, or null when it cannot be obtained
   */
  String fetchBackendVersion();

  /** @return URL the operations are sent to */
  String getEndpoint();
}
