package com.codeheadsystems.oluso.server.dpop;

/**
 * What a DPoP proof is checked against.
 *
 * @param proof                   the raw {@code DPoP} header value
 * @param httpMethod              method of the current request
 * @param httpUri                 absolute uri of the current request
 * @param expectedAccessTokenHash hash of the presented access token, set at resource servers only
 * @param expectedJwkThumbprint   thumbprint the proof key must match, when a binding already exists
 * @param requireNonce            whether a server nonce is mandatory for this request
 * @param clientId                the client, may be null at resource servers
 */
public record DPoPValidationContext(String proof,
                                    String httpMethod,
                                    String httpUri,
                                    String expectedAccessTokenHash,
                                    String expectedJwkThumbprint,
                                    boolean requireNonce,
                                    String clientId) {

  /**
   * Context for a token endpoint request, where no access token or binding exists yet.
   *
   * @param proof      the proof
   * @param httpMethod the method
   * @param httpUri    the uri
   * @param clientId   the client
   * @return the context
   */
  public static DPoPValidationContext forTokenRequest(String proof, String httpMethod, String httpUri,
                                                      String clientId) {
    return new DPoPValidationContext(proof, httpMethod, httpUri, null, null, false, clientId);
  }
}
