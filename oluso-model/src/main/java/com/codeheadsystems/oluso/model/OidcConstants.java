package com.codeheadsystems.oluso.model;

/**
 * OAuth 2.0 / OpenID Connect protocol vocabulary.
 * <p>
 * Every string in here is part of the public wire contract (RFC 6749, RFC 8628, RFC 8693,
 * RFC 9449, OpenID Connect Core and CIBA Core). Do not rename them.
 */
public final class OidcConstants {

  private OidcConstants() {
  }

  /**
   * Values of the {@code grant_type} token request parameter.
   */
  public static final class GrantTypes {
    public static final String AUTHORIZATION_CODE = "authorization_code";
    public static final String CLIENT_CREDENTIALS = "client_credentials";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String PASSWORD = "password";
    public static final String DEVICE_CODE = "urn:ietf:params:oauth:grant-type:device_code";
    public static final String CIBA = "urn:openid:params:grant-type:ciba";
    public static final String TOKEN_EXCHANGE = "urn:ietf:params:oauth:grant-type:token-exchange";
    public static final String JWT_BEARER = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private GrantTypes() {
    }
  }

  public static final class Scopes {
    public static final String OPENID = "openid";
    public static final String PROFILE = "profile";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String ADDRESS = "address";
    public static final String OFFLINE_ACCESS = "offline_access";

    private Scopes() {
    }
  }

  /**
   * Token type identifiers (RFC 8693 section 3).
   */
  public static final class TokenTypes {
    public static final String ACCESS_TOKEN = "urn:ietf:params:oauth:token-type:access_token";
    public static final String REFRESH_TOKEN = "urn:ietf:params:oauth:token-type:refresh_token";
    public static final String ID_TOKEN = "urn:ietf:params:oauth:token-type:id_token";
    public static final String JWT = "urn:ietf:params:oauth:token-type:jwt";
    public static final String BEARER = "Bearer";
    public static final String DPOP = "DPoP";

    private TokenTypes() {
    }
  }

  /**
   * Error codes returned in the {@code error} member of protocol error responses.
   */
  public static final class Errors {
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String UNAUTHORIZED_CLIENT = "unauthorized_client";
    public static final String UNSUPPORTED_GRANT_TYPE = "unsupported_grant_type";
    public static final String UNSUPPORTED_RESPONSE_TYPE = "unsupported_response_type";
    public static final String INVALID_SCOPE = "invalid_scope";
    public static final String INVALID_TARGET = "invalid_target";
    public static final String ACCESS_DENIED = "access_denied";
    public static final String SERVER_ERROR = "server_error";
    public static final String TEMPORARILY_UNAVAILABLE = "temporarily_unavailable";
    public static final String LOGIN_REQUIRED = "login_required";
    public static final String CONSENT_REQUIRED = "consent_required";
    public static final String INTERACTION_REQUIRED = "interaction_required";
    public static final String INVALID_REQUEST_URI = "invalid_request_uri";
    public static final String INVALID_REQUEST_OBJECT = "invalid_request_object";
    public static final String AUTHORIZATION_PENDING = "authorization_pending";
    public static final String SLOW_DOWN = "slow_down";
    public static final String EXPIRED_TOKEN = "expired_token";
    public static final String UNKNOWN_USER_ID = "unknown_user_id";
    public static final String INVALID_BINDING_MESSAGE = "invalid_binding_message";
    public static final String INVALID_USER_CODE = "invalid_user_code";
    public static final String USE_DPOP_NONCE = "use_dpop_nonce";
    public static final String INVALID_DPOP_PROOF = "invalid_dpop_proof";
    public static final String TRANSFORM_FAILED = "transform_failed";

    private Errors() {
    }
  }

  public static final class StandardClaims {
    public static final String SUBJECT = "sub";
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String CLIENT_ID = "client_id";
    public static final String SCOPE = "scope";
    public static final String SESSION_ID = "sid";
    public static final String TENANT_ID = "tenant_id";
    public static final String NONCE = "nonce";
    public static final String AUTH_TIME = "auth_time";
    public static final String AMR = "amr";
    public static final String ACR = "acr";
    public static final String AT_HASH = "at_hash";
    public static final String C_HASH = "c_hash";
    public static final String CONFIRMATION = "cnf";
    public static final String JWK_THUMBPRINT = "jkt";
    public static final String EMAIL = "email";
    public static final String NAME = "name";

    private StandardClaims() {
    }
  }

  public static final class ResponseTypes {
    public static final String CODE = "code";
    public static final String ID_TOKEN = "id_token";
    public static final String TOKEN = "token";
    public static final String CODE_ID_TOKEN = "code id_token";

    private ResponseTypes() {
    }
  }

  public static final class ResponseModes {
    public static final String QUERY = "query";
    public static final String FRAGMENT = "fragment";
    public static final String FORM_POST = "form_post";

    private ResponseModes() {
    }
  }

  public static final class CodeChallengeMethods {
    public static final String PLAIN = "plain";
    public static final String S256 = "S256";

    private CodeChallengeMethods() {
    }
  }

  public static final class PromptModes {
    public static final String NONE = "none";
    public static final String LOGIN = "login";
    public static final String CONSENT = "consent";
    public static final String SELECT_ACCOUNT = "select_account";
    public static final String CREATE = "create";

    private PromptModes() {
    }
  }

  public static final class ClientAssertionTypes {
    public static final String JWT_BEARER = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";

    private ClientAssertionTypes() {
    }
  }

  /**
   * Endpoint paths and the non-standard query parameters the authorize endpoint understands.
   */
  public static final class ProtocolEndpoints {
    public static final String AUTHORIZE = "/connect/authorize";
    public static final String TOKEN = "/connect/token";
    public static final String USER_INFO = "/connect/userinfo";
    public static final String END_SESSION = "/connect/endsession";
    public static final String INTROSPECTION = "/connect/introspect";
    public static final String REVOCATION = "/connect/revocation";
    public static final String DEVICE_AUTHORIZATION = "/connect/deviceauthorization";
    public static final String PUSHED_AUTHORIZATION = "/connect/par";
    public static final String BACKCHANNEL_AUTHENTICATION = "/connect/ciba";
    public static final String DISCOVERY = "/.well-known/openid-configuration";
    public static final String POLICY_QUERY_PARAM = "policy";
    public static final String POLICY_QUERY_PARAM_SHORT = "p";
    public static final String UI_MODE_QUERY_PARAM = "ui_mode";
    public static final String PAR_REQUEST_URI_PREFIX = "urn:ietf:params:oauth:request_uri:";

    private ProtocolEndpoints() {
    }
  }
}
