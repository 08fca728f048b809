package com.codeheadsystems.coffer.client;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.model.system.SystemInfo;
import java.net.http.HttpRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A session authenticated with a single service token instead of OAuth connections. The token
 * never expires and is sent in the {@value #SERVICE_TOKEN_HEADER} header.
 */
public final class ProvisioningClient implements AutoCloseable {

  public static final String SERVICE_TOKEN_HEADER = "X-Sds-Service-Token";

  private static final Logger log = LoggerFactory.getLogger(ProvisioningClient.class);

  private final ClientContext context;
  private final SecretValue serviceToken;

  ProvisioningClient(final ClientContext context, final SecretValue serviceToken) {
    log.info("ProvisioningClient()");
    this.context = context;
    this.serviceToken = serviceToken;
  }

  /**
   * The service token, for calls made outside this library.
   *
   * @return the token
   * @throws IllegalStateException after {@link #close()}
   */
  public String getServiceToken() {
    return serviceToken.expose();
  }

  /**
   * Adds the service token header to a request.
   *
   * @param builder the request builder
   * @return the same builder
   */
  public HttpRequest.Builder authenticate(final HttpRequest.Builder builder) {
    return builder.setHeader(SERVICE_TOKEN_HEADER, serviceToken.expose());
  }

  public SystemInfo getSystemInfo() {
    return context.publicAccessor().getSystemInfo();
  }

  public CofferClientConfig config() {
    return context.config();
  }

  public boolean isClosed() {
    return serviceToken.isDestroyed();
  }

  @Override
  public void close() {
    log.debug("close()");
    serviceToken.close();
  }
}
