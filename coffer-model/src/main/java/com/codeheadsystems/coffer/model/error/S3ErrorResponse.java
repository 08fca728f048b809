package com.codeheadsystems.coffer.model.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * XML error document returned by S3 compatible object storage, e.g.
 * {@code <Error><Code>NoSuchKey</Code><Message>..</Message></Error>}.
 *
 * @param code         the S3 error code
 * @param message      the message
 * @param requestId    the request id
 * @param hostId       the host id
 * @param argumentName the offending argument, if any
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "Error")
public record S3ErrorResponse(
    @JacksonXmlProperty(localName = "Code") String code,
    @JacksonXmlProperty(localName = "Message") String message,
    @JacksonXmlProperty(localName = "RequestId") String requestId,
    @JacksonXmlProperty(localName = "HostId") String hostId,
    @JacksonXmlProperty(localName = "ArgumentName") String argumentName) {

  @Override
  public String toString() {
    return (message == null ? "Unknown S3 error" : message) + (code == null ? "" : " [" + code + "]");
  }
}
