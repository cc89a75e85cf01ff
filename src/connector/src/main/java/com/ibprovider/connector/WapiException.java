package com.ibprovider.connector;

/** Failure talking to the WAPI endpoint, or a WAPI error response. */
public class WapiException extends RuntimeException {
  private final int statusCode;
  private final String code;

  public WapiException(String message) {
    this(message, 0, null, null);
  }

  public WapiException(String message, Throwable cause) {
    this(message, 0, null, cause);
  }

  public WapiException(String message, int statusCode, String code) {
    this(message, statusCode, code, null);
  }

  private WapiException(String message, int statusCode, String code, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.code = code;
  }

  /** HTTP status of the failed response, or {@code 0} when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }

  /** WAPI error code such as {@code Client.Ibap.Proto}, when the appliance sent one. */
  public String getCode() {
    return code;
  }
}
