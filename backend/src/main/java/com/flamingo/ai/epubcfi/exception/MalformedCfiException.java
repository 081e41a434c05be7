package com.flamingo.ai.epubcfi.exception;

/** Exception thrown when a string is not a well-formed CFI. */
public class MalformedCfiException extends RuntimeException {

  private final String cfi;

  public MalformedCfiException(String message) {
    this(null, message);
  }

  public MalformedCfiException(String cfi, String message) {
    super(cfi != null ? message + ": " + cfi : message);
    this.cfi = cfi;
  }

  public MalformedCfiException(String cfi, String message, Throwable cause) {
    super(cfi != null ? message + ": " + cfi : message, cause);
    this.cfi = cfi;
  }

  /** The offending CFI, when known. */
  public String getCfi() {
    return cfi;
  }

  public String getUserMessage() {
    return "The CFI is malformed";
  }
}
