package com.flamingo.ai.epubcfi.exception;

/** Exception thrown when a linked document cannot be retrieved. */
public class DocumentFetchException extends RuntimeException {

  private final String uri;

  public DocumentFetchException(String uri, String message) {
    super(message);
    this.uri = uri;
  }

  public DocumentFetchException(String uri, String message, Throwable cause) {
    super(message, cause);
    this.uri = uri;
  }

  public String getUri() {
    return uri;
  }

  public String getUserMessage() {
    return "A linked document could not be retrieved";
  }
}
