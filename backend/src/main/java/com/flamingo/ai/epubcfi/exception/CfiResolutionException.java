package com.flamingo.ai.epubcfi.exception;

/** Exception thrown when a CFI cannot be mapped onto (or generated from) a document tree. */
public class CfiResolutionException extends RuntimeException {

  private final String userMessage;

  public CfiResolutionException(String message) {
    super(message);
    this.userMessage = "The CFI does not match the document";
  }

  public CfiResolutionException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The CFI does not match the document";
  }

  public CfiResolutionException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
