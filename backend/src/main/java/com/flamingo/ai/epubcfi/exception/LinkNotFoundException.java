package com.flamingo.ai.epubcfi.exception;

/** Exception thrown when the element addressed by a CFI part does not link to another document. */
public class LinkNotFoundException extends RuntimeException {

  private final String tagName;

  public LinkNotFoundException(String tagName, String message) {
    super(message);
    this.tagName = tagName;
  }

  /** Tag of the addressed element, {@code null} when the target was not an element. */
  public String getTagName() {
    return tagName;
  }

  public String getUserMessage() {
    return "No linked document found for the CFI";
  }
}
