package com.flamingo.ai.epubcfi.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an escaped CFI value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscapeResponse {

  private String value;
  private String escaped;
}
