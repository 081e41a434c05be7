package com.flamingo.ai.epubcfi.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a CFI comparison. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareCfiResponse {

  /** -1, 0 or 1 as the left CFI comes before, with or after the right one. */
  private int result;
}
