package com.flamingo.ai.epubcfi.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for parsing a CFI; unset options fall back to the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseCfiRequest {

  @NotBlank(message = "CFI is required")
  private String cfi;

  private Boolean flattenRange;

  private Boolean stricter;
}
