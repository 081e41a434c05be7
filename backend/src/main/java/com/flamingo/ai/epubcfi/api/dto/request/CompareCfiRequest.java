package com.flamingo.ai.epubcfi.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for comparing two CFIs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareCfiRequest {

  @NotBlank(message = "Left CFI is required")
  private String left;

  @NotBlank(message = "Right CFI is required")
  private String right;
}
