package com.flamingo.ai.epubcfi.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for sorting CFIs in document order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SortCfiRequest {

  @NotEmpty(message = "At least one CFI is required")
  private List<@NotBlank String> cfis;
}
