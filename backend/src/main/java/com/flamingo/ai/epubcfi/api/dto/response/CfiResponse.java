package com.flamingo.ai.epubcfi.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.epubcfi.service.cfi.Cfi;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a parsed CFI. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CfiResponse {

  private String cfi;
  private boolean range;

  /** Location path; only for non-range CFIs. */
  private CfiPath path;

  private CfiPath from;
  private CfiPath to;

  /** Creates a CfiResponse from a parsed CFI. */
  public static CfiResponse fromCfi(Cfi cfi) {
    CfiResponseBuilder builder = CfiResponse.builder().cfi(cfi.toString()).range(cfi.isRange());
    if (cfi.isRange()) {
      return builder.from(cfi.getFrom()).to(cfi.getTo()).build();
    }
    return builder.path(cfi.getPath()).build();
  }
}
