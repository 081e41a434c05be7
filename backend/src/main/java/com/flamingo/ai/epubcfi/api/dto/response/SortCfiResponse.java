package com.flamingo.ai.epubcfi.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for sorted CFIs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SortCfiResponse {

  private List<String> cfis;
}
