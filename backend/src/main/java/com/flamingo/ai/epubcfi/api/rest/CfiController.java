package com.flamingo.ai.epubcfi.api.rest;

import com.flamingo.ai.epubcfi.api.dto.request.CompareCfiRequest;
import com.flamingo.ai.epubcfi.api.dto.request.ParseCfiRequest;
import com.flamingo.ai.epubcfi.api.dto.request.SortCfiRequest;
import com.flamingo.ai.epubcfi.api.dto.response.CfiResponse;
import com.flamingo.ai.epubcfi.api.dto.response.CompareCfiResponse;
import com.flamingo.ai.epubcfi.api.dto.response.EscapeResponse;
import com.flamingo.ai.epubcfi.api.dto.response.SortCfiResponse;
import com.flamingo.ai.epubcfi.service.cfi.Cfi;
import com.flamingo.ai.epubcfi.service.cfi.CfiService;
import com.flamingo.ai.epubcfi.service.cfi.parsing.ParseOptions;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for CFI parsing, ordering and escaping. */
@RestController
@RequestMapping("/api/cfi")
@RequiredArgsConstructor
public class CfiController {

  private final CfiService cfiService;

  /** Parses a CFI into its path, or its start and end paths for a range. */
  @PostMapping("/parse")
  public ResponseEntity<CfiResponse> parse(@Valid @RequestBody ParseCfiRequest request) {
    ParseOptions options = cfiService.defaultParseOptions();
    if (request.getFlattenRange() != null) {
      options = options.withFlattenRange(request.getFlattenRange());
    }
    if (request.getStricter() != null) {
      options = options.withStricter(request.getStricter());
    }
    Cfi cfi = cfiService.parse(request.getCfi(), options);
    return ResponseEntity.ok(CfiResponse.fromCfi(cfi));
  }

  /** Compares two CFIs in document order. */
  @PostMapping("/compare")
  public ResponseEntity<CompareCfiResponse> compare(
      @Valid @RequestBody CompareCfiRequest request) {
    int result = cfiService.compare(request.getLeft(), request.getRight());
    return ResponseEntity.ok(CompareCfiResponse.builder().result(result).build());
  }

  /** Sorts CFIs in document order. */
  @PostMapping("/sort")
  public ResponseEntity<SortCfiResponse> sort(@Valid @RequestBody SortCfiRequest request) {
    return ResponseEntity.ok(
        SortCfiResponse.builder().cfis(cfiService.sort(request.getCfis())).build());
  }

  /** Escapes a value (e.g. an element id) for use inside a CFI. */
  @GetMapping("/escape")
  public ResponseEntity<EscapeResponse> escape(@RequestParam("value") String value) {
    return ResponseEntity.ok(
        EscapeResponse.builder().value(value).escaped(cfiService.escape(value)).build());
  }
}
