package com.flamingo.ai.epubcfi.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.epubcfi.api.rest.CfiController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the CFI endpoints keep their published paths:
 *
 * <ul>
 *   <li>POST /api/cfi/parse - Parse a CFI
 *   <li>POST /api/cfi/compare - Compare two CFIs
 *   <li>POST /api/cfi/sort - Sort CFIs in document order
 *   <li>GET /api/cfi/escape - Escape a value for use inside a CFI
 * </ul>
 */
class ApiContractTest {

  private static Method method(String name) {
    return Arrays.stream(CfiController.class.getDeclaredMethods())
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No handler method " + name));
  }

  @Nested
  @DisplayName("CfiController API contract")
  class CfiControllerContract {

    @Test
    @DisplayName("should be mapped to /api/cfi")
    void shouldBeMappedToApiCfi() {
      RequestMapping mapping = CfiController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/cfi");
    }

    @Test
    @DisplayName("should accept POST on parse, compare and sort")
    void shouldMapPostEndpoints() {
      assertThat(method("parse").getAnnotation(PostMapping.class).value())
          .containsExactly("/parse");
      assertThat(method("compare").getAnnotation(PostMapping.class).value())
          .containsExactly("/compare");
      assertThat(method("sort").getAnnotation(PostMapping.class).value())
          .containsExactly("/sort");
    }

    @Test
    @DisplayName("should accept GET on escape")
    void shouldMapEscapeEndpoint() {
      assertThat(method("escape").getAnnotation(GetMapping.class).value())
          .containsExactly("/escape");
    }
  }
}
