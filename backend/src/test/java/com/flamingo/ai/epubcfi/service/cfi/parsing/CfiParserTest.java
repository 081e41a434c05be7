package com.flamingo.ai.epubcfi.service.cfi.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.epubcfi.exception.MalformedCfiException;
import com.flamingo.ai.epubcfi.service.cfi.Cfi;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPart;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import com.flamingo.ai.epubcfi.service.cfi.model.ParsedCfi;
import com.flamingo.ai.epubcfi.service.cfi.model.SideBias;
import com.flamingo.ai.epubcfi.service.cfi.model.SpatialPosition;
import com.flamingo.ai.epubcfi.service.cfi.model.TextLocationAssertion;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CfiParser Tests")
class CfiParserTest {

  private static final String FLAT_EQUIVALENT =
      "epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:5)";

  private static CfiExpression parse(String cfi) {
    return new CfiParser(ParseOptions.DEFAULT).parse(cfi);
  }

  private static CfiStep step(int nodeIndex) {
    return CfiStep.of(nodeIndex);
  }

  private static CfiStep step(int nodeIndex, String nodeId) {
    return CfiStep.builder().nodeIndex(nodeIndex).nodeId(nodeId).build();
  }

  private static CfiPart part(CfiStep... steps) {
    return new CfiPart(List.of(steps));
  }

  private static CfiPath path(CfiPart... parts) {
    return new CfiPath(List.of(parts));
  }

  @Nested
  @DisplayName("Locations")
  class Locations {

    @Test
    @DisplayName("should parse plain node indexes")
    void shouldParsePlainNodeIndexes() {
      assertThat(parse("epubcfi(/1/2)").path()).isEqualTo(path(part(step(1), step(2))));
      assertThat(parse("epubcfi(/1/0)").path()).isEqualTo(path(part(step(1), step(0))));
    }

    @Test
    @DisplayName("should split parts on document hops")
    void shouldSplitPartsOnDocumentHops() {
      CfiExpression result = parse("epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:5)");

      assertThat(result.isRange()).isFalse();
      assertThat(result.path())
          .isEqualTo(
              path(
                  part(step(6), step(4, "chap01ref")),
                  part(
                      step(4, "body01"),
                      step(10, "para05"),
                      CfiStep.builder().nodeIndex(3).offset(5).build())));
    }

    @Test
    @DisplayName("should read reserved characters literally inside node ids")
    void shouldReadReservedCharactersLiterallyInsideNodeIds() {
      CfiExpression result =
          parse("epubcfi(/6/14[cha!/p05ref]!/4[bo!/dy01]/10/2/1[foo]:5[don't!/ panic;s=b])");

      assertThat(result.path().part(0)).isEqualTo(part(step(6), step(14, "cha!/p05ref")));
      assertThat(result.path().part(1).steps())
          .containsExactly(
              step(4, "bo!/dy01"),
              step(10),
              step(2),
              CfiStep.builder()
                  .nodeIndex(1)
                  .nodeId("foo")
                  .offset(5)
                  .textLocationAssertion(TextLocationAssertion.plain("don't!/ panic"))
                  .sideBias(SideBias.BEFORE)
                  .build());
    }

    @Test
    @DisplayName("should unescape circumflexed characters in node ids")
    void shouldUnescapeCircumflexedCharactersInNodeIds() {
      assertThat(parse("epubcfi(/1[^^^]])").path()).isEqualTo(path(part(step(1, "^]"))));
      assertThat(parse("epubcfi(/2[a^]b,c])").path()).isEqualTo(path(part(step(2, "a]b,c"))));
    }

    @Test
    @DisplayName("should parse temporal and spatial positions")
    void shouldParseTemporalAndSpatialPositions() {
      CfiStep last =
          parse("epubcfi(/6/14[cha!/p05ref]!/4[bo!/dy01]/10/2/1[foo]~42.43@100:101)")
              .path()
              .lastPart()
              .lastStep();

      assertThat(last.nodeId()).isEqualTo("foo");
      assertThat(last.temporal()).isEqualTo(42.43);
      assertThat(last.spatial()).isEqualTo(new SpatialPosition(100, 101));
      assertThat(last.offset()).isNull();
    }

    @Test
    @DisplayName("should ignore vendor extensions after node indexes")
    void shouldIgnoreVendorExtensions() {
      assertThat(parse("epubcfi(/2/4vnd.foo/6foo.bar:20)").path())
          .isEqualTo(
              path(part(step(2), step(4), CfiStep.builder().nodeIndex(6).offset(20).build())));
    }

    @Test
    @DisplayName("should trim whitespace around the wrapper")
    void shouldTrimWhitespaceAroundWrapper() {
      assertThat(parse("  epubcfi(/2/4)\n").path()).isEqualTo(path(part(step(2), step(4))));
    }
  }

  @Nested
  @DisplayName("Text location assertions")
  class TextLocationAssertions {

    private TextLocationAssertion assertionOf(String cfi) {
      return parse(cfi).path().lastPart().lastStep().textLocationAssertion();
    }

    @Test
    @DisplayName("should parse pre and post text")
    void shouldParsePreAndPost() {
      assertThat(assertionOf("epubcfi(/1/2:3[pre,post])"))
          .isEqualTo(TextLocationAssertion.prePost("pre", "post"));
      assertThat(assertionOf("epubcfi(/1/2:3[,post])"))
          .isEqualTo(TextLocationAssertion.prePost(null, "post"));
      assertThat(assertionOf("epubcfi(/1/2:3[pre,])"))
          .isEqualTo(TextLocationAssertion.prePost("pre", null));
    }

    @Test
    @DisplayName("should split on the last unescaped comma")
    void shouldSplitOnLastComma() {
      assertThat(assertionOf("epubcfi(/3:1[a,b,c])"))
          .isEqualTo(TextLocationAssertion.prePost("b", "c"));
      assertThat(assertionOf("epubcfi(/3:1[a^,b])")).isEqualTo(TextLocationAssertion.plain("a,b"));
    }

    @Test
    @DisplayName("should read side bias only from an unescaped semicolon")
    void shouldReadSideBiasFromUnescapedSemicolon() {
      CfiStep after = parse("epubcfi(/3:1[x,y;s=a])").path().lastPart().lastStep();
      assertThat(after.sideBias()).isEqualTo(SideBias.AFTER);
      assertThat(after.textLocationAssertion()).isEqualTo(TextLocationAssertion.prePost("x", "y"));

      CfiStep escaped = parse("epubcfi(/3:1[x^;s=a])").path().lastPart().lastStep();
      assertThat(escaped.sideBias()).isNull();
      assertThat(escaped.textLocationAssertion())
          .isEqualTo(TextLocationAssertion.plain("x;s=a"));
    }

    @Test
    @DisplayName("should accept a bracket holding only the side bias")
    void shouldAcceptSideBiasOnly() {
      CfiStep last = parse("epubcfi(/3:1[;s=b])").path().lastPart().lastStep();
      assertThat(last.sideBias()).isEqualTo(SideBias.BEFORE);
      assertThat(last.textLocationAssertion()).isNull();
    }
  }

  @Nested
  @DisplayName("Ranges")
  class Ranges {

    private static final String RANGE =
        "epubcfi(/6/4[chap01ref]!/4[body01],/10[para05]/3:5,/10[para05]/3:8)";

    @Test
    @DisplayName("should expose full from and to paths")
    void shouldExposeFromAndTo() {
      ParsedCfi parsed = Cfi.parse(RANGE).get();

      assertThat(parsed.range()).isTrue();
      assertThat(parsed.from().part(0)).isEqualTo(part(step(6), step(4, "chap01ref")));
      assertThat(parsed.from().lastPart().steps())
          .containsExactly(
              step(4, "body01"),
              step(10, "para05"),
              CfiStep.builder().nodeIndex(3).offset(5).build());
      assertThat(parsed.to().lastPart().lastStep().offset()).isEqualTo(8);
    }

    @Test
    @DisplayName("should flatten a range into its start location")
    void shouldFlattenRange_whenOptionSet() {
      Cfi flattened = Cfi.parse(RANGE, ParseOptions.DEFAULT.withFlattenRange(true));

      assertThat(flattened.isRange()).isFalse();
      assertThat(flattened).isEqualTo(Cfi.parse(FLAT_EQUIVALENT));
      assertThat(flattened.get()).isEqualTo(Cfi.parse(FLAT_EQUIVALENT).get());
    }

    @Test
    @DisplayName("should degenerate to the start location when the end is missing")
    void shouldDegenerate_whenEndMissing() {
      CfiExpression result = parse("epubcfi(/6/4[chap01ref]!/4[body01],/10[para05]/3:5)");

      assertThat(result.isRange()).isFalse();
      assertThat(result.path().lastPart().steps()).hasSize(3);
    }

    @Test
    @DisplayName("should strip qualifiers from the shared prefix and leading suffix steps")
    void shouldStripQualifiersInRanges() {
      CfiExpression result = parse("epubcfi(/6/4:3,/10:2/3:5,/10~4/3:8)");

      assertThat(result.path()).isEqualTo(path(part(step(6), step(4))));
      assertThat(result.fromSuffix())
          .containsExactly(step(10), CfiStep.builder().nodeIndex(3).offset(5).build());
      assertThat(result.toSuffix())
          .containsExactly(step(10), CfiStep.builder().nodeIndex(3).offset(8).build());
    }

    @Test
    @DisplayName("should reject ranges that span documents")
    void shouldRejectRangesSpanningDocuments() {
      assertThatThrownBy(() -> parse("epubcfi(/6/4,/2!/4,/6)"))
          .isInstanceOf(MalformedCfiException.class)
          .hasMessageContaining("spans multiple documents");
    }

    @Test
    @DisplayName("should reject a range whose common path ends on a document hop")
    void shouldRejectRange_whenCommaFollowsDocumentHop() {
      assertThatThrownBy(() -> parse("epubcfi(/6/4!,/4,/6)"))
          .isInstanceOf(MalformedCfiException.class)
          .hasMessageContaining("spans multiple documents");
    }

    @Test
    @DisplayName("should reject more than two top-level commas")
    void shouldRejectTooManyCommas() {
      assertThatThrownBy(() -> parse("epubcfi(/2,/4,/6,/8)"))
          .isInstanceOf(MalformedCfiException.class);
    }
  }

  @Nested
  @DisplayName("Stricter mode")
  class StricterMode {

    @Test
    @DisplayName("should drop qualifiers from steps that are not last in their part")
    void shouldDropQualifiersFromNonFinalSteps() {
      assertThat(parse("epubcfi(/2~42.43@100:101/4!/6/8:100/6:200)").path())
          .isEqualTo(
              path(
                  part(step(2), step(4)),
                  part(step(6), step(8), CfiStep.builder().nodeIndex(6).offset(200).build())));
    }

    @Test
    @DisplayName("should keep qualifiers when stricter mode is off")
    void shouldKeepQualifiers_whenStricterOff() {
      CfiExpression result =
          new CfiParser(ParseOptions.DEFAULT.withStricter(false))
              .parse("epubcfi(/2~42.43/4!/6/8:100/6:200)");

      assertThat(result.path().part(0).steps().get(0).temporal()).isEqualTo(42.43);
      assertThat(result.path().part(1).steps().get(1).offset()).isEqualTo(100);
    }

    @Test
    @DisplayName("should reject an offset mixed with a temporal position")
    void shouldRejectOffsetAfterTemporal() {
      assertThatThrownBy(() -> parse("epubcfi(/2~1.5:5)"))
          .isInstanceOf(MalformedCfiException.class);
      assertThatThrownBy(() -> parse("epubcfi(/3:5@1:2)"))
          .isInstanceOf(MalformedCfiException.class);
    }

    @Test
    @DisplayName("should accept an offset with a temporal position when not stricter")
    void shouldAcceptMixedQualifiers_whenStricterOff() {
      CfiStep last =
          new CfiParser(ParseOptions.DEFAULT.withStricter(false))
              .parse("epubcfi(/2~1.5:5)")
              .path()
              .lastPart()
              .lastStep();

      assertThat(last.temporal()).isEqualTo(1.5);
      assertThat(last.offset()).isEqualTo(5);
    }
  }

  @Nested
  @DisplayName("Malformed input")
  class MalformedInput {

    @Test
    @DisplayName("should reject strings without the epubcfi wrapper")
    void shouldRejectMissingWrapper() {
      assertThatThrownBy(() -> parse("/6/4[chap01ref]"))
          .isInstanceOf(MalformedCfiException.class)
          .hasMessageContaining("Not a valid CFI");
    }

    @Test
    @DisplayName("should reject an empty path")
    void shouldRejectEmptyPath() {
      assertThatThrownBy(() -> parse("epubcfi()")).isInstanceOf(MalformedCfiException.class);
    }

    @Test
    @DisplayName("should reject a step without node index")
    void shouldRejectMissingNodeIndex() {
      assertThatThrownBy(() -> parse("epubcfi(/a/4)"))
          .isInstanceOf(MalformedCfiException.class)
          .hasMessageContaining("Missing child node index");
    }

    @Test
    @DisplayName("should reject an unterminated bracket")
    void shouldRejectUnterminatedBracket() {
      assertThatThrownBy(() -> parse("epubcfi(/2[abc)"))
          .isInstanceOf(MalformedCfiException.class)
          .hasMessageContaining("Unterminated");
      assertThatThrownBy(() -> parse("epubcfi(/3:1[abc)"))
          .isInstanceOf(MalformedCfiException.class);
    }

    @Test
    @DisplayName("should reject node indexes that overflow")
    void shouldRejectOverflowingNodeIndex() {
      assertThatThrownBy(() -> parse("epubcfi(/99999999999)"))
          .isInstanceOf(MalformedCfiException.class);
    }
  }

  @Test
  @DisplayName("should produce equal and unmodifiable results for the same input")
  void shouldProduceEqualUnmodifiableResults() {
    Cfi first = Cfi.parse(FLAT_EQUIVALENT);
    Cfi second = Cfi.parse(FLAT_EQUIVALENT);

    assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    assertThat(first.get()).isEqualTo(second.get());
    assertThatThrownBy(() -> first.get().path().parts().add(part(step(2))))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
