package com.cario.phiguard.app.service;

import static org.junit.jupiter.api.Assertions.*;

import com.cario.phiguard.app.model.AgentAnswer;
import com.cario.phiguard.app.model.Citation;
import com.cario.phiguard.app.model.ExtractedAnswer;
import com.cario.phiguard.app.model.UrlAnnotation;
import java.util.List;
import org.junit.jupiter.api.Test;

class CitationExtractorTest {

  private static final String M0 = "【3:0†source】";
  private static final String M1 = "【3:1†source】";
  private static final String M2 = "【3:2†source】";

  private final CitationExtractor extractor = new CitationExtractor();

  private static UrlAnnotation placed(String text, String marker, String url, String title) {
    int start = text.indexOf(marker);
    return UrlAnnotation.builder()
        .marker(marker)
        .url(url)
        .title(title)
        .startIndex(start)
        .endIndex(start + marker.length())
        .build();
  }

  @Test
  void answerWithoutAnnotationsHasNoCitations() {
    ExtractedAnswer out =
        extractor.extract(AgentAnswer.builder().text("Paris is the capital.").build());
    assertEquals("Paris is the capital.", out.getAnswerText());
    assertTrue(out.getCitations().isEmpty());
    assertFalse(out.isGroundingUsed());
  }

  @Test
  void markersBecomeNumberedReferencesInOrderOfAppearance() {
    String text = "Paris is the capital" + M0 + ". It hosts the Louvre" + M1 + ".";
    AgentAnswer raw =
        AgentAnswer.builder()
            .text(text)
            // reported out of text order on purpose
            .annotation(placed(text, M1, "https://louvre.fr", "Louvre"))
            .annotation(placed(text, M0, "https://en.wikipedia.org/wiki/Paris", "Paris"))
            .build();

    ExtractedAnswer out = extractor.extract(raw);

    assertEquals("Paris is the capital[1]. It hosts the Louvre[2].", out.getAnswerText());
    List<Citation> citations = out.getCitations();
    assertEquals(2, citations.size());
    assertEquals("https://en.wikipedia.org/wiki/Paris", citations.get(0).getUrl());
    assertEquals("Louvre", citations.get(1).getTitle());
    assertEquals(out.getAnswerText().indexOf("[1]"), citations.get(0).getPosition());
    assertEquals(out.getAnswerText().indexOf("[2]"), citations.get(1).getPosition());
    assertTrue(out.isGroundingUsed());
  }

  @Test
  void repeatedUrlIsCitedOnceAndReusesItsNumber() {
    String text = "A" + M0 + " B" + M1 + " C" + M2;
    AgentAnswer raw =
        AgentAnswer.builder()
            .text(text)
            .annotation(placed(text, M0, "https://a.example", "A"))
            .annotation(placed(text, M1, "https://b.example", "B"))
            .annotation(placed(text, M2, "https://a.example", "A again"))
            .build();

    ExtractedAnswer out = extractor.extract(raw);

    assertEquals("A[1] B[2] C[1]", out.getAnswerText());
    assertEquals(2, out.getCitations().size());
    assertEquals("A", out.getCitations().get(0).getTitle());
    assertEquals(1, out.getCitations().get(0).getPosition());
  }

  @Test
  void missingTitleFallsBackToDefault() {
    String text = "Fact" + M0;
    ExtractedAnswer out =
        extractor.extract(
            AgentAnswer.builder()
                .text(text)
                .annotation(placed(text, M0, "https://x.example", "  "))
                .build());
    assertEquals(CitationExtractor.DEFAULT_TITLE, out.getCitations().get(0).getTitle());
  }

  @Test
  void annotationWithoutUrlLosesMarkerAndCitation() {
    String text = "Fact" + M0 + " other" + M1;
    ExtractedAnswer out =
        extractor.extract(
            AgentAnswer.builder()
                .text(text)
                .annotation(placed(text, M0, null, null))
                .annotation(placed(text, M1, "https://x.example", "X"))
                .build());
    assertEquals("Fact other[1]", out.getAnswerText());
    assertEquals(1, out.getCitations().size());
  }

  @Test
  void markerIsSearchedWhenIndicesAreMissingOrWrong() {
    String text = "One" + M0 + " two" + M0;
    AgentAnswer raw =
        AgentAnswer.builder()
            .text(text)
            .annotation(UrlAnnotation.builder().marker(M0).url("https://1.example").build())
            .annotation(
                UrlAnnotation.builder()
                    .marker(M0)
                    .url("https://2.example")
                    .startIndex(0)
                    .endIndex(3)
                    .build())
            .build();

    ExtractedAnswer out = extractor.extract(raw);

    assertEquals("One[1] two[2]", out.getAnswerText());
    assertEquals("https://1.example", out.getCitations().get(0).getUrl());
    assertEquals("https://2.example", out.getCitations().get(1).getUrl());
  }

  @Test
  void unplaceableAnnotationStillYieldsCitation() {
    AgentAnswer raw =
        AgentAnswer.builder()
            .text("No markers here.")
            .annotation(
                UrlAnnotation.builder().marker(M0).url("https://x.example").title("X").build())
            .build();

    ExtractedAnswer out = extractor.extract(raw);

    assertEquals("No markers here.", out.getAnswerText());
    assertEquals(1, out.getCitations().size());
    assertEquals("No markers here.".length(), out.getCitations().get(0).getPosition());
  }

  @Test
  void extractionIsDeterministic() {
    String text = "A" + M0 + " B" + M1;
    AgentAnswer raw =
        AgentAnswer.builder()
            .text(text)
            .annotation(placed(text, M0, "https://a.example", "A"))
            .annotation(placed(text, M1, "https://b.example", "B"))
            .build();
    assertEquals(extractor.extract(raw), extractor.extract(raw));
  }

  @Test
  void zeroWidthAnnotationAtMarkerStartDoesNotBreakRewriting() {
    String marker = "【1†source】";
    String text = "Fact " + marker + " end";
    int at = text.indexOf(marker);
    UrlAnnotation range = placed(text, marker, "https://a.example", "A");
    UrlAnnotation point =
        UrlAnnotation.builder()
            .marker("")
            .url("https://b.example")
            .title("B")
            .startIndex(at)
            .endIndex(at)
            .build();

    ExtractedAnswer rangeFirst =
        extractor.extract(
            AgentAnswer.builder().text(text).annotation(range).annotation(point).build());
    ExtractedAnswer pointFirst =
        extractor.extract(
            AgentAnswer.builder().text(text).annotation(point).annotation(range).build());

    assertEquals("Fact [1][2] end", rangeFirst.getAnswerText());
    assertEquals("https://b.example", rangeFirst.getCitations().get(0).getUrl());
    assertEquals(rangeFirst, pointFirst);
  }

  @Test
  void zeroWidthAnnotationInsideMarkerIsNotPlacedInText() {
    String marker = "【1†source】";
    String text = "Fact " + marker + " end";
    UrlAnnotation inside =
        UrlAnnotation.builder()
            .marker("")
            .url("https://b.example")
            .startIndex(text.indexOf(marker) + 3)
            .endIndex(text.indexOf(marker) + 3)
            .build();

    ExtractedAnswer out =
        extractor.extract(
            AgentAnswer.builder()
                .text(text)
                .annotation(placed(text, marker, "https://a.example", "A"))
                .annotation(inside)
                .build());

    assertEquals("Fact [1] end", out.getAnswerText());
    assertEquals(2, out.getCitations().size());
    assertEquals(out.getAnswerText().length(), out.getCitations().get(1).getPosition());
  }
}
