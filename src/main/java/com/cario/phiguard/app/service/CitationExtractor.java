package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.AgentAnswer;
import com.cario.phiguard.app.model.Citation;
import com.cario.phiguard.app.model.ExtractedAnswer;
import com.cario.phiguard.app.model.UrlAnnotation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw assistant message into answer text plus an ordered, deduplicated citation list.
 *
 * <p>Each annotation marker in the text (e.g. {@code 【3:0†source】}) is replaced with a numbered
 * reference {@code [n]}; n is the citation's rank by first appearance, and repeated urls reuse the
 * number of their first occurrence. Annotations without a url lose their marker and produce no
 * citation. The result depends only on the input.
 */
public class CitationExtractor {

  static final String DEFAULT_TITLE = "Web Source";

  public ExtractedAnswer extract(AgentAnswer raw) {
    String text = raw.getText() == null ? "" : raw.getText();
    List<Located> located = locate(text, raw.getAnnotations());
    if (located.isEmpty()) {
      return new ExtractedAnswer(text, List.of());
    }

    Map<String, Integer> numberByUrl = new LinkedHashMap<>();
    Map<String, Citation> citationByUrl = new LinkedHashMap<>();
    StringBuilder out = new StringBuilder(text.length());
    int cursor = 0;

    for (Located l : located) {
      out.append(text, cursor, l.start);
      cursor = l.end;

      String url = l.annotation.getUrl();
      if (url == null || url.isBlank()) {
        continue;
      }
      url = url.trim();
      Integer number = numberByUrl.get(url);
      if (number == null) {
        number = numberByUrl.size() + 1;
        numberByUrl.put(url, number);
        citationByUrl.put(url, new Citation(url, titleOf(l.annotation), out.length()));
      }
      if (l.inText) {
        out.append('[').append(number).append(']');
      }
    }
    out.append(text, cursor, text.length());

    return new ExtractedAnswer(out.toString(), List.copyOf(citationByUrl.values()));
  }

  private static String titleOf(UrlAnnotation a) {
    String title = a.getTitle();
    return title == null || title.isBlank() ? DEFAULT_TITLE : title.trim();
  }

  /**
   * Places every annotation on a non-overlapping range of the text, in text order. Reported
   * indices are used when they match the marker; otherwise the marker is searched for.
   * Annotations that cannot be placed keep their citation but contribute no text replacement;
   * they are appended after all placed ones.
   */
  private static List<Located> locate(String text, List<UrlAnnotation> annotations) {
    List<Located> placed = new ArrayList<>();
    List<Located> unplaced = new ArrayList<>();
    for (UrlAnnotation a : annotations) {
      int start = a.getStartIndex();
      int end = a.getEndIndex();
      String marker = a.getMarker() == null ? "" : a.getMarker();
      boolean valid =
          start >= 0
              && end >= start
              && end <= text.length()
              && (marker.isEmpty() || text.substring(start, end).equals(marker));
      if (!valid && !marker.isEmpty()) {
        start = nextFreeOccurrence(text, marker, placed);
        end = start < 0 ? -1 : start + marker.length();
        valid = start >= 0;
      }
      if (valid && !overlapsAny(start, end, placed)) {
        placed.add(new Located(a, start, end, true));
      } else {
        unplaced.add(new Located(a, text.length(), text.length(), false));
      }
    }
    // zero-width entries sort ahead of a range starting at the same index
    placed.sort(Comparator.comparingInt((Located l) -> l.start).thenComparingInt(l -> l.end));
    placed.addAll(unplaced);
    return placed;
  }

  private static int nextFreeOccurrence(String text, String marker, List<Located> placed) {
    int from = 0;
    while (true) {
      int idx = text.indexOf(marker, from);
      if (idx < 0 || !overlapsAny(idx, idx + marker.length(), placed)) {
        return idx;
      }
      from = idx + 1;
    }
  }

  private static boolean overlapsAny(int start, int end, List<Located> placed) {
    for (Located l : placed) {
      if (start < l.end && l.start < end) return true;
      if (start == end && l.start < start && start < l.end) return true;
      if (start == end && start == l.start && l.start == l.end) return true;
    }
    return false;
  }

  private static final class Located {
    final UrlAnnotation annotation;
    final int start;
    final int end;
    final boolean inText;

    Located(UrlAnnotation annotation, int start, int end, boolean inText) {
      this.annotation = annotation;
      this.start = start;
      this.end = end;
      this.inText = inText;
    }
  }
}
