package com.cario.phiguard.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Inline source annotation attached to an answer. {@code marker} is the literal text in the answer
 * that the annotation covers (e.g. {@code 【3:0†source】}); {@code startIndex}/{@code endIndex} are
 * -1 when the service did not report them. {@code url} is null for non-web annotations.
 */
@Value
@Builder
public class UrlAnnotation {
  String marker;
  String url;
  String title;
  @Builder.Default int startIndex = -1;
  @Builder.Default int endIndex = -1;
}
