package com.cario.phiguard.app.model;

import lombok.Value;

/**
 * A web source backing part of an answer. {@code position} is the character offset in the answer
 * text where the source is first referenced.
 */
@Value
public class Citation {
  String url;
  String title;
  int position;
}
