package com.cario.phiguard.app.model;

import java.util.List;
import lombok.Value;

@Value
public class ExtractedAnswer {
  String answerText;
  List<Citation> citations;

  public boolean isGroundingUsed() {
    return !citations.isEmpty();
  }
}
