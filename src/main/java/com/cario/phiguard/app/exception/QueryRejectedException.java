package com.cario.phiguard.app.exception;

/** Raised when a caller tries to ground a query that the privacy policy rejected. */
public class QueryRejectedException extends PhiGuardException {

  private final int entityCount;

  public QueryRejectedException(int entityCount) {
    super("Query was rejected by privacy policy (" + entityCount + " entities detected)");
    this.entityCount = entityCount;
  }

  public int getEntityCount() {
    return entityCount;
  }
}
