package com.sentinel.analyzer.classify;

import com.sentinel.analyzer.model.ClassificationResult;
import com.sentinel.analyzer.model.FailureCause;

public record ClassificationOutcome(Kind kind, ClassificationResult result, Throwable error) {

  public enum Kind { SUCCESS, TOO_SHORT, STALE, BORING, OTHER }

  private static final ClassificationOutcome TOO_SHORT = new ClassificationOutcome(Kind.TOO_SHORT, null, null);
  private static final ClassificationOutcome STALE = new ClassificationOutcome(Kind.STALE, null, null);
  private static final ClassificationOutcome BORING = new ClassificationOutcome(Kind.BORING, null, null);

  public static ClassificationOutcome success(ClassificationResult result) {
    return new ClassificationOutcome(Kind.SUCCESS, result, null);
  }

  public static ClassificationOutcome tooShort() {
    return TOO_SHORT;
  }

  public static ClassificationOutcome stale() {
    return STALE;
  }

  public static ClassificationOutcome boring() {
    return BORING;
  }

  public static ClassificationOutcome other(Throwable error) {
    return new ClassificationOutcome(Kind.OTHER, null, error);
  }

  public FailureCause failureCause() {
    return switch (kind) {
      case SUCCESS -> null;
      case TOO_SHORT -> FailureCause.TOO_SHORT;
      case STALE -> FailureCause.STALE;
      case BORING -> FailureCause.BORING;
      case OTHER -> FailureCause.OTHER;
    };
  }
}
