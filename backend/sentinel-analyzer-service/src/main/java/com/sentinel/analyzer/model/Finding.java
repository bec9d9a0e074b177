package com.sentinel.analyzer.model;

import java.util.Comparator;

public record Finding(SeriesPoint point, String baseName) {

  public static final Comparator<Finding> BY_BASE_NAME = Comparator.comparing(Finding::baseName);
}
