package com.sentinel.analyzer.model;

public record SeriesPoint(long timestamp, double value) {}
