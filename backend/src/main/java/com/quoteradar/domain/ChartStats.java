package com.quoteradar.domain;

public record ChartStats(double change, double percentChange, boolean isUp, boolean isDown) {
}
