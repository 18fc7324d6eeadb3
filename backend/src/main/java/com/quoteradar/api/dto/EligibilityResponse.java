package com.quoteradar.api.dto;

public record EligibilityResponse(String symbol, String canonical, boolean eligible) {
}
