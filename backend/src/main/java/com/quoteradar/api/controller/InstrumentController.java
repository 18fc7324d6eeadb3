package com.quoteradar.api.controller;

import com.quoteradar.api.dto.EligibilityResponse;
import com.quoteradar.iss.InstrumentClassifier;
import com.quoteradar.quote.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/instruments/{symbol}/eligibility. No ISS call.
 */
@RestController
@RequestMapping("/api/v1/instruments")
@RequiredArgsConstructor
public class InstrumentController {

    private final QuoteService quoteService;

    @GetMapping("/{symbol}/eligibility")
    public EligibilityResponse eligibility(@PathVariable String symbol) {
        return new EligibilityResponse(symbol, InstrumentClassifier.canonicalize(symbol), quoteService.isEligible(symbol));
    }
}
