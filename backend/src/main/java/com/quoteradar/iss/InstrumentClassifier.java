package com.quoteradar.iss;

import com.quoteradar.iss.config.IssProperties;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decides which symbols are served by ISS and produces the canonical form used to match
 * results back to requests. A symbol qualifies when its bare ticker is known, or when it
 * carries an exchange suffix ({@code .ME}, {@code .MOEX}).
 */
@Component
public class InstrumentClassifier {

    /** Longest first, so ".MOEX" is not mistaken for a shorter suffix. */
    private static final List<String> SUFFIXES = List.of(".MOEX", ".ME");

    private static final Set<String> MOEX_TICKERS = Stream.of(
            "OZON", "SBER", "GAZP", "LKOH", "YNDX", "ROSN",
            "NVTK", "GMKN", "TATN", "MGNT", "AFLT", "MTSS",
            "VKCO", "POLY", "SNGS", "PLZL", "FEES", "ALRS",
            "MOEX", "RUAL", "CHMF", "NLMK", "PHOR", "PIKK",
            "VTBR", "IRAO", "SBERP", "TRNFP", "HYDR", "RTKM",
            "CBOM", "TCSG", "SMLT", "SGZH", "BELU", "FIXP",
            "OKEY", "FIVE", "GLTR", "BSPB", "DSKY", "LSRG",
            "MVID", "UPRO", "FLOT", "KMAZ", "SOFL", "ASTR",
            "MDMG", "HHRU", "WUSH", "POSI", "MSNG", "AQUA"
    ).collect(Collectors.toUnmodifiableSet());

    private final Set<String> knownTickers;

    public InstrumentClassifier(IssProperties issProperties) {
        Set<String> tickers = new HashSet<>(MOEX_TICKERS);
        issProperties.getAdditionalTickers().stream()
                .filter(t -> t != null && !t.isBlank())
                .map(InstrumentClassifier::canonicalize)
                .forEach(tickers::add);
        this.knownTickers = Set.copyOf(tickers);
    }

    public boolean isEligible(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        return knownTickers.contains(canonicalize(symbol)) || hasExchangeSuffix(symbol);
    }

    /**
     * Strips one exchange suffix and upper-cases: "sber.me" -> "SBER".
     */
    public static String canonicalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        String upper = symbol.strip().toUpperCase(Locale.ROOT);
        for (String suffix : SUFFIXES) {
            if (upper.endsWith(suffix)) {
                return upper.substring(0, upper.length() - suffix.length());
            }
        }
        return upper;
    }

    private static boolean hasExchangeSuffix(String symbol) {
        String upper = symbol.strip().toUpperCase(Locale.ROOT);
        return SUFFIXES.stream().anyMatch(s -> upper.endsWith(s) && upper.length() > s.length());
    }
}
