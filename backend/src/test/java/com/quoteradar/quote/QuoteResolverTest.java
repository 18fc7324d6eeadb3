package com.quoteradar.quote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quoteradar.domain.Quote;
import com.quoteradar.iss.config.IssProperties;
import com.quoteradar.iss.table.ColumnTable;
import com.quoteradar.iss.table.ColumnTableDecoder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuoteResolverTest {

    private static final String SEC_COLUMNS = "[\"SECID\", \"BOARDID\", \"SHORTNAME\", \"PREVPRICE\", \"SECNAME\"]";
    private static final String MD_COLUMNS =
            "[\"SECID\", \"BOARDID\", \"LAST\", \"OPEN\", \"HIGH\", \"LOW\", \"LCLOSEPRICE\", \"LASTTOPREVPRICE\", \"VOLTODAY\"]";

    private final ColumnTableDecoder decoder = new ColumnTableDecoder(new ObjectMapper());
    private final QuoteResolver resolver = new QuoteResolver(new IssProperties());

    private Quote resolve(String symbol, String secRows, String mdRows) {
        JsonNode root = decoder.parse("{\"securities\": {\"columns\": " + SEC_COLUMNS + ", \"data\": " + secRows + "},"
                + "\"marketdata\": {\"columns\": " + MD_COLUMNS + ", \"data\": " + mdRows + "}}");
        ColumnTable securities = decoder.decodeRequired(root, "securities");
        ColumnTable marketdata = decoder.decodeRequired(root, "marketdata");
        return resolver.resolve(symbol, securities, marketdata);
    }

    @Test
    @DisplayName("primary board row wins and live LAST is the price")
    void primaryBoardLivePrice() {
        Quote q = resolve("SBER",
                "[[\"SBER\", \"SMAL\", \"Sber small\", 1.0, null], [\"SBER\", \"TQBR\", \"Sberbank\", 300.5, \"Sberbank of Russia\"]]",
                "[[\"SBER\", \"SMAL\", 1.0, 1.0, 1.0, 1.0, 1.0, 0.1, 5],"
                        + " [\"SBER\", \"TQBR\", 310.5, 305.0, 312.0, 299.0, 309.0, 3.33, 48213570]]");

        assertThat(q.symbol()).isEqualTo("SBER");
        assertThat(q.name()).isEqualTo("Sberbank of Russia");
        assertThat(q.lastTradePrice()).isEqualTo(310.5);
        assertThat(q.previousClose()).isEqualTo(300.5);
        assertThat(q.change()).isEqualTo(10.0);
        assertThat(q.changePercent()).isEqualTo(3.33);
        assertThat(q.open()).isEqualTo(305.0);
        assertThat(q.high()).isEqualTo(312.0);
        assertThat(q.low()).isEqualTo(299.0);
        assertThat(q.volume()).isEqualTo(48213570L);
        assertThat(q.currencyCode()).isEqualTo("RUB");
        assertThat(q.exchange()).isEqualTo("MOEX");
        assertThat(q.marketState()).isEqualTo("REGULAR");
    }

    @Test
    @DisplayName("falls back to the first row when no primary board row exists")
    void firstRowFallback() {
        Quote q = resolve("GAZP",
                "[[\"GAZP\", \"SMAL\", \"Gazprom\", 160.0, \"Gazprom PAO\"]]",
                "[[\"GAZP\", \"SMAL\", 161.0, null, null, null, null, null, null],"
                        + " [\"GAZP\", \"SPEQ\", 999.0, null, null, null, null, null, null]]");

        assertThat(q.lastTradePrice()).isEqualTo(161.0);
    }

    @Test
    @DisplayName("zero LAST falls back to LCLOSEPRICE")
    void lastZeroUsesSessionClose() {
        Quote q = resolve("LKOH",
                "[[\"LKOH\", \"TQBR\", \"Lukoil\", 7000.0, \"Lukoil PAO\"]]",
                "[[\"LKOH\", \"TQBR\", 0, null, null, null, 7100.0, null, null]]");

        assertThat(q.lastTradePrice()).isEqualTo(7100.0);
        assertThat(q.change()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("absent LAST and LCLOSEPRICE fall back to PREVPRICE with a flat OHLC")
    void prevPriceFallbackFlatOhlc() {
        Quote q = resolve("ROSN",
                "[[\"ROSN\", \"TQBR\", \"Rosneft\", 550.0, \"Rosneft PAO\"]]",
                "[[\"ROSN\", \"TQBR\", null, 0, null, null, 0, null, null]]");

        assertThat(q.lastTradePrice()).isEqualTo(550.0);
        assertThat(q.open()).isEqualTo(550.0);
        assertThat(q.high()).isEqualTo(550.0);
        assertThat(q.low()).isEqualTo(550.0);
        assertThat(q.change()).isEqualTo(0.0);
        assertThat(q.changePercent()).isEqualTo(0.0);
        assertThat(q.volume()).isZero();
    }

    @Test
    @DisplayName("no usable price anywhere is NO_PRICE_AVAILABLE")
    void noPrice() {
        assertThatThrownBy(() -> resolve("VTBR",
                "[[\"VTBR\", \"TQBR\", \"VTB\", 0, \"VTB Bank\"]]",
                "[[\"VTBR\", \"TQBR\", 0, null, null, null, null, null, null]]"))
                .isInstanceOf(NoPriceAvailableException.class)
                .hasFieldOrPropertyWithValue("errorCode", "NO_PRICE_AVAILABLE");
    }

    @Test
    @DisplayName("percent change is computed when the source omits it")
    void computedPercent() {
        Quote q = resolve("MGNT",
                "[[\"MGNT\", \"TQBR\", \"Magnit\", 200.0, \"Magnit PAO\"]]",
                "[[\"MGNT\", \"TQBR\", 210.0, null, null, null, null, null, 10]]");

        assertThat(q.change()).isEqualTo(10.0);
        assertThat(q.changePercent()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("change is zero when previous close is unknown")
    void changeZeroWithoutPreviousClose() {
        Quote q = resolve("AFLT",
                "[[\"AFLT\", \"TQBR\", \"Aeroflot\", null, \"Aeroflot PAO\"]]",
                "[[\"AFLT\", \"TQBR\", 55.5, null, null, null, null, null, null]]");

        assertThat(q.previousClose()).isZero();
        assertThat(q.change()).isZero();
        assertThat(q.changePercent()).isZero();
    }

    @Test
    @DisplayName("change equals last minus previous close whenever previous close is non-zero")
    void changeInvariant() {
        double[][] cases = {{310.5, 300.5}, {0.1, 0.3}, {123.456, 120.01}, {1e-4, 2e-4}};
        for (double[] c : cases) {
            Quote q = resolve("SBER",
                    "[[\"SBER\", \"TQBR\", \"Sberbank\", " + c[1] + ", \"Sberbank\"]]",
                    "[[\"SBER\", \"TQBR\", " + c[0] + ", null, null, null, null, null, null]]");
            assertThat(q.change()).isEqualTo(q.lastTradePrice() - q.previousClose());
        }
    }

    @Test
    @DisplayName("name falls back SECNAME -> SHORTNAME -> input symbol, and symbol keeps the input")
    void nameFallbackAndSymbolRoundTrip() {
        Quote shortName = resolve("sber.me",
                "[[\"SBER\", \"TQBR\", \"Sberbank\", 300.0, \"  \"]]",
                "[[\"SBER\", \"TQBR\", 301.0, null, null, null, null, null, null]]");
        Quote bare = resolve("sber.me",
                "[[\"SBER\", \"TQBR\", null, 300.0, null]]",
                "[[\"SBER\", \"TQBR\", 301.0, null, null, null, null, null, null]]");

        assertThat(shortName.name()).isEqualTo("Sberbank");
        assertThat(shortName.symbol()).isEqualTo("sber.me");
        assertThat(bare.name()).isEqualTo("sber.me");
    }
}
