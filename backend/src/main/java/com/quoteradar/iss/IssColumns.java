package com.quoteradar.iss;

/**
 * ISS block and column names. Quote blocks use upper-case columns, the candles block lower-case.
 */
public final class IssColumns {

    private IssColumns() {}

    public static final String SECURITIES = "securities";
    public static final String MARKETDATA = "marketdata";
    public static final String CANDLES = "candles";

    public static final String BOARDID = "BOARDID";

    // securities
    public static final String PREVPRICE = "PREVPRICE";
    public static final String SECNAME = "SECNAME";
    public static final String SHORTNAME = "SHORTNAME";

    // marketdata
    public static final String LAST = "LAST";
    public static final String LCLOSEPRICE = "LCLOSEPRICE";
    public static final String OPEN = "OPEN";
    public static final String HIGH = "HIGH";
    public static final String LOW = "LOW";
    public static final String LASTTOPREVPRICE = "LASTTOPREVPRICE";
    public static final String VOLTODAY = "VOLTODAY";

    // candles
    public static final String CANDLE_OPEN = "open";
    public static final String CANDLE_CLOSE = "close";
    public static final String CANDLE_HIGH = "high";
    public static final String CANDLE_LOW = "low";
    public static final String CANDLE_VOLUME = "volume";
    public static final String CANDLE_BEGIN = "begin";
    public static final String CANDLE_END = "end";
}
