package com.confluenceplatform.common.normalize;

import com.confluenceplatform.common.model.TrackedSymbol;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pure, stateless resolver from raw instrument mentions to the {@link TrackedSymbol} catalog.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>trim + uppercase; blank → empty</li>
 *   <li>catalog member → itself</li>
 *   <li>alias table: ticker variants, ETF/index equivalences, company names,
 *       futures roots, {@code =F} / {@code _F} exchange-suffixed codes, micro contracts</li>
 *   <li>input with the {@code /} contract marker → retry 2–3 with the marker stripped</li>
 * </ol>
 *
 * <p>Never throws. Callers discard an empty result instead of failing a batch.
 */
public final class SymbolNormalizer {

    static final char CONTRACT_MARKER = '/';

    private static final Map<String, TrackedSymbol> ALIASES = buildAliases();

    private SymbolNormalizer() {}

    public static Optional<TrackedSymbol> normalize(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.trim().toUpperCase();
        if (key.isEmpty()) {
            return Optional.empty();
        }

        TrackedSymbol resolved = lookup(key);
        if (resolved == null && key.charAt(0) == CONTRACT_MARKER) {
            resolved = lookup(key.substring(1).trim());
        }
        return Optional.ofNullable(resolved);
    }

    private static TrackedSymbol lookup(String key) {
        if (key.isEmpty()) return null;
        for (TrackedSymbol symbol : TrackedSymbol.values()) {
            if (symbol.name().equals(key)) return symbol;
        }
        return ALIASES.get(key);
    }

    // ── alias table ────────────────────────────────────────────────────────

    private static Map<String, TrackedSymbol> buildAliases() {
        Map<String, TrackedSymbol> aliases = new HashMap<>();

        // company names and share-class tickers
        put(aliases, TrackedSymbol.GOOGL, "GOOGLE", "GOOG", "ALPHABET");
        put(aliases, TrackedSymbol.AAPL,  "APPLE");
        put(aliases, TrackedSymbol.AMZN,  "AMAZON");
        put(aliases, TrackedSymbol.MSFT,  "MICROSOFT");
        put(aliases, TrackedSymbol.TSLA,  "TESLA");
        put(aliases, TrackedSymbol.NVDA,  "NVIDIA");

        // index names and ETF equivalences
        put(aliases, TrackedSymbol.IWM, "RUSSELL", "RUSSELL 2000", "RUT");
        put(aliases, TrackedSymbol.QQQ, "NASDAQ", "NASDAQ 100", "NDX", "QS");
        put(aliases, TrackedSymbol.SPX, "S&P", "S&P 500", "SP500", "SPY");
        put(aliases, TrackedSymbol.BTC, "BITCOIN", "BTCUSD");
        put(aliases, TrackedSymbol.SMH, "SEMIS", "SEMICONDUCTORS");

        // futures roots: bare, "=F" and "_F" suffixed
        putFutures(aliases, TrackedSymbol.SPX, "ES", "SP", "MES");
        putFutures(aliases, TrackedSymbol.QQQ, "NQ", "MNQ");
        putFutures(aliases, TrackedSymbol.IWM, "RTY", "M2K");
        putFutures(aliases, TrackedSymbol.BTC, "MBT");
        aliases.put("BTC=F", TrackedSymbol.BTC);
        aliases.put("BTC_F", TrackedSymbol.BTC);

        return Map.copyOf(aliases);
    }

    private static void put(Map<String, TrackedSymbol> aliases, TrackedSymbol symbol, String... keys) {
        for (String key : keys) {
            aliases.put(key, symbol);
        }
    }

    private static void putFutures(Map<String, TrackedSymbol> aliases, TrackedSymbol symbol, String... roots) {
        for (String root : roots) {
            aliases.put(root, symbol);
            aliases.put(root + "=F", symbol);
            aliases.put(root + "_F", symbol);
        }
    }
}
