package com.confluenceplatform.common.model;

/**
 * Closed catalog of instruments the platform tracks.
 *
 * <p>Only members of this enum ever appear as the {@code symbol} of a
 * {@link PriceLevel}, {@link SourceView} or {@link ConfluenceState}. Raw mentions
 * are resolved onto it by {@link com.confluenceplatform.common.normalize.SymbolNormalizer}.
 */
public enum TrackedSymbol {

    SPX(AssetClass.INDEX),
    QQQ(AssetClass.INDEX),
    IWM(AssetClass.INDEX),
    BTC(AssetClass.CRYPTO),
    SMH(AssetClass.SEMICONDUCTOR),
    NVDA(AssetClass.SEMICONDUCTOR),
    TSLA(AssetClass.MEGA_CAP),
    GOOGL(AssetClass.MEGA_CAP),
    AAPL(AssetClass.MEGA_CAP),
    MSFT(AssetClass.MEGA_CAP),
    AMZN(AssetClass.MEGA_CAP);

    public enum AssetClass {
        INDEX,
        CRYPTO,
        SEMICONDUCTOR,
        MEGA_CAP
    }

    private final AssetClass assetClass;

    TrackedSymbol(AssetClass assetClass) {
        this.assetClass = assetClass;
    }

    public AssetClass assetClass() {
        return assetClass;
    }
}
