package io.trading.marketdata.dbn.model;

/**
 * Auction imbalance update.
 */
public record ImbalanceMsg(
    RecordHeader header,
    long tsRecv,
    long refPrice,
    long auctionTime,
    long contBookClrPrice,
    long aucInterestClrPrice,
    long ssrFillingPrice,
    long indMatchPrice,
    long upperCollar,
    long lowerCollar,
    long pairedQty,
    long totalImbalanceQty,
    long marketImbalanceQty,
    long unpairedQty,
    char auctionType,
    char side,
    int auctionStatus,
    int freezeStatus,
    int numExtensions,
    char unpairedSide,
    char significantImbalance
) implements Record {
    public ImbalanceMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
    }
}
