package com.assetsync.domain.vo;

import lombok.Value;

/**
 * Serial number linking one workbook row to one Lansweeper asset.
 * Never blank: rows without a serial number are skipped before an identity is built.
 */
@Value
public class AssetIdentity {

    String serialNumber;

    public static AssetIdentity of(String serialNumber) {
        if (serialNumber == null || serialNumber.isBlank()) {
            throw new IllegalArgumentException("Serial number must not be blank");
        }
        return new AssetIdentity(serialNumber.trim());
    }

    @Override
    public String toString() {
        return serialNumber;
    }
}
