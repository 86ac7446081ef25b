package com.assetsync.domain.model;

import com.assetsync.domain.enums.LedgerCategory;
import com.assetsync.domain.enums.LedgerEntryType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One append-only line of the change ledger. {@code sequence} is the global processing order.
 */
@Value
@Builder
public class LedgerEntry {

    long sequence;
    LocalDateTime timestamp;
    LedgerCategory category;
    LedgerEntryType type;
    String serialNumber;
    String field;
    String localValue;
    String remoteValue;
    String detail;
}
