package com.assetsync.domain.enums;

/**
 * Report section a {@link com.assetsync.domain.model.LedgerEntry} belongs to.
 * Declaration order is the order sections appear in the rendered report.
 */
public enum LedgerCategory {
    IDENTITY_ISSUE("Assets Not Found / Ambiguous"),
    MISSING_DATA("Fields Empty In Both Sources"),
    LOCAL_MUTATION("Local Updates"),
    REMOTE_MUTATION("Lansweeper Updates"),
    CONFLICT("Conflicts And Skips");

    private final String title;

    LedgerCategory(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
