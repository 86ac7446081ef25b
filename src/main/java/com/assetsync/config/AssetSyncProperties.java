package com.assetsync.config;

import com.assetsync.domain.enums.ConflictMode;
import com.assetsync.domain.enums.Direction;
import com.assetsync.domain.enums.GateMode;
import com.assetsync.domain.model.ComparableField;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Reconciliation settings bound from the {@code assetsync.*} prefix.
 *
 * <p>The default field set matches the asset register layout: barcode, invoice (purchase)
 * date and extended warranty date. Setting any {@code assetsync.fields[n]} replaces the
 * whole list.
 */
@Configuration
@ConfigurationProperties(prefix = "assetsync")
@Validated
@Getter
@Setter
public class AssetSyncProperties {

    /** Workbook to reconcile. */
    @NotBlank
    private String datasetPath = "assets.xlsx";

    /** Text report the run appends to. */
    @NotBlank
    private String reportFile = "discrepancies.txt";

    /** Column holding the serial number. */
    @NotBlank
    private String identityColumn = "Serial Number";

    @Valid
    @NotEmpty
    private List<ComparableField> fields = new ArrayList<>(List.of(
            ComparableField.text("Barcode Number", "barCode"),
            ComparableField.date("Invoice Date", "purchaseDate"),
            ComparableField.date("Extended Warranty", "warrantyDate")));

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Conflict conflict = new Conflict();

    @Getter
    @Setter
    public static class Dispatch {

        /** The continuation gate is presented every this many remote requests. */
        @Min(1)
        private int gateThreshold = 150;

        private GateMode gateMode = GateMode.INTERACTIVE;
    }

    @Getter
    @Setter
    public static class Conflict {

        private ConflictMode mode = ConflictMode.SKIP;

        /** Used by POLICY mode for fields without an entry in {@link #policy}. */
        private Direction defaultDirection = Direction.SKIP;

        /** POLICY mode directions keyed by remote field name, e.g. {@code policy.barCode=ADOPT_LOCAL}. */
        private Map<String, Direction> policy = new HashMap<>();
    }
}
