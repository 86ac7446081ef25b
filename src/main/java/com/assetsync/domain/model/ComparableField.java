package com.assetsync.domain.model;

import com.assetsync.domain.enums.FieldType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A field reconciled between the workbook and Lansweeper.
 *
 * <p>Bound from {@code assetsync.fields[n]}. {@code localName} is the workbook column header,
 * {@code remoteName} the Lansweeper {@code assetCustom} property. {@code pattern} is an optional
 * regular expression a non-empty TEXT value must match in full; values that fail it are
 * reported as format conflicts instead of being compared.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparableField {

    @NotBlank
    private String localName;

    @NotBlank
    private String remoteName;

    @NotNull
    @Builder.Default
    private FieldType type = FieldType.TEXT;

    private String pattern;

    public static ComparableField text(String localName, String remoteName) {
        return ComparableField.builder()
                .localName(localName)
                .remoteName(remoteName)
                .type(FieldType.TEXT)
                .build();
    }

    public static ComparableField date(String localName, String remoteName) {
        return ComparableField.builder()
                .localName(localName)
                .remoteName(remoteName)
                .type(FieldType.DATE)
                .build();
    }
}
