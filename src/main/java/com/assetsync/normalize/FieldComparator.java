package com.assetsync.normalize;

import com.assetsync.domain.enums.FieldType;
import com.assetsync.domain.vo.FieldValue;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Equality between a normalized workbook value and a normalized Lansweeper value.
 *
 * <p>INVALID counts as empty here. Empty vs non-empty is unequal but is not a conflict:
 * the engine routes it to gap-filling.
 */
@Component
public class FieldComparator {

    public boolean equal(FieldValue local, FieldValue remote, FieldType type) {
        boolean localBlank = local.isBlankForComparison();
        boolean remoteBlank = remote.isBlankForComparison();
        if (localBlank || remoteBlank) {
            return localBlank && remoteBlank;
        }
        return switch (type) {
            case DATE -> Objects.equals(local.getDate(), remote.getDate());
            case TEXT -> Objects.equals(textOf(local), textOf(remote));
        };
    }

    private static String textOf(FieldValue value) {
        if (value.getText() != null) {
            return value.getText();
        }
        return value.getDate() != null ? value.getDate().toString() : null;
    }
}
