package com.assetsync.domain.model;

import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * One Lansweeper asset as returned by a serial-number lookup.
 *
 * <p>{@code key} is the opaque asset key required by the edit mutation. {@code fields} holds
 * the raw {@code assetCustom} values by remote field name; absent properties map to null.
 */
@Data
@Builder
public class RemoteRecord {

    private String key;
    private String name;

    @Builder.Default
    private Map<String, Object> fields = new HashMap<>();

    public Object get(String remoteName) {
        return fields != null ? fields.get(remoteName) : null;
    }
}
