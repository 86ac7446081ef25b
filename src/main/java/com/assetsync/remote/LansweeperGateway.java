package com.assetsync.remote;

import com.assetsync.config.AssetSyncProperties;
import com.assetsync.config.LansweeperConfig;
import com.assetsync.domain.enums.FieldType;
import com.assetsync.domain.model.ComparableField;
import com.assetsync.domain.model.RemoteRecord;
import com.assetsync.domain.model.SerialMatches;
import com.assetsync.domain.model.UpdateBatch;
import com.assetsync.exception.RemoteServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Lansweeper GraphQL implementation of {@link AssetServiceGateway}.
 *
 * <p>Lookups filter {@code assetResources} on {@code assetCustom.serialNumber} with a page size
 * of 2: one more than needed, so a duplicated serial number shows up as two items. The
 * reported {@code total} is kept as well, so more matches than returned items still count as
 * ambiguous. The requested field list is built from the configured comparable fields.
 *
 * <p>Updates go through {@code editAsset}. Lansweeper expects dates as
 * {@code {"value": "<UTC timestamp>"}} objects and text as plain strings.
 *
 * <p>HTTP and I/O errors become {@code TRANSPORT_FAILURE}; a GraphQL {@code errors} array or a
 * response without the expected shape becomes {@code SERVICE_REJECTED}.
 */
@Component
public class LansweeperGateway implements AssetServiceGateway {

    private static final Logger log = LoggerFactory.getLogger(LansweeperGateway.class);

    static final int LOOKUP_PAGE_SIZE = 2;

    static final String FIND_BY_SERIAL_QUERY = """
            query GetAssetBySerial($siteId: ID!, $serialNumber: String!, $limit: Int!, $fields: [String!]!) {
                site(id: $siteId) {
                    assetResources(
                        assetPagination: { limit: $limit }
                        filters: {
                            conditions: [{
                                path: "assetCustom.serialNumber"
                                operator: EQUAL
                                value: $serialNumber
                            }]
                        }
                        fields: $fields
                    ) {
                        total
                        items
                    }
                }
            }
            """;

    static final String EDIT_ASSET_MUTATION = """
            mutation EditAsset($siteId: ID!, $key: ID!, $customFields: AssetCustomInput!) {
                site(id: $siteId) {
                    editAsset(
                        key: $key
                        fields: {
                            assetCustom: $customFields
                        }
                    ) {
                        key
                    }
                }
            }
            """;

    private final RestClient lansweeperRestClient;
    private final LansweeperConfig lansweeperConfig;
    private final List<ComparableField> fields;

    public LansweeperGateway(
            RestClient lansweeperRestClient,
            LansweeperConfig lansweeperConfig,
            AssetSyncProperties assetSyncProperties) {
        this.lansweeperRestClient = lansweeperRestClient;
        this.lansweeperConfig = lansweeperConfig;
        this.fields = List.copyOf(assetSyncProperties.getFields());
    }

    @Override
    public SerialMatches findBySerial(String serialNumber) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("siteId", lansweeperConfig.getSiteId());
        variables.put("serialNumber", serialNumber);
        variables.put("limit", LOOKUP_PAGE_SIZE);
        variables.put("fields", requestedFields());

        JsonNode data = execute(FIND_BY_SERIAL_QUERY, variables, "lookup of serial " + serialNumber);
        JsonNode assetResources = data.path("site").path("assetResources");
        JsonNode items = assetResources.path("items");
        if (!items.isArray()) {
            throw RemoteServiceException.rejected("Unexpected response structure for serial " + serialNumber);
        }

        List<RemoteRecord> records = new ArrayList<>();
        for (JsonNode item : items) {
            records.add(toRemoteRecord(item, serialNumber));
        }
        int total = assetResources.path("total").asInt(records.size());
        if (records.isEmpty() && total > 0) {
            throw RemoteServiceException.rejected(
                    "Serial " + serialNumber + " reports " + total + " matches but no items were returned");
        }
        if (total > records.size()) {
            log.debug("Serial {} matches {} assets, {} returned", serialNumber, total, records.size());
        }
        return SerialMatches.of(records, total);
    }

    @Override
    public void updateAsset(String assetKey, UpdateBatch batch) {
        Map<String, Object> customFields = new LinkedHashMap<>();
        batch.getUpdates().forEach((remoteName, staged) -> customFields.put(
                remoteName, staged.type() == FieldType.DATE ? Map.of("value", staged.value()) : staged.value()));

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("siteId", lansweeperConfig.getSiteId());
        variables.put("key", assetKey);
        variables.put("customFields", customFields);

        JsonNode data = execute(EDIT_ASSET_MUTATION, variables, "update of asset " + assetKey);
        if (data.path("site").path("editAsset").isMissingNode() || data.path("site").path("editAsset").isNull()) {
            throw RemoteServiceException.rejected("Update of asset " + assetKey + " returned no result");
        }
    }

    List<String> requestedFields() {
        List<String> requested = new ArrayList<>(List.of("key", "assetBasicInfo.name", "assetCustom.serialNumber"));
        for (ComparableField field : fields) {
            requested.add("assetCustom." + field.getRemoteName());
        }
        return requested;
    }

    private JsonNode execute(String document, Map<String, Object> variables, String description) {
        JsonNode response;
        try {
            response = lansweeperRestClient.post()
                    .body(Map.of("query", document, "variables", variables))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw RemoteServiceException.transport("Request failed for " + description + ": " + e.getMessage(), e);
        }

        if (response == null) {
            throw RemoteServiceException.rejected("Empty response for " + description);
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw RemoteServiceException.rejected("GraphQL errors for " + description + ": " + errors);
        }
        JsonNode data = response.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw RemoteServiceException.rejected("Response without data for " + description);
        }
        return data;
    }

    private RemoteRecord toRemoteRecord(JsonNode item, String serialNumber) {
        String key = item.path("key").asText(null);
        if (key == null || key.isBlank()) {
            throw RemoteServiceException.rejected("Asset without key returned for serial " + serialNumber);
        }
        JsonNode assetCustom = item.path("assetCustom");
        Map<String, Object> values = new HashMap<>();
        for (ComparableField field : fields) {
            values.put(field.getRemoteName(), toRawValue(assetCustom.path(field.getRemoteName())));
        }
        return RemoteRecord.builder()
                .key(key)
                .name(item.path("assetBasicInfo").path("name").asText(null))
                .fields(values)
                .build();
    }

    /** Scalars become String/Number/Boolean; objects and arrays stay JsonNode and normalize as invalid. */
    private static Object toRawValue(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node;
    }
}
