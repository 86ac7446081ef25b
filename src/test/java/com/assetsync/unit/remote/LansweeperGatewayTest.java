package com.assetsync.unit.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.assetsync.config.AssetSyncProperties;
import com.assetsync.config.LansweeperConfig;
import com.assetsync.domain.enums.FieldType;
import com.assetsync.domain.model.RemoteRecord;
import com.assetsync.domain.model.SerialMatches;
import com.assetsync.domain.model.UpdateBatch;
import com.assetsync.exception.ErrorCode;
import com.assetsync.exception.RemoteServiceException;
import com.assetsync.remote.LansweeperGateway;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Tests for LansweeperGateway against a mock GraphQL endpoint: request shape, response mapping
 * and error classification.
 */
class LansweeperGatewayTest {

    private static final String API_URL = "https://lansweeper.test/api/v2/graphql";

    private MockRestServiceServer server;
    private LansweeperGateway lansweeperGateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(API_URL);
        server = MockRestServiceServer.bindTo(builder).build();

        LansweeperConfig lansweeperConfig = new LansweeperConfig();
        lansweeperConfig.setSiteId("site-1");
        lansweeperConfig.setToken("secret");

        lansweeperGateway = new LansweeperGateway(builder.build(), lansweeperConfig, new AssetSyncProperties());
    }

    @Nested
    @DisplayName("Lookup by serial")
    class FindBySerial {

        @Test
        @DisplayName("Sends the serial filter with a page size of two and the configured fields")
        void requestShape() {
            server.expect(requestTo(API_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.variables.siteId").value("site-1"))
                    .andExpect(jsonPath("$.variables.serialNumber").value("SN1"))
                    .andExpect(jsonPath("$.variables.limit").value(2))
                    .andExpect(jsonPath("$.variables.fields[0]").value("key"))
                    .andExpect(jsonPath("$.variables.fields[3]").value("assetCustom.barCode"))
                    .andExpect(jsonPath("$.variables.fields[4]").value("assetCustom.purchaseDate"))
                    .andExpect(jsonPath("$.variables.fields[5]").value("assetCustom.warrantyDate"))
                    .andRespond(withSuccess(
                            "{\"data\":{\"site\":{\"assetResources\":{\"total\":0,\"items\":[]}}}}",
                            MediaType.APPLICATION_JSON));

            assertThat(lansweeperGateway.findBySerial("SN1").isEmpty()).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("Maps key, name and assetCustom values, absent fields become null")
        void mapsRecord() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess("""
                            {"data":{"site":{"assetResources":{"total":1,"items":[{
                              "key":"asset-key-1",
                              "assetBasicInfo":{"name":"LAPTOP-1"},
                              "assetCustom":{"serialNumber":"SN1","barCode":"BC124",
                                             "purchaseDate":"2024-11-08T00:00:00Z","warrantyDate":null}
                            }]}}}}
                            """, MediaType.APPLICATION_JSON));

            List<RemoteRecord> records = lansweeperGateway.findBySerial("SN1").getRecords();

            assertThat(records).hasSize(1);
            RemoteRecord record = records.get(0);
            assertThat(record.getKey()).isEqualTo("asset-key-1");
            assertThat(record.getName()).isEqualTo("LAPTOP-1");
            assertThat(record.get("barCode")).isEqualTo("BC124");
            assertThat(record.get("purchaseDate")).isEqualTo("2024-11-08T00:00:00Z");
            assertThat(record.get("warrantyDate")).isNull();
        }

        @Test
        @DisplayName("Two items are returned as two records with the reported total")
        void duplicates() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess("""
                            {"data":{"site":{"assetResources":{"total":3,"items":[
                              {"key":"a","assetCustom":{}},
                              {"key":"b","assetCustom":{}}
                            ]}}}}
                            """, MediaType.APPLICATION_JSON));

            SerialMatches matches = lansweeperGateway.findBySerial("SN1");

            assertThat(matches.getRecords()).extracting(RemoteRecord::getKey).containsExactly("a", "b");
            assertThat(matches.getTotal()).isEqualTo(3);
        }

        @Test
        @DisplayName("A total above the returned items is not unique")
        void totalAboveItems() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess("""
                            {"data":{"site":{"assetResources":{"total":2,"items":[
                              {"key":"a","assetCustom":{}}
                            ]}}}}
                            """, MediaType.APPLICATION_JSON));

            SerialMatches matches = lansweeperGateway.findBySerial("SN1");

            assertThat(matches.getRecords()).hasSize(1);
            assertThat(matches.getTotal()).isEqualTo(2);
            assertThat(matches.isUnique()).isFalse();
        }

        @Test
        @DisplayName("A positive total without items is rejected")
        void totalWithoutItems() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess(
                            "{\"data\":{\"site\":{\"assetResources\":{\"total\":1,\"items\":[]}}}}",
                            MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> lansweeperGateway.findBySerial("SN1"))
                    .isInstanceOf(RemoteServiceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SERVICE_REJECTED);
        }

        @Test
        @DisplayName("GraphQL errors are SERVICE_REJECTED")
        void graphQlErrors() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess(
                            "{\"errors\":[{\"message\":\"Site not found\"}]}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> lansweeperGateway.findBySerial("SN1"))
                    .isInstanceOf(RemoteServiceException.class)
                    .hasMessageContaining("Site not found")
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SERVICE_REJECTED);
        }

        @Test
        @DisplayName("HTTP errors are TRANSPORT_FAILURE")
        void httpError() {
            server.expect(requestTo(API_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> lansweeperGateway.findBySerial("SN1"))
                    .isInstanceOf(RemoteServiceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TRANSPORT_FAILURE);
        }

        @Test
        @DisplayName("An item without a key is rejected")
        void missingKey() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess(
                            "{\"data\":{\"site\":{\"assetResources\":{\"items\":[{\"assetCustom\":{}}]}}}}",
                            MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> lansweeperGateway.findBySerial("SN1"))
                    .isInstanceOf(RemoteServiceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SERVICE_REJECTED);
        }
    }

    @Nested
    @DisplayName("Asset update")
    class UpdateAsset {

        @Test
        @DisplayName("Dates are wrapped in a value object, text is sent plain")
        void requestShape() {
            server.expect(requestTo(API_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.query").value(containsString("editAsset")))
                    .andExpect(jsonPath("$.variables.key").value("asset-key-1"))
                    .andExpect(jsonPath("$.variables.customFields.barCode").value("BC123"))
                    .andExpect(jsonPath("$.variables.customFields.purchaseDate.value").value("2024-11-08T00:00:00Z"))
                    .andRespond(withSuccess(
                            "{\"data\":{\"site\":{\"editAsset\":{\"key\":\"asset-key-1\"}}}}",
                            MediaType.APPLICATION_JSON));

            UpdateBatch batch = new UpdateBatch();
            batch.stage("barCode", FieldType.TEXT, "BC123");
            batch.stage("purchaseDate", FieldType.DATE, "2024-11-08T00:00:00Z");

            lansweeperGateway.updateAsset("asset-key-1", batch);
            server.verify();
        }

        @Test
        @DisplayName("A null editAsset result is rejected")
        void nullResult() {
            server.expect(requestTo(API_URL))
                    .andRespond(withSuccess(
                            "{\"data\":{\"site\":{\"editAsset\":null}}}", MediaType.APPLICATION_JSON));

            UpdateBatch batch = new UpdateBatch();
            batch.stage("barCode", FieldType.TEXT, "BC123");

            assertThatThrownBy(() -> lansweeperGateway.updateAsset("asset-key-1", batch))
                    .isInstanceOf(RemoteServiceException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SERVICE_REJECTED);
        }
    }
}
