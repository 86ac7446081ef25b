package com.assetsync.remote;

import com.assetsync.domain.model.SerialMatches;
import com.assetsync.domain.model.UpdateBatch;

/**
 * Remote asset-management service. Every component that reads or writes remote assets goes
 * through {@link com.assetsync.dispatch.UpdateDispatcher}, which is the only caller of this
 * interface, so that each request is counted.
 */
public interface AssetServiceGateway {

    /**
     * Finds assets by serial number. Returns enough records to tell one match from several,
     * not necessarily every match, together with the total the service reports.
     *
     * @throws com.assetsync.exception.RemoteServiceException on transport failure or a
     *     service-reported error
     */
    SerialMatches findBySerial(String serialNumber);

    /**
     * Applies the staged fields to one asset. Only changed fields are sent.
     *
     * @throws com.assetsync.exception.RemoteServiceException on transport failure or a
     *     service-reported error
     */
    void updateAsset(String assetKey, UpdateBatch batch);
}
