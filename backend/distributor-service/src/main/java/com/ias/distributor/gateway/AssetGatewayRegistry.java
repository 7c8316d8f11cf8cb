package com.ias.distributor.gateway;

import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves asset references to the gateway beans available in the context
 */
@Component
@Slf4j
public class AssetGatewayRegistry {

    private final Map<String, AssetTransferGateway> gateways = new LinkedHashMap<>();

    public AssetGatewayRegistry(List<AssetTransferGateway> available) {
        for (AssetTransferGateway gateway : available) {
            AssetTransferGateway previous = gateways.putIfAbsent(gateway.handle(), gateway);
            if (previous != null) {
                throw new IllegalStateException("Duplicate asset gateway handle: " + gateway.handle());
            }
        }
        log.info("Registered asset gateways: {}", gateways.keySet());
    }

    public Optional<AssetTransferGateway> find(String handle) {
        return Optional.ofNullable(handle).map(gateways::get);
    }

    public AssetTransferGateway require(String handle) {
        return find(handle)
                .orElseThrow(() -> new DistributionException(ErrorCode.ASSET_UNAVAILABLE,
                        "No asset gateway registered for reference: " + handle));
    }

    public Set<String> handles() {
        return Collections.unmodifiableSet(gateways.keySet());
    }
}
