package com.flagship.split_escrow.payment.psp;

import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up gateways by provider name.
 */
@Component
public class PspGatewayRegistry {

    private final Map<String, PspGateway> gateways;
    private final String defaultProvider;

    public PspGatewayRegistry(List<PspGateway> gateways,
                              @Value("${psp.default-provider:sandbox}") String defaultProvider) {
        this.gateways = gateways.stream()
                .collect(Collectors.toUnmodifiableMap(PspGateway::providerName, Function.identity()));
        this.defaultProvider = defaultProvider;
    }

    public PspGateway get(String provider) {
        PspGateway gateway = gateways.get(provider);
        if (gateway == null) {
            throw new NotFoundException(ErrorCode.PROVIDER_NOT_FOUND, "Unknown payment provider: " + provider);
        }
        return gateway;
    }

    public PspGateway getDefault() {
        return get(defaultProvider);
    }

    public Set<String> providers() {
        return gateways.keySet();
    }
}
