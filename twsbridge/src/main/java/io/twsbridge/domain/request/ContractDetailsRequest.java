package io.twsbridge.domain.request;

import io.twsbridge.domain.contract.Contract;

public record ContractDetailsRequest(long requestId, Contract contract) implements ClientRequest {

    public ContractDetailsRequest {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
    }
}
