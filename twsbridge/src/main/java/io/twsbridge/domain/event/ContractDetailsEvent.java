package io.twsbridge.domain.event;

import io.twsbridge.domain.contract.ContractDetails;

/**
 * One match for a contract details request. Ambiguous queries produce several.
 */
public record ContractDetailsEvent(long requestId, ContractDetails details) implements InboundEvent {
}
