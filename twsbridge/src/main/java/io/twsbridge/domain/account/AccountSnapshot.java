package io.twsbridge.domain.account;

import io.twsbridge.domain.event.AccountValueEvent;
import io.twsbridge.domain.event.PortfolioValueEvent;

import java.util.List;
import java.util.Optional;

/**
 * One full download of an account's values and portfolio.
 *
 * @param updateTime gateway time of the last update, HH:mm, empty if none was sent
 */
public record AccountSnapshot(
    String account,
    List<AccountValueEvent> values,
    List<PortfolioValueEvent> portfolio,
    String updateTime
) {

    public AccountSnapshot {
        values = List.copyOf(values);
        portfolio = List.copyOf(portfolio);
        if (updateTime == null) {
            updateTime = "";
        }
    }

    /**
     * Latest value for a key such as NetLiquidation in one currency.
     */
    public Optional<String> value(String key, String currency) {
        String found = null;
        for (AccountValueEvent value : values) {
            if (value.key().equals(key) && value.currency().equals(currency)) {
                found = value.value();
            }
        }
        return Optional.ofNullable(found);
    }
}
