package io.github.goodees.ledger.banking.projection;

/*-
 * #%L
 * ledger-banking
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Denormalized view of single account. Transactions count deposits and withdrawals.
 */
@Value.Immutable
public interface AccountSummary {
    String getAccountId();

    String getHolderName();

    BigDecimal getCurrentBalance();

    boolean isClosed();

    int getTotalTransactions();

    Instant getCreatedAt();

    Instant getLastActivityAt();

    Optional<Instant> getClosedAt();

    /**
     * Version of the account the summary reflects.
     * @return version of last folded event
     */
    long getVersion();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAccountSummary.Builder {

    }
}
