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

import io.github.goodees.ledger.banking.event.AccountClosedEvent;
import io.github.goodees.ledger.banking.event.AccountCreatedEvent;
import io.github.goodees.ledger.banking.event.AccountEventHandler;
import io.github.goodees.ledger.banking.event.MoneyDepositedEvent;
import io.github.goodees.ledger.banking.event.MoneyWithdrawnEvent;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.config.EventSourcingConfig;
import io.github.goodees.ledger.core.matching.TypeSwitch;
import io.github.goodees.ledger.core.projection.Projection;

import java.math.BigDecimal;

/**
 * Summaries of all accounts, folded from the global event stream.
 */
public class AccountSummaryProjection extends Projection<AccountSummary> {

    private final TypeSwitch eventHandler = AccountEventHandler.dispatcher(new Folder());

    public AccountSummaryProjection() {
        this(EventSourcingConfig.DEFAULT_CONFIG);
    }

    public AccountSummaryProjection(EventSourcingConfig config) {
        super(config);
    }

    @Override
    protected void project(Event event) {
        eventHandler.executeMatching(event);
    }

    private static AccountSummary transaction(AccountSummary summary, Event event, BigDecimal newBalance) {
        return AccountSummary.builder().from(summary)
                .currentBalance(newBalance)
                .totalTransactions(summary.getTotalTransactions() + 1)
                .lastActivityAt(event.getTimestamp())
                .version(event.entityStateVersion())
                .build();
    }

    private class Folder implements AccountEventHandler {

        @Override
        public void accountCreated(AccountCreatedEvent event) {
            put(event.entityId(), AccountSummary.builder()
                    .accountId(event.entityId())
                    .holderName(event.getHolderName())
                    .currentBalance(event.getInitialBalance())
                    .closed(false)
                    .totalTransactions(0)
                    .createdAt(event.getTimestamp())
                    .lastActivityAt(event.getTimestamp())
                    .version(event.entityStateVersion())
                    .build());
        }

        @Override
        public void moneyDeposited(MoneyDepositedEvent event) {
            update(event.entityId(), (s) -> transaction(s, event, s.getCurrentBalance().add(event.getAmount())));
        }

        @Override
        public void moneyWithdrawn(MoneyWithdrawnEvent event) {
            update(event.entityId(), (s) -> transaction(s, event, s.getCurrentBalance().subtract(event.getAmount())));
        }

        @Override
        public void accountClosed(AccountClosedEvent event) {
            update(event.entityId(), (s) -> AccountSummary.builder().from(s)
                    .closed(true)
                    .closedAt(event.getTimestamp())
                    .lastActivityAt(event.getTimestamp())
                    .version(event.entityStateVersion())
                    .build());
        }

        @Override
        public void unknownEvent(Event event) {
            AccountSummaryProjection.this.unknownEvent(event);
        }
    }
}
