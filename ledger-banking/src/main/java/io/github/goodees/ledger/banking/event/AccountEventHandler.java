package io.github.goodees.ledger.banking.event;

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

import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.matching.TypeSwitch;

/**
 * Callback per kind of account event. Both the account and its projections dispatch events through
 * {@link #dispatcher(AccountEventHandler)}, so they always recognize the same set of event kinds.
 */
public interface AccountEventHandler {

    void accountCreated(AccountCreatedEvent event);

    void moneyDeposited(MoneyDepositedEvent event);

    void moneyWithdrawn(MoneyWithdrawnEvent event);

    void accountClosed(AccountClosedEvent event);

    /**
     * Any event not covered by other methods.
     * @param event the event
     */
    void unknownEvent(Event event);

    static TypeSwitch dispatcher(AccountEventHandler handler) {
        return TypeSwitch.builder()
                .on(AccountCreatedEvent.class, handler::accountCreated)
                .on(MoneyDepositedEvent.class, handler::moneyDeposited)
                .on(MoneyWithdrawnEvent.class, handler::moneyWithdrawn)
                .on(AccountClosedEvent.class, handler::accountClosed)
                .otherwise((e) -> handler.unknownEvent((Event) e))
                .build();
    }
}
