package io.github.goodees.ledger.banking;

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

import io.github.goodees.ledger.core.EventSourcedRepository;
import io.github.goodees.ledger.core.config.EventSourcingConfig;
import io.github.goodees.ledger.core.store.EventStore;

import java.util.Objects;

/**
 * Repository of bank accounts.
 */
public class BankAccountRepository extends EventSourcedRepository<BankAccount> {
    private final EventSourcingConfig config;

    public BankAccountRepository(EventStore eventStore) {
        this(eventStore, EventSourcingConfig.DEFAULT_CONFIG);
    }

    public BankAccountRepository(EventStore eventStore, EventSourcingConfig config) {
        super(eventStore);
        this.config = Objects.requireNonNull(config);
    }

    @Override
    protected BankAccount instantiate(String entityId) {
        return new BankAccount(entityId, config);
    }
}
