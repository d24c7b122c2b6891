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

import io.github.goodees.ledger.banking.BankAccount;
import io.github.goodees.ledger.banking.BankAccountRepository;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.EventHeader;
import io.github.goodees.ledger.core.UnsupportedEventException;
import io.github.goodees.ledger.core.config.DefaultEventSourcingConfig;
import io.github.goodees.ledger.core.config.UnknownEventPolicy;
import io.github.goodees.ledger.core.store.EventStoreException;
import io.github.goodees.ledger.core.store.inmemory.InMemoryEventStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class AccountSummaryProjectionTest {
    private static final Instant OPENED = Instant.parse("2017-11-13T10:00:00Z");

    private InMemoryEventStore eventStore;
    private DefaultEventSourcingConfig config;
    private BankAccountRepository repository;
    private AccountSummaryProjection projection;

    @Before
    public void setUp() {
        eventStore = new InMemoryEventStore();
        config = new DefaultEventSourcingConfig();
        config.setClock(Clock.fixed(OPENED, ZoneOffset.UTC));
        repository = new BankAccountRepository(eventStore, config);
        projection = new AccountSummaryProjection(config);
    }

    private static BigDecimal amount(long value) {
        return BigDecimal.valueOf(value);
    }

    private void at(Instant instant) {
        config.setClock(Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    public void summaries_follow_account_history() throws EventStoreException {
        BankAccount alice = new BankAccount("alice", "Alice", amount(1000), config);
        BankAccount bob = new BankAccount("bob", "Bob", amount(0), config);
        at(OPENED.plusSeconds(60));
        alice.deposit(amount(500), "Salary");
        bob.deposit(amount(20), "Gift");
        at(OPENED.plusSeconds(120));
        alice.withdraw(amount(300), "Rent");
        repository.save(alice);
        repository.save(bob);

        projection.rebuild(eventStore.readAll());

        AccountSummary summary = projection.get("alice").get();
        assertEquals("alice", summary.getAccountId());
        assertEquals("Alice", summary.getHolderName());
        assertEquals(amount(1200), summary.getCurrentBalance());
        assertFalse(summary.isClosed());
        assertEquals(2, summary.getTotalTransactions());
        assertEquals(OPENED, summary.getCreatedAt());
        assertEquals(OPENED.plusSeconds(120), summary.getLastActivityAt());
        assertFalse(summary.getClosedAt().isPresent());
        assertEquals(3, summary.getVersion());

        assertEquals(amount(20), projection.get("bob").get().getCurrentBalance());
        assertEquals(1, projection.get("bob").get().getTotalTransactions());
        assertEquals(2, projection.size());
        assertThat(projection.getAll().stream().map(AccountSummary::getAccountId).collect(toList()),
            contains("alice", "bob"));
        assertFalse(projection.get("carol").isPresent());
    }

    @Test
    public void summary_balances_match_replayed_accounts() throws EventStoreException {
        for (int i = 0; i < 5; i++) {
            BankAccount account = new BankAccount("acc-" + i, "Holder " + i, amount(100 * i), config);
            for (int j = 0; j <= i; j++) {
                account.deposit(amount(j + 1), "deposit");
            }
            if (i % 2 == 1) {
                account.withdraw(amount(i), "withdrawal");
            }
            repository.save(account);
        }

        projection.rebuild(eventStore.readAll());
        for (String id : eventStore.streamIds()) {
            BankAccount account = repository.load(id).get();
            AccountSummary summary = projection.get(id).get();
            assertEquals(0, account.getBalance().compareTo(summary.getCurrentBalance()));
            assertEquals(account.getStateVersion(), summary.getVersion());
            assertEquals(account.getStateVersion() - 1, summary.getTotalTransactions());
        }
    }

    @Test
    public void closing_is_not_counted_as_transaction() throws EventStoreException {
        BankAccount account = new BankAccount("acc", "Alice", amount(10), config);
        account.withdraw(amount(10), "all");
        Instant closedAt = OPENED.plusSeconds(3600);
        at(closedAt);
        account.close("done");
        repository.save(account);

        projection.rebuild(eventStore.readAll());
        AccountSummary summary = projection.get("acc").get();
        assertTrue(summary.isClosed());
        assertEquals(closedAt, summary.getClosedAt().get());
        assertEquals(closedAt, summary.getLastActivityAt());
        assertEquals(1, summary.getTotalTransactions());
        assertEquals(0, summary.getCurrentBalance().signum());
    }

    @Test
    public void rebuild_discards_previous_views() throws EventStoreException {
        repository.save(new BankAccount("acc", "Alice", amount(10), config));
        projection.rebuild(eventStore.readAll());
        assertEquals(1, projection.size());

        projection.rebuild(Collections.<Event>emptyList());
        assertEquals(0, projection.size());
        assertTrue(projection.getAll().isEmpty());
    }

    @Test
    public void rebuild_twice_gives_same_views() throws EventStoreException {
        BankAccount account = new BankAccount("acc", "Alice", amount(10), config);
        account.deposit(amount(5), "tip");
        repository.save(account);

        projection.rebuild(eventStore.readAll());
        AccountSummary first = projection.get("acc").get();
        projection.rebuild(eventStore.readAll());
        assertEquals(first, projection.get("acc").get());
    }

    @Test
    public void events_without_creation_are_skipped() throws EventStoreException {
        BankAccount account = new BankAccount("acc", "Alice", amount(10), config);
        account.deposit(amount(5), "tip");
        List<Event> tail = new ArrayList<>(account.getUncommittedEvents().subList(1, 2));
        projection.rebuild(tail);
        assertEquals(0, projection.size());
    }

    @Test
    public void unknown_events_are_ignored_by_default() {
        projection.rebuild(Collections.singletonList(new EventHeader("acc", 1, OPENED)));
        assertEquals(0, projection.size());
    }

    @Test(expected = UnsupportedEventException.class)
    public void unknown_events_can_be_rejected() {
        config.setUnknownEventPolicy(UnknownEventPolicy.REJECT);
        projection.rebuild(Collections.singletonList(new EventHeader("acc", 1, OPENED)));
    }
}
