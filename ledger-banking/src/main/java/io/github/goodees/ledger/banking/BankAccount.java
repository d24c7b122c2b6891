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

import io.github.goodees.ledger.banking.event.AccountClosedEvent;
import io.github.goodees.ledger.banking.event.AccountCreatedEvent;
import io.github.goodees.ledger.banking.event.AccountEventHandler;
import io.github.goodees.ledger.banking.event.MoneyDepositedEvent;
import io.github.goodees.ledger.banking.event.MoneyWithdrawnEvent;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.EventSourcedEntity;
import io.github.goodees.ledger.core.InvalidStateException;
import io.github.goodees.ledger.core.ValidationException;
import io.github.goodees.ledger.core.config.EventSourcingConfig;
import io.github.goodees.ledger.core.matching.TypeSwitch;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;

/**
 * Bank account, the usual event sourced aggregate.
 *
 * <p>An account is open after creation, money can be deposited to it and withdrawn from it as long as the balance
 * stays non-negative. An account with zero balance can be closed, and a closed account accepts no more commands.</p>
 *
 * <p>Every command validates its input and the state first, and then emits exactly one event. Commands that fail
 * leave the account unchanged.</p>
 */
public class BankAccount extends EventSourcedEntity {

    enum AccountStatus {
        OPEN, CLOSED
    }

    private final TypeSwitch eventHandler = AccountEventHandler.dispatcher(new State());
    private String holderName;
    private BigDecimal balance = BigDecimal.ZERO;
    private AccountStatus status = AccountStatus.OPEN;

    /**
     * Open new account.
     * @param id identity of the account
     * @param holderName name of the account holder, not blank
     * @param initialBalance non-negative opening balance
     * @throws ValidationException when name is blank or initial balance is negative
     */
    public BankAccount(String id, String holderName, BigDecimal initialBalance) {
        this(id, holderName, initialBalance, EventSourcingConfig.DEFAULT_CONFIG);
    }

    public BankAccount(String id, String holderName, BigDecimal initialBalance, EventSourcingConfig config) {
        super(id, config);
        if (holderName == null || holderName.trim().isEmpty()) {
            throw new ValidationException("Account holder name is required");
        }
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new ValidationException("Initial balance cannot be negative");
        }
        emit(AccountCreatedEvent.builder(this)
                .holderName(holderName)
                .initialBalance(initialBalance)
                .build());
    }

    /**
     * Empty account to be replayed.
     */
    BankAccount(String id, EventSourcingConfig config) {
        super(id, config);
    }

    /**
     * Reconstruct an account from its history, without validating it.
     * @param history events of single account, ordered by version
     * @return the account in the state after last event
     * @throws IllegalArgumentException when history is empty
     */
    public static BankAccount fromHistory(List<? extends Event> history) {
        return fromHistory(history, EventSourcingConfig.DEFAULT_CONFIG);
    }

    public static BankAccount fromHistory(List<? extends Event> history, EventSourcingConfig config) {
        Iterator<? extends Event> it = history.iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException("Cannot replay an account without any event");
        }
        BankAccount account = new BankAccount(it.next().entityId(), config);
        account.replay(history);
        return account;
    }

    /**
     * Deposit money.
     * @param amount positive amount
     * @param description description of the transaction, may be null
     * @throws InvalidStateException when the account is closed
     * @throws ValidationException when amount is not positive
     */
    public void deposit(BigDecimal amount, String description) {
        if (isClosed()) {
            throw new InvalidStateException("Cannot deposit into a closed account");
        }
        requirePositive(amount, "Deposit");
        emit(MoneyDepositedEvent.builder(this)
                .amount(amount)
                .description(nullToEmpty(description))
                .build());
    }

    /**
     * Withdraw money.
     * @param amount positive amount, not higher than current balance
     * @param description description of the transaction, may be null
     * @throws InvalidStateException when the account is closed
     * @throws ValidationException when amount is not positive
     * @throws InsufficientFundsException when amount exceeds the balance
     */
    public void withdraw(BigDecimal amount, String description) {
        if (isClosed()) {
            throw new InvalidStateException("Cannot withdraw from a closed account");
        }
        requirePositive(amount, "Withdrawal");
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientFundsException(getIdentity(), balance, amount);
        }
        emit(MoneyWithdrawnEvent.builder(this)
                .amount(amount)
                .description(nullToEmpty(description))
                .build());
    }

    /**
     * Close the account.
     * @param reason reason of closing, may be null
     * @throws InvalidStateException when the account is already closed or its balance is not zero
     */
    public void close(String reason) {
        if (isClosed()) {
            throw new InvalidStateException("Account is already closed");
        }
        if (balance.signum() != 0) {
            throw new InvalidStateException("Cannot close account with non-zero balance " + balance);
        }
        emit(AccountClosedEvent.builder(this).reason(nullToEmpty(reason)).build());
    }

    private static void requirePositive(BigDecimal amount, String operation) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(operation + " amount must be positive");
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getHolderName() {
        return holderName;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public boolean isClosed() {
        return status == AccountStatus.CLOSED;
    }

    @Override
    protected void updateState(Event event) {
        eventHandler.executeMatching(event);
    }

    @Override
    public String toString() {
        return "BankAccount{" + "id=" + getIdentity() + ", holderName=" + holderName + ", balance=" + balance
                + ", status=" + status + ", version=" + getStateVersion() + '}';
    }

    private class State implements AccountEventHandler {

        @Override
        public void accountCreated(AccountCreatedEvent event) {
            holderName = event.getHolderName();
            balance = event.getInitialBalance();
        }

        @Override
        public void moneyDeposited(MoneyDepositedEvent event) {
            balance = balance.add(event.getAmount());
        }

        @Override
        public void moneyWithdrawn(MoneyWithdrawnEvent event) {
            balance = balance.subtract(event.getAmount());
        }

        @Override
        public void accountClosed(AccountClosedEvent event) {
            status = AccountStatus.CLOSED;
        }

        @Override
        public void unknownEvent(Event event) {
            BankAccount.this.unknownEvent(event);
        }
    }
}
