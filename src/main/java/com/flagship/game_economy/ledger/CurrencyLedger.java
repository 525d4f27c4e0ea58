package com.flagship.game_economy.ledger;

import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.event.BalanceChangedEvent;
import com.flagship.game_economy.event.CurrencyEarnedEvent;
import com.flagship.game_economy.event.CurrencyExchangedEvent;
import com.flagship.game_economy.event.CurrencySpentEvent;
import com.flagship.game_economy.event.EconomyEvent;
import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns every player's balances and executes earn, spend and exchange.
 *
 * This service enforces the core invariants:
 * 1. A balance never leaves its currency's {@code [minAmount, maxAmount]} band
 * 2. Every balance mutation appends exactly one {@link Transaction} whose
 *    {@code balanceAfter} equals the new balance
 * 3. A failed exchange leaves balances as if it never started, through an
 *    explicit compensating refund
 *
 * All mutations for one player are serialized on that player's wallet lock.
 * Change events are appended to the {@link EconomyEventBus} while the lock is
 * still held, so a player's events are queued in the order they happened.
 *
 * Inside {@link #atomically} change events and flow entries are held back and
 * only released when the whole operation succeeds.
 */
@Service
@Slf4j
public class CurrencyLedger {

    static final String EXCHANGE_REFUND_TAG = "exchange_refund";
    static final String REFUND_TAG_PREFIX = "refund_";

    private final ConcurrentHashMap<String, PlayerWallet> wallets = new ConcurrentHashMap<>();
    private final CurrencyRegistry registry;
    private final ExchangeRateBook rates;
    private final CurrencyFlowLog flowLog;
    private final EconomyEventBus eventBus;
    private final EconomyMetrics metrics;
    private final Clock clock;
    private final int historyCapacity;
    private final ThreadLocal<PendingEffects> pending = new ThreadLocal<>();

    public CurrencyLedger(CurrencyRegistry registry,
                          ExchangeRateBook rates,
                          CurrencyFlowLog flowLog,
                          EconomyEventBus eventBus,
                          EconomyMetrics metrics,
                          Clock clock,
                          EconomyProperties properties) {
        this.registry = registry;
        this.rates = rates;
        this.flowLog = flowLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.historyCapacity = properties.getLedger().getHistoryCapacity();
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("economy.ledger.history-capacity must be positive");
        }
    }

    // ==================== Reads ====================

    /**
     * Current balance. Unknown currencies read as 0; a currency the player never
     * touched reads as its minimum.
     */
    public long getBalance(String playerId, String currencyId) {
        requireId(playerId, "playerId");
        Optional<Currency> currency = registry.find(currencyId);
        if (currency.isEmpty()) {
            return 0L;
        }
        PlayerWallet wallet = wallets.get(playerId);
        if (wallet == null) {
            return currency.get().getMinAmount();
        }
        wallet.lock().lock();
        try {
            return wallet.balance(currencyId, currency.get().getMinAmount());
        } finally {
            wallet.lock().unlock();
        }
    }

    /**
     * Balances for every registered currency, in catalog order.
     */
    public Map<String, Long> balances(String playerId) {
        requireId(playerId, "playerId");
        Map<String, Long> result = new LinkedHashMap<>();
        PlayerWallet wallet = wallets.get(playerId);
        if (wallet != null) {
            wallet.lock().lock();
        }
        try {
            for (Currency currency : registry.all()) {
                long balance = wallet == null ? currency.getMinAmount()
                    : wallet.balance(currency.getId(), currency.getMinAmount());
                result.put(currency.getId(), balance);
            }
        } finally {
            if (wallet != null) {
                wallet.lock().unlock();
            }
        }
        return result;
    }

    public boolean canAfford(String playerId, String currencyId, long amount) {
        if (!registry.contains(currencyId) || amount < 0) {
            return false;
        }
        long balance = getBalance(playerId, currencyId);
        long min = registry.find(currencyId).map(Currency::getMinAmount).orElse(0L);
        return balance >= amount && balance - amount >= min;
    }

    /**
     * Converted amount an exchange would credit right now, or 0 when the pair
     * cannot be exchanged.
     */
    public long quoteExchange(String fromId, String toId, long amount) {
        if (amount <= 0) {
            return 0L;
        }
        return usableRate(fromId, toId)
            .map(rate -> Math.round(amount * rate.getRate()))
            .orElse(0L);
    }

    public boolean canExchange(String playerId, String fromId, String toId, long amount) {
        return quoteExchange(fromId, toId, amount) > 0 && canAfford(playerId, fromId, amount);
    }

    /**
     * Current directional rate, or 0 when the pair is not listed.
     */
    public double getExchangeRate(String fromId, String toId) {
        return rates.rateOf(fromId, toId);
    }

    public List<Currency> tradeableCurrencies() {
        return registry.tradeable();
    }

    /**
     * Retained transactions for one player and currency, oldest first.
     */
    public List<Transaction> history(String playerId, String currencyId, int limit) {
        requireId(playerId, "playerId");
        PlayerWallet wallet = wallets.get(playerId);
        if (wallet == null || !registry.contains(currencyId)) {
            return List.of();
        }
        wallet.lock().lock();
        try {
            return wallet.history(currencyId).recent(limit);
        } finally {
            wallet.lock().unlock();
        }
    }

    public long totalEarned(String playerId, String currencyId) {
        return readWallet(playerId, wallet -> wallet.totalEarned(currencyId), 0L);
    }

    public long totalSpent(String playerId, String currencyId) {
        return readWallet(playerId, wallet -> wallet.totalSpent(currencyId), 0L);
    }

    public Set<String> playerIds() {
        return Set.copyOf(wallets.keySet());
    }

    // ==================== Mutations ====================

    /**
     * Credits a currency. The new balance is {@code min(old + amount, max)}; any
     * excess above the ceiling is discarded.
     *
     * @return the new balance
     */
    public EconomyResult<Long> earn(String playerId, String currencyId, long amount, String source) {
        requireId(playerId, "playerId");
        Optional<Currency> found = registry.find(currencyId);
        if (found.isEmpty()) {
            return reject("earn", currencyId, EconomyResult.rejected(EconomyError.CURRENCY_UNKNOWN,
                "Currency %s is not registered", currencyId));
        }
        if (amount <= 0) {
            return reject("earn", currencyId, EconomyResult.rejected(EconomyError.INVALID_AMOUNT,
                "Earn amount must be positive: %d", amount));
        }
        Currency currency = found.get();
        String tag = tagOrDefault(source, "unspecified");

        EconomyResult<Long> result = mutate(playerId, (wallet, events) -> {
            Transaction credited = credit(wallet, currency, amount, TransactionType.EARN, tag, false, events);
            if (credited == null) {
                return EconomyResult.rejected(EconomyError.BALANCE_AT_MAXIMUM,
                    "%s balance already at maximum %d", currencyId, currency.getMaxAmount());
            }
            wallet.addEarned(currencyId, credited.getAmount());
            events.add(CurrencyEarnedEvent.of(playerId, currencyId, credited.getAmount(), tag,
                currency.isHardCurrency(), credited.getTimestamp()));
            if (credited.getAmount() < amount) {
                log.debug("Earn of {} {} clamped at ceiling, {} discarded", amount, currencyId,
                    amount - credited.getAmount());
            }
            return EconomyResult.ok(credited.getBalanceAfter());
        });
        return record("earn", currencyId, result);
    }

    /**
     * Debits a currency. Never leaves the balance below the currency minimum.
     *
     * @return the new balance
     */
    public EconomyResult<Long> spend(String playerId, String currencyId, long amount, String reason) {
        requireId(playerId, "playerId");
        Optional<Currency> found = registry.find(currencyId);
        if (found.isEmpty()) {
            return reject("spend", currencyId, EconomyResult.rejected(EconomyError.CURRENCY_UNKNOWN,
                "Currency %s is not registered", currencyId));
        }
        if (amount <= 0) {
            return reject("spend", currencyId, EconomyResult.rejected(EconomyError.INVALID_AMOUNT,
                "Spend amount must be positive: %d", amount));
        }
        Currency currency = found.get();
        String tag = tagOrDefault(reason, "unspecified");

        EconomyResult<Long> result = mutate(playerId, (wallet, events) -> {
            Transaction debited = debit(wallet, currency, amount, TransactionType.SPEND, tag, events);
            if (debited == null) {
                return EconomyResult.rejected(EconomyError.INSUFFICIENT_FUNDS,
                    "Need %d %s, have %d", amount, currencyId,
                    wallet.balance(currencyId, currency.getMinAmount()));
            }
            wallet.addSpent(currencyId, amount);
            events.add(CurrencySpentEvent.of(playerId, currencyId, amount, tag,
                currency.isHardCurrency(), debited.getTimestamp()));
            return EconomyResult.ok(debited.getBalanceAfter());
        });
        return record("spend", currencyId, result);
    }

    /**
     * Converts {@code amount} of one currency into another at the current directional rate.
     *
     * The source is debited first; if the converted amount rounds to zero or the
     * target cannot be credited, the debit is refunded with a compensating
     * transaction before the rejection is returned.
     *
     * @return the converted amount credited to the target currency
     */
    public EconomyResult<Long> exchange(String playerId, String fromId, String toId, long amount) {
        requireId(playerId, "playerId");
        if (amount <= 0) {
            return reject("exchange", fromId, EconomyResult.rejected(EconomyError.INVALID_AMOUNT,
                "Exchange amount must be positive: %d", amount));
        }
        Optional<Currency> from = registry.find(fromId);
        Optional<Currency> to = registry.find(toId);
        if (from.isEmpty() || to.isEmpty()) {
            return reject("exchange", fromId, EconomyResult.rejected(EconomyError.CURRENCY_UNKNOWN,
                "Currency %s is not registered", from.isEmpty() ? fromId : toId));
        }
        Optional<ExchangeRate> rate = usableRate(fromId, toId);
        if (rate.isEmpty()) {
            return reject("exchange", fromId, EconomyResult.rejected(EconomyError.EXCHANGE_UNAVAILABLE,
                "No active exchange from %s to %s", fromId, toId));
        }
        double applied = rate.get().getRate();
        Currency source = from.get();
        Currency target = to.get();

        EconomyResult<Long> result = mutate(playerId, (wallet, events) -> {
            Transaction debited = debit(wallet, source, amount, TransactionType.EXCHANGE,
                "exchange_to_" + toId, events);
            if (debited == null) {
                return EconomyResult.rejected(EconomyError.INSUFFICIENT_FUNDS,
                    "Need %d %s, have %d", amount, fromId, wallet.balance(fromId, source.getMinAmount()));
            }

            long converted = Math.round(amount * applied);
            if (converted <= 0) {
                refund(wallet, source, amount, EXCHANGE_REFUND_TAG, TransactionType.EXCHANGE, events);
                return EconomyResult.rejected(EconomyError.EXCHANGE_TOO_SMALL,
                    "%d %s converts to nothing at rate %s", amount, fromId, applied);
            }

            Transaction credited = credit(wallet, target, converted, TransactionType.EXCHANGE,
                "exchange_from_" + fromId, false, events);
            if (credited == null) {
                refund(wallet, source, amount, EXCHANGE_REFUND_TAG, TransactionType.EXCHANGE, events);
                return EconomyResult.rejected(EconomyError.BALANCE_AT_MAXIMUM,
                    "%s balance already at maximum %d", toId, target.getMaxAmount());
            }

            events.add(CurrencyExchangedEvent.of(playerId, fromId, toId, amount, credited.getAmount(),
                applied, credited.getTimestamp()));
            return EconomyResult.ok(credited.getAmount());
        });
        return record("exchange", fromId, result);
    }

    /**
     * Refunds currency taken by an operation that failed partway. The refund is
     * recorded as a compensating earn and removed from the player's lifetime spend.
     */
    public void compensate(String playerId, String currencyId, long amount, String reason) {
        requireId(playerId, "playerId");
        Currency currency = registry.find(currencyId)
            .orElseThrow(() -> new IllegalArgumentException("Currency " + currencyId + " is not registered"));
        if (amount <= 0) {
            return;
        }
        mutate(playerId, (wallet, events) -> {
            refund(wallet, currency, amount, REFUND_TAG_PREFIX + tagOrDefault(reason, "unspecified"),
                TransactionType.EARN, events);
            wallet.reduceSpent(currencyId, amount);
            return EconomyResult.ok(wallet.balance(currencyId, currency.getMinAmount()));
        });
    }

    /**
     * Runs an action while holding the player's wallet lock. Ledger calls made
     * inside the action re-enter the same lock, so a multi-step operation such as
     * a purchase cannot interleave with other mutations for the player.
     */
    public <T> T withPlayerLock(String playerId, Supplier<T> action) {
        requireId(playerId, "playerId");
        PlayerWallet wallet = wallet(playerId);
        wallet.lock().lock();
        try {
            return action.get();
        } finally {
            wallet.lock().unlock();
        }
    }

    /**
     * Runs a multi-step operation under the player's wallet lock as one unit.
     * Events and inflation flow entries produced by ledger calls inside it are
     * published only if the operation succeeds. A rejected operation must have
     * compensated its own balance changes; its side effects are dropped.
     */
    public <T> EconomyResult<T> atomically(String playerId, Supplier<EconomyResult<T>> operation) {
        requireId(playerId, "playerId");
        if (pending.get() != null) {
            return withPlayerLock(playerId, operation);
        }
        return withPlayerLock(playerId, () -> {
            PendingEffects effects = new PendingEffects();
            pending.set(effects);
            EconomyResult<T> result;
            try {
                result = operation.get();
            } finally {
                pending.remove();
            }
            if (result.isSuccess()) {
                effects.flows.forEach(flowLog::record);
                effects.events.forEach(eventBus::publish);
            } else if (!effects.events.isEmpty()) {
                log.debug("Dropped {} events and {} flow entries of rejected operation for player {}",
                    effects.events.size(), effects.flows.size(), playerId);
            }
            return result;
        });
    }

    /**
     * Publishes an event, behind the ledger changes of the enclosing
     * {@link #atomically} operation when there is one.
     */
    public void publish(EconomyEvent event) {
        PendingEffects effects = pending.get();
        if (effects != null) {
            effects.events.add(event);
        } else {
            eventBus.publish(event);
        }
    }

    // ==================== Snapshots ====================

    public List<WalletState> exportWallets() {
        List<WalletState> states = new ArrayList<>();
        for (PlayerWallet wallet : wallets.values()) {
            wallet.lock().lock();
            try {
                Map<String, List<Transaction>> histories = new LinkedHashMap<>();
                wallet.histories().forEach((currencyId, history) -> histories.put(currencyId, history.all()));
                states.add(new WalletState(wallet.playerId(), wallet.balances(), histories,
                    wallet.totalsEarned(), wallet.totalsSpent()));
            } finally {
                wallet.lock().unlock();
            }
        }
        return states;
    }

    /**
     * Replaces all wallets. Callers validate the states first.
     */
    public void restoreWallets(Collection<WalletState> states) {
        Map<String, PlayerWallet> restored = new LinkedHashMap<>();
        for (WalletState state : states) {
            PlayerWallet wallet = new PlayerWallet(state.getPlayerId(), historyCapacity);
            state.getBalances().forEach(wallet::setBalance);
            state.getHistories().forEach((currencyId, entries) -> wallet.history(currencyId).restore(entries));
            state.getTotalEarned().forEach(wallet::addEarned);
            state.getTotalSpent().forEach(wallet::addSpent);
            restored.put(state.getPlayerId(), wallet);
        }
        wallets.clear();
        wallets.putAll(restored);
        log.info("Restored {} wallets", restored.size());
    }

    // ==================== Internals ====================

    private static final class PendingEffects {
        private final List<EconomyEvent> events = new ArrayList<>();
        private final List<Transaction> flows = new ArrayList<>();
    }

    @FunctionalInterface
    private interface WalletMutation {
        EconomyResult<Long> apply(PlayerWallet wallet, List<EconomyEvent> events);
    }

    private EconomyResult<Long> mutate(String playerId, WalletMutation mutation) {
        PlayerWallet wallet = wallet(playerId);
        List<EconomyEvent> events = new ArrayList<>();
        wallet.lock().lock();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(CorrelationContext.PLAYER_ID_MDC_KEY, playerId)) {
            EconomyResult<Long> result = mutation.apply(wallet, events);
            events.forEach(this::publish);
            return result;
        } finally {
            wallet.lock().unlock();
        }
    }

    private Transaction credit(PlayerWallet wallet, Currency currency, long amount, TransactionType type,
                               String tag, boolean compensation, List<EconomyEvent> events) {
        long old = wallet.balance(currency.getId(), currency.getMinAmount());
        long sum = amount > Long.MAX_VALUE - old ? Long.MAX_VALUE : old + amount;
        long updated = currency.clamp(sum);
        if (updated == old) {
            return null;
        }
        return apply(wallet, currency, old, updated, type, tag, compensation, events);
    }

    private Transaction debit(PlayerWallet wallet, Currency currency, long amount, TransactionType type,
                              String tag, List<EconomyEvent> events) {
        long old = wallet.balance(currency.getId(), currency.getMinAmount());
        if (old < amount || old - amount < currency.getMinAmount()) {
            return null;
        }
        return apply(wallet, currency, old, old - amount, type, tag, false, events);
    }

    private void refund(PlayerWallet wallet, Currency currency, long amount, String tag, TransactionType type,
                        List<EconomyEvent> events) {
        Transaction refunded = credit(wallet, currency, amount, type, tag, true, events);
        long credited = refunded == null ? 0L : refunded.getAmount();
        if (credited != amount) {
            log.warn("Refund of {} {} for player {} only credited {}", amount, currency.getId(),
                wallet.playerId(), credited);
        } else {
            log.warn("Compensating refund: {} {} returned to player {} ({})", amount, currency.getId(),
                wallet.playerId(), tag);
        }
        metrics.recordRefund(tag);
    }

    private Transaction apply(PlayerWallet wallet, Currency currency, long oldBalance, long newBalance,
                              TransactionType type, String tag, boolean compensation, List<EconomyEvent> events) {
        Transaction transaction = Transaction.of(wallet.playerId(), currency.getId(), type,
            newBalance - oldBalance, tag, clock.instant(), newBalance, compensation);
        wallet.setBalance(currency.getId(), newBalance);
        wallet.history(currency.getId()).append(transaction);
        PendingEffects effects = pending.get();
        if (effects != null) {
            effects.flows.add(transaction);
        } else {
            flowLog.record(transaction);
        }
        events.add(BalanceChangedEvent.of(wallet.playerId(), currency.getId(), oldBalance, newBalance,
            transaction.getTimestamp()));
        return transaction;
    }

    private Optional<ExchangeRate> usableRate(String fromId, String toId) {
        Optional<Currency> from = registry.find(fromId);
        Optional<Currency> to = registry.find(toId);
        if (from.isEmpty() || to.isEmpty() || !from.get().isTradeable() || !to.get().isTradeable()) {
            return Optional.empty();
        }
        return rates.find(fromId, toId).filter(ExchangeRate::isActive);
    }

    private PlayerWallet wallet(String playerId) {
        return wallets.computeIfAbsent(playerId, id -> new PlayerWallet(id, historyCapacity));
    }

    private <T> T readWallet(String playerId, Function<PlayerWallet, T> reader, T absent) {
        requireId(playerId, "playerId");
        PlayerWallet wallet = wallets.get(playerId);
        if (wallet == null) {
            return absent;
        }
        wallet.lock().lock();
        try {
            return reader.apply(wallet);
        } finally {
            wallet.lock().unlock();
        }
    }

    private EconomyResult<Long> record(String operation, String currencyId, EconomyResult<Long> result) {
        if (result.isSuccess()) {
            metrics.recordLedgerOperation(operation, currencyId, "success");
            return result;
        }
        return reject(operation, currencyId, result);
    }

    private EconomyResult<Long> reject(String operation, String currencyId, EconomyResult<Long> rejection) {
        log.debug("{} rejected: {} - {}", operation, rejection.getError(), rejection.getMessage());
        metrics.recordLedgerOperation(operation, currencyId, rejection.getError().name().toLowerCase());
        return rejection;
    }

    private static String tagOrDefault(String tag, String fallback) {
        return tag == null || tag.isBlank() ? fallback : tag;
    }

    static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
