package com.realdonation.registry.infrastructure.bank;

import com.realdonation.observability.CorrelationContext;
import com.realdonation.observability.CorrelationContextHolder;
import com.realdonation.registry.domain.TransferRejectedException;
import com.realdonation.registry.domain.ValueTransfer;
import com.realdonation.security.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process balances of the native value unit.
 * <p>
 * Accounts start at zero and are funded with {@link #credit}. An account may install a
 * {@link ValueReceiver}; a transfer to it only happens if the receiver accepts within the
 * configured deadline. Transfers are serialized, and balances move only after acceptance, so a
 * rejected transfer changes nothing.
 */
public class NativeValueBank implements ValueTransfer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NativeValueBank.class);

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<Address, ValueReceiver> receivers = new ConcurrentHashMap<>();
    private final Duration acceptTimeout;
    private final ExecutorService acceptExecutor;

    /**
     * @param acceptTimeout how long a receiver may take to accept a transfer
     */
    public NativeValueBank(Duration acceptTimeout) {
        if (acceptTimeout == null || acceptTimeout.isNegative() || acceptTimeout.isZero()) {
            throw new IllegalArgumentException("acceptTimeout must be positive");
        }
        this.acceptTimeout = acceptTimeout;
        AtomicInteger threads = new AtomicInteger();
        this.acceptExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "value-receiver-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /** Adds {@code amount} to an account's balance. */
    public void credit(Address account, BigInteger amount) {
        Objects.requireNonNull(account, "account");
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("credit amount must be positive");
        }
        balances.merge(account, amount, BigInteger::add);
        log.debug("Credited {} to {}", amount, account);
    }

    /** Balance of an account; zero for accounts never credited. */
    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    /** Installs (or replaces) the accept logic of an account. */
    public void registerReceiver(Address account, ValueReceiver receiver) {
        receivers.put(Objects.requireNonNull(account, "account"), Objects.requireNonNull(receiver, "receiver"));
    }

    /** Removes an account's accept logic; it then accepts everything again. */
    public void removeReceiver(Address account) {
        receivers.remove(account);
    }

    @Override
    public synchronized void transfer(Address from, Address to, BigInteger amount)
            throws TransferRejectedException {
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            throw new TransferRejectedException(
                    "Balance of %s is %s, cannot send %s".formatted(from, available, amount));
        }
        ValueReceiver receiver = receivers.get(to);
        if (receiver != null) {
            awaitAcceptance(receiver, from, to, amount);
        }
        if (!debit(from, amount)) {
            throw new TransferRejectedException(
                    "Balance of %s is %s, cannot send %s".formatted(from, balanceOf(from), amount));
        }
        balances.merge(to, amount, BigInteger::add);
    }

    /** Atomically takes {@code amount} from an account, keeping credits that land meanwhile. */
    private boolean debit(Address account, BigInteger amount) {
        if (amount.signum() == 0) {
            return true;
        }
        while (true) {
            BigInteger current = balanceOf(account);
            if (current.compareTo(amount) < 0) {
                return false;
            }
            if (balances.replace(account, current, current.subtract(amount))) {
                return true;
            }
        }
    }

    /** Stops the receiver worker threads. */
    @Override
    public void close() {
        acceptExecutor.shutdownNow();
    }

    private void awaitAcceptance(ValueReceiver receiver, Address from, Address to, BigInteger amount)
            throws TransferRejectedException {
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        Future<Boolean> decision = acceptExecutor.submit(() -> {
            if (context != null) {
                CorrelationContextHolder.set(context);
            }
            try {
                return receiver.accept(from, amount);
            } finally {
                CorrelationContextHolder.clear();
            }
        });

        boolean accepted;
        try {
            accepted = decision.get(acceptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            decision.cancel(true);
            throw new TransferRejectedException(
                    "Receiver %s did not answer within %s".formatted(to, acceptTimeout), e);
        } catch (ExecutionException e) {
            throw new TransferRejectedException("Receiver %s failed".formatted(to), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            decision.cancel(true);
            throw new TransferRejectedException("Interrupted while waiting for receiver " + to, e);
        }
        if (!accepted) {
            throw new TransferRejectedException("Receiver %s refused %s".formatted(to, amount));
        }
    }
}
