package com.vrwx.ledger.token;

import com.vrwx.core.domain.Address;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.ValidationException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fungible balance table for one token. Used twice: the stable settlement token and the
 * VRWX protocol token.
 *
 * Methods are trusted in-process calls; authorization is enforced by the component that
 * moves the funds. Each method is atomic.
 */
public class TokenLedger {

    private final String symbol;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public TokenLedger(String symbol) {
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null");
    }

    public String symbol() {
        return symbol;
    }

    public synchronized BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    public synchronized void mint(Address to, BigInteger amount) {
        requirePositive(amount);
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    public synchronized void burn(Address from, BigInteger amount) {
        requirePositive(amount);
        debit(from, amount);
        totalSupply = totalSupply.subtract(amount);
    }

    public synchronized void transfer(Address from, Address to, BigInteger amount) {
        requirePositive(amount);
        debit(from, amount);
        balances.merge(to, amount, BigInteger::add);
    }

    private void debit(Address from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                    symbol + " balance of " + from + " is " + balance + ", needs " + amount);
        }
        balances.put(from, balance.subtract(amount));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT);
        }
    }
}
