package dao.gaszero.relayer.repository;

import java.math.BigInteger;

/**
 * Native currency deposited by users to a relayer and not yet consumed by a swap.
 * Keys combine chain and user address.
 */
public interface NativeCreditRepository {

    BigInteger balanceOf(String key);

    /**
     * Credits a deposit once.
     *
     * @return false when {@code depositTxHash} was already credited
     */
    boolean credit(String key, String depositTxHash, BigInteger amount);

    /**
     * @return false (and nothing changes) when the balance is lower than {@code amount}
     */
    boolean debit(String key, BigInteger amount);

    void restore(String key, BigInteger amount);
}
