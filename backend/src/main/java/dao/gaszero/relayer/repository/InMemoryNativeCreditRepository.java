package dao.gaszero.relayer.repository;

import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Repository
public class InMemoryNativeCreditRepository implements NativeCreditRepository {

    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Set<String> creditedDeposits = new HashSet<>();

    @Override
    public synchronized BigInteger balanceOf(String key) {
        return balances.getOrDefault(key, BigInteger.ZERO);
    }

    @Override
    public synchronized boolean credit(String key, String depositTxHash, BigInteger amount) {
        if (!creditedDeposits.add(depositTxHash.toLowerCase(Locale.ROOT))) {
            return false;
        }
        balances.merge(key, amount, BigInteger::add);
        return true;
    }

    @Override
    public synchronized boolean debit(String key, BigInteger amount) {
        BigInteger current = balances.getOrDefault(key, BigInteger.ZERO);
        if (current.compareTo(amount) < 0) {
            return false;
        }
        BigInteger left = current.subtract(amount);
        if (left.signum() == 0) {
            balances.remove(key);
        } else {
            balances.put(key, left);
        }
        return true;
    }

    @Override
    public synchronized void restore(String key, BigInteger amount) {
        balances.merge(key, amount, BigInteger::add);
    }
}
