package dao.gaszero.relayer.repository;

import dao.gaszero.relayer.model.FundingHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRepositoriesTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000L);

    @Test
    @DisplayName("Funding histories older than the cutoff are evicted")
    void evictsOldFundingHistory() {
        InMemoryFundingHistoryRepository repo = new InMemoryFundingHistoryRepository();
        repo.save("11155111:0xaa", FundingHistory.first(T0));
        repo.save("11155111:0xbb", FundingHistory.first(T0).next(T0.plusSeconds(7200)));

        assertEquals(1, repo.evictFundedBefore(T0.plusSeconds(3600)));
        assertTrue(repo.find("11155111:0xaa").isEmpty());
        assertEquals(2, repo.find("11155111:0xbb").orElseThrow().fundingCount());
        assertEquals(1, repo.count());
    }

    @Test
    void fundingHistoryNextIncrementsCount() {
        FundingHistory next = FundingHistory.first(T0).next(T0.plusSeconds(10));

        assertEquals(2, next.fundingCount());
        assertEquals(T0.plusSeconds(10), next.lastFundedAt());
        assertEquals(T0, next.previousFundedAt());
    }

    @Test
    @DisplayName("A deposit hash is credited once regardless of case")
    void creditOncePerDeposit() {
        InMemoryNativeCreditRepository repo = new InMemoryNativeCreditRepository();
        String hash = "0x" + "Ab".repeat(32);

        assertTrue(repo.credit("eth-sepolia:0xaa", hash, BigInteger.TEN));
        assertFalse(repo.credit("eth-sepolia:0xaa", hash.toLowerCase(), BigInteger.TEN));
        assertEquals(BigInteger.TEN, repo.balanceOf("eth-sepolia:0xaa"));
    }

    @Test
    void debitNeverGoesNegative() {
        InMemoryNativeCreditRepository repo = new InMemoryNativeCreditRepository();
        repo.credit("k", "0x01", BigInteger.valueOf(5));

        assertFalse(repo.debit("k", BigInteger.valueOf(6)));
        assertTrue(repo.debit("k", BigInteger.valueOf(5)));
        assertEquals(BigInteger.ZERO, repo.balanceOf("k"));

        repo.restore("k", BigInteger.valueOf(3));
        assertEquals(BigInteger.valueOf(3), repo.balanceOf("k"));
    }
}
