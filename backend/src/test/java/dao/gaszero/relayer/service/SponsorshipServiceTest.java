package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.config.SponsorshipProperties;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SponsorshipRequest;
import dao.gaszero.relayer.model.TokenInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Map;

import static dao.gaszero.relayer.service.TestChains.USER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SponsorshipServiceTest {

    @Mock
    private ChainClient client;
    @Mock
    private GasSponsorshipFunder funder;

    private ChainExecutionQueue queue;
    private SponsorshipProperties props;
    private SponsorshipService service;

    @BeforeEach
    void setUp() {
        queue = new ChainExecutionQueue("eth-sepolia");
        props = new SponsorshipProperties();
        RelayerAccountRegistry accounts = RelayerAccountRegistry.of(new RelayerAccount(TestChains.sepolia(), client, queue));
        service = new SponsorshipService(accounts, funder, props);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private static SponsorshipRequest request(String reason) {
        SponsorshipRequest req = new SponsorshipRequest();
        req.setChain("eth-sepolia");
        req.setUserAddress(USER);
        req.setToken("USDC");
        req.setAmount("100");
        req.setReason(reason);
        return req;
    }

    @Test
    @DisplayName("Funding runs the allowance decision for the requested amount")
    void funds() {
        when(funder.ensureAllowance(any(), any(TokenInfo.class), eq(USER), eq(BigInteger.valueOf(100_000_000L))))
                .thenReturn(new SponsorshipDecision(SponsorshipState.FUNDED, "0xfund", "Approval gas sent"));

        Map<String, Object> body = service.fund(request("approval_needed"));

        assertEquals(true, body.get("funded"));
        assertEquals("0xfund", body.get("hash"));
        assertEquals("0.001", body.get("amount"));
        assertEquals("https://sepolia.etherscan.io/tx/0xfund", body.get("explorerUrl"));
    }

    @Test
    void cooldownIsRateLimited() {
        when(funder.ensureAllowance(any(), any(TokenInfo.class), any(), any()))
                .thenReturn(new SponsorshipDecision(SponsorshipState.NEEDS_FUNDING, null, "Funding cooldown active"));

        RelayException ex = assertThrows(RelayException.class, () -> service.fund(request("approval_needed")));

        assertEquals(RelayErrorKind.RATE_LIMITED, ex.getKind());
    }

    @Test
    void wrongReasonOrDisabled() {
        RelayException reason = assertThrows(RelayException.class, () -> service.fund(request("because")));
        assertEquals(RelayErrorKind.VALIDATION_ERROR, reason.getKind());

        props.setEnabled(false);
        RelayException disabled = assertThrows(RelayException.class, () -> service.fund(request("approval_needed")));
        assertEquals(RelayErrorKind.UNSUPPORTED_FEATURE, disabled.getKind());

        verifyNoInteractions(funder);
    }

    @Test
    void unsupportedToken() {
        SponsorshipRequest req = request("approval_needed");
        req.setToken("DAI");

        RelayException ex = assertThrows(RelayException.class, () -> service.fund(req));

        assertEquals(RelayErrorKind.VALIDATION_ERROR, ex.getKind());
    }
}
