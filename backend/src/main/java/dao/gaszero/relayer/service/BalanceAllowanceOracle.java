package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.chain.ContractFunctions;
import dao.gaszero.relayer.model.TokenInfo;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only chain queries. Failures stay {@link ChainClientException}s; they never become
 * business errors here.
 */
@Component
public class BalanceAllowanceOracle {

    public BigInteger tokenBalance(ChainClient client, TokenInfo token, String address) {
        return uint(client.readContract(token.address(), ContractFunctions.balanceOf(address)), "balanceOf");
    }

    public BigInteger allowance(ChainClient client, TokenInfo token, String owner, String spender) {
        return uint(client.readContract(token.address(), ContractFunctions.allowance(owner, spender)), "allowance");
    }

    public BigInteger nativeBalance(ChainClient client, String address) {
        return client.getBalance(address);
    }

    @SuppressWarnings("rawtypes")
    private static BigInteger uint(List<Type> decoded, String fn) {
        if (decoded == null || decoded.isEmpty()) {
            throw new ChainClientException(fn + " returned no value");
        }
        return (BigInteger) decoded.get(0).getValue();
    }
}
