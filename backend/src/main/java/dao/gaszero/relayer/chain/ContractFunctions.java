package dao.gaszero.relayer.chain;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * ABI definitions of the ERC20, WETH9 and SwapRouter02 calls the relayer issues.
 */
public final class ContractFunctions {

    private ContractFunctions() {}

    // ---- ERC20 reads ----

    public static Function balanceOf(String account) {
        return new Function(
                "balanceOf",
                Collections.singletonList(new Address(account)),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
    }

    public static Function allowance(String owner, String spender) {
        return new Function(
                "allowance",
                Arrays.asList(new Address(owner), new Address(spender)),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
    }

    // ---- ERC20 writes ----

    public static String transferFrom(String from, String to, BigInteger amount) {
        return FunctionEncoder.encode(new Function(
                "transferFrom",
                Arrays.asList(new Address(from), new Address(to), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        ));
    }

    public static String transfer(String to, BigInteger amount) {
        return FunctionEncoder.encode(new Function(
                "transfer",
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        ));
    }

    public static String approve(String spender, BigInteger amount) {
        return FunctionEncoder.encode(new Function(
                "approve",
                Arrays.asList(new Address(spender), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        ));
    }

    // ---- WETH9 ----

    public static String wrapDeposit() {
        return FunctionEncoder.encode(new Function("deposit", List.of(), List.of()));
    }

    public static String unwrapWithdraw(BigInteger amount) {
        return FunctionEncoder.encode(new Function(
                "withdraw",
                Collections.singletonList(new Uint256(amount)),
                List.of()
        ));
    }

    // ---- SwapRouter02 ----

    /**
     * exactInputSingle((address tokenIn, address tokenOut, uint24 fee, address recipient,
     * uint256 amountIn, uint256 amountOutMinimum, uint160 sqrtPriceLimitX96))
     * with no price limit.
     */
    public static String exactInputSingle(String tokenIn, String tokenOut, int feeTier, String recipient,
                                          BigInteger amountIn, BigInteger amountOutMinimum) {
        StaticStruct params = new StaticStruct(
                new Address(tokenIn),
                new Address(tokenOut),
                new Uint24(BigInteger.valueOf(feeTier)),
                new Address(recipient),
                new Uint256(amountIn),
                new Uint256(amountOutMinimum),
                new Uint160(BigInteger.ZERO)
        );
        return FunctionEncoder.encode(new Function(
                "exactInputSingle",
                Collections.singletonList(params),
                Collections.singletonList(new TypeReference<Uint256>() {})
        ));
    }
}
