package dao.gaszero.relayer.chain;

import java.math.BigInteger;

/**
 * An unsigned relayer transaction.
 *
 * @param label short step name used in logs and error details (pull, push, approve, swap, ...)
 */
public record PreparedTransaction(
        String label,
        String to,
        String data,
        BigInteger value,
        BigInteger gasLimit
) {

    public static PreparedTransaction call(String label, String to, String data, long gasLimit) {
        return new PreparedTransaction(label, to, data, BigInteger.ZERO, BigInteger.valueOf(gasLimit));
    }

    public static PreparedTransaction valueTransfer(String label, String to, BigInteger value, long gasLimit) {
        return new PreparedTransaction(label, to, "0x", value, BigInteger.valueOf(gasLimit));
    }
}
