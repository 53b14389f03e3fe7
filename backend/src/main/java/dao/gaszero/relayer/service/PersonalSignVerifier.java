package dao.gaszero.relayer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * EIP-191 {@code personal_sign} recovery ("\x19Ethereum Signed Message:\n" + length prefix).
 */
@Slf4j
@Component
public class PersonalSignVerifier implements SignatureVerifier {

    @Override
    public boolean verify(String message, String signature, String address) {
        if (message == null || signature == null || address == null) return false;
        byte[] sig;
        try {
            sig = Numeric.hexStringToByteArray(signature.trim());
        } catch (RuntimeException e) {
            log.debug("Malformed signature hex: {}", e.getMessage());
            return false;
        }
        if (sig.length != 65) {
            log.debug("Unexpected signature length: {}", sig.length);
            return false;
        }
        byte v = sig[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(sig, 0, 32),
                Arrays.copyOfRange(sig, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message.getBytes(StandardCharsets.UTF_8), data);
            String recovered = "0x" + Keys.getAddress(publicKey);
            return recovered.equalsIgnoreCase(address.trim());
        } catch (SignatureException | IllegalArgumentException e) {
            log.debug("Signature recovery failed: {}", e.getMessage());
            return false;
        }
    }
}
