package dao.gaszero.relayer.service;

public interface SignatureVerifier {

    /**
     * @return true when {@code signature} over {@code message} recovers to {@code address}
     */
    boolean verify(String message, String signature, String address);
}
