package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.model.TransferRequest;

import java.math.BigInteger;
import java.time.Instant;

public record ValidatedTransfer(
        TransferRequest request,
        ChainConfig config,
        TokenInfo token,
        BigInteger amount,
        Instant deadline
) implements ValidatedRelay {}
