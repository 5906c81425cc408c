package com.flagship.split_escrow.payment.psp;

import lombok.Value;

@Value
public class TransferResult {
    String providerTransferId;
    PspStatus status;
    String failureReason;

    public static TransferResult succeeded(String providerTransferId) {
        return new TransferResult(providerTransferId, PspStatus.SUCCEEDED, null);
    }

    public static TransferResult pending(String providerTransferId) {
        return new TransferResult(providerTransferId, PspStatus.PENDING, null);
    }

    public static TransferResult failed(String reason) {
        return new TransferResult(null, PspStatus.FAILED, reason);
    }
}
