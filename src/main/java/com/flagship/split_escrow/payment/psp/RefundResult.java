package com.flagship.split_escrow.payment.psp;

import lombok.Value;

@Value
public class RefundResult {
    String providerRefundId;
    PspStatus status;
    String failureReason;
}
