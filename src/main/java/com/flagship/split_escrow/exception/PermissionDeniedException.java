package com.flagship.split_escrow.exception;

public class PermissionDeniedException extends SettlementException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
