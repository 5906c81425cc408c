package com.flagship.split_escrow.exception;

public class NotFoundException extends SettlementException {

    public NotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
