package com.flagship.split_escrow.exception;

import lombok.Getter;

@Getter
public class JobTypeNotFoundException extends NotFoundException {

    private final String jobType;

    public JobTypeNotFoundException(String jobType) {
        super(ErrorCode.JOB_TYPE_NOT_FOUND, "Job type not registered: " + jobType);
        this.jobType = jobType;
    }
}
