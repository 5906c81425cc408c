package com.flagship.split_escrow.job;

import lombok.Value;

@Value
public class JobDefinition {
    String type;
    JobPolicy policy;
    JobSchema schema;
}
