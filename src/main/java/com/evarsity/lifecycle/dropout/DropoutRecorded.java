package com.evarsity.lifecycle.dropout;

import com.evarsity.lifecycle.domain.DomainModels.DropoutRecord;

public record DropoutRecorded(DropoutRecord record) {}
