package com.evarsity.lifecycle.certificate;

import com.evarsity.lifecycle.domain.DomainModels.Certificate;

public record CertificateIssued(Certificate certificate) {}
