package com.evarsity.lifecycle.certificate;

import com.evarsity.lifecycle.config.LifecycleProperties;
import com.evarsity.lifecycle.domain.DomainModels.CertificateType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Builds certificate references of the form
 * {@code <prefix><student>_<course>_<yyyyMMddHHmmss>_<digest>.pdf}. The digest covers student, course,
 * type and the issuance instant to the millisecond, so two certificates only share a reference when all
 * four are equal.
 */
@Component
public class CertificateReferenceGenerator {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final String prefix;

    public CertificateReferenceGenerator(LifecycleProperties properties) {
        this.prefix = properties.certificateUrlPrefix();
    }

    public String referenceFor(String studentId, String courseId, CertificateType type, Instant issuedAt) {
        String digest = sha256(studentId + "|" + courseId + "|" + type.name() + "|" + issuedAt.toEpochMilli()).substring(0, 16);
        return prefix + slug(studentId) + "_" + slug(courseId) + "_" + STAMP.format(issuedAt) + "_" + digest + ".pdf";
    }

    private String slug(String value) {
        return value.replaceAll("[^A-Za-z0-9.-]", "-");
    }

    private String sha256(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
